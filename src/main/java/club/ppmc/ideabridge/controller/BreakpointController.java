/**
 * BreakpointController.java
 *
 * 行断点管理。断点按源文件路径和行号登记，对当前和之后附加的调试会话都生效。
 */
package club.ppmc.ideabridge.controller;

import club.ppmc.ideabridge.model.debug.BreakpointListResult;
import club.ppmc.ideabridge.model.debug.BreakpointRequest;
import club.ppmc.ideabridge.model.debug.BreakpointResult;
import club.ppmc.ideabridge.service.DebugFacadeService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/breakpoint")
public class BreakpointController {

    private final DebugFacadeService debugFacade;

    public BreakpointController(DebugFacadeService debugFacade) {
        this.debugFacade = debugFacade;
    }

    @GetMapping("/list")
    public ResponseEntity<BreakpointListResult> list() {
        return ResponseEntity.ok(debugFacade.listBreakpoints());
    }

    @PostMapping("/set")
    public ResponseEntity<BreakpointResult> set(@Valid @RequestBody BreakpointRequest request) {
        BreakpointResult result = debugFacade.setBreakpoint(request.file(), request.line());
        return BridgeResponses.of(result, result.error());
    }

    @PostMapping("/remove")
    public ResponseEntity<BreakpointResult> remove(@Valid @RequestBody BreakpointRequest request) {
        BreakpointResult result = debugFacade.removeBreakpoint(request.file(), request.line());
        return BridgeResponses.of(result, result.error());
    }
}
