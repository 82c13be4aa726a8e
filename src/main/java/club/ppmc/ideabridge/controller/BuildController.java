/**
 * BuildController.java
 *
 * 编译相关的 HTTP 接口：触发编译、查询上一次编译结果、获取诊断信息。
 * 编译请求会阻塞直到编译完成或超时。
 */
package club.ppmc.ideabridge.controller;

import club.ppmc.ideabridge.model.BuildRequest;
import club.ppmc.ideabridge.model.CompileResult;
import club.ppmc.ideabridge.model.DiagnosticsResult;
import club.ppmc.ideabridge.service.CompileService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/build")
public class BuildController {

    private final CompileService compileService;

    public BuildController(CompileService compileService) {
        this.compileService = compileService;
    }

    /**
     * 触发一次编译。请求体可以省略，此时执行默认超时的增量编译。
     */
    @PostMapping
    public ResponseEntity<CompileResult> build(@Valid @RequestBody(required = false) BuildRequest request) {
        BuildRequest effective = request != null ? request : new BuildRequest(true, null, null);
        CompileResult result = compileService.compile(effective);
        return BridgeResponses.of(result, result.error());
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        return compileService.lastResult()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of("status", "no_compilation_yet")));
    }

    @GetMapping("/diagnostics")
    public ResponseEntity<DiagnosticsResult> diagnostics(@RequestParam(required = false) String projectRef) {
        DiagnosticsResult result = compileService.diagnostics(projectRef);
        return BridgeResponses.of(result, result.error());
    }
}
