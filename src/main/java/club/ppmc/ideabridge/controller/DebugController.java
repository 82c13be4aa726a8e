/**
 * DebugController.java
 *
 * 调试相关的 HTTP 接口。控制类操作（暂停、继续、单步）和查询类操作（调用栈、变量、求值）都是同步的：
 * 请求会一直阻塞到调试器给出结果或超时，而不是通过推送事件异步返回。
 */
package club.ppmc.ideabridge.controller;

import club.ppmc.ideabridge.model.RunStartResult;
import club.ppmc.ideabridge.model.debug.DebugEvaluateResult;
import club.ppmc.ideabridge.model.debug.DebugRequest;
import club.ppmc.ideabridge.model.debug.DebugSessionsResult;
import club.ppmc.ideabridge.model.debug.DebugStackResult;
import club.ppmc.ideabridge.model.debug.DebugStepResult;
import club.ppmc.ideabridge.model.debug.DebugVariablesResult;
import club.ppmc.ideabridge.model.debug.EvaluateRequest;
import club.ppmc.ideabridge.service.DebugFacadeService;
import club.ppmc.ideabridge.service.DebugLaunchService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/debug")
public class DebugController {

    private final DebugFacadeService debugFacade;
    private final DebugLaunchService debugLaunch;

    public DebugController(DebugFacadeService debugFacade, DebugLaunchService debugLaunch) {
        this.debugFacade = debugFacade;
        this.debugLaunch = debugLaunch;
    }

    /**
     * 以调试模式启动主类并附加调试器。返回时会话已建立，可以立即设置断点或暂停。
     */
    @PostMapping("/start")
    public ResponseEntity<RunStartResult> start(@Valid @RequestBody DebugRequest request) {
        RunStartResult result = debugLaunch.start(request.mainClass(), request.projectRef());
        return BridgeResponses.of(result, result.error());
    }

    @PostMapping("/stop")
    public ResponseEntity<DebugStepResult> stop() {
        return step(debugLaunch.stop());
    }

    @GetMapping("/sessions")
    public ResponseEntity<DebugSessionsResult> sessions() {
        return ResponseEntity.ok(debugFacade.listSessions());
    }

    @GetMapping("/stack")
    public ResponseEntity<DebugStackResult> stack() {
        DebugStackResult result = debugFacade.getStack();
        return BridgeResponses.of(result, result.error());
    }

    @GetMapping("/variables")
    public ResponseEntity<DebugVariablesResult> variables(@RequestParam(defaultValue = "0") int frameIndex) {
        DebugVariablesResult result = debugFacade.getVariables(frameIndex);
        return BridgeResponses.of(result, result.error());
    }

    @PostMapping("/evaluate")
    public ResponseEntity<DebugEvaluateResult> evaluate(@Valid @RequestBody EvaluateRequest request) {
        DebugEvaluateResult result = debugFacade.evaluate(request.expression());
        return BridgeResponses.of(result, result.error());
    }

    @PostMapping("/pause")
    public ResponseEntity<DebugStepResult> pause() {
        return step(debugFacade.pause());
    }

    @PostMapping("/resume")
    public ResponseEntity<DebugStepResult> resume() {
        return step(debugFacade.resume());
    }

    @PostMapping("/step/over")
    public ResponseEntity<DebugStepResult> stepOver() {
        return step(debugFacade.stepOver());
    }

    @PostMapping("/step/into")
    public ResponseEntity<DebugStepResult> stepInto() {
        return step(debugFacade.stepInto());
    }

    @PostMapping("/step/out")
    public ResponseEntity<DebugStepResult> stepOut() {
        return step(debugFacade.stepOut());
    }

    private static ResponseEntity<DebugStepResult> step(DebugStepResult result) {
        return BridgeResponses.of(result, result.error());
    }
}
