/**
 * RunController.java
 *
 * 运行管理的 HTTP 接口：按名称启动运行配置、读取输出、停止、列出与清理运行，以及列出已打开的项目。
 * 启动在进程创建后立即返回，输出通过轮询 /{runId}/output 获取。
 */
package club.ppmc.ideabridge.controller;

import club.ppmc.ideabridge.model.ProjectListResult;
import club.ppmc.ideabridge.model.RunListResult;
import club.ppmc.ideabridge.model.RunOutputResult;
import club.ppmc.ideabridge.model.RunStartRequest;
import club.ppmc.ideabridge.model.RunStartResult;
import club.ppmc.ideabridge.model.RunStopResult;
import club.ppmc.ideabridge.service.RunRegistryService;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/run")
public class RunController {

    private final RunRegistryService runRegistry;

    public RunController(RunRegistryService runRegistry) {
        this.runRegistry = runRegistry;
    }

    @PostMapping("/start")
    public ResponseEntity<RunStartResult> start(@Valid @RequestBody RunStartRequest request) {
        RunStartResult result = runRegistry.start(request.configName(), request.projectRef());
        return BridgeResponses.of(result, result.error());
    }

    @GetMapping("/list")
    public ResponseEntity<RunListResult> list() {
        return ResponseEntity.ok(runRegistry.list());
    }

    /**
     * @param clear 为 true 时读取后清空缓冲区，下次只返回新的输出。
     */
    @GetMapping("/{runId}/output")
    public ResponseEntity<RunOutputResult> output(
            @PathVariable String runId, @RequestParam(defaultValue = "false") boolean clear) {
        RunOutputResult result = runRegistry.getOutput(runId, clear);
        return BridgeResponses.of(result, result.error());
    }

    @PostMapping("/{runId}/stop")
    public ResponseEntity<RunStopResult> stop(@PathVariable String runId) {
        RunStopResult result = runRegistry.stop(runId);
        return BridgeResponses.of(result, result.error());
    }

    /**
     * @param maxAgeSeconds 省略时使用配置的保留时间。
     */
    @PostMapping("/prune")
    public ResponseEntity<Map<String, Integer>> prune(@RequestParam(required = false) Long maxAgeSeconds) {
        int removed = maxAgeSeconds == null
                ? runRegistry.pruneExpired()
                : runRegistry.prune(Duration.ofSeconds(Math.max(0, maxAgeSeconds)));
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    @GetMapping("/projects")
    public ResponseEntity<ProjectListResult> projects() {
        return ResponseEntity.ok(runRegistry.projects());
    }
}
