/**
 * TestController.java
 *
 * 测试相关的 HTTP 接口：按模式运行测试并返回结构化结果，查询上一次测试结果。
 */
package club.ppmc.ideabridge.controller;

import club.ppmc.ideabridge.model.TestRequest;
import club.ppmc.ideabridge.model.TestRunResult;
import club.ppmc.ideabridge.service.TestService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/test")
public class TestController {

    private final TestService testService;

    public TestController(TestService testService) {
        this.testService = testService;
    }

    @PostMapping
    public ResponseEntity<TestRunResult> runTests(@Valid @RequestBody TestRequest request) {
        TestRunResult result = testService.runTests(request);
        return BridgeResponses.of(result, result.error());
    }

    @GetMapping("/results")
    public ResponseEntity<?> results() {
        return testService.lastResult()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of("status", "no_tests_run_yet")));
    }
}
