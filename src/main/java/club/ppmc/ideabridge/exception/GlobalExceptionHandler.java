/**
 * GlobalExceptionHandler.java
 *
 * HTTP 边界的最后一道防线。服务层的失败都以 BridgeError 作为数据返回，这里只处理请求校验失败
 * 以及确实逃逸出来的意外异常，并保证响应体与正常错误结果的结构一致: {error: {kind, category, remedy, message}}。
 */
package club.ppmc.ideabridge.exception;

import club.ppmc.ideabridge.controller.BridgeResponses;
import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, BridgeError>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return respond(BridgeError.of(BridgeErrorKind.VALIDATION_FAILED, "请求参数无效: " + message));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, BridgeError>> handleMalformedRequest(Exception e) {
        return respond(BridgeError.of(BridgeErrorKind.VALIDATION_FAILED, "请求格式错误: " + e.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, String>> handleNoResource(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "接口不存在: " + e.getResourcePath()));
    }

    @ExceptionHandler(EnvironmentConfigurationException.class)
    public ResponseEntity<Map<String, BridgeError>> handleEnvironment(EnvironmentConfigurationException e) {
        log.warn("执行环境未正确配置: {}", e.toErrorData());
        return respond(e.toBridgeError());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, BridgeError>> handleUnexpected(Exception e) {
        log.error("请求处理过程中发生未预期的异常", e);
        return respond(BridgeError.fault(e));
    }

    private static ResponseEntity<Map<String, BridgeError>> respond(BridgeError error) {
        return BridgeResponses.of(Map.of("error", error), error);
    }
}
