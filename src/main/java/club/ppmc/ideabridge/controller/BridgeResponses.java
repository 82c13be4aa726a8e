/**
 * BridgeResponses.java
 *
 * 把携带 BridgeError 的结果映射为 HTTP 响应。状态码只由错误的 ErrorCategory 决定，不解析消息文本。
 */
package club.ppmc.ideabridge.controller;

import club.ppmc.ideabridge.model.BridgeError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

public final class BridgeResponses {

    private BridgeResponses() {}

    public static <T> ResponseEntity<T> of(T body, BridgeError error) {
        return ResponseEntity.status(statusOf(error)).body(body);
    }

    public static HttpStatus statusOf(BridgeError error) {
        if (error == null) {
            return HttpStatus.OK;
        }
        return switch (error.category()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
