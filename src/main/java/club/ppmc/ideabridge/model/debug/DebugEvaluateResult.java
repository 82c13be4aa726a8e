/**
 * DebugEvaluateResult.java
 */
package club.ppmc.ideabridge.model.debug;

import club.ppmc.ideabridge.model.BridgeError;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param expression 被求值的表达式。
 * @param value 求值结果的字符串表示。
 * @param type 求值结果的类型。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DebugEvaluateResult(boolean success, String expression, String value, String type, BridgeError error) {

    public static DebugEvaluateResult failed(String expression, BridgeError error) {
        return new DebugEvaluateResult(false, expression, null, null, error);
    }
}
