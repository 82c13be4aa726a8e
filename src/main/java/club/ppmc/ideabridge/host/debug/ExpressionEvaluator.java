/**
 * ExpressionEvaluator.java
 *
 * 在挂起位置对表达式求值。
 */
package club.ppmc.ideabridge.host.debug;

import club.ppmc.ideabridge.model.debug.VariableInfo;

public interface ExpressionEvaluator {

    void evaluate(String expression, EvaluationCallback callback);

    interface EvaluationCallback {

        void evaluated(VariableInfo result);

        void errorOccurred(String message);
    }
}
