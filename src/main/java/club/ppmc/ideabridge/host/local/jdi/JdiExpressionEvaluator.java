/**
 * JdiExpressionEvaluator.java
 *
 * 在挂起线程的栈顶帧上求值的简易表达式求值器。
 * 支持 this、局部变量名、this 的字段名，以及用点号连接的字段访问（例如 a.b.c、items.length）。
 * 不支持方法调用和运算符，遇到时通过回调报告错误。
 */
package club.ppmc.ideabridge.host.local.jdi;

import club.ppmc.ideabridge.host.debug.ExpressionEvaluator;
import com.sun.jdi.AbsentInformationException;
import com.sun.jdi.ArrayReference;
import com.sun.jdi.Field;
import com.sun.jdi.IncompatibleThreadStateException;
import com.sun.jdi.LocalVariable;
import com.sun.jdi.ObjectReference;
import com.sun.jdi.StackFrame;
import com.sun.jdi.ThreadReference;
import com.sun.jdi.Value;
import java.util.regex.Pattern;

class JdiExpressionEvaluator implements ExpressionEvaluator {

    private static final Pattern FIELD_PATH = Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");

    private final ThreadReference thread;

    JdiExpressionEvaluator(ThreadReference thread) {
        this.thread = thread;
    }

    @Override
    public void evaluate(String expression, EvaluationCallback callback) {
        String trimmed = expression.trim();
        if (!FIELD_PATH.matcher(trimmed).matches()) {
            callback.errorOccurred("不支持的表达式: '" + expression + "'。仅支持变量名和以点号连接的字段访问。");
            return;
        }
        try {
            String[] parts = trimmed.split("\\.");
            StackFrame frame = thread.frame(0);
            Value current = resolveRoot(frame, parts[0]);
            for (int i = 1; i < parts.length; i++) {
                current = resolveMember(current, parts[i], parts[i - 1]);
            }
            callback.evaluated(JdiValues.describe(trimmed, current));
        } catch (EvaluationException e) {
            callback.errorOccurred(e.getMessage());
        } catch (IncompatibleThreadStateException e) {
            callback.errorOccurred("线程未处于挂起状态，无法求值。");
        } catch (AbsentInformationException e) {
            callback.errorOccurred("当前类缺少调试信息（编译时未包含局部变量表），无法求值局部变量。");
        } catch (RuntimeException e) {
            callback.errorOccurred("求值失败: " + e.getMessage());
        }
    }

    private Value resolveRoot(StackFrame frame, String name) throws AbsentInformationException {
        if ("this".equals(name)) {
            ObjectReference self = frame.thisObject();
            if (self == null) {
                throw new EvaluationException("静态方法中没有 this。");
            }
            return self;
        }
        LocalVariable variable = frame.visibleVariableByName(name);
        if (variable != null) {
            return frame.getValue(variable);
        }
        ObjectReference self = frame.thisObject();
        Field field = frame.location().declaringType().fieldByName(name);
        if (field != null) {
            return field.isStatic() ? frame.location().declaringType().getValue(field) : readField(self, field, name);
        }
        throw new EvaluationException("找不到变量或字段: " + name);
    }

    private Value resolveMember(Value owner, String member, String ownerName) {
        if (owner instanceof ArrayReference array && "length".equals(member)) {
            return thread.virtualMachine().mirrorOf(array.length());
        }
        if (!(owner instanceof ObjectReference object)) {
            throw new EvaluationException("'" + ownerName + "' 不是对象，无法访问 '" + member + "'。");
        }
        Field field = object.referenceType().fieldByName(member);
        if (field == null) {
            throw new EvaluationException("类型 " + object.referenceType().name() + " 中没有字段 '" + member + "'。");
        }
        return field.isStatic() ? object.referenceType().getValue(field) : object.getValue(field);
    }

    private Value readField(ObjectReference self, Field field, String name) {
        if (self == null) {
            throw new EvaluationException("静态方法中不能访问实例字段: " + name);
        }
        return self.getValue(field);
    }

    private static class EvaluationException extends RuntimeException {
        EvaluationException(String message) {
            super(message);
        }
    }
}
