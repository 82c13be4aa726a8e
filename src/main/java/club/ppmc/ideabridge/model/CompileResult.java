/**
 * CompileResult.java
 *
 * 一次构建操作的结构化结果。超时或锁获取失败时同样返回该结构，error 字段说明原因。
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * @param success 编译是否成功（未中止且没有错误）。
 * @param errors 编译错误。
 * @param warnings 编译警告。
 * @param timeMs 耗时，毫秒。
 * @param aborted 编译是否被中止或在超时前未完成。
 * @param error 非编译错误导致的失败原因，例如锁超时。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResult(
        boolean success,
        List<CompileMessage> errors,
        List<CompileMessage> warnings,
        long timeMs,
        boolean aborted,
        BridgeError error) {

    public static CompileResult completed(boolean aborted, List<CompileMessage> messages, long timeMs) {
        List<CompileMessage> errors = messages.stream().filter(CompileMessage::isError).toList();
        List<CompileMessage> warnings = messages.stream().filter(m -> !m.isError()).toList();
        return new CompileResult(!aborted && errors.isEmpty(), errors, warnings, timeMs, aborted, null);
    }

    public static CompileResult failed(BridgeError error, long timeMs, boolean aborted) {
        return new CompileResult(false, List.of(), List.of(), timeMs, aborted, error);
    }

    public CompileResult withTimeMs(long newTimeMs) {
        return new CompileResult(success, errors, warnings, newTimeMs, aborted, error);
    }
}
