/**
 * CompileMessage.java
 *
 * 该文件定义了一条编译诊断信息（错误或警告）。
 * 由编译宿主从编译器输出中解析得到，并作为 CompileResult 和 DiagnosticsResult 的组成部分返回给调用方。
 */
package club.ppmc.ideabridge.model;

/**
 * 代表一条编译诊断信息。
 *
 * @param type 结果类型 ("ERROR", "WARNING")。
 * @param message 具体的诊断信息文本。
 * @param filePath 产生问题的源文件路径。
 * @param lineNumber 问题所在的行号 (基于1)。
 * @param columnNumber 问题所在的列号 (基于1)。
 */
public record CompileMessage(
        String type, String message, String filePath, Integer lineNumber, Integer columnNumber) {

    public static final String ERROR = "ERROR";
    public static final String WARNING = "WARNING";

    public boolean isError() {
        return ERROR.equals(type);
    }
}
