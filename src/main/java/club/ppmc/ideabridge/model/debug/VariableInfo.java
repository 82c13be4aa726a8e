/**
 * VariableInfo.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于表示调试器暂停时一个变量或一次表达式求值的结果。
 * 它包含了名称、类型和值的字符串表示。
 */
package club.ppmc.ideabridge.model.debug;

/**
 * @param name 变量名称或表达式。
 * @param type 类型（例如, "int", "java.lang.String"）。
 * @param value 当前值的字符串表示。
 */
public record VariableInfo(String name, String type, String value) {}
