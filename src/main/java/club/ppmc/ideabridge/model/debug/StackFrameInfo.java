/**
 * StackFrameInfo.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于表示调用栈中的一个帧（Frame）。
 * 它提供了关于类、方法调用、文件名和行号的信息。
 */
package club.ppmc.ideabridge.model.debug;

/**
 * 代表调用栈中的一个帧的记录。
 *
 * @param index 帧在调用栈中的位置，0 为栈顶。
 * @param className 声明该方法的类。
 * @param methodName 当前帧所执行的方法名。
 * @param fileName 方法所在的文件名。
 * @param lineNumber 当前执行到的行号。
 */
public record StackFrameInfo(int index, String className, String methodName, String fileName, int lineNumber) {}
