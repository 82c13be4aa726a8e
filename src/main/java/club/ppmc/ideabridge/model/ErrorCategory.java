/**
 * ErrorCategory.java
 *
 * 错误在边界层的结构化分类。调用方可以据此分支处理，而无需匹配错误消息文本。
 */
package club.ppmc.ideabridge.model;

public enum ErrorCategory {
    /** 请求本身不合法（缺少必填字段等）。 */
    VALIDATION,
    /** 请求引用的对象不存在（未知的运行ID、运行配置等）。 */
    NOT_FOUND,
    /** 当前状态不允许执行该操作（锁被占用、会话未暂停等）。 */
    CONFLICT,
    /** 等待宿主完成时超时。 */
    TIMEOUT,
    /** 内部故障或宿主报告的错误。 */
    INTERNAL
}
