/**
 * Remedy.java
 *
 * 对调用方的处理建议：稍后重试、重置锁、等待更久，还是修正请求。
 */
package club.ppmc.ideabridge.model;

public enum Remedy {
    RETRY_LATER,
    RESET_LOCK,
    WAIT_LONGER,
    FIX_REQUEST,
    NONE
}
