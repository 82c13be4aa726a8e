/**
 * RunCategory.java
 */
package club.ppmc.ideabridge.model;

public enum RunCategory {
    /** 由运行配置启动的普通程序。 */
    APPLICATION,
    /** 测试操作启动的测试进程。 */
    TEST,
    /** 以 JDWP 调试模式启动的程序。 */
    DEBUG
}
