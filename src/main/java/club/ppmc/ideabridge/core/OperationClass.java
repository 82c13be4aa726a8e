/**
 * OperationClass.java
 *
 * 互斥操作的类别。同一类别在一个进程内最多只有一个正在进行的实例。
 */
package club.ppmc.ideabridge.core;

public enum OperationClass {
    BUILD("构建"),
    TEST("测试");

    private final String displayName;

    OperationClass(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
