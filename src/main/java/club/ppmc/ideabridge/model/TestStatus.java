/**
 * TestStatus.java
 *
 * 单个测试用例的结果。FAILED 表示断言失败，ERROR 表示测试抛出了非断言异常。
 */
package club.ppmc.ideabridge.model;

public enum TestStatus {
    PASSED,
    FAILED,
    ERROR,
    SKIPPED
}
