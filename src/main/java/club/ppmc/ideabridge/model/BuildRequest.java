/**
 * BuildRequest.java
 *
 * 该文件定义了构建请求的数据传输对象，由 BuildController 接收。
 */
package club.ppmc.ideabridge.model;

import jakarta.validation.constraints.Positive;

/**
 * @param incremental 是否增量编译，缺省为 true。
 * @param timeoutSeconds 覆盖默认的构建超时，秒。
 * @param projectRef 项目名称或路径，缺省为第一个已打开的项目。
 */
public record BuildRequest(Boolean incremental, @Positive Integer timeoutSeconds, String projectRef) {

    public boolean isIncremental() {
        return incremental == null || incremental;
    }
}
