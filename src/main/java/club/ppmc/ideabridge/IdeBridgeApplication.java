/**
 * IdeBridgeApplication.java
 *
 * Spring Boot 应用的主入口类。
 * @EnableScheduling 用于启用定时任务，供 RunRegistryService 定期清理已结束的运行。
 */
package club.ppmc.ideabridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IdeBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdeBridgeApplication.class, args);
    }
}
