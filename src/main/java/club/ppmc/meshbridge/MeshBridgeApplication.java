/**
 * MeshBridgeApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动 meshcli 桥接服务，对外暴露 HTTP 接口，并在后台持有一个长期运行的 meshcli 会话。
 * @EnableScheduling 注解用于启用定时任务，供 SessionSupervisor 的健康检查使用。
 */
package club.ppmc.meshbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MeshBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeshBridgeApplication.class, args);
    }
}
