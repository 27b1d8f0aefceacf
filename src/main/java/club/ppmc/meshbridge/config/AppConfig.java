/**
 * AppConfig.java
 *
 * 应用级别的Bean定义。
 * 负责绑定桥接配置，并提供事件序列化所需的 Gson 实例和统一的时钟。
 */
package club.ppmc.meshbridge.config;

import com.google.gson.Gson;
import java.time.Clock;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    @Bean
    @ConfigurationProperties(prefix = "bridge")
    public BridgeProperties bridgeProperties() {
        return new BridgeProperties();
    }

    /**
     * 全局的 Gson Bean。
     * 在WebSocket服务中用于将事件记录转换为JSON字符串，确保与前端的兼容性。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }

    /**
     * 事件接收时间戳使用的时钟。不信任 meshcli 自身的时间。
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
