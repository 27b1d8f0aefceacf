/**
 * WebSocketConfig.java
 *
 * 配置Spring WebSocket和STOMP消息代理。
 * 桥接服务通过 /topic/events 实时广播 meshcli 的异步事件，通过 /topic/session/status 广播会话状态变化。
 */
package club.ppmc.meshbridge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    /**
     * 配置消息代理。
     *
     * <p>只需要广播，所以只启用 `/topic` 前缀的 Simple Broker。
     * STOMP 心跳设为10秒发送、10秒接收，用于检测订阅方是否掉线。
     * </p>
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("ws-heartbeat-thread-");
        taskScheduler.initialize();

        config.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[] {10000, 10000})
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
    }

    /**
     * 注册STOMP端点 `/ws`。
     * 启用 SockJS 回退，并每25秒发送一次传输层心跳，防止反向代理因空闲而断开连接。
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS()
                .setHeartbeatTime(25000);
    }
}
