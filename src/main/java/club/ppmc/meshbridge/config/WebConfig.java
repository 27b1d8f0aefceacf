/**
 * WebConfig.java
 *
 * 全局的Spring Web MVC配置。
 * 桥接服务通常只被同一 Docker 网络中的 Web 应用调用，但为了方便调试，这里仍然开放CORS。
 */
package club.ppmc.meshbridge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * 配置全局CORS映射。
     * allowCredentials 为 true 时只能使用 {@code allowedOriginPatterns}。
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
