/**
 * WebConfig.java
 *
 * 全局的 Spring Web MVC 配置，目前只配置 /api 下状态接口的跨域访问。
 */
package club.ppmc.devserver.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * 允许任意来源读取连接和终端状态。
     * 使用 allowedOriginPatterns 而不是 allowedOrigins，才能与 allowCredentials(true) 同时使用。
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "DELETE")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
