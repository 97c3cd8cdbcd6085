/**
 * WebSocketConfig.java
 *
 * 注册原始 WebSocket 端点 /remote。
 * 客户端在该端点上发送的第一帧是握手消息，之后的帧由接管套接字的连接或隧道处理。
 * 这里不使用 STOMP：重连、离线缓冲和消息顺序都由会话层自己保证。
 */
package club.ppmc.devserver.config;

import club.ppmc.devserver.socket.RemoteSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String REMOTE_ENDPOINT = "/remote";

    private final RemoteSocketHandler remoteSocketHandler;

    public WebSocketConfig(RemoteSocketHandler remoteSocketHandler) {
        this.remoteSocketHandler = remoteSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(remoteSocketHandler, REMOTE_ENDPOINT).setAllowedOriginPatterns("*");
    }
}
