/**
 * WebSocketClientSocket.java
 *
 * 把 Spring 的 WebSocketSession 适配为 ClientSocket。
 * 使用 ConcurrentWebSocketSessionDecorator 包装会话，使终端输出线程与 RPC 回复线程可以并发发送。
 */
package club.ppmc.devserver.socket;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Slf4j
public class WebSocketClientSocket implements ClientSocket {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 4 * 1024 * 1024;

    private final WebSocketSession session;

    public WebSocketClientSocket(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String message) throws IOException {
        session.sendMessage(new TextMessage(message));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("关闭 WebSocket 会话 {} 时出错: {}", session.getId(), e.getMessage());
        }
    }
}
