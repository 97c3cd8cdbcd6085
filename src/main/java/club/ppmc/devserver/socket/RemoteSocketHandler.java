/**
 * RemoteSocketHandler.java
 *
 * /remote 端点的原始 WebSocket 处理器。
 * 它为每个新连接创建一个 Protocol，把第一帧解析为握手消息交给 SessionDispatcher，
 * 之后的帧和关闭事件都转交给该 Protocol，由接管它的连接对象处理。
 */
package club.ppmc.devserver.socket;

import club.ppmc.devserver.exception.ProtocolError;
import club.ppmc.devserver.exception.ProtocolException;
import club.ppmc.devserver.model.ConnectionTypeRequest;
import club.ppmc.devserver.service.SessionDispatcher;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class RemoteSocketHandler extends TextWebSocketHandler {

    static final String PROTOCOL_ATTRIBUTE = "devserver.protocol";

    private final SessionDispatcher dispatcher;
    private final Gson gson;

    public RemoteSocketHandler(SessionDispatcher dispatcher, Gson gson) {
        this.dispatcher = dispatcher;
        this.gson = gson;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var protocol = new Protocol(new WebSocketClientSocket(session), gson);
        session.getAttributes().put(PROTOCOL_ATTRIBUTE, protocol);
        log.debug("接收到新的 WebSocket 连接 {}，等待握手。", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Protocol protocol = protocolOf(session);
        if (protocol == null) {
            return;
        }
        if (protocol.beginHandshake()) {
            ConnectionTypeRequest request;
            try {
                request = gson.fromJson(message.getPayload(), ConnectionTypeRequest.class);
            } catch (JsonParseException e) {
                dispatcher.rejectHandshake(protocol, new ProtocolException(ProtocolError.MALFORMED_HANDSHAKE, e));
                return;
            }
            if (request == null) {
                dispatcher.rejectHandshake(protocol, new ProtocolException(ProtocolError.MALFORMED_HANDSHAKE));
                return;
            }
            dispatcher.handleHandshake(protocol, request);
            return;
        }
        protocol.acceptMessage(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket 连接 {} 传输错误: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Protocol protocol = protocolOf(session);
        log.debug("WebSocket 连接断开: {} ({})", session.getId(), status);
        if (protocol != null) {
            protocol.handleSocketClosed();
        }
    }

    private Protocol protocolOf(WebSocketSession session) {
        return (Protocol) session.getAttributes().get(PROTOCOL_ATTRIBUTE);
    }
}
