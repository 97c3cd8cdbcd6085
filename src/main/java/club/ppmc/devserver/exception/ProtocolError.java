/**
 * ProtocolError.java
 *
 * 握手阶段可能出现的协议错误类型。每个错误都带有发送给客户端的原因文本，
 * 客户端据此决定是放弃重连还是重新建立会话。
 */
package club.ppmc.devserver.exception;

import lombok.Getter;

@Getter
public enum ProtocolError {
    MISSING_TOKEN("Reconnection token is missing"),
    DUPLICATE_TOKEN("Duplicate reconnection token"),
    UNRECOGNIZED_TOKEN("Unrecognized reconnection token"),
    UNRECOGNIZED_TYPE("Unrecognized connection type"),
    MALFORMED_HANDSHAKE("Malformed handshake message"),
    EXTENSION_HOST_UNAVAILABLE("Extension host is not available"),
    TUNNEL_FAILED("Unable to open tunnel");

    private final String reason;

    ProtocolError(String reason) {
        this.reason = reason;
    }
}
