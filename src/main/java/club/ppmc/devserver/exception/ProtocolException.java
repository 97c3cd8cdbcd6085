/**
 * ProtocolException.java
 *
 * 握手失败时抛出的运行时异常。它只对当前的套接字是致命的：
 * SessionDispatcher 捕获它，向客户端发送错误帧后关闭该套接字，其他会话不受影响。
 */
package club.ppmc.devserver.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class ProtocolException extends RuntimeException {

    private final ProtocolError error;

    public ProtocolException(ProtocolError error) {
        super(error.getReason());
        this.error = error;
    }

    public ProtocolException(ProtocolError error, String detail) {
        super(error.getReason() + ": " + detail);
        this.error = error;
    }

    public ProtocolException(ProtocolError error, Throwable cause) {
        super(error.getReason() + ": " + cause.getMessage(), cause);
        this.error = error;
    }

    /**
     * 转换为发送给客户端的握手失败帧。
     *
     * @return 形如 {type: "error", reason: "..."} 的 Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of("type", "error", "reason", getMessage());
    }
}
