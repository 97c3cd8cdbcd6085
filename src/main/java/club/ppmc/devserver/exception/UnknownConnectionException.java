/**
 * UnknownConnectionException.java
 *
 * 调用方引用了一个不存在的连接令牌。
 */
package club.ppmc.devserver.exception;

import club.ppmc.devserver.model.ConnectionType;
import java.util.Map;
import lombok.Getter;

@Getter
public class UnknownConnectionException extends RuntimeException {

    private final ConnectionType connectionType;
    private final String token;

    public UnknownConnectionException(ConnectionType connectionType, String token) {
        super("No " + connectionType + " connection for token \"" + token + "\"");
        this.connectionType = connectionType;
        this.token = token;
    }

    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "UNKNOWN_CONNECTION",
                "message", getMessage(),
                "connectionType", connectionType.name(),
                "token", token);
    }
}
