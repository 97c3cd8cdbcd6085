/**
 * ConnectionTypeRequest.java
 *
 * 握手消息，即客户端在新套接字上发送的第一帧。
 * 由 RemoteSocketHandler 使用 Gson 反序列化后交给 SessionDispatcher。
 */
package club.ppmc.devserver.model;

import lombok.Data;

@Data
public class ConnectionTypeRequest {

    private ConnectionType desiredConnectionType;

    /** 客户端提供的不透明令牌，在多次物理连接之间标识同一个逻辑会话。必填。 */
    private String reconnectionToken;

    /** 为 true 表示这是对已有会话的重连，而不是新会话。 */
    private boolean reconnection;

    /** 客户端构建所对应的提交号，仅用于版本不一致时的告警。 */
    private String commit;

    private Args args;

    @Data
    public static class Args {
        /** 扩展宿主的界面语言，例如 "en" 或 "zh-cn"。 */
        private String language;

        /** 隧道连接的目标本地端口。 */
        private Integer port;
    }
}
