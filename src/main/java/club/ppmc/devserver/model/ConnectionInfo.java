package club.ppmc.devserver.model;

/**
 * 一个逻辑连接的只读快照，供 REST 接口展示。
 *
 * @param type 连接类型。
 * @param token 重连令牌。
 * @param online 当前是否绑定了存活的套接字。
 * @param offlineSince 最近一次断开的时间戳（毫秒），在线时为 null。
 */
public record ConnectionInfo(ConnectionType type, String token, boolean online, Long offlineSince) {}
