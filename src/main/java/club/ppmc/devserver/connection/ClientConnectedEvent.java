package club.ppmc.devserver.connection;

/**
 * 新的管理连接注册完成后由 SessionDispatcher 发布的 Spring 应用事件。
 *
 * @param connection 新注册的管理连接。
 */
public record ClientConnectedEvent(ManagementConnection connection) {}
