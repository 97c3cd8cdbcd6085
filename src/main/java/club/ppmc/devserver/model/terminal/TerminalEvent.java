package club.ppmc.devserver.model.terminal;

/**
 * 注册表级别的事件包装，附带产生事件的持久化终端 ID。
 *
 * @param id 持久化终端 ID。
 * @param payload 具体事件载荷。
 */
public record TerminalEvent<T>(int id, T payload) {}
