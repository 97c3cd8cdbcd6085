/**
 * TerminalLaunchError.java
 *
 * 终端子进程启动失败时返回给调用方的结果值。它不是异常：
 * 注册表中的条目依旧存在（但处于惰性状态），由调用方决定是否关闭它。
 *
 * @param message 失败原因。
 * @param code 可选的错误码，无法获得时为 null。
 */
package club.ppmc.devserver.model.terminal;

public record TerminalLaunchError(String message, Integer code) {}
