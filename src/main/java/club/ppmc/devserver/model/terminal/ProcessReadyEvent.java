package club.ppmc.devserver.model.terminal;

/**
 * 终端子进程就绪时发布的事件。
 *
 * @param pid 操作系统进程号。
 * @param cwd 启动时的工作目录。
 */
public record ProcessReadyEvent(long pid, String cwd) {}
