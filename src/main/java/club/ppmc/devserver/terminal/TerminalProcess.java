/**
 * TerminalProcess.java
 *
 * 一个终端子进程的抽象。PersistentTerminalProcess 只通过此接口与底层进程交互，
 * 测试中可以用内存实现替代真实的操作系统进程。
 */
package club.ppmc.devserver.terminal;

import club.ppmc.devserver.model.terminal.ProcessReadyEvent;
import club.ppmc.devserver.model.terminal.TerminalLaunchError;
import club.ppmc.devserver.util.EventChannel;

public interface TerminalProcess {

    /**
     * 启动子进程。
     *
     * @return 启动失败时返回错误值；成功时返回 null。
     */
    TerminalLaunchError start();

    void input(String data);

    void resize(int cols, int rows);

    /** 客户端确认已处理的字符数，用于流控。 */
    void acknowledgeDataEvent(int charCount);

    /** 回放后重置未确认字符计数。 */
    void clearUnacknowledgedChars();

    void shutdown(boolean immediate);

    String getInitialCwd();

    String getCwd();

    long getLatency();

    String getCurrentTitle();

    EventChannel<String> onProcessData();

    /** 进程退出事件，载荷为退出码；无法取得退出码时为 null。 */
    EventChannel<Integer> onProcessExit();

    EventChannel<ProcessReadyEvent> onProcessReady();

    EventChannel<String> onProcessTitleChanged();
}
