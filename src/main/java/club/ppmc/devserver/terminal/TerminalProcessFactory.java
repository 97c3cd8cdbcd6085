package club.ppmc.devserver.terminal;

import club.ppmc.devserver.model.terminal.ShellLaunchConfig;
import java.util.Map;

/** 创建（尚未启动的）终端子进程。 */
public interface TerminalProcessFactory {

    TerminalProcess create(
            ShellLaunchConfig launchConfig, String cwd, int cols, int rows, Map<String, String> env);
}
