/**
 * LocalChildProcessSpawner.java
 *
 * 基于 ProcessBuilder 的子进程启动器。
 * 它接受一个命令列表（而不是单个字符串）以避免因路径中存在空格而导致的解析问题。
 */
package club.ppmc.devserver.util;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LocalChildProcessSpawner implements ChildProcessSpawner {

    @Override
    public Process spawn(List<String> command, File workingDirectory, Map<String, String> env)
            throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IOException("执行的命令不能为空。");
        }
        var processBuilder =
                new ProcessBuilder(command)
                        .directory(workingDirectory)
                        .redirectErrorStream(true); // 将错误流重定向到标准输出流
        if (env != null) {
            processBuilder.environment().putAll(env);
        }
        Process process = processBuilder.start();
        log.info(
                "已在目录 {} 中启动进程 PID {}: {}",
                workingDirectory.getAbsolutePath(),
                process.pid(),
                String.join(" ", command));
        return process;
    }
}
