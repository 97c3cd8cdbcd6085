/**
 * LocalTerminalProcessFactory.java
 *
 * 创建基于操作系统进程的终端。所有终端共享一个缓存线程池来读取输出。
 */
package club.ppmc.devserver.terminal;

import club.ppmc.devserver.model.terminal.ShellLaunchConfig;
import club.ppmc.devserver.service.EnvironmentService;
import club.ppmc.devserver.util.ChildProcessSpawner;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.stereotype.Component;

@Component
public class LocalTerminalProcessFactory implements TerminalProcessFactory {

    private final ChildProcessSpawner spawner;
    private final EnvironmentService environmentService;
    private final ExecutorService executorService = Executors.newCachedThreadPool();

    public LocalTerminalProcessFactory(ChildProcessSpawner spawner, EnvironmentService environmentService) {
        this.spawner = spawner;
        this.environmentService = environmentService;
    }

    @Override
    public TerminalProcess create(
            ShellLaunchConfig launchConfig, String cwd, int cols, int rows, Map<String, String> env) {
        return new LocalTerminalProcess(
                launchConfig,
                environmentService.resolveTerminalCwd(cwd),
                cols,
                rows,
                env,
                environmentService.getDefaultShell(),
                spawner,
                executorService);
    }

    @PreDestroy
    public void destroy() {
        executorService.shutdownNow();
    }
}
