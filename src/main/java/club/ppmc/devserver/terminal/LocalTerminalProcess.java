/**
 * LocalTerminalProcess.java
 *
 * 基于操作系统进程的终端实现（如 bash 或 cmd.exe）。
 * 它把进程的输出流异步读取为数据事件，把输入写入进程的标准输入，
 * 并实现了一个简单的流控：未确认字符超过高水位时暂停读取，客户端确认到低水位以下后恢复。
 */
package club.ppmc.devserver.terminal;

import club.ppmc.devserver.model.terminal.ProcessReadyEvent;
import club.ppmc.devserver.model.terminal.ShellLaunchConfig;
import club.ppmc.devserver.model.terminal.TerminalLaunchError;
import club.ppmc.devserver.util.ChildProcessSpawner;
import club.ppmc.devserver.util.EventChannel;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

@Slf4j
public class LocalTerminalProcess implements TerminalProcess {

    static final int HIGH_WATERMARK_CHARS = 100_000;
    static final int LOW_WATERMARK_CHARS = 5_000;

    private static final boolean IS_WINDOWS =
            System.getProperty("os.name").toLowerCase().contains("win");

    private final ShellLaunchConfig launchConfig;
    private final String initialCwd;
    private final Map<String, String> env;
    private final String defaultShell;
    private final ChildProcessSpawner spawner;
    private final ExecutorService executorService;

    private final EventChannel<String> onProcessData = new EventChannel<>("processData");
    private final EventChannel<Integer> onProcessExit = new EventChannel<>("processExit");
    private final EventChannel<ProcessReadyEvent> onProcessReady = new EventChannel<>("processReady");
    private final EventChannel<String> onProcessTitleChanged = new EventChannel<>("processTitle");

    private final Object flowLock = new Object();
    private int unacknowledgedCharCount;
    private boolean paused;
    /** 子进程已结束或正在被关闭；此后读取线程不再暂停，直接把剩余输出读完。 */
    private boolean processExited;

    private final AtomicBoolean exitFired = new AtomicBoolean(false);
    private volatile Process process;
    private volatile BufferedWriter writer;
    private volatile String currentTitle;
    private int cols;
    private int rows;

    public LocalTerminalProcess(
            ShellLaunchConfig launchConfig,
            String cwd,
            int cols,
            int rows,
            Map<String, String> env,
            String defaultShell,
            ChildProcessSpawner spawner,
            ExecutorService executorService) {
        this.launchConfig = launchConfig;
        this.initialCwd = cwd;
        this.cols = cols;
        this.rows = rows;
        this.env = env != null ? env : Map.of();
        this.defaultShell = defaultShell;
        this.spawner = spawner;
        this.executorService = executorService;
        this.currentTitle = resolveTitle();
    }

    @Override
    public synchronized TerminalLaunchError start() {
        if (process != null) {
            return null;
        }
        Path workingDirectory = Paths.get(initialCwd).toAbsolutePath().normalize();
        if (!Files.isDirectory(workingDirectory)) {
            log.warn("终端启动目录不存在: {}", workingDirectory);
            return new TerminalLaunchError(
                    "Starting directory (cwd) \"" + workingDirectory + "\" does not exist", null);
        }

        List<String> command = buildCommand();
        Map<String, String> processEnv = new HashMap<>(env);
        if (launchConfig.getEnv() != null) {
            processEnv.putAll(launchConfig.getEnv());
        }
        processEnv.put("COLUMNS", Integer.toString(cols));
        processEnv.put("LINES", Integer.toString(rows));
        if (!IS_WINDOWS) {
            processEnv.putIfAbsent("TERM", "xterm-256color");
            processEnv.putIfAbsent("LANG", "en_US.UTF-8"); // 设置环境变量以支持UTF-8
        }

        Process started;
        try {
            started = spawner.spawn(command, workingDirectory.toFile(), processEnv);
        } catch (IOException e) {
            log.error("启动终端进程失败，命令: {}", command, e);
            return new TerminalLaunchError("A native exception occurred during launch: " + e.getMessage(), null);
        }
        this.process = started;
        this.writer =
                new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));

        onProcessReady.fire(new ProcessReadyEvent(started.pid(), workingDirectory.toString()));
        onProcessTitleChanged.fire(currentTitle);

        // 暂停中的读取线程必须在进程结束时被唤醒，否则下面的退出事件永远等不到读取结束
        started.onExit().thenRun(this::releaseFlowControl);

        // 进程退出且输出流被完全读取后，才发布退出事件，保证最后的输出不会丢失
        CompletableFuture<Void> readerFuture =
                CompletableFuture.runAsync(() -> readAndForwardOutput(started), executorService);
        started.onExit()
                .thenCombine(readerFuture, (p, v) -> p)
                .whenComplete((p, error) -> fireExit(error == null ? p.exitValue() : null));
        return null;
    }

    private void readAndForwardOutput(Process started) {
        try (var reader = new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8)) {
            char[] buffer = new char[4096];
            int charsRead;
            while ((charsRead = reader.read(buffer)) != -1) {
                onProcessData.fire(new String(buffer, 0, charsRead));
                awaitAcknowledgement(charsRead);
            }
        } catch (IOException e) {
            // 当进程被销毁时，读取流会关闭并抛出异常
            log.info("读取终端进程 PID {} 输出时出错 (可能是会话已正常结束): {}", started.pid(), e.getMessage());
        }
    }

    private void awaitAcknowledgement(int charsRead) {
        synchronized (flowLock) {
            unacknowledgedCharCount += charsRead;
            if (!paused && !processExited && unacknowledgedCharCount > HIGH_WATERMARK_CHARS) {
                log.debug("终端 PID {} 未确认字符达到 {}，暂停读取。", process.pid(), unacknowledgedCharCount);
                paused = true;
            }
            while (paused && !processExited) {
                try {
                    flowLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    @Override
    public void input(String data) {
        BufferedWriter current = writer;
        if (current == null) {
            log.warn("终端尚未启动，忽略 {} 个字符的输入。", data.length());
            return;
        }
        try {
            current.write(data);
            current.flush();
        } catch (IOException e) {
            log.error("向终端进程写入失败: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void resize(int cols, int rows) {
        // 管道没有窗口尺寸的概念，新尺寸只在下次启动时通过 COLUMNS/LINES 生效
        this.cols = cols;
        this.rows = rows;
        log.debug("终端尺寸变为 {}x{}", cols, rows);
    }

    @Override
    public void acknowledgeDataEvent(int charCount) {
        synchronized (flowLock) {
            unacknowledgedCharCount = Math.max(unacknowledgedCharCount - charCount, 0);
            if (paused && unacknowledgedCharCount < LOW_WATERMARK_CHARS) {
                paused = false;
                flowLock.notifyAll();
            }
        }
    }

    @Override
    public void clearUnacknowledgedChars() {
        synchronized (flowLock) {
            unacknowledgedCharCount = 0;
            paused = false;
            flowLock.notifyAll();
        }
    }

    @Override
    public void shutdown(boolean immediate) {
        Process current = process;
        if (current == null) {
            // 从未启动的进程没有 onExit 回调，直接发布退出事件
            fireExit(null);
            return;
        }
        log.info("正在结束终端进程 PID {} (immediate={})", current.pid(), immediate);
        releaseFlowControl();
        if (immediate) {
            current.destroyForcibly();
        } else {
            current.destroy();
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("关闭终端写入器时出错: {}", e.getMessage());
        }
    }

    @Override
    public String getInitialCwd() {
        return initialCwd;
    }

    @Override
    public String getCwd() {
        Process current = process;
        if (current == null || IS_WINDOWS) {
            return initialCwd;
        }
        try {
            return Files.readSymbolicLink(Paths.get("/proc", Long.toString(current.pid()), "cwd")).toString();
        } catch (IOException | UnsupportedOperationException e) {
            return initialCwd;
        }
    }

    @Override
    public long getLatency() {
        return 0;
    }

    @Override
    public String getCurrentTitle() {
        return currentTitle;
    }

    @Override
    public EventChannel<String> onProcessData() {
        return onProcessData;
    }

    @Override
    public EventChannel<Integer> onProcessExit() {
        return onProcessExit;
    }

    @Override
    public EventChannel<ProcessReadyEvent> onProcessReady() {
        return onProcessReady;
    }

    @Override
    public EventChannel<String> onProcessTitleChanged() {
        return onProcessTitleChanged;
    }

    private void releaseFlowControl() {
        synchronized (flowLock) {
            processExited = true;
            paused = false;
            flowLock.notifyAll();
        }
    }

    private void fireExit(Integer exitCode) {
        if (!exitFired.compareAndSet(false, true)) {
            return;
        }
        log.info("终端进程 '{}' 已退出，退出码: {}", currentTitle, exitCode);
        onProcessExit.fire(exitCode);
    }

    private List<String> buildCommand() {
        List<String> command = new ArrayList<>();
        if (StringUtils.hasText(launchConfig.getExecutable())) {
            command.add(launchConfig.getExecutable());
            if (launchConfig.getArgs() != null) {
                command.addAll(launchConfig.getArgs());
            }
        } else if (StringUtils.hasText(defaultShell)) {
            command.add(defaultShell);
        } else if (IS_WINDOWS) {
            // 在Windows上，启动cmd并执行chcp 65001将代码页切换为UTF-8，以支持中文
            command.addAll(List.of("cmd.exe", "/K", "chcp 65001 > nul"));
        } else {
            command.addAll(List.of("bash", "-i"));
        }
        return command;
    }

    private String resolveTitle() {
        if (StringUtils.hasText(launchConfig.getName())) {
            return launchConfig.getName();
        }
        String executable = StringUtils.hasText(launchConfig.getExecutable())
                ? launchConfig.getExecutable()
                : StringUtils.hasText(defaultShell) ? defaultShell : (IS_WINDOWS ? "cmd.exe" : "bash");
        return Paths.get(executable).getFileName().toString();
    }
}
