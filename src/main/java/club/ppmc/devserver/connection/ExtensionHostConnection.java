/**
 * ExtensionHostConnection.java
 *
 * 扩展宿主连接：为每个令牌启动一个扩展宿主子进程，并在套接字与进程之间按行转发消息。
 * 进程以客户端请求的界面语言启动；客户端接管之前收到的帧（启动缓冲）最先写入进程。
 * 离线期间进程的输出进入待发送队列，重连后回放到新的套接字。进程退出即释放连接。
 */
package club.ppmc.devserver.connection;

import club.ppmc.devserver.model.ConnectionType;
import club.ppmc.devserver.service.EnvironmentService;
import club.ppmc.devserver.socket.Protocol;
import club.ppmc.devserver.util.ChildProcessSpawner;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ExtensionHostConnection extends Connection {

    static final String LOCALE_ENV = "DEVSERVER_LOCALE";
    static final String TOKEN_ENV = "DEVSERVER_RECONNECTION_TOKEN";

    @Getter private final String language;
    private final EnvironmentService environmentService;
    private final ChildProcessSpawner spawner;
    private final ExecutorService executorService;

    private final Object writeLock = new Object();
    private volatile Process process;
    private volatile BufferedWriter writer;

    public ExtensionHostConnection(
            String token,
            String language,
            Protocol protocol,
            EnvironmentService environmentService,
            ChildProcessSpawner spawner,
            ExecutorService executorService,
            Clock clock,
            int maxPendingMessages) {
        super(ConnectionType.EXTENSION_HOST, token, protocol, clock, maxPendingMessages);
        this.language = language;
        this.environmentService = environmentService;
        this.spawner = spawner;
        this.executorService = executorService;
    }

    @Override
    protected void onStart(List<String> startupBuffer) throws IOException {
        Map<String, String> env = new HashMap<>(environmentService.getEnvironment().getExtensionHostEnv());
        env.put(LOCALE_ENV, language);
        env.put(TOKEN_ENV, getToken());

        Process started = spawner.spawn(
                environmentService.getExtensionHostCommand(),
                environmentService.getWorkspaceRoot().toFile(),
                env);
        this.process = started;
        this.writer = new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));
        log.info("已为连接 {} 启动扩展宿主进程 PID {} (语言: {})", getToken(), started.pid(), language);

        for (String frame : startupBuffer) {
            writeToProcess(frame);
        }

        CompletableFuture<Void> readerFuture =
                CompletableFuture.runAsync(() -> readAndForwardOutput(started), executorService);
        started.onExit()
                .thenCombine(readerFuture, (p, v) -> p)
                .whenComplete((p, error) -> {
                    log.info("连接 {} 的扩展宿主进程已退出，连接将被释放。", getToken());
                    dispose();
                });
    }

    @Override
    protected void handleMessage(String frame) {
        writeToProcess(frame);
    }

    @Override
    protected void onDispose() {
        Process current = process;
        if (current != null && current.isAlive()) {
            log.info("正在结束连接 {} 的扩展宿主进程 PID {}", getToken(), current.pid());
            current.destroy();
        }
    }

    public boolean isProcessAlive() {
        Process current = process;
        return current != null && current.isAlive();
    }

    private void readAndForwardOutput(Process started) {
        try (var reader = new BufferedReader(new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                send(line);
            }
        } catch (IOException e) {
            log.info("读取扩展宿主输出时出错 (可能是进程已结束): {}", e.getMessage());
        }
    }

    private void writeToProcess(String frame) {
        BufferedWriter current = writer;
        if (current == null) {
            log.warn("扩展宿主尚未启动，丢弃一帧输入。");
            return;
        }
        // 子进程 stdin 可能阻塞，不能占用连接自身的锁
        synchronized (writeLock) {
            try {
                current.write(frame);
                current.newLine();
                current.flush();
            } catch (IOException e) {
                log.error("向连接 {} 的扩展宿主进程写入失败: {}", getToken(), e.getMessage());
            }
        }
    }
}
