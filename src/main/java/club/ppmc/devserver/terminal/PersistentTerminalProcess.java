/**
 * PersistentTerminalProcess.java
 *
 * 包装一个长期存活的终端子进程，使其在客户端断开后继续运行。
 * 它拥有一个输出记录器、两个宽限期计时器（长/短）以及一个孤儿探测屏障。
 *
 * <p>状态流转: Created → Started → {Attached, Detached} → Shutdown。
 * 客户端断开（detach）后，需要持久化的终端会启动长宽限期计时器，在计时结束前重新附加即可恢复；
 * 不需要持久化的终端则立即关闭。
 */
package club.ppmc.devserver.terminal;

import club.ppmc.devserver.model.terminal.ProcessReadyEvent;
import club.ppmc.devserver.model.terminal.ReplayEvent;
import club.ppmc.devserver.model.terminal.TerminalLaunchError;
import club.ppmc.devserver.util.EventChannel;
import club.ppmc.devserver.util.EventChannel.Subscription;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

@Slf4j
public class PersistentTerminalProcess {

    @Getter private final int id;
    @Getter private final String workspaceId;
    @Getter private final String workspaceName;
    @Getter private final boolean shouldPersist;

    private final TerminalProcess terminalProcess;
    private final TerminalRecorder recorder;
    private final GraceTimer disconnectRunner;
    private final GraceTimer shortDisconnectRunner;
    private final OrphanDetector orphanDetector;
    private final List<Subscription> subscriptions = new ArrayList<>();

    /** 记录输出、转发输出与生成回放共用的锁，保证回放帧之后不会收到其中已包含的数据。 */
    private final Object outputLock = new Object();

    private final EventChannel<String> onProcessData = new EventChannel<>("processData");
    private final EventChannel<ReplayEvent> onProcessReplay = new EventChannel<>("processReplay");
    private final EventChannel<ProcessReadyEvent> onProcessReady = new EventChannel<>("processReady");
    private final EventChannel<String> onProcessTitleChanged = new EventChannel<>("processTitle");
    private final EventChannel<Void> onOrphanQuestion = new EventChannel<>("orphanQuestion");

    private CompletableFuture<Boolean> pendingOrphanCheck;
    private boolean started;
    private boolean disposed;
    private volatile boolean inReplay;
    private volatile long pid = -1;
    private volatile String cwd = "";

    public PersistentTerminalProcess(
            int id,
            TerminalProcess terminalProcess,
            String workspaceId,
            String workspaceName,
            boolean shouldPersist,
            int cols,
            int rows,
            TaskScheduler scheduler,
            ReconnectConstants constants) {
        this.id = id;
        this.terminalProcess = terminalProcess;
        this.workspaceId = workspaceId;
        this.workspaceName = workspaceName;
        this.shouldPersist = shouldPersist;
        this.recorder = new TerminalRecorder(cols, rows, constants.recorderMaxChars());
        this.orphanDetector =
                new OrphanDetector(scheduler, constants.orphanQuestionTimeout(), constants.orphanReplyWindow());
        this.disconnectRunner = new GraceTimer(scheduler, constants.graceTime(), () -> {
            log.info(
                    "持久化终端 \"{}\": 重连宽限期 {} 已到期，进程 (pid={}) 将被关闭。",
                    id, printTime(constants.graceTime()), pid);
            shutdown(true);
        });
        this.shortDisconnectRunner = new GraceTimer(scheduler, constants.shortGraceTime(), () -> {
            log.info(
                    "持久化终端 \"{}\": 短重连宽限期 {} 已到期，进程 (pid={}) 将被关闭。",
                    id, printTime(constants.shortGraceTime()), pid);
            shutdown(true);
        });

        subscriptions.add(terminalProcess.onProcessReady().subscribe(e -> {
            this.pid = e.pid();
            this.cwd = e.cwd();
            onProcessReady.fire(e);
        }));
        subscriptions.add(terminalProcess.onProcessTitleChanged().subscribe(onProcessTitleChanged::fire));
        subscriptions.add(terminalProcess.onProcessData().subscribe(this::forwardData));
    }

    /** 客户端重新附加：取消长宽限期计时器。回放由随后的 start() 触发。 */
    public void attach() {
        disconnectRunner.cancel();
    }

    public void detach() {
        synchronized (this) {
            if (disposed) {
                return;
            }
        }
        if (shouldPersist) {
            disconnectRunner.schedule();
        } else {
            shutdown(true);
        }
    }

    /**
     * 首次调用真正启动子进程；之后的调用（重新附加的客户端）会重新发布就绪与标题事件并触发回放。
     *
     * @return 子进程启动失败时的错误值，否则为 null。
     */
    public TerminalLaunchError start() {
        synchronized (this) {
            if (!started) {
                TerminalLaunchError error = terminalProcess.start();
                if (error != null) {
                    log.warn("持久化终端 \"{}\" 启动失败: {}", id, error.message());
                    return error;
                }
                started = true;
                return null;
            }
        }
        onProcessReady.fire(new ProcessReadyEvent(pid, cwd));
        onProcessTitleChanged.fire(terminalProcess.getCurrentTitle());
        triggerReplay();
        return null;
    }

    public void shutdown(boolean immediate) {
        terminalProcess.shutdown(immediate);
    }

    public void input(String data) {
        if (inReplay) {
            return;
        }
        terminalProcess.input(data);
    }

    public void resize(int cols, int rows) {
        if (inReplay) {
            return;
        }
        recorder.recordResize(cols, rows);
        terminalProcess.resize(cols, rows);
    }

    public void acknowledgeDataEvent(int charCount) {
        if (inReplay) {
            return;
        }
        terminalProcess.acknowledgeDataEvent(charCount);
    }

    public String getInitialCwd() {
        return terminalProcess.getInitialCwd();
    }

    public String getCwd() {
        return terminalProcess.getCwd();
    }

    public long getLatency() {
        return terminalProcess.getLatency();
    }

    public String getTitle() {
        return terminalProcess.getCurrentTitle();
    }

    public long getPid() {
        return pid;
    }

    public void triggerReplay() {
        synchronized (outputLock) {
            ReplayEvent event = recorder.generateReplayEvent();
            log.info(
                    "持久化终端 \"{}\": 回放 {} 个字符和 {} 个尺寸事件",
                    id, event.dataLength(), event.resizeCount());
            inReplay = true;
            try {
                onProcessReplay.fire(event);
            } finally {
                inReplay = false;
            }
        }
        terminalProcess.clearUnacknowledgedChars();
    }

    private void forwardData(String data) {
        synchronized (outputLock) {
            recorder.recordData(data);
            onProcessData.fire(data);
        }
    }

    public void orphanQuestionReply() {
        orphanDetector.reply();
    }

    /** 确认拥有者几乎不可能返回时，把正在计时的长宽限期换成短宽限期。 */
    public void reduceGraceTime() {
        if (shortDisconnectRunner.isScheduled()) {
            return;
        }
        if (disconnectRunner.isScheduled()) {
            shortDisconnectRunner.schedule();
        }
    }

    /**
     * 判断此进程是否已没有任何拥有者。同一时刻最多只有一次探测在进行，
     * 并发的调用方共享同一次探测的结果。
     *
     * @return 值为 true 表示孤儿。
     */
    public synchronized CompletableFuture<Boolean> isOrphaned() {
        if (pendingOrphanCheck != null) {
            return pendingOrphanCheck;
        }
        if (disconnectRunner.isScheduled() || shortDisconnectRunner.isScheduled()) {
            return CompletableFuture.completedFuture(true);
        }
        CompletableFuture<Boolean> check = orphanDetector.ask();
        pendingOrphanCheck = check;
        check.whenComplete((result, error) -> clearOrphanCheck(check));
        if (!check.isDone()) {
            onOrphanQuestion.fire(null);
        }
        return check;
    }

    private synchronized void clearOrphanCheck(CompletableFuture<Boolean> check) {
        if (pendingOrphanCheck == check) {
            pendingOrphanCheck = null;
        }
    }

    public boolean isGraceTimerScheduled() {
        return disconnectRunner.isScheduled() || shortDisconnectRunner.isScheduled();
    }

    /** 取消两个计时器和孤儿屏障，并解除对底层进程事件的订阅。 */
    public void dispose() {
        synchronized (this) {
            if (disposed) {
                return;
            }
            disposed = true;
        }
        disconnectRunner.cancel();
        shortDisconnectRunner.cancel();
        orphanDetector.dispose();
        subscriptions.forEach(Subscription::cancel);
        onProcessData.clear();
        onProcessReplay.clear();
        onProcessReady.clear();
        onProcessTitleChanged.clear();
        onOrphanQuestion.clear();
    }

    /** 子进程输出，已先写入记录器。 */
    public EventChannel<String> onProcessData() {
        return onProcessData;
    }

    public EventChannel<ReplayEvent> onProcessReplay() {
        return onProcessReplay;
    }

    public EventChannel<ProcessReadyEvent> onProcessReady() {
        return onProcessReady;
    }

    public EventChannel<String> onProcessTitleChanged() {
        return onProcessTitleChanged;
    }

    public EventChannel<Void> onOrphanQuestion() {
        return onOrphanQuestion;
    }

    static String printTime(Duration duration) {
        long ms = duration.toMillis();
        long h = ms / 3_600_000;
        long m = (ms % 3_600_000) / 60_000;
        long s = (ms % 60_000) / 1000;
        long rest = ms % 1000;
        StringBuilder sb = new StringBuilder();
        if (h > 0) {
            sb.append(h).append('h');
        }
        if (m > 0) {
            sb.append(m).append('m');
        }
        if (s > 0) {
            sb.append(s).append('s');
        }
        if (rest > 0) {
            sb.append(rest).append("ms");
        }
        return sb.toString();
    }
}
