/**
 * OrphanDetector.java
 *
 * 孤儿探测屏障。ask() 打开一个屏障并返回探测结果；屏障在收到客户端回复时提前打开，
 * 否则在超时后自动打开。屏障打开时，如果最近一次回复距今超过回复窗口，进程即被视为孤儿，
 * 也就是说，回复得慢但仍然存在的客户端依旧算作"拥有者在线"。
 */
package club.ppmc.devserver.terminal;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.LongSupplier;
import org.springframework.scheduling.TaskScheduler;

public class OrphanDetector {

    private final TaskScheduler scheduler;
    private final Duration timeout;
    private final Duration replyWindow;
    private final LongSupplier clock;

    private CompletableFuture<Void> barrier;
    private ScheduledFuture<?> autoOpen;
    private volatile long replyTime;

    public OrphanDetector(TaskScheduler scheduler, Duration timeout, Duration replyWindow) {
        this(scheduler, timeout, replyWindow, System::currentTimeMillis);
    }

    public OrphanDetector(
            TaskScheduler scheduler, Duration timeout, Duration replyWindow, LongSupplier clock) {
        this.scheduler = scheduler;
        this.timeout = timeout;
        this.replyWindow = replyWindow;
        this.clock = clock;
    }

    /**
     * 打开屏障（若尚未打开）并等待它被回复或超时打开。
     *
     * @return 在屏障打开后完成的 Future，值为 true 表示孤儿。
     */
    public synchronized CompletableFuture<Boolean> ask() {
        if (barrier == null) {
            CompletableFuture<Void> newBarrier = new CompletableFuture<>();
            barrier = newBarrier;
            replyTime = 0;
            autoOpen = scheduler.schedule(() -> open(newBarrier), Instant.now().plus(timeout));
        }
        return barrier.thenApply(v -> clock.getAsLong() - replyTime > replyWindow.toMillis());
    }

    /** 客户端对孤儿询问的回复。记录回复时间并立即打开屏障。 */
    public void reply() {
        CompletableFuture<Void> current;
        synchronized (this) {
            replyTime = clock.getAsLong();
            current = barrier;
        }
        if (current != null) {
            open(current);
        }
    }

    public synchronized boolean isWaiting() {
        return barrier != null;
    }

    /** 取消自动打开的计时器，并释放所有等待中的探测。 */
    public void dispose() {
        CompletableFuture<Void> current;
        synchronized (this) {
            current = barrier;
        }
        if (current != null) {
            open(current);
        }
    }

    private void open(CompletableFuture<Void> target) {
        synchronized (this) {
            if (barrier == target) {
                barrier = null;
                if (autoOpen != null) {
                    autoOpen.cancel(false);
                    autoOpen = null;
                }
            }
        }
        target.complete(null);
    }
}
