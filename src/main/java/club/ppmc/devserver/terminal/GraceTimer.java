/**
 * GraceTimer.java
 *
 * 一次性的可取消计时器，用于持久化终端的宽限期。
 * schedule() 会重新计时；cancel() 是幂等的，对已触发或已取消的计时器调用不会出错。
 * 每次 schedule() 都有一个代号，过期代号的回调即使已被线程池取出也不会执行，
 * 因此"取消后又被触发"的竞态不会关闭进程。
 */
package club.ppmc.devserver.terminal;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.springframework.scheduling.TaskScheduler;

public class GraceTimer {

    private final TaskScheduler scheduler;
    private final Duration delay;
    private final Runnable task;

    private ScheduledFuture<?> future;
    private long generation;

    public GraceTimer(TaskScheduler scheduler, Duration delay, Runnable task) {
        this.scheduler = scheduler;
        this.delay = delay;
        this.task = task;
    }

    public synchronized void schedule() {
        cancel();
        long scheduledGeneration = ++generation;
        future = scheduler.schedule(() -> fire(scheduledGeneration), Instant.now().plus(delay));
    }

    public synchronized void cancel() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
        generation++;
    }

    public synchronized boolean isScheduled() {
        return future != null;
    }

    private void fire(long firedGeneration) {
        synchronized (this) {
            if (firedGeneration != generation || future == null) {
                return;
            }
            future = null;
        }
        // 在锁外执行，任务可能会回调 cancel()
        task.run();
    }
}
