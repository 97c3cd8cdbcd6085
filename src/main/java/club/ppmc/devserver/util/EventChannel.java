/**
 * EventChannel.java
 *
 * 一个类型化的发布/订阅通道，每一类事件（数据、退出、就绪、标题、回放等）各用一个实例。
 * 订阅返回一个 Subscription，调用 cancel() 即可退订。
 * 监听器抛出的异常会被记录并隔离，不会影响其他监听器，也不会打断计时器或注册表的状态转换。
 */
package club.ppmc.devserver.util;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class EventChannel<T> {

    private final String name;
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    public EventChannel(String name) {
        this.name = name;
    }

    public Subscription subscribe(Consumer<? super T> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * 按订阅顺序同步地通知所有监听器。
     *
     * @param event 事件载荷。
     */
    public void fire(T event) {
        for (Consumer<? super T> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("事件通道 '{}' 的监听器执行失败，已忽略。", name, e);
            }
        }
    }

    public void clear() {
        listeners.clear();
    }

    public int size() {
        return listeners.size();
    }

    /** 一次订阅的句柄。重复取消是安全的。 */
    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }
}
