/**
 * Connection.java
 *
 * 一个绑定在物理套接字上的逻辑通道。它的身份（令牌）在多次物理连接之间保持不变：
 * 套接字关闭后连接进入离线状态（记录离线时间戳），之后可以用新的套接字重连。
 *
 * <p>不变式：连接要么绑定在唯一一个存活的 Protocol 上，要么处于离线状态，二者互斥。
 * 离线期间发出的消息会进入一个有上限的队列，重连时按顺序冲刷到新的套接字。
 */
package club.ppmc.devserver.connection;

import club.ppmc.devserver.model.ConnectionInfo;
import club.ppmc.devserver.model.ConnectionType;
import club.ppmc.devserver.socket.Protocol;
import club.ppmc.devserver.util.EventChannel;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public abstract class Connection {

    @Getter private final ConnectionType type;
    @Getter private final String token;

    private final Clock clock;
    private final int maxPendingMessages;
    private final Deque<String> pendingOutbound = new ArrayDeque<>();

    private final EventChannel<Connection> onClose = new EventChannel<>("connectionClose");
    private final EventChannel<Connection> onOffline = new EventChannel<>("connectionOffline");
    private final EventChannel<Connection> onReconnect = new EventChannel<>("connectionReconnect");

    private Protocol protocol;
    private Long offline;
    private boolean disposed;

    protected Connection(
            ConnectionType type, String token, Protocol protocol, Clock clock, int maxPendingMessages) {
        this.type = type;
        this.token = token;
        this.protocol = protocol;
        this.clock = clock;
        this.maxPendingMessages = maxPendingMessages;
    }

    /**
     * 开始在初始套接字上工作。握手确认发出之后由调度器调用一次。
     * 握手帧之后、接管之前收到的帧作为启动缓冲交给 onStart。
     *
     * @throws IOException 连接背后的资源（例如扩展宿主进程）无法启动时抛出，此时连接已被释放，但套接字保持打开。
     */
    public void start() throws IOException {
        Protocol initial;
        synchronized (this) {
            initial = protocol;
        }
        List<String> startupBuffer = initial.readEntireBuffer();
        try {
            onStart(startupBuffer);
        } catch (IOException | RuntimeException e) {
            synchronized (this) {
                disposed = true;
                protocol = null;
            }
            onDispose();
            throw e;
        }
        bind(initial);
    }

    /**
     * 用新的套接字重连。旧套接字上未发出的消息冲刷到新套接字，旧套接字被关闭。
     *
     * @param newProtocol 已完成握手的新协议对象。
     * @param buffer 新套接字上握手之后已收到、尚未消费的入站帧。
     */
    public void reconnect(Protocol newProtocol, List<String> buffer) {
        Protocol old;
        synchronized (this) {
            if (disposed) {
                log.warn("连接 {} ({}) 已被释放，拒绝重连。", token, type);
                newProtocol.close();
                return;
            }
            old = protocol;
            protocol = newProtocol;
            offline = null;
            while (!pendingOutbound.isEmpty()) {
                if (!newProtocol.send(pendingOutbound.peekFirst())) {
                    break;
                }
                pendingOutbound.pollFirst();
            }
        }
        if (old != null && old != newProtocol) {
            old.close();
        }
        log.info("连接 {} ({}) 已重连到套接字 {}", token, type, newProtocol.getSocket().getId());
        bind(newProtocol);
        buffer.forEach(this::handleMessage);
        onReconnect.fire(this);
    }

    /**
     * 向客户端发送一帧。离线或发送失败时进入待发送队列，队列满时丢弃最旧的消息。
     */
    public void send(String frame) {
        synchronized (this) {
            if (disposed) {
                return;
            }
            if (protocol != null && pendingOutbound.isEmpty() && protocol.send(frame)) {
                return;
            }
            if (pendingOutbound.size() >= maxPendingMessages) {
                pendingOutbound.pollFirst();
            }
            pendingOutbound.addLast(frame);
        }
    }

    /** 释放连接：关闭套接字、释放子类资源并发布关闭事件。重复调用是安全的。 */
    public void dispose() {
        Protocol current;
        synchronized (this) {
            if (disposed) {
                return;
            }
            disposed = true;
            current = protocol;
            protocol = null;
            pendingOutbound.clear();
        }
        log.debug("正在释放连接 {} ({})", token, type);
        if (current != null) {
            current.close();
        }
        onDispose();
        onClose.fire(this);
        onClose.clear();
        onOffline.clear();
        onReconnect.clear();
    }

    /** 最近一次断开的时间戳（毫秒）；在线时为 null。 */
    public synchronized Long getOffline() {
        return offline;
    }

    public synchronized boolean isDisposed() {
        return disposed;
    }

    public synchronized boolean isOnline() {
        return protocol != null;
    }

    public synchronized int getPendingMessageCount() {
        return pendingOutbound.size();
    }

    public synchronized ConnectionInfo toInfo() {
        return new ConnectionInfo(type, token, protocol != null, offline);
    }

    public EventChannel<Connection> onClose() {
        return onClose;
    }

    public EventChannel<Connection> onOffline() {
        return onOffline;
    }

    public EventChannel<Connection> onReconnect() {
        return onReconnect;
    }

    /** 处理一个来自客户端的入站帧。 */
    protected abstract void handleMessage(String frame);

    /** 初始套接字绑定前调用；默认把启动缓冲当作普通入站帧处理。 */
    protected void onStart(List<String> startupBuffer) throws IOException {
        startupBuffer.forEach(this::handleMessage);
    }

    protected void onDispose() {}

    private void bind(Protocol target) {
        target.setMessageListener(this::handleMessage);
        target.onClose(() -> handleSocketClosed(target));
    }

    private void handleSocketClosed(Protocol closed) {
        synchronized (this) {
            if (disposed || protocol != closed) {
                // 已经被新的套接字取代，旧套接字的关闭事件不影响在线状态
                return;
            }
            protocol = null;
            offline = clock.millis();
        }
        log.info("连接 {} ({}) 的套接字已关闭，进入离线状态。", token, type);
        onOffline.fire(this);
    }
}
