/**
 * Protocol.java
 *
 * 包装一条物理连接，负责 JSON 帧的发送、入站帧的缓冲以及关闭通知。
 * 握手完成之前以及连接对象接管之前收到的入站帧都会被缓冲，
 * 接管者通过 readEntireBuffer() 一次性取走它们，保证不丢帧、不乱序。
 */
package club.ppmc.devserver.socket;

import com.google.gson.Gson;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Protocol {

    private final ClientSocket socket;
    private final Gson gson;
    private final List<String> inbound = new ArrayList<>();

    private Consumer<String> messageListener;
    private Runnable closeListener;
    private boolean handshakeStarted;
    private boolean socketClosed;
    private boolean disposed;

    public Protocol(ClientSocket socket, Gson gson) {
        this.socket = socket;
        this.gson = gson;
    }

    /**
     * 标记握手开始。只有第一次调用返回 true，第一帧之后的帧都属于会话数据。
     */
    public synchronized boolean beginHandshake() {
        if (handshakeStarted) {
            return false;
        }
        handshakeStarted = true;
        return true;
    }

    public void sendMessage(Object payload) {
        send(gson.toJson(payload));
    }

    /**
     * 发送一个原始文本帧。
     *
     * @return 发送成功返回 true；套接字已关闭或写入失败返回 false。
     */
    public boolean send(String frame) {
        if (!socket.isOpen()) {
            return false;
        }
        try {
            socket.send(frame);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("向套接字 {} 发送消息失败: {}", socket.getId(), e.getMessage());
            return false;
        }
    }

    /** 由传输层调用：一个入站帧到达。 */
    public void acceptMessage(String frame) {
        Consumer<String> listener;
        synchronized (this) {
            if (disposed) {
                return;
            }
            if (messageListener == null) {
                inbound.add(frame);
                return;
            }
            listener = messageListener;
        }
        listener.accept(frame);
    }

    /** 取走所有尚未被消费的入站帧。 */
    public synchronized List<String> readEntireBuffer() {
        List<String> buffered = new ArrayList<>(inbound);
        inbound.clear();
        return buffered;
    }

    public synchronized void setMessageListener(Consumer<String> listener) {
        this.messageListener = listener;
    }

    /**
     * 注册关闭监听器。如果套接字已经关闭，监听器会被立即调用。
     */
    public void onClose(Runnable listener) {
        boolean alreadyClosed;
        synchronized (this) {
            this.closeListener = listener;
            alreadyClosed = socketClosed;
        }
        if (alreadyClosed) {
            listener.run();
        }
    }

    /** 由传输层调用：底层套接字已关闭。 */
    public void handleSocketClosed() {
        Runnable listener;
        synchronized (this) {
            if (socketClosed) {
                return;
            }
            socketClosed = true;
            listener = disposed ? null : closeListener;
        }
        if (listener != null) {
            listener.run();
        }
    }

    public synchronized boolean isSocketClosed() {
        return socketClosed;
    }

    /** 解除所有监听器并丢弃缓冲，但不关闭底层套接字。 */
    public synchronized void dispose() {
        disposed = true;
        messageListener = null;
        closeListener = null;
        inbound.clear();
    }

    /** 释放协议对象并关闭底层套接字。 */
    public void close() {
        dispose();
        socket.close();
    }

    public ClientSocket getSocket() {
        return socket;
    }
}
