/**
 * ManagementConnection.java
 *
 * 管理连接：承载任意的应用层消息（目前是终端 RPC 通道）。
 * 在消息处理器安装之前收到的入站帧会被缓存，安装时按顺序补发。
 */
package club.ppmc.devserver.connection;

import club.ppmc.devserver.model.ConnectionType;
import club.ppmc.devserver.socket.Protocol;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public class ManagementConnection extends Connection {

    private final List<String> unhandled = new ArrayList<>();
    private Consumer<String> messageHandler;

    public ManagementConnection(String token, Protocol protocol, Clock clock, int maxPendingMessages) {
        super(ConnectionType.MANAGEMENT, token, protocol, clock, maxPendingMessages);
    }

    public void setMessageHandler(Consumer<String> handler) {
        List<String> backlog;
        synchronized (unhandled) {
            this.messageHandler = handler;
            backlog = new ArrayList<>(unhandled);
            unhandled.clear();
        }
        backlog.forEach(handler);
    }

    @Override
    protected void handleMessage(String frame) {
        Consumer<String> handler;
        synchronized (unhandled) {
            handler = messageHandler;
            if (handler == null) {
                unhandled.add(frame);
                return;
            }
        }
        handler.accept(frame);
    }

    @Override
    protected void onDispose() {
        synchronized (unhandled) {
            unhandled.clear();
            messageHandler = null;
        }
    }
}
