/**
 * ClientSocket.java
 *
 * 一条物理连接的最小抽象：发送文本帧、关闭、查询是否存活。
 * 生产环境由 WebSocketClientSocket 实现，测试中使用内存实现。
 */
package club.ppmc.devserver.socket;

import java.io.IOException;

public interface ClientSocket {

    String getId();

    boolean isOpen();

    void send(String message) throws IOException;

    /** 关闭连接。重复调用是安全的。 */
    void close();
}
