/**
 * TunnelService.java
 *
 * 隧道连接：把一个 WebSocket 直接转交给本机的 TCP 端口。
 * 字节在两个方向上原样转发，WebSocket 一侧以 Base64 文本帧承载。
 * 隧道不会被登记为连接，也不支持重连；任意一端关闭，另一端随之关闭。
 */
package club.ppmc.devserver.service;

import club.ppmc.devserver.exception.ProtocolError;
import club.ppmc.devserver.exception.ProtocolException;
import club.ppmc.devserver.model.ConnectionTypeRequest;
import club.ppmc.devserver.socket.Protocol;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TunnelService {

    private static final int READ_BUFFER_SIZE = 8192;

    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final Set<Socket> openSockets = ConcurrentHashMap.newKeySet();

    /**
     * 打开到 127.0.0.1:args.port 的 TCP 连接并接管该协议对象。
     *
     * @throws ProtocolException 缺少端口或无法连接目标端口时抛出，由调度器回复错误帧并关闭套接字。
     */
    public void tunnel(Protocol protocol, ConnectionTypeRequest request) {
        Integer port = request.getArgs() != null ? request.getArgs().getPort() : null;
        if (port == null || port <= 0 || port > 65535) {
            throw new ProtocolException(ProtocolError.TUNNEL_FAILED, "missing or invalid port");
        }

        Socket socket;
        try {
            socket = new Socket(InetAddress.getLoopbackAddress(), port);
        } catch (IOException e) {
            throw new ProtocolException(ProtocolError.TUNNEL_FAILED, e);
        }
        openSockets.add(socket);
        log.info("已为套接字 {} 打开到本地端口 {} 的隧道", protocol.getSocket().getId(), port);

        protocol.sendMessage(Map.of("type", "ok"));

        OutputStream out;
        try {
            out = socket.getOutputStream();
        } catch (IOException e) {
            closeQuietly(socket);
            throw new ProtocolException(ProtocolError.TUNNEL_FAILED, e);
        }
        for (String frame : protocol.readEntireBuffer()) {
            writeFrame(socket, out, frame);
        }
        protocol.setMessageListener(frame -> writeFrame(socket, out, frame));
        protocol.onClose(() -> closeQuietly(socket));

        executorService.submit(() -> pipeToClient(socket, protocol));
    }

    public int getOpenTunnelCount() {
        return openSockets.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 TunnelService，关闭 {} 个隧道。", openSockets.size());
        openSockets.forEach(this::closeQuietly);
        executorService.shutdownNow();
    }

    private void pipeToClient(Socket socket, Protocol protocol) {
        byte[] buffer = new byte[READ_BUFFER_SIZE];
        try (InputStream in = socket.getInputStream()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                String frame = Base64.getEncoder().encodeToString(Arrays.copyOf(buffer, read));
                if (!protocol.send(frame)) {
                    break;
                }
            }
        } catch (IOException e) {
            log.debug("隧道读取结束: {}", e.getMessage());
        } finally {
            closeQuietly(socket);
            protocol.close();
        }
    }

    private void writeFrame(Socket socket, OutputStream out, String frame) {
        try {
            byte[] bytes = Base64.getDecoder().decode(frame);
            synchronized (out) {
                out.write(bytes);
                out.flush();
            }
        } catch (IllegalArgumentException e) {
            log.warn("丢弃无法解码的隧道帧: {}", e.getMessage());
        } catch (IOException e) {
            log.info("向隧道写入失败，关闭隧道: {}", e.getMessage());
            closeQuietly(socket);
        }
    }

    private void closeQuietly(Socket socket) {
        if (openSockets.remove(socket)) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("关闭隧道套接字时出错: {}", e.getMessage());
            }
        }
    }
}
