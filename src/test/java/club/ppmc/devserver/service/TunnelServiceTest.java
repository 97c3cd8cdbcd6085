package club.ppmc.devserver.service;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.devserver.exception.ProtocolError;
import club.ppmc.devserver.exception.ProtocolException;
import club.ppmc.devserver.model.ConnectionType;
import club.ppmc.devserver.model.ConnectionTypeRequest;
import club.ppmc.devserver.socket.FakeClientSocket;
import club.ppmc.devserver.socket.Protocol;
import com.google.gson.Gson;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class TunnelServiceTest {

    private final TunnelService tunnelService = new TunnelService();
    private ServerSocket echoServer;

    @AfterEach
    public void tearDown() throws IOException {
        tunnelService.shutdown();
        if (echoServer != null) {
            echoServer.close();
        }
    }

    private static ConnectionTypeRequest tunnelRequest(Integer port) {
        var request = new ConnectionTypeRequest();
        request.setDesiredConnectionType(ConnectionType.TUNNEL);
        request.setReconnectionToken("tunnel-1");
        var args = new ConnectionTypeRequest.Args();
        args.setPort(port);
        request.setArgs(args);
        return request;
    }

    private int startEchoServer() throws IOException {
        echoServer = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        Thread echo = new Thread(() -> {
            try (Socket client = echoServer.accept();
                    InputStream in = client.getInputStream();
                    OutputStream out = client.getOutputStream()) {
                in.transferTo(out);
            } catch (IOException e) {
                // 服务器在测试结束时关闭
            }
        });
        echo.setDaemon(true);
        echo.start();
        return echoServer.getLocalPort();
    }

    @Test
    public void bytesArePipedBothWays() throws Exception {
        int port = startEchoServer();
        var socket = new FakeClientSocket("s1");
        var protocol = new Protocol(socket, new Gson());

        tunnelService.tunnel(protocol, tunnelRequest(port));
        protocol.acceptMessage(Base64.getEncoder().encodeToString("ping".getBytes(StandardCharsets.UTF_8)));

        assertTrue(socket.nextSent().contains("ok"));
        String echoed = new String(Base64.getDecoder().decode(socket.nextSent()), StandardCharsets.UTF_8);
        assertEquals("ping", echoed);
        assertEquals(1, tunnelService.getOpenTunnelCount());

        protocol.handleSocketClosed();
        assertEquals(0, tunnelService.getOpenTunnelCount());
    }

    @Test
    public void missingPort_isRejected() {
        var protocol = new Protocol(new FakeClientSocket("s1"), new Gson());

        var e = assertThrows(ProtocolException.class, () -> tunnelService.tunnel(protocol, tunnelRequest(null)));
        assertEquals(ProtocolError.TUNNEL_FAILED, e.getError());
    }

    @Test
    public void closedPort_isRejected() throws Exception {
        int port;
        try (var unused = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = unused.getLocalPort();
        }
        var protocol = new Protocol(new FakeClientSocket("s1"), new Gson());

        var e = assertThrows(ProtocolException.class, () -> tunnelService.tunnel(protocol, tunnelRequest(port)));
        assertEquals(ProtocolError.TUNNEL_FAILED, e.getError());
        assertEquals(0, tunnelService.getOpenTunnelCount());
    }
}
