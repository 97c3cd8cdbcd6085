/**
 * SessionDispatcher.java
 *
 * 会话调度器：处理每个新套接字上的握手，把它分配给新建的连接、已有的连接（重连）或隧道。
 *
 * <p>连接表按 (类型, 令牌) 索引，同一对 (类型, 令牌) 任何时刻最多只有一个存活的连接。
 * 存在性检查与重新绑定在同一把锁内完成，因此并发的两次重连只有一次能成功。
 * 套接字关闭不会删除连接，只会让它进入离线状态；每次登记新连接后，
 * 同类型的离线连接中只保留最新的 app.connection.max-extra-offline-connections 个。
 */
package club.ppmc.devserver.service;

import club.ppmc.devserver.connection.ClientConnectedEvent;
import club.ppmc.devserver.connection.Connection;
import club.ppmc.devserver.connection.ExtensionHostConnection;
import club.ppmc.devserver.connection.ManagementConnection;
import club.ppmc.devserver.exception.ProtocolError;
import club.ppmc.devserver.exception.ProtocolException;
import club.ppmc.devserver.exception.UnknownConnectionException;
import club.ppmc.devserver.model.ConnectionInfo;
import club.ppmc.devserver.model.ConnectionType;
import club.ppmc.devserver.model.ConnectionTypeRequest;
import club.ppmc.devserver.model.ExtensionHostAck;
import club.ppmc.devserver.socket.Protocol;
import club.ppmc.devserver.util.ChildProcessSpawner;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class SessionDispatcher {

    static final String DEFAULT_LANGUAGE = "en";

    private final EnvironmentService environmentService;
    private final ChildProcessSpawner spawner;
    private final TunnelService tunnelService;
    private final DebugPortProvider debugPortProvider;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxExtraOfflineConnections;
    private final int maxPendingMessages;
    private final String serverCommit;

    private final ExecutorService extensionHostExecutor = Executors.newCachedThreadPool();
    private final Map<ConnectionType, Map<String, Connection>> connections = new EnumMap<>(ConnectionType.class);

    public SessionDispatcher(
            EnvironmentService environmentService,
            ChildProcessSpawner spawner,
            TunnelService tunnelService,
            DebugPortProvider debugPortProvider,
            ApplicationEventPublisher eventPublisher,
            Clock clock,
            @Value("${app.connection.max-extra-offline-connections:0}") int maxExtraOfflineConnections,
            @Value("${app.connection.max-pending-messages:1000}") int maxPendingMessages,
            @Value("${app.server.commit:}") String serverCommit) {
        this.environmentService = environmentService;
        this.spawner = spawner;
        this.tunnelService = tunnelService;
        this.debugPortProvider = debugPortProvider;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxExtraOfflineConnections = Math.max(0, maxExtraOfflineConnections);
        this.maxPendingMessages = maxPendingMessages;
        this.serverCommit = serverCommit;
        connections.put(ConnectionType.MANAGEMENT, new LinkedHashMap<>());
        connections.put(ConnectionType.EXTENSION_HOST, new LinkedHashMap<>());
    }

    /**
     * 处理一个套接字上的握手消息。任何握手失败都只影响这一个套接字。
     */
    public void handleHandshake(Protocol protocol, ConnectionTypeRequest request) {
        try {
            ManagementConnection created = connect(protocol, request);
            if (created != null) {
                eventPublisher.publishEvent(new ClientConnectedEvent(created));
            }
        } catch (ProtocolException e) {
            rejectHandshake(protocol, e);
        }
    }

    /** 回复错误帧并关闭套接字，不登记任何连接。 */
    public void rejectHandshake(Protocol protocol, ProtocolException e) {
        log.warn("拒绝套接字 {} 的握手: {}", protocol.getSocket().getId(), e.getMessage());
        protocol.sendMessage(e.toErrorData());
        protocol.close();
    }

    /** 所有已登记连接（包括离线连接）的快照。 */
    public synchronized List<ConnectionInfo> listConnections() {
        List<ConnectionInfo> infos = new ArrayList<>();
        connections.values().forEach(byToken -> byToken.values().forEach(c -> infos.add(c.toInfo())));
        return infos;
    }

    public synchronized int countConnections(ConnectionType type) {
        Map<String, Connection> byToken = connections.get(type);
        return byToken == null ? 0 : byToken.size();
    }

    public synchronized Connection getConnection(ConnectionType type, String token) {
        Map<String, Connection> byToken = connections.get(type);
        return byToken == null ? null : byToken.get(token);
    }

    /**
     * 强制释放一个连接。
     *
     * @throws UnknownConnectionException 连接不存在时抛出。
     */
    public void disposeConnection(ConnectionType type, String token) {
        Connection connection = getConnection(type, token);
        if (connection == null) {
            throw new UnknownConnectionException(type, token);
        }
        connection.dispose();
    }

    @PreDestroy
    public void disposeAll() {
        List<Connection> all = new ArrayList<>();
        synchronized (this) {
            connections.values().forEach(byToken -> all.addAll(byToken.values()));
        }
        log.info("正在关闭 SessionDispatcher。将释放 {} 个连接。", all.size());
        all.forEach(Connection::dispose);
        extensionHostExecutor.shutdownNow();
    }

    /**
     * @return 新建的管理连接（需要在锁外发布事件）；其他情况返回 null。
     */
    private ManagementConnection connect(Protocol protocol, ConnectionTypeRequest request) {
        checkCommit(request.getCommit());

        ConnectionType type = request.getDesiredConnectionType();
        if (type == null) {
            throw new ProtocolException(ProtocolError.UNRECOGNIZED_TYPE);
        }
        String token = request.getReconnectionToken();
        if (!StringUtils.hasText(token)) {
            throw new ProtocolException(ProtocolError.MISSING_TOKEN);
        }
        if (type == ConnectionType.TUNNEL) {
            tunnelService.tunnel(protocol, request);
            return null;
        }

        synchronized (this) {
            Map<String, Connection> byToken = connections.get(type);
            Connection existing = byToken.get(token);

            if (request.isReconnection()) {
                if (existing == null || existing.isDisposed()) {
                    throw new ProtocolException(ProtocolError.UNRECOGNIZED_TOKEN);
                }
                protocol.sendMessage(ackFor(type));
                existing.reconnect(protocol, protocol.readEntireBuffer());
                log.info("{} 连接 {} 已重连", type, token);
                return null;
            }

            if (existing != null) {
                throw new ProtocolException(ProtocolError.DUPLICATE_TOKEN);
            }

            Connection connection = createConnection(type, token, protocol, request);
            protocol.sendMessage(ackFor(type));
            try {
                connection.start();
            } catch (IOException e) {
                throw new ProtocolException(ProtocolError.EXTENSION_HOST_UNAVAILABLE, e);
            }

            byToken.put(token, connection);
            connection.onClose().subscribe(closed -> unregister(closed));
            log.info("已登记新的 {} 连接 {}", type, token);
            disposeOldOfflineConnections(type);

            return connection instanceof ManagementConnection management ? management : null;
        }
    }

    private Connection createConnection(
            ConnectionType type, String token, Protocol protocol, ConnectionTypeRequest request) {
        if (type == ConnectionType.MANAGEMENT) {
            return new ManagementConnection(token, protocol, clock, maxPendingMessages);
        }
        if (!environmentService.isExtensionHostAvailable()) {
            throw new ProtocolException(ProtocolError.EXTENSION_HOST_UNAVAILABLE, "no command configured");
        }
        String language = request.getArgs() != null && StringUtils.hasText(request.getArgs().getLanguage())
                ? request.getArgs().getLanguage()
                : DEFAULT_LANGUAGE;
        return new ExtensionHostConnection(
                token,
                language,
                protocol,
                environmentService,
                spawner,
                extensionHostExecutor,
                clock,
                maxPendingMessages);
    }

    private Object ackFor(ConnectionType type) {
        if (type == ConnectionType.EXTENSION_HOST) {
            return new ExtensionHostAck(debugPortProvider.getDebugPort());
        }
        return Map.of("type", "ok");
    }

    private void checkCommit(String clientCommit) {
        if (StringUtils.hasText(serverCommit)
                && StringUtils.hasText(clientCommit)
                && !serverCommit.equals(clientCommit)) {
            log.warn("客户端版本 ({}) 与服务器版本 ({}) 不一致，继续处理握手。", clientCommit, serverCommit);
        }
    }

    private synchronized void unregister(Connection closed) {
        Map<String, Connection> byToken = connections.get(closed.getType());
        if (byToken.get(closed.getToken()) == closed) {
            byToken.remove(closed.getToken());
            log.info("{} 连接 {} 已从连接表移除", closed.getType(), closed.getToken());
        }
    }

    /** 同类型的离线连接按离线时间从旧到新排序，只保留最新的若干个。 */
    private void disposeOldOfflineConnections(ConnectionType type) {
        List<Connection> offline = connections.get(type).values().stream()
                .filter(c -> c.getOffline() != null)
                .sorted(Comparator.comparing(Connection::getOffline))
                .toList();
        int excess = offline.size() - maxExtraOfflineConnections;
        for (int i = 0; i < excess; i++) {
            Connection stale = offline.get(i);
            log.info("离线连接过多，释放 {} 连接 {}", type, stale.getToken());
            stale.dispose();
        }
    }
}
