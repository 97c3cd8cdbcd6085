/**
 * TerminalChannelService.java
 *
 * 终端 RPC 通道：把管理连接上的 JSON 请求翻译为对 PtyService 的调用，
 * 并把注册表的终端事件广播给所有已绑定的管理连接。
 *
 * <p>每个管理连接都记录自己创建或附加过的终端。连接离线时这些终端被分离（持久化终端开始宽限期计时），
 * 重连成功后重新附加；连接被释放时仍处于附加状态的终端也会被分离。
 */
package club.ppmc.devserver.service;

import club.ppmc.devserver.connection.Connection;
import club.ppmc.devserver.connection.ManagementConnection;
import club.ppmc.devserver.exception.AttachNotAllowedException;
import club.ppmc.devserver.exception.UnknownProcessException;
import club.ppmc.devserver.model.terminal.CreateProcessRequest;
import club.ppmc.devserver.model.terminal.TerminalChannelMessage;
import club.ppmc.devserver.model.terminal.TerminalLayoutInfo;
import club.ppmc.devserver.model.terminal.TerminalRequest;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TerminalChannelService {

    private final PtyService ptyService;
    private final Gson gson;

    /** 已绑定的管理连接 → 该连接持有（附加中）的终端 ID。 */
    private final Map<ManagementConnection, Set<Integer>> boundConnections = new ConcurrentHashMap<>();

    public TerminalChannelService(PtyService ptyService, Gson gson) {
        this.ptyService = ptyService;
        this.gson = gson;

        ptyService.onProcessData().subscribe(e -> broadcast("data", e.id(), e.payload()));
        ptyService.onProcessReplay().subscribe(e -> broadcast("replay", e.id(), e.payload()));
        ptyService.onProcessReady().subscribe(e -> broadcast("ready", e.id(), e.payload()));
        ptyService.onProcessTitleChanged().subscribe(e -> broadcast("titleChanged", e.id(), e.payload()));
        ptyService.onProcessOrphanQuestion().subscribe(e -> broadcast("orphanQuestion", e.id(), null));
        ptyService.onProcessExit().subscribe(e -> {
            boundConnections.values().forEach(ids -> ids.remove(e.id()));
            broadcast("exit", e.id(), e.payload());
        });
    }

    /** 把一个新建的管理连接接入终端通道。 */
    public void bind(ManagementConnection connection) {
        boundConnections.put(connection, ConcurrentHashMap.newKeySet());
        connection.onOffline().subscribe(c -> detachAll(connection));
        connection.onReconnect().subscribe(c -> reattachAll(connection));
        connection.onClose().subscribe(c -> {
            Set<Integer> owned = boundConnections.remove(connection);
            if (owned != null && !owned.isEmpty() && c.getOffline() == null) {
                // 在线状态下被释放，终端还没有被分离
                owned.forEach(this::detachQuietly);
            }
        });
        connection.setMessageHandler(frame -> handleFrame(connection, frame));
        log.debug("管理连接 {} 已接入终端通道", connection.getToken());
    }

    public int getBoundConnectionCount() {
        return boundConnections.size();
    }

    /** 某个连接当前持有的终端 ID；连接未绑定时为空集合。 */
    public Set<Integer> getOwnedProcesses(ManagementConnection connection) {
        Set<Integer> owned = boundConnections.get(connection);
        return owned == null ? Set.of() : Set.copyOf(owned);
    }

    void handleFrame(ManagementConnection connection, String frame) {
        TerminalRequest request;
        try {
            request = gson.fromJson(frame, TerminalRequest.class);
        } catch (JsonParseException e) {
            log.warn("管理连接 {} 收到无法解析的消息: {}", connection.getToken(), e.getMessage());
            connection.send(gson.toJson(TerminalChannelMessage.error(null, "Malformed request")));
            return;
        }
        if (request == null || request.getCommand() == null) {
            connection.send(gson.toJson(TerminalChannelMessage.error(null, "Missing command")));
            return;
        }
        Integer requestId = request.getRequestId();
        JsonObject args = request.getArgs() != null ? request.getArgs() : new JsonObject();

        CompletableFuture<?> result;
        try {
            result = dispatch(connection, request.getCommand(), args);
        } catch (UnknownProcessException | AttachNotAllowedException | IllegalArgumentException e) {
            replyError(connection, requestId, e.getMessage());
            return;
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            replyError(connection, requestId, "Invalid arguments for " + request.getCommand());
            return;
        } catch (RuntimeException e) {
            // 请求错误只回复给调用方，不能让异常关闭整个套接字
            log.error("处理终端请求 {} 时出错", request.getCommand(), e);
            replyError(connection, requestId, "Failed to handle " + request.getCommand() + ": " + e.getMessage());
            return;
        }
        result.whenComplete((value, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                replyError(connection, requestId, cause.getMessage());
            } else {
                connection.send(gson.toJson(TerminalChannelMessage.reply(requestId, value)));
            }
        });
    }

    private CompletableFuture<?> dispatch(ManagementConnection connection, String command, JsonObject args) {
        switch (command) {
            case "createProcess" -> {
                var create = gson.fromJson(args, CreateProcessRequest.class);
                int id = ptyService.createProcess(
                        create.getShellLaunchConfig(),
                        create.getCwd(),
                        create.getCols(),
                        create.getRows(),
                        create.getEnv(),
                        create.isShouldPersist(),
                        create.getWorkspaceId(),
                        create.getWorkspaceName());
                own(connection, id);
                return CompletableFuture.completedFuture(id);
            }
            case "attachToProcess" -> {
                int id = id(args);
                ptyService.attachToProcess(id);
                own(connection, id);
                return done();
            }
            case "detachFromProcess" -> {
                int id = id(args);
                ptyService.detachFromProcess(id);
                disown(connection, id);
                return done();
            }
            case "start" -> {
                return CompletableFuture.completedFuture(ptyService.start(id(args)));
            }
            case "shutdown" -> {
                ptyService.shutdown(id(args), args.has("immediate") && args.get("immediate").getAsBoolean());
                return done();
            }
            case "input" -> {
                ptyService.input(id(args), stringArg(args, "data"));
                return done();
            }
            case "resize" -> {
                ptyService.resize(id(args), intArg(args, "cols"), intArg(args, "rows"));
                return done();
            }
            case "getInitialCwd" -> {
                return CompletableFuture.completedFuture(ptyService.getInitialCwd(id(args)));
            }
            case "getCwd" -> {
                return CompletableFuture.completedFuture(ptyService.getCwd(id(args)));
            }
            case "acknowledgeDataEvent" -> {
                ptyService.acknowledgeDataEvent(id(args), intArg(args, "charCount"));
                return done();
            }
            case "getLatency" -> {
                return CompletableFuture.completedFuture(ptyService.getLatency(id(args)));
            }
            case "orphanQuestionReply" -> {
                ptyService.orphanQuestionReply(id(args));
                return done();
            }
            case "isOrphaned" -> {
                return ptyService.isOrphaned(id(args));
            }
            case "setTerminalLayoutInfo" -> {
                ptyService.setTerminalLayoutInfo(gson.fromJson(args, TerminalLayoutInfo.class));
                return done();
            }
            case "getTerminalLayoutInfo" -> {
                return ptyService.getTerminalLayoutInfo(stringArg(args, "workspaceId"));
            }
            case "reduceConnectionGraceTime" -> {
                ptyService.reduceConnectionGraceTime();
                return done();
            }
            case "listProcesses" -> {
                return ptyService.listProcesses();
            }
            default -> throw new IllegalArgumentException("Unknown command \"" + command + "\"");
        }
    }

    private void broadcast(String event, int id, Object payload) {
        if (boundConnections.isEmpty()) {
            return;
        }
        String frame = gson.toJson(TerminalChannelMessage.event(event, id, payload));
        boundConnections.keySet().forEach(connection -> connection.send(frame));
    }

    private void detachAll(ManagementConnection connection) {
        Set<Integer> owned = boundConnections.get(connection);
        if (owned == null || owned.isEmpty()) {
            return;
        }
        log.info("管理连接 {} 离线，分离 {} 个终端", connection.getToken(), owned.size());
        for (Integer id : Set.copyOf(owned)) {
            if (!detachQuietly(id)) {
                owned.remove(id);
            }
        }
    }

    private void reattachAll(Connection connection) {
        Set<Integer> owned = boundConnections.get(connection);
        if (owned == null) {
            return;
        }
        for (Integer id : Set.copyOf(owned)) {
            try {
                ptyService.attachToProcess(id);
            } catch (UnknownProcessException e) {
                log.info("终端 \"{}\" 在离线期间已结束，不再重新附加", id);
                owned.remove(id);
            }
        }
    }

    /**
     * @return 终端仍然存在并且已被分离时返回 true。
     */
    private boolean detachQuietly(int id) {
        try {
            ptyService.detachFromProcess(id);
            return ptyService.hasProcess(id);
        } catch (UnknownProcessException e) {
            log.debug("分离终端时终端已不存在: {}", e.getMessage());
            return false;
        }
    }

    private void own(ManagementConnection connection, int id) {
        Set<Integer> owned = boundConnections.get(connection);
        if (owned != null) {
            owned.add(id);
        }
    }

    private void disown(ManagementConnection connection, int id) {
        Set<Integer> owned = boundConnections.get(connection);
        if (owned != null) {
            owned.remove(id);
        }
    }

    private void replyError(ManagementConnection connection, Integer requestId, String message) {
        connection.send(gson.toJson(TerminalChannelMessage.error(requestId, message)));
    }

    private static int id(JsonObject args) {
        return intArg(args, "id");
    }

    private static int intArg(JsonObject args, String name) {
        return requireArg(args, name).getAsInt();
    }

    private static String stringArg(JsonObject args, String name) {
        return requireArg(args, name).getAsString();
    }

    private static JsonElement requireArg(JsonObject args, String name) {
        JsonElement value = args.get(name);
        if (value == null || value.isJsonNull()) {
            throw new IllegalArgumentException("Missing argument \"" + name + "\"");
        }
        return value;
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }
}
