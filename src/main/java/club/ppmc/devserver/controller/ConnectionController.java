/**
 * ConnectionController.java
 *
 * 查看和管理会话调度器中登记的连接（包括离线但仍被保留的连接）。
 */
package club.ppmc.devserver.controller;

import club.ppmc.devserver.exception.UnknownConnectionException;
import club.ppmc.devserver.model.ConnectionInfo;
import club.ppmc.devserver.model.ConnectionType;
import club.ppmc.devserver.service.SessionDispatcher;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/connections")
@Slf4j
public class ConnectionController {

    private final SessionDispatcher sessionDispatcher;

    public ConnectionController(SessionDispatcher sessionDispatcher) {
        this.sessionDispatcher = sessionDispatcher;
    }

    @GetMapping
    public ResponseEntity<List<ConnectionInfo>> listConnections() {
        return ResponseEntity.ok(sessionDispatcher.listConnections());
    }

    /**
     * 强制释放一个连接，例如清理一个不会再回来的离线客户端。
     */
    @DeleteMapping("/{type}/{token}")
    public ResponseEntity<?> disposeConnection(@PathVariable String type, @PathVariable String token) {
        ConnectionType connectionType;
        try {
            connectionType = ConnectionType.valueOf(type.toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", "未知的连接类型: " + type));
        }
        try {
            sessionDispatcher.disposeConnection(connectionType, token);
            log.info("已通过 API 释放 {} 连接 {}", connectionType, token);
            return ResponseEntity.ok(Map.of("message", "连接已释放。"));
        } catch (UnknownConnectionException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.toErrorData());
        }
    }
}
