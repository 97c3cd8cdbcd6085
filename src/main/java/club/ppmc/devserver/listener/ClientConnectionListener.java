/**
 * ClientConnectionListener.java
 *
 * Spring 事件监听器：管理连接登记成功后，把它接入终端 RPC 通道。
 * 事件在 SessionDispatcher 释放连接表锁之后发布，监听器里可以安全地回调调度器。
 */
package club.ppmc.devserver.listener;

import club.ppmc.devserver.connection.ClientConnectedEvent;
import club.ppmc.devserver.service.TerminalChannelService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class ClientConnectionListener {

    private final TerminalChannelService terminalChannelService;

    public ClientConnectionListener(TerminalChannelService terminalChannelService) {
        this.terminalChannelService = terminalChannelService;
    }

    @EventListener
    public void handleClientConnected(ClientConnectedEvent event) {
        log.info("新的管理连接已建立，令牌: {}", event.connection().getToken());
        terminalChannelService.bind(event.connection());
    }
}
