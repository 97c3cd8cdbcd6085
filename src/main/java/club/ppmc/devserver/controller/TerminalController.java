/**
 * TerminalController.java
 *
 * 持久化终端的只读 HTTP 接口：列出存活的终端，以及读取某个工作区展开后的终端布局。
 * 终端的创建和交互都走管理连接上的 RPC 通道，不在这里提供。
 */
package club.ppmc.devserver.controller;

import club.ppmc.devserver.model.terminal.ExpandedTerminalLayout;
import club.ppmc.devserver.model.terminal.TerminalDescription;
import club.ppmc.devserver.service.PtyService;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/terminals")
public class TerminalController {

    private final PtyService ptyService;

    public TerminalController(PtyService ptyService) {
        this.ptyService = ptyService;
    }

    @GetMapping
    public CompletableFuture<List<TerminalDescription>> listTerminals() {
        return ptyService.listProcesses();
    }

    /**
     * @return 展开后的布局；工作区从未保存过布局时返回 404。
     */
    @GetMapping("/layout/{workspaceId}")
    public CompletableFuture<ResponseEntity<ExpandedTerminalLayout>> getLayout(@PathVariable String workspaceId) {
        return ptyService.getTerminalLayoutInfo(workspaceId)
                .<ResponseEntity<ExpandedTerminalLayout>>thenApply(layout -> layout == null
                        ? ResponseEntity.notFound().build()
                        : ResponseEntity.ok(layout));
    }
}
