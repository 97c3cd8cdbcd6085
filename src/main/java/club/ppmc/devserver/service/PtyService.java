/**
 * PtyService.java
 *
 * 持久化终端进程注册表。它拥有全部 PersistentTerminalProcess 以及每个工作区的终端布局，
 * 负责创建、查找终端，并把它们展开为面向客户端的描述。
 * 连接只通过数字 ID 引用终端，从不直接持有它们。
 *
 * <p>所有按 ID 的操作在找不到终端时都会抛出 UnknownProcessException。
 * 终端事件以带 ID 的类型化通道对外发布，由 TerminalChannelService 转发给客户端。
 */
package club.ppmc.devserver.service;

import club.ppmc.devserver.exception.AttachNotAllowedException;
import club.ppmc.devserver.exception.UnknownProcessException;
import club.ppmc.devserver.model.terminal.ExpandedTerminalLayout;
import club.ppmc.devserver.model.terminal.ProcessReadyEvent;
import club.ppmc.devserver.model.terminal.ReplayEvent;
import club.ppmc.devserver.model.terminal.ShellLaunchConfig;
import club.ppmc.devserver.model.terminal.TerminalDescription;
import club.ppmc.devserver.model.terminal.TerminalEvent;
import club.ppmc.devserver.model.terminal.TerminalLaunchError;
import club.ppmc.devserver.model.terminal.TerminalLayoutInfo;
import club.ppmc.devserver.terminal.PersistentTerminalProcess;
import club.ppmc.devserver.terminal.ReconnectConstants;
import club.ppmc.devserver.terminal.TerminalProcess;
import club.ppmc.devserver.terminal.TerminalProcessFactory;
import club.ppmc.devserver.util.EventChannel;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class PtyService {

    private final TerminalProcessFactory processFactory;
    private final TaskScheduler scheduler;
    private final ReconnectConstants constants;

    private final AtomicInteger lastPtyId = new AtomicInteger();
    private final Map<Integer, PersistentTerminalProcess> ptys = new ConcurrentHashMap<>();
    private final Map<String, TerminalLayoutInfo> workspaceLayoutInfos = new ConcurrentHashMap<>();

    private final EventChannel<TerminalEvent<String>> onProcessData = new EventChannel<>("ptyData");
    private final EventChannel<TerminalEvent<ReplayEvent>> onProcessReplay = new EventChannel<>("ptyReplay");
    private final EventChannel<TerminalEvent<Integer>> onProcessExit = new EventChannel<>("ptyExit");
    private final EventChannel<TerminalEvent<ProcessReadyEvent>> onProcessReady = new EventChannel<>("ptyReady");
    private final EventChannel<TerminalEvent<String>> onProcessTitleChanged = new EventChannel<>("ptyTitle");
    private final EventChannel<TerminalEvent<Void>> onProcessOrphanQuestion = new EventChannel<>("ptyOrphanQuestion");

    public PtyService(
            TerminalProcessFactory processFactory,
            @Qualifier("terminalTaskScheduler") TaskScheduler scheduler,
            ReconnectConstants constants) {
        this.processFactory = processFactory;
        this.scheduler = scheduler;
        this.constants = constants;
    }

    /**
     * 创建一个新的持久化终端（尚未启动，需随后调用 start）。
     *
     * @return 新终端的 ID，在注册表生命周期内永不复用。
     */
    public int createProcess(
            ShellLaunchConfig launchConfig,
            String cwd,
            int cols,
            int rows,
            Map<String, String> env,
            boolean shouldPersist,
            String workspaceId,
            String workspaceName) {
        if (launchConfig == null) {
            throw new IllegalArgumentException("Missing argument \"shellLaunchConfig\"");
        }
        if (launchConfig.getAttachPersistentProcess() != null) {
            throw new AttachNotAllowedException();
        }
        int id = lastPtyId.incrementAndGet();
        TerminalProcess process = processFactory.create(launchConfig, cwd, cols, rows, env);
        var persistentProcess = new PersistentTerminalProcess(
                id, process, workspaceId, workspaceName, shouldPersist, cols, rows, scheduler, constants);

        persistentProcess.onProcessData().subscribe(data -> onProcessData.fire(new TerminalEvent<>(id, data)));
        process.onProcessExit().subscribe(exitCode -> {
            removeProcess(id);
            onProcessExit.fire(new TerminalEvent<>(id, exitCode));
        });
        persistentProcess.onProcessReplay().subscribe(e -> onProcessReplay.fire(new TerminalEvent<>(id, e)));
        persistentProcess.onProcessReady().subscribe(e -> onProcessReady.fire(new TerminalEvent<>(id, e)));
        persistentProcess.onProcessTitleChanged()
                .subscribe(title -> onProcessTitleChanged.fire(new TerminalEvent<>(id, title)));
        persistentProcess.onOrphanQuestion()
                .subscribe(v -> onProcessOrphanQuestion.fire(new TerminalEvent<>(id, null)));

        ptys.put(id, persistentProcess);
        log.info("已创建持久化终端 \"{}\" (工作区: {}, persist={})", id, workspaceId, shouldPersist);
        return id;
    }

    public void attachToProcess(int id) {
        throwIfNoPty(id).attach();
        log.debug("持久化终端 \"{}\" 已重新附加", id);
    }

    public void detachFromProcess(int id) {
        PersistentTerminalProcess pty = throwIfNoPty(id);
        if (!pty.isShouldPersist()) {
            // 非持久化终端立即从注册表移除，之后的 attach 必须失败
            ptys.remove(id);
            pty.detach();
            pty.dispose();
            return;
        }
        pty.detach();
    }

    public TerminalLaunchError start(int id) {
        return throwIfNoPty(id).start();
    }

    public void shutdown(int id, boolean immediate) {
        throwIfNoPty(id).shutdown(immediate);
    }

    public void input(int id, String data) {
        throwIfNoPty(id).input(data);
    }

    public void resize(int id, int cols, int rows) {
        throwIfNoPty(id).resize(cols, rows);
    }

    public String getInitialCwd(int id) {
        return throwIfNoPty(id).getInitialCwd();
    }

    public String getCwd(int id) {
        return throwIfNoPty(id).getCwd();
    }

    public void acknowledgeDataEvent(int id, int charCount) {
        throwIfNoPty(id).acknowledgeDataEvent(charCount);
    }

    public long getLatency(int id) {
        return throwIfNoPty(id).getLatency();
    }

    public void orphanQuestionReply(int id) {
        throwIfNoPty(id).orphanQuestionReply();
    }

    public CompletableFuture<Boolean> isOrphaned(int id) {
        return throwIfNoPty(id).isOrphaned();
    }

    /** 客户端整页离开等情况下，把所有正在计时的终端切换到短宽限期。 */
    public void reduceConnectionGraceTime() {
        ptys.values().forEach(PersistentTerminalProcess::reduceGraceTime);
    }

    public void setTerminalLayoutInfo(TerminalLayoutInfo layout) {
        if (layout == null || layout.getWorkspaceId() == null) {
            throw new IllegalArgumentException("Missing argument \"workspaceId\"");
        }
        List<TerminalLayoutInfo.Tab> tabs = layout.getTabs() == null
                ? List.of()
                : layout.getTabs().stream().filter(Objects::nonNull).toList();
        tabs.stream()
                .filter(tab -> tab.getTerminals() == null)
                .forEach(tab -> tab.setTerminals(List.of()));
        layout.setTabs(tabs);
        workspaceLayoutInfos.put(layout.getWorkspaceId(), layout);
    }

    /**
     * 读取工作区布局，并把终端引用展开为实时描述。
     * 已断开的终端被过滤掉，展开后没有任何终端的标签页也被过滤掉。
     *
     * @return 展开后的布局；该工作区从未保存过布局时为 null。
     */
    public CompletableFuture<ExpandedTerminalLayout> getTerminalLayoutInfo(String workspaceId) {
        TerminalLayoutInfo layout = workspaceLayoutInfos.get(workspaceId);
        if (layout == null) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<ExpandedTerminalLayout.Tab>> tabs =
                layout.getTabs().stream().map(this::expandTerminalTab).toList();
        return CompletableFuture.allOf(tabs.toArray(new CompletableFuture[0]))
                .thenApply(v -> new ExpandedTerminalLayout(tabs.stream()
                        .map(CompletableFuture::join)
                        .filter(tab -> !tab.terminals().isEmpty())
                        .toList()));
    }

    /** 所有存活终端的描述。 */
    public CompletableFuture<List<TerminalDescription>> listProcesses() {
        List<CompletableFuture<TerminalDescription>> descriptions = new ArrayList<>();
        ptys.forEach((id, pty) -> descriptions.add(terminalToDescription(pty)));
        return CompletableFuture.allOf(descriptions.toArray(new CompletableFuture[0]))
                .thenApply(v -> descriptions.stream().map(CompletableFuture::join).toList());
    }

    public boolean hasProcess(int id) {
        return ptys.containsKey(id);
    }

    public int size() {
        return ptys.size();
    }

    /** 无条件释放并关闭所有终端，不等待宽限期。 */
    @PreDestroy
    public void shutdownAll() {
        log.info("正在关闭 PtyService。将销毁所有 {} 个持久化终端。", ptys.size());
        for (Integer id : List.copyOf(ptys.keySet())) {
            PersistentTerminalProcess pty = ptys.remove(id);
            if (pty != null) {
                pty.dispose();
                pty.shutdown(true);
            }
        }
    }

    private CompletableFuture<ExpandedTerminalLayout.Tab> expandTerminalTab(TerminalLayoutInfo.Tab tab) {
        List<CompletableFuture<ExpandedTerminalLayout.Instance>> terminals =
                tab.getTerminals().stream().map(this::expandTerminalInstance).toList();
        return CompletableFuture.allOf(terminals.toArray(new CompletableFuture[0]))
                .thenApply(v -> new ExpandedTerminalLayout.Tab(
                        tab.isActive(),
                        tab.getActivePersistentTerminalId(),
                        terminals.stream()
                                .map(CompletableFuture::join)
                                .filter(instance -> instance.terminal() != null)
                                .toList()));
    }

    private CompletableFuture<ExpandedTerminalLayout.Instance> expandTerminalInstance(
            TerminalLayoutInfo.Instance instance) {
        try {
            PersistentTerminalProcess pty = throwIfNoPty(instance.getTerminal());
            return terminalToDescription(pty)
                    .thenApply(description -> new ExpandedTerminalLayout.Instance(description, instance.getRelativeSize()));
        } catch (UnknownProcessException e) {
            log.debug("无法获取布局信息，终端可能已断开: {}", e.getMessage());
            // 占位为 null，随后被过滤，不会被重新连接
            return CompletableFuture.completedFuture(
                    new ExpandedTerminalLayout.Instance(null, instance.getRelativeSize()));
        }
    }

    private CompletableFuture<TerminalDescription> terminalToDescription(PersistentTerminalProcess pty) {
        String cwd = pty.getCwd();
        return pty.isOrphaned().thenApply(orphan -> new TerminalDescription(
                pty.getId(),
                pty.getTitle(),
                pty.getPid(),
                pty.getWorkspaceId(),
                pty.getWorkspaceName(),
                cwd,
                orphan));
    }

    private void removeProcess(int id) {
        PersistentTerminalProcess pty = ptys.remove(id);
        if (pty != null) {
            pty.dispose();
            log.info("持久化终端 \"{}\" 已从注册表移除", id);
        }
    }

    private PersistentTerminalProcess throwIfNoPty(int id) {
        PersistentTerminalProcess pty = ptys.get(id);
        if (pty == null) {
            throw new UnknownProcessException(id);
        }
        return pty;
    }

    public EventChannel<TerminalEvent<String>> onProcessData() {
        return onProcessData;
    }

    public EventChannel<TerminalEvent<ReplayEvent>> onProcessReplay() {
        return onProcessReplay;
    }

    public EventChannel<TerminalEvent<Integer>> onProcessExit() {
        return onProcessExit;
    }

    public EventChannel<TerminalEvent<ProcessReadyEvent>> onProcessReady() {
        return onProcessReady;
    }

    public EventChannel<TerminalEvent<String>> onProcessTitleChanged() {
        return onProcessTitleChanged;
    }

    public EventChannel<TerminalEvent<Void>> onProcessOrphanQuestion() {
        return onProcessOrphanQuestion;
    }
}
