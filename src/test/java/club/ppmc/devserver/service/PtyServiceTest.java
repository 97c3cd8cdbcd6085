package club.ppmc.devserver.service;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.devserver.exception.AttachNotAllowedException;
import club.ppmc.devserver.exception.UnknownProcessException;
import club.ppmc.devserver.model.terminal.ExpandedTerminalLayout;
import club.ppmc.devserver.model.terminal.ReplayEntry;
import club.ppmc.devserver.model.terminal.ReplayEvent;
import club.ppmc.devserver.model.terminal.ShellLaunchConfig;
import club.ppmc.devserver.model.terminal.TerminalDescription;
import club.ppmc.devserver.model.terminal.TerminalEvent;
import club.ppmc.devserver.model.terminal.TerminalLayoutInfo;
import club.ppmc.devserver.terminal.FakeTerminalProcessFactory;
import club.ppmc.devserver.terminal.ReconnectConstants;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

public class PtyServiceTest {

    private ThreadPoolTaskScheduler scheduler;
    private FakeTerminalProcessFactory factory;
    private PtyService ptyService;

    @BeforeEach
    public void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        factory = new FakeTerminalProcessFactory();
        var constants = new ReconnectConstants(
                Duration.ofHours(3), Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(500), 10_000);
        ptyService = new PtyService(factory, scheduler, constants);
    }

    @AfterEach
    public void tearDown() {
        ptyService.shutdownAll();
        scheduler.shutdown();
    }

    private int create(boolean persist) {
        return ptyService.createProcess(new ShellLaunchConfig(), "/work", 80, 24, Map.of(), persist, "ws-1", "Workspace");
    }

    @Test
    public void ids_areMonotonic() {
        int first = create(true);
        int second = create(true);

        assertTrue(second > first);
        assertEquals(2, ptyService.size());
    }

    @Test
    public void attachDescriptor_cannotCreateProcess() {
        var config = new ShellLaunchConfig();
        config.setAttachPersistentProcess(3);

        assertThrows(
                AttachNotAllowedException.class,
                () -> ptyService.createProcess(config, "/work", 80, 24, Map.of(), true, "ws", "ws"));
        assertEquals(0, ptyService.size());
    }

    @Test
    public void unknownId_isRejected() {
        assertThrows(UnknownProcessException.class, () -> ptyService.input(99, "x"));
        assertThrows(UnknownProcessException.class, () -> ptyService.attachToProcess(99));
        assertThrows(UnknownProcessException.class, () -> ptyService.getCwd(99));
    }

    @Test
    public void detachThenReattach_replaysExactOutput() {
        List<TerminalEvent<ReplayEvent>> replays = new ArrayList<>();
        ptyService.onProcessReplay().subscribe(replays::add);
        int id = create(true);
        ptyService.start(id);
        ptyService.resize(id, 100, 40);
        factory.last().emitData("$ echo hi\r\nhi\r\n");

        ptyService.detachFromProcess(id);
        factory.last().emitData("$ ");
        ptyService.attachToProcess(id);
        ptyService.start(id);

        assertEquals(1, replays.size());
        assertEquals(id, replays.get(0).id());
        assertEquals(
                List.of(
                        ReplayEntry.resize(100, 40),
                        ReplayEntry.data("$ echo hi\r\nhi\r\n"),
                        ReplayEntry.data("$ ")),
                replays.get(0).payload().events());
        assertFalse(factory.last().wasShutDown());
    }

    @Test
    public void nonPersistentDetach_removesProcess() {
        int id = create(false);
        ptyService.start(id);

        ptyService.detachFromProcess(id);

        assertTrue(factory.last().wasShutDown());
        assertFalse(ptyService.hasProcess(id));
        assertThrows(UnknownProcessException.class, () -> ptyService.attachToProcess(id));
    }

    @Test
    public void childExit_removesFromRegistryAndFiresExit() {
        List<TerminalEvent<Integer>> exits = new ArrayList<>();
        ptyService.onProcessExit().subscribe(exits::add);
        int id = create(true);
        ptyService.start(id);

        factory.last().exit(0);

        assertFalse(ptyService.hasProcess(id));
        assertEquals(1, exits.size());
        assertEquals(0, exits.get(0).payload());
    }

    @Test
    public void layout_dropsDeadTerminalsAndEmptyTabs() throws Exception {
        int alive = create(true);
        int dead = create(true);
        ptyService.start(alive);
        ptyService.start(dead);
        factory.created.get(1).exit(1);

        var layout = new TerminalLayoutInfo();
        layout.setWorkspaceId("ws-1");
        layout.setTabs(List.of(tab(true, alive, dead), tab(false, dead)));
        ptyService.setTerminalLayoutInfo(layout);

        // 两个终端都在计时器之外，isOrphaned 需要一次探测；回复让它尽快完成
        ptyService.onProcessOrphanQuestion().subscribe(e -> ptyService.orphanQuestionReply(e.id()));
        ExpandedTerminalLayout expanded = ptyService.getTerminalLayoutInfo("ws-1").get(2, TimeUnit.SECONDS);

        assertEquals(1, expanded.tabs().size());
        var tab = expanded.tabs().get(0);
        assertTrue(tab.active());
        assertEquals(1, tab.terminals().size());
        TerminalDescription description = tab.terminals().get(0).terminal();
        assertEquals(alive, description.id());
        assertEquals("ws-1", description.workspaceId());
        assertFalse(description.orphan());
    }

    @Test
    public void layout_unknownWorkspaceIsNull() throws Exception {
        assertNull(ptyService.getTerminalLayoutInfo("nope").get(1, TimeUnit.SECONDS));
    }

    @Test
    public void isOrphaned_concurrentCallsFireOneQuestion() throws Exception {
        var questions = new AtomicInteger();
        ptyService.onProcessOrphanQuestion().subscribe(e -> questions.incrementAndGet());
        int id = create(true);
        ptyService.start(id);

        var first = ptyService.isOrphaned(id);
        var second = ptyService.isOrphaned(id);

        assertTrue(first.get(2, TimeUnit.SECONDS));
        assertTrue(second.get(2, TimeUnit.SECONDS));
        assertEquals(1, questions.get());
    }

    @Test
    public void reduceConnectionGraceTime_shutsDownDetachedSoon() throws Exception {
        int detached = create(true);
        int attached = create(true);
        ptyService.start(detached);
        ptyService.start(attached);
        ptyService.detachFromProcess(detached);

        ptyService.reduceConnectionGraceTime();
        Thread.sleep(400);

        assertTrue(factory.created.get(0).wasShutDown());
        assertFalse(factory.created.get(1).wasShutDown());
    }

    @Test
    public void shutdownAll_bypassesGrace() {
        int id = create(true);
        ptyService.start(id);
        ptyService.detachFromProcess(id);

        ptyService.shutdownAll();

        assertEquals(0, ptyService.size());
        assertEquals(List.of(true), factory.last().shutdowns);
    }

    private static TerminalLayoutInfo.Tab tab(boolean active, int... terminals) {
        var tab = new TerminalLayoutInfo.Tab();
        tab.setActive(active);
        List<TerminalLayoutInfo.Instance> instances = new ArrayList<>();
        for (int terminal : terminals) {
            var instance = new TerminalLayoutInfo.Instance();
            instance.setTerminal(terminal);
            instance.setRelativeSize(1.0 / terminals.length);
            instances.add(instance);
        }
        tab.setTerminals(instances);
        return tab;
    }
}
