package club.ppmc.devserver.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.devserver.model.terminal.ShellLaunchConfig;
import club.ppmc.devserver.model.terminal.TerminalLayoutInfo;
import club.ppmc.devserver.service.PtyService;
import club.ppmc.devserver.terminal.FakeTerminalProcessFactory;
import club.ppmc.devserver.terminal.ReconnectConstants;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

public class TerminalControllerTest {

    private ThreadPoolTaskScheduler scheduler;
    private PtyService ptyService;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();
        ptyService = new PtyService(new FakeTerminalProcessFactory(), scheduler, ReconnectConstants.defaults());
        mockMvc = MockMvcBuilders.standaloneSetup(new TerminalController(ptyService)).build();
    }

    @AfterEach
    public void tearDown() {
        ptyService.shutdownAll();
        scheduler.shutdown();
    }

    private int detachedTerminal() {
        int id = ptyService.createProcess(new ShellLaunchConfig(), "/work", 80, 24, Map.of(), true, "ws-1", "Workspace");
        ptyService.start(id);
        // 已分离的终端处于宽限期内，孤儿判断无需等待客户端回复
        ptyService.detachFromProcess(id);
        return id;
    }

    @Test
    public void listTerminals_describesLiveProcesses() throws Exception {
        int id = detachedTerminal();

        MvcResult result = mockMvc.perform(get("/api/terminals")).andExpect(request().asyncStarted()).andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(id))
                .andExpect(jsonPath("$[0].workspaceId").value("ws-1"))
                .andExpect(jsonPath("$[0].orphan").value(true));
    }

    @Test
    public void layout_unknownWorkspaceIs404() throws Exception {
        MvcResult result =
                mockMvc.perform(get("/api/terminals/layout/nope")).andExpect(request().asyncStarted()).andReturn();

        mockMvc.perform(asyncDispatch(result)).andExpect(status().isNotFound());
    }

    @Test
    public void layout_isExpanded() throws Exception {
        int id = detachedTerminal();
        var instance = new TerminalLayoutInfo.Instance();
        instance.setTerminal(id);
        instance.setRelativeSize(1.0);
        var tab = new TerminalLayoutInfo.Tab();
        tab.setActive(true);
        tab.setTerminals(List.of(instance));
        var layout = new TerminalLayoutInfo();
        layout.setWorkspaceId("ws-1");
        layout.setTabs(List.of(tab));
        ptyService.setTerminalLayoutInfo(layout);

        MvcResult result =
                mockMvc.perform(get("/api/terminals/layout/ws-1")).andExpect(request().asyncStarted()).andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tabs[0].active").value(true))
                .andExpect(jsonPath("$.tabs[0].terminals[0].terminal.id").value(id));
    }
}
