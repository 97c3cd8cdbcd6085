package club.ppmc.devserver.service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class EnvironmentServiceTest {

    @TempDir
    Path tempDir;

    @Test
    public void defaults_comeFromProperties() {
        var service = new EnvironmentService(
                tempDir.resolve("ws").toString(), tempDir.resolve("data").toString(), "/bin/zsh", List.of("", "node"));
        service.init();

        assertTrue(Files.isDirectory(tempDir.resolve("ws")));
        assertEquals("/bin/zsh", service.getDefaultShell());
        assertEquals(List.of("node"), service.getExtensionHostCommand());
        assertTrue(service.isExtensionHostAvailable());
    }

    @Test
    public void environmentFile_overridesDefaults() throws Exception {
        Path data = Files.createDirectories(tempDir.resolve("data"));
        String workspace = tempDir.resolve("other-ws").toString().replace("\\", "/");
        Files.writeString(
                data.resolve(EnvironmentService.ENVIRONMENT_FILE_NAME),
                "{\"workspaceRoot\":\"" + workspace + "\",\"extensionHostCommand\":[],\"unknown\":1}");
        var service = new EnvironmentService(tempDir.resolve("ws").toString(), data.toString(), "", List.of("node"));

        service.init();

        assertEquals(tempDir.resolve("other-ws").toAbsolutePath().normalize(), service.getWorkspaceRoot());
        assertFalse(service.isExtensionHostAvailable());
    }

    @Test
    public void resolveTerminalCwd_isRelativeToWorkspace() {
        var service = new EnvironmentService(tempDir.resolve("ws").toString(), tempDir.toString(), "", List.of());

        assertEquals(service.getWorkspaceRoot().toString(), service.resolveTerminalCwd(null));
        assertEquals(service.getWorkspaceRoot().resolve("src").toString(), service.resolveTerminalCwd("src"));
    }
}
