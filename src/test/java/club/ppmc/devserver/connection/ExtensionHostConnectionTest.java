package club.ppmc.devserver.connection;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.devserver.service.EnvironmentService;
import club.ppmc.devserver.socket.FakeClientSocket;
import club.ppmc.devserver.socket.Protocol;
import club.ppmc.devserver.util.ChildProcessSpawner;
import club.ppmc.devserver.util.FakeProcess;
import com.google.gson.Gson;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ExtensionHostConnectionTest {

    @TempDir
    Path tempDir;

    private final Gson gson = new Gson();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private EnvironmentService environmentService;

    @BeforeEach
    public void setUp() {
        environmentService = new EnvironmentService(
                tempDir.resolve("workspace").toString(),
                tempDir.resolve("data").toString(),
                "",
                List.of("node", "extensionHost.js"));
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private ExtensionHostConnection connection(Protocol protocol, ChildProcessSpawner spawner) {
        return new ExtensionHostConnection(
                "ext-1", "zh-cn", protocol, environmentService, spawner, executor, clock, 100);
    }

    @Test
    public void start_spawnsHostWithLocaleAndForwardsStartupBuffer() throws Exception {
        var process = new FakeProcess("");
        AtomicReference<List<String>> command = new AtomicReference<>();
        AtomicReference<Map<String, String>> env = new AtomicReference<>();
        var protocol = new Protocol(new FakeClientSocket("s1"), gson);
        protocol.acceptMessage("init");
        var connection = connection(protocol, (cmd, dir, e) -> {
            command.set(cmd);
            env.set(e);
            return process;
        });

        connection.start();
        protocol.acceptMessage("next");

        assertEquals(List.of("node", "extensionHost.js"), command.get());
        assertEquals("zh-cn", env.get().get(ExtensionHostConnection.LOCALE_ENV));
        assertEquals("ext-1", env.get().get(ExtensionHostConnection.TOKEN_ENV));
        String nl = System.lineSeparator();
        assertEquals("init" + nl + "next" + nl, process.stdinText());
        connection.dispose();
    }

    @Test
    public void hostOutput_isSentToSocketLineByLine() throws Exception {
        var process = new FakeProcess("first\nsecond\n");
        var socket = new FakeClientSocket("s1");
        var connection = connection(new Protocol(socket, gson), (cmd, dir, e) -> process);

        connection.start();

        assertEquals("first", socket.nextSent());
        assertEquals("second", socket.nextSent());
        connection.dispose();
    }

    @Test
    public void hostExit_disposesConnection() throws Exception {
        var process = new FakeProcess("");
        var socket = new FakeClientSocket("s1");
        var connection = connection(new Protocol(socket, gson), (cmd, dir, e) -> process);
        connection.start();

        process.terminate();

        long deadline = System.currentTimeMillis() + 5000;
        while (!connection.isDisposed() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(connection.isDisposed());
        assertFalse(socket.isOpen());
    }

    @Test
    public void dispose_destroysHost() throws Exception {
        var process = new FakeProcess("");
        var connection = connection(new Protocol(new FakeClientSocket("s1"), gson), (cmd, dir, e) -> process);
        connection.start();

        connection.dispose();

        assertTrue(process.isDestroyed());
        assertFalse(connection.isProcessAlive());
    }

    @Test
    public void spawnFailure_propagatesAndDisposes() {
        var socket = new FakeClientSocket("s1");
        var connection = connection(new Protocol(socket, gson), (cmd, dir, e) -> {
            throw new IOException("node not found");
        });

        assertThrows(IOException.class, connection::start);
        assertTrue(connection.isDisposed());
        assertTrue(socket.isOpen(), "the dispatcher decides how to answer the socket");
    }
}
