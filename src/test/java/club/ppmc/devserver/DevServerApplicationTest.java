package club.ppmc.devserver;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class DevServerApplicationTest {

    @LocalServerPort
    public int serverPort;

    @Autowired
    private TestRestTemplate restTemplate;

    private static class RecordingHandler extends TextWebSocketHandler {
        final LinkedBlockingQueue<String> received = new LinkedBlockingQueue<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            received.add(message.getPayload());
        }

        JsonObject next() throws InterruptedException {
            String frame = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(frame, "expected a frame from the server");
            return JsonParser.parseString(frame).getAsJsonObject();
        }
    }

    private WebSocketSession open(RecordingHandler handler) throws Exception {
        return new StandardWebSocketClient()
                .execute(handler, "ws://localhost:" + serverPort + "/remote")
                .get(5, TimeUnit.SECONDS);
    }

    private static TextMessage handshake(String type, String token, boolean reconnection) {
        return new TextMessage("{\"desiredConnectionType\":\"" + type + "\",\"reconnectionToken\":\"" + token
                + "\",\"reconnection\":" + reconnection + ",\"commit\":\"test-commit\"}");
    }

    @Test
    public void managementHandshake_thenTerminalRpc() throws Exception {
        var handler = new RecordingHandler();
        WebSocketSession session = open(handler);

        session.sendMessage(handshake("Management", "it-token", false));
        assertEquals("ok", handler.next().get("type").getAsString());

        session.sendMessage(new TextMessage("{\"requestId\":1,\"command\":\"listProcesses\",\"args\":{}}"));
        JsonObject reply = handler.next();
        assertEquals("reply", reply.get("type").getAsString());
        assertEquals(1, reply.get("requestId").getAsInt());
        assertTrue(reply.getAsJsonArray("result").isEmpty());

        String connections = restTemplate.getForObject("/api/connections", String.class);
        assertTrue(connections.contains("it-token"));
        session.close();
    }

    @Test
    public void duplicateHandshake_isRejected() throws Exception {
        var first = new RecordingHandler();
        WebSocketSession firstSession = open(first);
        firstSession.sendMessage(handshake("Management", "dup-token", false));
        assertEquals("ok", first.next().get("type").getAsString());

        var second = new RecordingHandler();
        WebSocketSession secondSession = open(second);
        secondSession.sendMessage(handshake("Management", "dup-token", false));

        JsonObject error = second.next();
        assertEquals("error", error.get("type").getAsString());
        assertEquals("Duplicate reconnection token", error.get("reason").getAsString());
        firstSession.close();
    }

    @Test
    public void malformedHandshake_isRejected() throws Exception {
        var handler = new RecordingHandler();
        WebSocketSession session = open(handler);

        session.sendMessage(new TextMessage("not json"));

        assertEquals("error", handler.next().get("type").getAsString());
    }
}
