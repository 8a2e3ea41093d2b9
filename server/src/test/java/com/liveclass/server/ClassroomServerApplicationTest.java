package com.liveclass.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

/**
 * Boots the server on a random port with in-memory stores and drives it over real sockets.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "classroom.store=memory",
        "classroom.memory.classes=R1,R2",
        "classroom.moderator.grace-period-ms=300"
})
class ClassroomServerApplicationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<WebSocketSession> opened = new ArrayList<>();

    @AfterEach
    void closeClients() throws Exception {
        for (WebSocketSession s : opened) {
            if (s.isOpen()) s.close();
        }
    }

    private static final class Client extends TextWebSocketHandler {
        final BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        private final ObjectMapper mapper;
        WebSocketSession session;

        Client(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
            inbox.add(mapper.readTree(message.getPayload()));
        }

        void send(String event, Map<String, Object> data) throws Exception {
            Map<String, Object> env = Map.of("event", event, "data", data);
            session.sendMessage(new TextMessage(mapper.writeValueAsString(env)));
        }

        JsonNode await(String event) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (System.currentTimeMillis() < deadline) {
                JsonNode next = inbox.poll(100, TimeUnit.MILLISECONDS);
                if (next != null && event.equals(next.path("event").asText())) return next.get("data");
            }
            return fail("no " + event + " within 5s");
        }
    }

    private Client connect() throws Exception {
        Client client = new Client(mapper);
        client.session = new StandardWebSocketClient()
                .execute(client, "ws://localhost:" + port + "/classroom")
                .get(5, TimeUnit.SECONDS);
        opened.add(client.session);
        return client;
    }

    @Test
    void studentSeesModeratorAndEndClassNotifiesRoom() throws Exception {
        Client moderator = connect();
        moderator.send("join-room", Map.of("userId", "t1", "roomId", "R1", "name", "Teacher", "role", "moderator"));
        assertThat(moderator.await("user-list").size()).isZero();

        Client student = connect();
        student.send("join-room", Map.of("userId", "u1", "roomId", "R1", "name", "Ann"));

        JsonNode others = student.await("user-list");
        assertThat(others.size()).isEqualTo(1);
        assertThat(others.get(0).get("userId").asText()).isEqualTo("t1");
        assertThat(others.get(0).get("role").asText()).isEqualTo("moderator");

        JsonNode joined = moderator.await("user-joined");
        assertThat(joined.get("name").asText()).isEqualTo("Ann");
        assertThat(joined.get("role").asText()).isEqualTo("student");

        ResponseEntity<Map> res = rest.postForEntity("/classes/end-class/R1", null, Map.class);
        assertThat(res.getStatusCode().value()).isEqualTo(200);

        assertThat(student.await("class-ended").get("reason").asText()).isEqualTo("Class ended by moderator");
    }

    @Test
    void moderatorDropStartsGracePeriodThenClosesRoom() throws Exception {
        Client moderator = connect();
        moderator.send("join-room", Map.of("userId", "t2", "roomId", "R2", "name", "Teacher", "role", "moderator"));
        moderator.await("user-list");

        Client student = connect();
        student.send("join-room", Map.of("userId", "u2", "roomId", "R2", "name", "Bob"));
        student.await("user-list");

        moderator.session.close(CloseStatus.NORMAL);

        assertThat(student.await("user-disconnected").isTextual()).isTrue();
        assertThat(student.await("moderator-left").get("countdown").asInt()).isEqualTo(1);
        assertThat(student.await("room-closed").get("reason").asText()).contains("didn't return");
    }

    @Test
    void unknownClassIsNotFound() {
        ResponseEntity<Map> res = rest.postForEntity("/classes/start-class/NOPE", null, Map.class);
        assertThat(res.getStatusCode().value()).isEqualTo(404);
        assertThat(res.getBody()).containsEntry("error", "Class not found");
    }
}
