package org.chatrooms;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.chatrooms.model.ChatRoom;
import org.chatrooms.repo.ChatRoomRepository;
import org.chatrooms.repo.MessageRepository;
import org.chatrooms.security.JwtUtil;
import org.chatrooms.service.realtime.lifecycle.CloseReason;
import org.chatrooms.service.realtime.registry.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Real sockets against the embedded server.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ChatroomScenarioTest {

    @LocalServerPort
    private int port;

    @Autowired
    private JwtUtil jwtUtil;

    @Autowired
    private ChatRoomRepository chatRoomRepository;

    @Autowired
    private MessageRepository messageRepository;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private ObjectMapper objectMapper;

    private final StandardWebSocketClient client = new StandardWebSocketClient();
    private final List<WebSocketSession> opened = new ArrayList<>();
    private String roomId;

    @BeforeEach
    void setUp() {
        messageRepository.deleteAll();
        roomId = String.valueOf(chatRoomRepository.save(ChatRoom.builder().name("lobby").build()).getId());
    }

    @AfterEach
    void tearDown() throws Exception {
        for (WebSocketSession s : opened) {
            if (s.isOpen()) s.close();
        }
    }

    static class Recorder extends TextWebSocketHandler {
        final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        final CompletableFuture<CloseStatus> closed = new CompletableFuture<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            frames.add(message.getPayload());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closed.complete(status);
        }
    }

    private WebSocketSession connectWithHeader(String room, String token, Recorder recorder) throws Exception {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        URI uri = URI.create("ws://localhost:" + port + "/api/v1/ws/chatrooms/" + room);
        WebSocketSession s = client.execute(recorder, headers, uri).get(5, TimeUnit.SECONDS);
        opened.add(s);
        return s;
    }

    private WebSocketSession connectWithQuery(String room, String token, Recorder recorder) throws Exception {
        URI uri = URI.create("ws://localhost:" + port + "/api/v1/ws/chatrooms/" + room + "?token=" + token);
        WebSocketSession s = client.execute(recorder, null, uri).get(5, TimeUnit.SECONDS);
        opened.add(s);
        return s;
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    private JsonNode nextFrame(Recorder r) throws Exception {
        String raw = r.frames.poll(5, TimeUnit.SECONDS);
        assertThat(raw).as("frame received").isNotNull();
        return objectMapper.readTree(raw);
    }

    @Test
    void twoMembers_seeEachOthersMessages_inTheSameOrder() throws Exception {
        Recorder r1 = new Recorder();
        Recorder r2 = new Recorder();
        WebSocketSession s1 = connectWithHeader(roomId, jwtUtil.generateToken("u1", "alice", "USER"), r1);
        WebSocketSession s2 = connectWithQuery(roomId, jwtUtil.generateToken("u2", "bob", "USER"), r2);
        waitUntil(() -> registry.membersOf(roomId).size() == 2);

        s1.sendMessage(new TextMessage("{\"content\":\"hi\"}"));

        for (Recorder r : List.of(r1, r2)) {
            JsonNode f = nextFrame(r);
            assertThat(f.get("content").asText()).isEqualTo("hi");
            assertThat(f.get("sender_id").asText()).isEqualTo("u1");
            assertThat(f.get("chatroom_id").asText()).isEqualTo(roomId);
            assertThat(f.get("id").isNumber()).isTrue();
            assertThat(f.hasNonNull("created_at")).isTrue();
        }
        assertThat(messageRepository.count()).isEqualTo(1);

        s2.sendMessage(new TextMessage("{\"content\":\"there\"}"));
        s1.sendMessage(new TextMessage("{\"content\":\"again\"}"));

        List<String> seenBy1 = List.of(nextFrame(r1).get("content").asText(), nextFrame(r1).get("content").asText());
        List<String> seenBy2 = List.of(nextFrame(r2).get("content").asText(), nextFrame(r2).get("content").asText());
        assertThat(seenBy1).containsExactlyInAnyOrder("there", "again");
        assertThat(seenBy2).isEqualTo(seenBy1);
    }

    @Test
    void messages_stayInsideTheirRoom() throws Exception {
        String otherRoom = String.valueOf(chatRoomRepository.save(ChatRoom.builder().name("annex").build()).getId());
        Recorder inRoom = new Recorder();
        Recorder elsewhere = new Recorder();
        WebSocketSession s1 = connectWithHeader(roomId, jwtUtil.generateToken("u1", "alice", "USER"), inRoom);
        connectWithHeader(otherRoom, jwtUtil.generateToken("u3", "carol", "USER"), elsewhere);
        waitUntil(() -> registry.membersOf(roomId).size() == 1 && registry.membersOf(otherRoom).size() == 1);

        s1.sendMessage(new TextMessage("{\"content\":\"hi\"}"));

        assertThat(nextFrame(inRoom).get("content").asText()).isEqualTo("hi");
        assertThat(elsewhere.frames.poll(300, TimeUnit.MILLISECONDS)).isNull();
        assertThat(registry.membersOf(otherRoom)).hasSize(1);
    }

    @Test
    void invalidToken_isClosedWithUnauthorized_andNeverAdmitted() throws Exception {
        Recorder r = new Recorder();
        connectWithHeader(roomId, "garbage", r);

        CloseStatus status = r.closed.get(5, TimeUnit.SECONDS);

        assertThat(status.getCode()).isEqualTo(CloseReason.UNAUTHORIZED.code());
        assertThat(r.frames).isEmpty();
        assertThat(registry.membersOf(roomId)).isEmpty();
    }

    @Test
    void unknownRoom_isClosedWithRoomNotFound() throws Exception {
        Recorder r = new Recorder();
        connectWithHeader("999999", jwtUtil.generateToken("u1", "alice", "USER"), r);

        CloseStatus status = r.closed.get(5, TimeUnit.SECONDS);

        assertThat(status.getCode()).isEqualTo(CloseReason.ROOM_NOT_FOUND.code());
    }

    @Test
    void malformedFrame_getsErrorFrame_andConnectionStaysUsable() throws Exception {
        Recorder r = new Recorder();
        WebSocketSession s = connectWithHeader(roomId, jwtUtil.generateToken("u1", "alice", "USER"), r);
        waitUntil(() -> registry.membersOf(roomId).size() == 1);

        s.sendMessage(new TextMessage("{\"text\":\"hi\"}"));
        JsonNode error = nextFrame(r);
        assertThat(error.get("error").asText()).isEqualTo("INVALID_PAYLOAD");
        assertThat(messageRepository.count()).isZero();

        s.sendMessage(new TextMessage("{\"content\":\"ok now\"}"));
        assertThat(nextFrame(r).get("content").asText()).isEqualTo("ok now");
    }

    @Test
    void peerClose_deregistersTheConnection() throws Exception {
        Recorder r1 = new Recorder();
        Recorder r2 = new Recorder();
        WebSocketSession s1 = connectWithHeader(roomId, jwtUtil.generateToken("u1", "alice", "USER"), r1);
        connectWithHeader(roomId, jwtUtil.generateToken("u2", "bob", "USER"), r2);
        waitUntil(() -> registry.membersOf(roomId).size() == 2);

        s1.close();

        waitUntil(() -> registry.membersOf(roomId).size() == 1);
        assertThat(registry.membersOf(roomId).get(0).getIdentity().userId()).isEqualTo("u2");
    }
}
