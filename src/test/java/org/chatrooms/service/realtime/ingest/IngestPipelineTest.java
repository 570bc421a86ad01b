package org.chatrooms.service.realtime.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.chatrooms.config.RealtimeSettings;
import org.chatrooms.dto.Identity;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.*;
import org.chatrooms.service.MessageStore;
import org.chatrooms.service.RoomDirectory;
import org.chatrooms.service.realtime.broadcast.Broadcaster;
import org.chatrooms.service.realtime.lifecycle.ChatConnection;
import org.chatrooms.service.realtime.registry.ConnectionRegistry;
import org.chatrooms.service.realtime.util.Payloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestPipelineTest {

    @Mock
    private MessageStore messageStore;
    @Mock
    private Broadcaster broadcaster;
    @Mock
    private RoomDirectory roomDirectory;

    private ConnectionRegistry registry;
    private IngestPipeline pipeline;
    private ChatConnection alice;

    @BeforeEach
    void init() {
        registry = new ConnectionRegistry(roomDirectory);
        pipeline = new IngestPipeline(registry, messageStore, broadcaster, roomDirectory,
                new Payloads(new ObjectMapper()), new RealtimeSettings(8, 4, 10, 50));
        alice = new ChatConnection(new Identity("u1", "alice"), "1", mock(WebSocketSession.class), 8, c -> { });
    }

    private void admitAlice() {
        when(roomDirectory.exists("1")).thenReturn(true);
        registry.admit("1", alice);
    }

    private StoredMessage stored(long id, String content) {
        return StoredMessage.builder().id(id).chatroomId("1").senderId("u1").content(content).createdAt(Instant.now()).build();
    }

    @Test
    void ingest_persistsTrimmedContent_thenBroadcastsToWholeRoom() {
        admitAlice();
        StoredMessage saved = stored(1, "hi");
        when(messageStore.append("1", "u1", "hi")).thenReturn(saved);

        StoredMessage result = pipeline.ingest(alice, "{\"content\":\"  hi \"}");

        assertThat(result).isSameAs(saved);
        InOrder order = inOrder(messageStore, broadcaster);
        order.verify(messageStore).append("1", "u1", "hi");
        order.verify(broadcaster).broadcast("1", saved, null);
    }

    @Test
    void ingest_malformedPayload_storesNothing() {
        admitAlice();

        assertThatThrownBy(() -> pipeline.ingest(alice, "{\"text\":\"hi\"}"))
                .isInstanceOf(InvalidPayloadException.class);
        assertThatThrownBy(() -> pipeline.ingest(alice, "{\"content\":\"   \"}"))
                .isInstanceOf(InvalidPayloadException.class);
        assertThatThrownBy(() -> pipeline.ingest(alice, "{\"content\":\"way too long!\"}"))
                .isInstanceOf(InvalidPayloadException.class);

        verifyNoInteractions(messageStore, broadcaster);
    }

    @Test
    void ingest_afterRemoval_throwsNotMember_withoutStoring() {
        admitAlice();
        registry.remove("1", alice.getId());

        assertThatThrownBy(() -> pipeline.ingest(alice, "{\"content\":\"hi\"}"))
                .isInstanceOf(NotMemberException.class);

        verifyNoInteractions(messageStore, broadcaster);
    }

    @Test
    void ingest_storeFailure_isReported_andNothingIsBroadcast() {
        admitAlice();
        when(messageStore.append("1", "u1", "hi")).thenThrow(new MessageStoreException("db down"));

        assertThatThrownBy(() -> pipeline.ingest(alice, "{\"content\":\"hi\"}"))
                .isInstanceOf(PersistenceFailureException.class)
                .hasCauseInstanceOf(MessageStoreException.class);

        verifyNoInteractions(broadcaster);
    }

    @Test
    void ingest_afterStoreFailure_laterMessagesStillFlow() {
        admitAlice();
        StoredMessage saved = stored(2, "again");
        when(messageStore.append("1", "u1", "hi")).thenThrow(new MessageStoreException("db down"));
        when(messageStore.append("1", "u1", "again")).thenReturn(saved);

        assertThatThrownBy(() -> pipeline.ingest(alice, "{\"content\":\"hi\"}"))
                .isInstanceOf(PersistenceFailureException.class);
        pipeline.ingest(alice, "{\"content\":\"again\"}");

        verify(broadcaster).broadcast("1", saved, null);
    }

    @Test
    void ingest_slowStoreCall_doesNotHoldUpTheRoom() throws Exception {
        admitAlice();
        AtomicLong ids = new AtomicLong();
        CountDownLatch slowInStore = new CountDownLatch(1);
        CountDownLatch releaseSlow = new CountDownLatch(1);

        // ids are handed out when the store call returns
        when(messageStore.append("1", "u1", "slow")).thenAnswer(inv -> {
            slowInStore.countDown();
            releaseSlow.await(5, TimeUnit.SECONDS);
            return stored(ids.incrementAndGet(), "slow");
        });
        when(messageStore.append("1", "u1", "fast")).thenAnswer(inv -> stored(ids.incrementAndGet(), "fast"));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<StoredMessage> slow = pool.submit(() -> pipeline.ingest(alice, "{\"content\":\"slow\"}"));
        assertThat(slowInStore.await(5, TimeUnit.SECONDS)).isTrue();

        StoredMessage fast = pipeline.ingest(alice, "{\"content\":\"fast\"}");
        assertThat(fast.getId()).isEqualTo(1L);
        verify(broadcaster).broadcast("1", fast, null);
        assertThat(slow.isDone()).isFalse();

        releaseSlow.countDown();
        StoredMessage late = slow.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(late.getId()).isEqualTo(2L);
        InOrder order = inOrder(broadcaster);
        order.verify(broadcaster).broadcast("1", fast, null);
        order.verify(broadcaster).broadcast("1", late, null);
    }

    @Test
    void publish_unknownRoom_throwsRoomUnknown() {
        when(roomDirectory.exists("404")).thenReturn(false);

        assertThatThrownBy(() -> pipeline.publish("404", new Identity("u1", "alice"), "hi"))
                .isInstanceOf(RoomUnknownException.class);
        verifyNoInteractions(messageStore);
    }

    @Test
    void publish_withoutLiveMembers_storesOnly() {
        when(roomDirectory.exists("1")).thenReturn(true);
        StoredMessage saved = stored(3, "rest");
        when(messageStore.append("1", "u1", "rest")).thenReturn(saved);

        assertThat(pipeline.publish("1", new Identity("u1", "alice"), " rest ")).isSameAs(saved);

        verifyNoInteractions(broadcaster);
        assertThat(registry.roomCount()).isZero();
    }

    @Test
    void publish_withLiveMembers_broadcastsToTheRoom() {
        admitAlice();
        StoredMessage saved = stored(4, "rest");
        when(messageStore.append("1", "u2", "rest")).thenReturn(saved);

        pipeline.publish("1", new Identity("u2", "bob"), "rest");

        verify(broadcaster).broadcast("1", saved, null);
    }

    @Test
    void ingest_nullFromStore_isAPersistenceFailure() {
        admitAlice();
        when(messageStore.append("1", "u1", "hi")).thenReturn(null);

        assertThatThrownBy(() -> pipeline.ingest(alice, "{\"content\":\"hi\"}"))
                .isInstanceOf(PersistenceFailureException.class);
        verifyNoInteractions(broadcaster);
    }

    @Test
    void normalize_rejectsNullBlankAndOversized() {
        assertThatThrownBy(() -> pipeline.normalize(null)).isInstanceOf(InvalidPayloadException.class);
        assertThatThrownBy(() -> pipeline.normalize("\t\n")).isInstanceOf(InvalidPayloadException.class);
        assertThatThrownBy(() -> pipeline.normalize("12345678901")).isInstanceOf(InvalidPayloadException.class);
        assertThat(pipeline.normalize(" 1234567890 ")).isEqualTo("1234567890");
    }
}
