package club.ppmc.sessionhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.sessionhub.model.WorkerInfo;
import club.ppmc.sessionhub.websocket.CloseCodes;
import com.google.gson.Gson;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

class WorkerRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final WorkerRegistry registry =
            new WorkerRegistry(new ViewerMessenger(new Gson()), Duration.ofSeconds(90), clock);

    private WorkerInfo worker(String id, WebSocketSession connection, int maxSessions) {
        return new WorkerInfo(id, id + "-name", "host-" + id, connection,
                new WorkerInfo.Capabilities(maxSessions, true, true), clock.instant());
    }

    @Test
    void reRegistrationClosesPreviousConnection() throws IOException {
        WebSocketSession first = TestViewers.open("c1");
        WebSocketSession second = TestViewers.open("c2");
        registry.register(worker("w1", first, 2));

        registry.register(worker("w1", second, 2));

        verify(first).close(CloseCodes.WORKER_REPLACED);
        assertThat(registry.getWorker("w1").orElseThrow().getConnection()).isSameAs(second);
    }

    @Test
    void staleConnectionCloseDoesNotRemoveReplacement() {
        WebSocketSession first = TestViewers.open("c1");
        WebSocketSession second = TestViewers.open("c2");
        registry.register(worker("w1", first, 2));
        registry.register(worker("w1", second, 2));

        registry.unregisterConnection("w1", first);

        assertThat(registry.getWorker("w1")).isPresent();
        registry.unregisterConnection("w1", second);
        assertThat(registry.getWorker("w1")).isEmpty();
    }

    @Test
    void workersWithoutHeartbeatArePruned() throws IOException {
        WebSocketSession quiet = TestViewers.open("c1");
        WebSocketSession chatty = TestViewers.open("c2");
        registry.register(worker("quiet", quiet, 2));
        registry.register(worker("chatty", chatty, 2));

        clock.advance(Duration.ofSeconds(60));
        registry.updateHeartbeat("chatty", List.of());
        clock.advance(Duration.ofSeconds(60));
        registry.pruneStaleWorkers();

        assertThat(registry.listWorkers()).extracting(WorkerInfo::getId).containsExactly("chatty");
        verify(quiet).close(CloseCodes.WORKER_STALE);
        verify(chatty, never()).close(CloseCodes.WORKER_STALE);
    }

    @Test
    void heartbeatReplacesReportedSessions() {
        registry.register(worker("w1", TestViewers.open("c1"), 4));
        registry.addSession("w1", "old");

        registry.updateHeartbeat("w1", List.of("a", "b"));

        assertThat(registry.getWorker("w1").orElseThrow().getActiveSessions()).containsExactlyInAnyOrder("a", "b");
        assertThat(registry.isReportedByLiveWorker("a")).isTrue();
        assertThat(registry.isReportedByLiveWorker("old")).isFalse();
    }

    @Test
    void availableWorkerIsTheLeastLoadedWithCapacity() {
        registry.register(worker("full", TestViewers.open("c1"), 1));
        registry.register(worker("busy", TestViewers.open("c2"), 4));
        registry.register(worker("idle", TestViewers.open("c3"), 4));
        registry.addSession("full", "s1");
        registry.addSession("busy", "s2");

        assertThat(registry.findAvailableWorker()).map(WorkerInfo::getId).contains("idle");
    }

    @Test
    void closedConnectionIsNotLive() {
        WebSocketSession connection = TestViewers.open("c1");
        registry.register(worker("w1", connection, 2));
        when(connection.isOpen()).thenReturn(false);

        assertThat(registry.getWorker("w1")).isPresent();
        assertThat(registry.getLiveWorker("w1")).isEmpty();
        assertThat(registry.findAvailableWorker()).isEmpty();
    }
}
