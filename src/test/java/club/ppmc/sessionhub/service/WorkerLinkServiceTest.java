package club.ppmc.sessionhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.model.WorkerInfo;
import club.ppmc.sessionhub.store.JsonFileSessionRecordStore;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.socket.WebSocketSession;

class WorkerLinkServiceTest {

    private static final String REGISTER = """
            {"type":"launcher_register","id":"w1","name":"build box","hostname":"box-1",
             "capabilities":{"maxSessions":3,"hasTmux":true,"hasAgentCli":true},"activeSessions":["s0"]}""";

    @TempDir
    Path storeDir;

    private final AdminBridgeRouter router = mock(AdminBridgeRouter.class);
    private final Gson gson = new Gson();
    private final ViewerMessenger messenger = new ViewerMessenger(gson);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final WorkerRegistry registry = new WorkerRegistry(messenger, Duration.ofSeconds(90), clock);
    private final WebSocketSession connection = TestViewers.open("conn-1");

    private JsonFileSessionRecordStore store;
    private WorkerLinkService link;

    @BeforeEach
    void setUp() {
        store = new JsonFileSessionRecordStore(storeDir);
        store.init();
        link = new WorkerLinkService(registry, store, router, messenger, gson);
    }

    @Test
    void registrationAddsWorkerAndReplies() {
        link.handleMessage(connection, REGISTER);

        WorkerInfo worker = registry.getWorker("w1").orElseThrow();
        assertThat(worker.getName()).isEqualTo("build box");
        assertThat(worker.getCapabilities().maxSessions()).isEqualTo(3);
        assertThat(worker.getActiveSessions()).containsExactly("s0");
        JsonObject reply = TestViewers.sent(connection).get(0);
        assertThat(reply.get("type").getAsString()).isEqualTo("launcher_registered");
        assertThat(reply.get("ok").getAsBoolean()).isTrue();
    }

    @Test
    void registrationWithoutIdIsRejected() {
        link.handleMessage(connection, "{\"type\":\"launcher_register\"}");

        assertThat(registry.listWorkers()).isEmpty();
        assertThat(TestViewers.sent(connection).get(0).get("ok").getAsBoolean()).isFalse();
    }

    @Test
    void sessionEventsFromUnregisteredConnectionAreDropped() {
        store.create(SessionRecord.builder().id("s1").build());

        link.handleMessage(connection, "{\"type\":\"launcher_session_started\",\"sessionId\":\"s1\",\"pid\":10}");

        assertThat(store.findById("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.PENDING);
    }

    @Test
    void sessionStartedMarksRecordRunning() {
        store.create(SessionRecord.builder().id("s1").build());
        link.handleMessage(connection, REGISTER);

        link.handleMessage(connection,
                "{\"type\":\"launcher_session_started\",\"sessionId\":\"s1\",\"pid\":10,\"tmuxSessionName\":\"sh-s1\"}");

        SessionRecord record = store.findById("s1").orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(record.getWorkerId()).isEqualTo("w1");
        assertThat(record.getProcessId()).isEqualTo(10L);
        assertThat(record.getMultiplexName()).isEqualTo("sh-s1");
        assertThat(registry.isReportedByLiveWorker("s1")).isTrue();
    }

    @Test
    void outputIsRelayedToRoutedViewers() {
        link.handleMessage(connection, REGISTER);
        link.handleMessage(connection,
                "{\"type\":\"launcher_session_output\",\"sessionId\":\"s1\","
                        + "\"output\":{\"type\":\"sequenced_output\",\"seq\":4}}");

        verify(router).deliverToRoutedViewers(eq("s1"),
                argThat(json -> json.contains("\"seq\":4") && json.contains("sequenced_output")));
    }

    @Test
    void outputFromUnregisteredConnectionIsDropped() {
        link.handleMessage(connection,
                "{\"type\":\"launcher_session_output\",\"sessionId\":\"s1\","
                        + "\"output\":{\"type\":\"sequenced_output\",\"seq\":4}}");

        verify(router, never()).deliverToRoutedViewers(anyString(), any());
    }

    @Test
    void sessionEndedDerivesStatusFromExitCode() {
        store.create(SessionRecord.builder().id("s1").status(SessionStatus.RUNNING).workerId("w1").build());
        link.handleMessage(connection, REGISTER);

        link.handleMessage(connection,
                "{\"type\":\"launcher_session_ended\",\"sessionId\":\"s1\",\"exitCode\":3,\"outputLog\":\"bye\"}");

        SessionRecord record = store.findById("s1").orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(record.getExitCode()).isEqualTo(3);
        assertThat(record.getOutputLog()).isEqualTo("bye");
        verify(router).notifyRoutedExit("s1", 3, SessionStatus.FAILED);
    }

    @Test
    void reportedTerminalStatusWins() {
        store.create(SessionRecord.builder().id("s1").status(SessionStatus.RUNNING).build());
        link.handleMessage(connection, REGISTER);

        link.handleMessage(connection,
                "{\"type\":\"launcher_session_ended\",\"sessionId\":\"s1\",\"exitCode\":0,\"status\":\"killed\"}");

        assertThat(store.findById("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.KILLED);
    }

    @Test
    void closingConnectionUnregistersWorker() {
        link.handleMessage(connection, REGISTER);

        link.connectionClosed(connection);

        assertThat(registry.getWorker("w1")).isEmpty();
    }

    @Test
    void garbageIsIgnored() {
        link.handleMessage(connection, "[1,2");

        verify(router, never()).deliverToRoutedViewers(anyString(), any());
        assertThat(TestViewers.sent(connection)).isEmpty();
    }
}
