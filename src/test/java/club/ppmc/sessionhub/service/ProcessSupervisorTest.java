package club.ppmc.sessionhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.exception.SpawnConflictException;
import club.ppmc.sessionhub.exception.SpawnFailureException;
import club.ppmc.sessionhub.model.PermissionProfile;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.model.SpawnRequest;
import club.ppmc.sessionhub.model.protocol.InputContent;
import club.ppmc.sessionhub.store.JsonFileSessionRecordStore;
import club.ppmc.sessionhub.terminal.AgentCommandBuilder;
import club.ppmc.sessionhub.terminal.TerminalLauncher;
import club.ppmc.sessionhub.terminal.TerminalMultiplexer;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

class ProcessSupervisorTest {

    @TempDir
    Path storeDir;

    private final SessionHubProperties properties = new SessionHubProperties();
    private final TerminalMultiplexer multiplexer = mock(TerminalMultiplexer.class);
    private final TerminalLauncher launcher = mock(TerminalLauncher.class);
    private final ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
    private final FakeTerminalProcess process = new FakeTerminalProcess(42);
    private final OutputLedger ledger = new OutputLedger(1000, Duration.ofMinutes(5), Clock.systemUTC());

    private JsonFileSessionRecordStore store;
    private ProcessSupervisor supervisor;

    @BeforeEach
    void setUp() throws IOException {
        store = new JsonFileSessionRecordStore(storeDir);
        store.init();
        when(launcher.launch(anyList(), anyString(), anyInt(), anyInt())).thenReturn(process);
        // 读取线程不执行，输出与退出由测试直接驱动
        supervisor = new ProcessSupervisor(
                store,
                ledger,
                multiplexer,
                launcher,
                new AgentCommandBuilder(properties),
                new ViewerMessenger(new Gson()),
                events,
                properties,
                runnable -> {},
                mock(ScheduledExecutorService.class),
                Clock.systemUTC());
    }

    private static SpawnRequest request(String sessionId, PermissionProfile profile) {
        return new SpawnRequest(sessionId, "do it", "/tmp", profile, null, null, null, null, null);
    }

    private ProcessHandle spawn(String sessionId) {
        supervisor.spawn(request(sessionId, PermissionProfile.INTERACTIVE));
        return supervisor.getHandle(sessionId).orElseThrow();
    }

    private static List<JsonObject> exits(WebSocketSession viewer) {
        return TestViewers.sent(viewer).stream().filter(m -> "exit".equals(TestViewers.typeOf(m))).toList();
    }

    @Test
    void spawnMarksRecordRunningAndPublishesEvent() {
        SessionRecord record = supervisor.spawn(request("s1", PermissionProfile.AUTO));

        assertThat(record.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(record.getProcessId()).isEqualTo(42L);
        assertThat(record.getStartedAt()).isNotNull();
        assertThat(supervisor.isActive("s1")).isTrue();
        verify(events).publishEvent(new SessionSpawnedEvent("s1", PermissionProfile.AUTO));
    }

    @Test
    void secondSpawnForActiveSessionConflicts() {
        spawn("s1");

        assertThatThrownBy(() -> supervisor.spawn(request("s1", PermissionProfile.INTERACTIVE)))
                .isInstanceOf(SpawnConflictException.class);
    }

    @Test
    void spawnOfFinishedRecordConflicts() {
        store.create(SessionRecord.builder().id("s1").status(SessionStatus.COMPLETED).build());

        assertThatThrownBy(() -> supervisor.spawn(request("s1", PermissionProfile.INTERACTIVE)))
                .isInstanceOf(SpawnConflictException.class);
    }

    @Test
    void launchFailureMarksRecordFailed() throws IOException {
        when(launcher.launch(anyList(), anyString(), anyInt(), anyInt())).thenThrow(new IOException("no such file"));

        assertThatThrownBy(() -> supervisor.spawn(request("s1", PermissionProfile.INTERACTIVE)))
                .isInstanceOf(SpawnFailureException.class);
        assertThat(store.findById("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(supervisor.isActive("s1")).isFalse();
    }

    @Test
    void viewerGetsHistoryThenMonotonicSequencedOutput() {
        ProcessHandle handle = spawn("s1");
        supervisor.processOutput(handle, "before ");
        WebSocketSession viewer = TestViewers.open("v1");

        assertThat(supervisor.attachViewer("s1", viewer, false)).isEqualTo(ProcessSupervisor.AttachOutcome.LIVE);
        supervisor.processOutput(handle, "a");
        supervisor.processOutput(handle, "b");

        List<JsonObject> sent = TestViewers.sent(viewer);
        assertThat(sent).hasSize(3);
        assertThat(sent.get(0).get("type").getAsString()).isEqualTo("history");
        assertThat(sent.get(0).get("data").getAsString()).isEqualTo("before ");
        assertThat(sent.get(1).get("seq").getAsLong()).isEqualTo(2);
        assertThat(sent.get(2).get("seq").getAsLong()).isEqualTo(3);
        assertThat(sent.get(2).getAsJsonObject("content").get("data").getAsString()).isEqualTo("b");
    }

    @Test
    void bellEmitsWaitingStateBeforeTheOutput() {
        ProcessHandle handle = spawn("s1");
        WebSocketSession viewer = TestViewers.open("v1");
        supervisor.attachViewer("s1", viewer, false);

        supervisor.processOutput(handle, "Do you want to proceed?\u0007");

        assertThat(TestViewers.types(viewer)).containsExactly("history", "waiting_state", "output");
        assertThat(handle.isWaitingForInput()).isTrue();
        assertThat(supervisor.waitingSessionIds()).containsExactly("s1");
    }

    @Test
    void outputTailIsCappedButByteCountIsNot() {
        ProcessHandle handle = spawn("s1");
        String chunk = "x".repeat(100 * 1024);

        for (int i = 0; i < 6; i++) {
            supervisor.processOutput(handle, chunk);
        }

        assertThat(handle.getOutputSnapshot()).hasSize(500 * 1024);
        assertThat(handle.getTotalBytes()).isEqualTo(600 * 1024);
    }

    @Test
    void ledgerKeepsEveryEmittedMessage() {
        ProcessHandle handle = spawn("s1");
        supervisor.processOutput(handle, "one");
        supervisor.processOutput(handle, "two");

        assertThat(ledger.replay("s1", 1)).extracting(OutputLedger.LedgerEntry::seq).containsExactly(2L);
    }

    @Test
    void killTwiceEmitsOneExit() {
        spawn("s1");
        WebSocketSession viewer = TestViewers.open("v1");
        supervisor.attachViewer("s1", viewer, false);

        assertThat(supervisor.kill("s1")).isTrue();
        assertThat(supervisor.kill("s1")).isFalse();

        assertThat(exits(viewer)).hasSize(1);
        assertThat(exits(viewer).get(0).getAsJsonObject("content").get("exitCode").getAsInt()).isEqualTo(-1);
        SessionRecord record = store.findById("s1").orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SessionStatus.KILLED);
        assertThat(record.getExitCode()).isEqualTo(-1);
        assertThat(process.destroyed).isTrue();
    }

    @Test
    void exitAfterKillIsIgnored() {
        ProcessHandle handle = spawn("s1");
        WebSocketSession viewer = TestViewers.open("v1");
        supervisor.attachViewer("s1", viewer, false);
        supervisor.kill("s1");

        supervisor.processExit(handle, 143);

        assertThat(exits(viewer)).hasSize(1);
        assertThat(store.findById("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.KILLED);
    }

    @Test
    void nonZeroExitFailsAndZeroCompletes() throws IOException {
        ProcessHandle failing = spawn("s1");
        supervisor.processOutput(failing, "boom");
        supervisor.processExit(failing, 1);

        FakeTerminalProcess second = new FakeTerminalProcess(43);
        when(launcher.launch(anyList(), anyString(), anyInt(), anyInt())).thenReturn(second);
        ProcessHandle ok = spawn("s2");
        supervisor.processExit(ok, 0);

        SessionRecord failed = store.findById("s1").orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(failed.getExitCode()).isEqualTo(1);
        assertThat(failed.getOutputLog()).isEqualTo("boom");
        assertThat(failed.getLastOutputSeq()).isEqualTo(2);
        assertThat(store.findById("s2").orElseThrow().getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(supervisor.activeSessionIds()).isEmpty();
    }

    @Test
    void sequencedInputIsAppliedOnce() {
        spawn("s1");
        var input = new InputContent(InputContent.KIND_INPUT, "ls\r", null, null);

        assertThat(supervisor.handleSequencedInput("s1", 1, input)).isEqualTo(1);
        assertThat(supervisor.handleSequencedInput("s1", 1, input)).isEqualTo(1);
        assertThat(supervisor.handleSequencedInput("s1", 2, input)).isEqualTo(2);

        assertThat(process.writes).containsExactly("ls\r", "ls\r");
    }

    @Test
    void retransmittedOlderInputIsAckedWithItsOwnSeq() {
        spawn("s1");

        assertThat(supervisor.handleSequencedInput("s1", 3, new InputContent(InputContent.KIND_INPUT, "a", null, null)))
                .isEqualTo(3);
        assertThat(supervisor.handleSequencedInput("s1", 5, new InputContent(InputContent.KIND_INPUT, "b", null, null)))
                .isEqualTo(5);
        assertThat(supervisor.handleSequencedInput("s1", 3, new InputContent(InputContent.KIND_INPUT, "a", null, null)))
                .isEqualTo(3);

        assertThat(process.writes).containsExactly("a", "b");
    }

    @Test
    void sequencedResizeAndKill() {
        spawn("s1");

        supervisor.handleSequencedInput("s1", 1, new InputContent(InputContent.KIND_RESIZE, null, 100, 30));
        supervisor.handleSequencedInput("s1", 2, new InputContent(InputContent.KIND_KILL, null, null, null));

        assertThat(process.cols).isEqualTo(100);
        assertThat(process.rows).isEqualTo(30);
        assertThat(store.findById("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.KILLED);
    }

    @Test
    void pendingViewerMovesToLiveProcess() {
        store.create(SessionRecord.builder().id("s1").build());
        WebSocketSession viewer = TestViewers.open("v1");

        assertThat(supervisor.attachViewer("s1", viewer, true)).isEqualTo(ProcessSupervisor.AttachOutcome.PENDING);
        ProcessHandle handle = spawn("s1");
        supervisor.processOutput(handle, "hello");

        assertThat(TestViewers.types(viewer)).containsExactly("history", "output");
        assertThat(handle.getViewerCount()).isEqualTo(1);
    }

    @Test
    void pendingViewerGetsExitWhenSpawnFails() throws IOException {
        store.create(SessionRecord.builder().id("s1").build());
        WebSocketSession viewer = TestViewers.open("v1");
        supervisor.attachViewer("s1", viewer, true);
        when(launcher.launch(anyList(), anyString(), anyInt(), anyInt())).thenThrow(new IOException("denied"));

        assertThatThrownBy(() -> supervisor.spawn(request("s1", PermissionProfile.INTERACTIVE)))
                .isInstanceOf(SpawnFailureException.class);

        assertThat(TestViewers.types(viewer)).containsExactly("history", "exit");
    }

    @Test
    void failingViewerIsDropped() throws IOException {
        ProcessHandle handle = spawn("s1");
        WebSocketSession viewer = TestViewers.open("v1");
        supervisor.attachViewer("s1", viewer, false);
        doThrow(new IOException("broken pipe")).when(viewer).sendMessage(any());

        supervisor.processOutput(handle, "x");

        assertThat(handle.getViewerCount()).isZero();
    }

    @Test
    void tmuxClientExitWithLiveSessionKeepsRecordRunning() throws IOException {
        when(multiplexer.isAvailable()).thenReturn(true);
        when(multiplexer.sessionName("s1")).thenReturn("sh-s1");
        when(multiplexer.attach(eq("sh-s1"), anyInt(), anyInt())).thenReturn(process);
        when(multiplexer.exists("sh-s1")).thenReturn(true);
        ProcessHandle handle = spawn("s1");
        WebSocketSession viewer = TestViewers.open("v1");
        supervisor.attachViewer("s1", viewer, false);

        supervisor.processExit(handle, 0);

        assertThat(store.findById("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(supervisor.isActive("s1")).isFalse();
        verify(viewer).close(CloseStatus.SERVICE_RESTARTED);
    }

    @Test
    void tmuxExitStatusOverridesClientExitCode() throws IOException {
        when(multiplexer.isAvailable()).thenReturn(true);
        when(multiplexer.sessionName("s1")).thenReturn("sh-s1");
        when(multiplexer.attach(eq("sh-s1"), anyInt(), anyInt())).thenReturn(process);
        when(multiplexer.exists("sh-s1")).thenReturn(false);
        when(multiplexer.exitStatus("sh-s1")).thenReturn(OptionalInt.of(2));
        ProcessHandle handle = spawn("s1");

        supervisor.processExit(handle, 0);

        SessionRecord record = store.findById("s1").orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(record.getExitCode()).isEqualTo(2);
        assertThat(record.getMultiplexName()).isEqualTo("sh-s1");
        verify(multiplexer).kill("sh-s1");
    }

    @Test
    void shutdownKeepsTmuxSessions() throws IOException {
        when(multiplexer.isAvailable()).thenReturn(true);
        when(multiplexer.sessionName("s1")).thenReturn("sh-s1");
        when(multiplexer.attach(eq("sh-s1"), anyInt(), anyInt())).thenReturn(process);
        ProcessHandle handle = spawn("s1");

        supervisor.shutdown();
        supervisor.processExit(handle, 0);

        verify(multiplexer).detachClients("sh-s1");
        assertThat(store.findById("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.RUNNING);
    }

    @Test
    void adoptRecoveredContinuesSequenceFromRecord() {
        store.create(SessionRecord.builder()
                .id("s1")
                .status(SessionStatus.RUNNING)
                .multiplexName("sh-s1")
                .lastOutputSeq(10)
                .lastInputSeq(4)
                .build());
        WebSocketSession viewer = TestViewers.open("v1");

        supervisor.adoptRecovered(store.findById("s1").orElseThrow(), process, "pane text", true);
        supervisor.attachViewer("s1", viewer, false);
        supervisor.processOutput(supervisor.getHandle("s1").orElseThrow(), "more");

        List<JsonObject> sent = TestViewers.sent(viewer);
        assertThat(sent.get(0).get("data").getAsString()).isEqualTo("pane text");
        assertThat(sent.get(0).get("lastInputAckSeq").getAsLong()).isEqualTo(4);
        assertThat(sent.get(0).get("waiting").getAsBoolean()).isTrue();
        assertThat(sent.get(1).get("seq").getAsLong()).isEqualTo(11);
    }

    @Test
    void adoptRecoveredContinuesAfterLedgerWhenRecordLags() {
        store.create(SessionRecord.builder()
                .id("s1")
                .status(SessionStatus.RUNNING)
                .multiplexName("sh-s1")
                .lastOutputSeq(10)
                .build());
        ledger.append("s1", "output", 12, "{}");
        WebSocketSession viewer = TestViewers.open("v1");

        supervisor.adoptRecovered(store.findById("s1").orElseThrow(), process, "pane text", false);
        supervisor.attachViewer("s1", viewer, false);
        supervisor.processOutput(supervisor.getHandle("s1").orElseThrow(), "more");

        assertThat(TestViewers.sent(viewer).get(1).get("seq").getAsLong()).isEqualTo(13);
        assertThat(ledger.replay("s1", 12)).extracting(OutputLedger.LedgerEntry::seq).containsExactly(13L);
    }

    @Test
    void slowViewerOfOneSessionDoesNotBlockAttachToAnother() throws Exception {
        FakeTerminalProcess second = new FakeTerminalProcess(43);
        when(launcher.launch(anyList(), anyString(), anyInt(), anyInt())).thenReturn(process, second);
        spawn("s1");
        spawn("s2");
        var sendStarted = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        WebSocketSession slow = TestViewers.open("slow");
        doAnswer(inv -> {
            sendStarted.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(slow).sendMessage(any());
        Thread attacher = new Thread(() -> supervisor.attachViewer("s1", slow, false));
        attacher.start();
        assertThat(sendStarted.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            CompletableFuture<ProcessSupervisor.AttachOutcome> other = CompletableFuture.supplyAsync(
                    () -> supervisor.attachViewer("s2", TestViewers.open("v2"), false));
            assertThat(other.get(2, TimeUnit.SECONDS)).isEqualTo(ProcessSupervisor.AttachOutcome.LIVE);
            CompletableFuture<ProcessSupervisor.AttachOutcome> pending = CompletableFuture.supplyAsync(
                    () -> supervisor.attachViewer("s3", TestViewers.open("v3"), true));
            assertThat(pending.get(2, TimeUnit.SECONDS)).isEqualTo(ProcessSupervisor.AttachOutcome.PENDING);
        } finally {
            release.countDown();
            attacher.join(5_000);
        }
    }
}
