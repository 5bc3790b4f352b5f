package club.ppmc.sessionhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.detect.ConfirmationPromptDetector;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.store.JsonFileSessionRecordStore;
import club.ppmc.sessionhub.terminal.TerminalMultiplexer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionRecoveryServiceTest {

    @TempDir
    Path storeDir;

    private final ProcessSupervisor supervisor = mock(ProcessSupervisor.class);
    private final TerminalMultiplexer multiplexer = mock(TerminalMultiplexer.class);
    private final FakeTerminalProcess client = new FakeTerminalProcess(99);

    private JsonFileSessionRecordStore store;
    private SessionRecoveryService recovery;

    @BeforeEach
    void setUp() throws IOException {
        store = new JsonFileSessionRecordStore(storeDir);
        store.init();
        when(multiplexer.sessionName(any())).thenAnswer(inv -> "sh-" + inv.getArgument(0));
        when(multiplexer.attach(any(), anyInt(), anyInt())).thenReturn(client);
        recovery = new SessionRecoveryService(
                store,
                supervisor,
                multiplexer,
                new ConfirmationPromptDetector(3, List.of("Do you want to")),
                new SessionHubProperties());
    }

    private void running(String id, String workerId) {
        store.create(SessionRecord.builder()
                .id(id)
                .status(SessionStatus.RUNNING)
                .workerId(workerId)
                .outputLog("stored tail")
                .build());
    }

    private SessionStatus statusOf(String id) {
        return store.findById(id).orElseThrow().getStatus();
    }

    @Test
    void withoutTmuxLocalRunningRecordsFail() {
        running("local", null);
        running("remote", "worker-1");

        SessionRecoveryService.RecoveryReport report = recovery.recoverAll();

        assertThat(report.failed()).isEqualTo(1);
        assertThat(statusOf("local")).isEqualTo(SessionStatus.FAILED);
        assertThat(store.findById("local").orElseThrow().getCompletedAt()).isNotNull();
        assertThat(statusOf("remote")).isEqualTo(SessionStatus.RUNNING);
    }

    @Test
    void liveTmuxSessionIsReattachedWithPaneText() {
        running("s1", null);
        String pane = "editing file\nDo you want to make this edit?\n 1. Yes\n";
        when(multiplexer.isAvailable()).thenReturn(true);
        when(multiplexer.exists("sh-s1")).thenReturn(true);
        when(multiplexer.capturePane("sh-s1")).thenReturn(Optional.of(pane));

        SessionRecoveryService.RecoveryReport report = recovery.recoverAll();

        assertThat(report.recovered()).isEqualTo(1);
        verify(supervisor).adoptRecovered(
                argThat(r -> "s1".equals(r.getId()) && "sh-s1".equals(r.getMultiplexName())),
                eq(client),
                eq(pane),
                eq(true));
    }

    @Test
    void blankPaneFallsBackToStoredTail() {
        running("s1", null);
        when(multiplexer.isAvailable()).thenReturn(true);
        when(multiplexer.exists("sh-s1")).thenReturn(true);
        when(multiplexer.capturePane("sh-s1")).thenReturn(Optional.of("\n  \n"));

        assertThat(recovery.tryRecover(store.findById("s1").orElseThrow())).isTrue();

        verify(supervisor).adoptRecovered(any(), eq(client), eq("stored tail"), eq(false));
    }

    @Test
    void missingTmuxSessionMarksRecordFailed() {
        running("s1", null);
        when(multiplexer.isAvailable()).thenReturn(true);
        when(multiplexer.exists("sh-s1")).thenReturn(false);

        assertThat(recovery.tryRecover(store.findById("s1").orElseThrow())).isFalse();

        assertThat(statusOf("s1")).isEqualTo(SessionStatus.FAILED);
        verify(supervisor, never()).adoptRecovered(any(), any(), any(), anyBoolean());
    }

    @Test
    void failedRecordWithLiveTmuxSessionIsRevived() {
        store.create(SessionRecord.builder().id("s2").status(SessionStatus.FAILED).build());
        when(multiplexer.isAvailable()).thenReturn(true);
        when(multiplexer.listSessionIds()).thenReturn(List.of("s2", "unknown"));
        when(multiplexer.exists("sh-s2")).thenReturn(true);
        when(multiplexer.capturePane("sh-s2")).thenReturn(Optional.empty());

        SessionRecoveryService.RecoveryReport report = recovery.recoverAll();

        assertThat(report.recovered()).isEqualTo(1);
        verify(supervisor).adoptRecovered(argThat(r -> "s2".equals(r.getId())), eq(client), any(), eq(false));
    }

    @Test
    void workerRecordsAreNeverRecoveredLocally() {
        running("s1", "worker-1");

        assertThat(recovery.tryRecover(store.findById("s1").orElseThrow())).isFalse();

        assertThat(statusOf("s1")).isEqualTo(SessionStatus.RUNNING);
    }

    @Test
    void unexpectedErrorInOneRecordDoesNotStopTheOthers() {
        running("s1", null);
        running("s2", null);
        when(multiplexer.isAvailable()).thenReturn(true);
        when(multiplexer.exists(any())).thenReturn(true);
        when(multiplexer.capturePane(any())).thenReturn(Optional.of("pane"));
        when(supervisor.adoptRecovered(argThat(r -> r != null && "s1".equals(r.getId())), any(), any(), anyBoolean()))
                .thenThrow(new IllegalStateException("pty failure"));

        SessionRecoveryService.RecoveryReport report = recovery.recoverAll();

        assertThat(report.recovered()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        verify(supervisor).adoptRecovered(argThat(r -> r != null && "s2".equals(r.getId())), eq(client), eq("pane"), eq(false));
    }
}
