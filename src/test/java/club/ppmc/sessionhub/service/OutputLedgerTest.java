package club.ppmc.sessionhub.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputLedgerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final OutputLedger ledger = new OutputLedger(3, Duration.ofMinutes(5), clock);

    @Test
    void replayReturnsEntriesAfterSequenceInOrder() {
        ledger.append("s1", "output", 1, "{\"seq\":1}");
        ledger.append("s1", "waiting_state", 2, "{\"seq\":2}");
        ledger.append("s1", "output", 3, "{\"seq\":3}");

        assertThat(ledger.replay("s1", 1))
                .extracting(OutputLedger.LedgerEntry::seq)
                .containsExactly(2L, 3L);
        assertThat(ledger.replay("other", 0)).isEmpty();
    }

    @Test
    void rejectsNonIncreasingSequence() {
        ledger.append("s1", "output", 5, "a");
        ledger.append("s1", "output", 5, "b");
        ledger.append("s1", "output", 4, "c");

        assertThat(ledger.replay("s1", 0)).extracting(OutputLedger.LedgerEntry::payload).containsExactly("a");
    }

    @Test
    void capacityDropsOldestEntries() {
        for (long seq = 1; seq <= 5; seq++) {
            ledger.append("s1", "output", seq, "p" + seq);
        }

        assertThat(ledger.size("s1")).isEqualTo(3);
        assertThat(ledger.replay("s1", 0)).extracting(OutputLedger.LedgerEntry::seq).containsExactly(3L, 4L, 5L);
    }

    @Test
    void acknowledgeReleasesEntriesUpToSequence() {
        ledger.append("s1", "output", 1, "a");
        ledger.append("s1", "output", 2, "b");
        ledger.append("s1", "output", 3, "c");

        ledger.acknowledge("s1", 2);

        assertThat(ledger.replay("s1", 0)).extracting(OutputLedger.LedgerEntry::seq).containsExactly(3L);
    }

    @Test
    void pruneDropsExpiredEntriesAndEmptySessions() {
        ledger.append("old", "output", 1, "a");
        clock.advance(Duration.ofMinutes(4));
        ledger.append("mixed", "output", 1, "b");
        clock.advance(Duration.ofMinutes(2));

        ledger.prune();

        assertThat(ledger.size("old")).isZero();
        assertThat(ledger.size("mixed")).isEqualTo(1);
    }

    @Test
    void appendAfterPruneStartsFreshLog() {
        ledger.append("s1", "output", 1, "a");
        clock.advance(Duration.ofMinutes(10));
        ledger.prune();

        ledger.append("s1", "output", 2, "b");

        assertThat(ledger.replay("s1", 0)).extracting(OutputLedger.LedgerEntry::seq).containsExactly(2L);
    }

    @Test
    void replayAfterRestartReturnsPersistedEntries(@TempDir Path dir) {
        var before = new OutputLedger(3, Duration.ofMinutes(5), clock, dir);
        before.init();
        before.append("s1", "output", 1, "{\"seq\":1}");
        before.append("s1", "output", 2, "{\"seq\":2}");
        before.append("s1", "exit", 3, "{\"seq\":3}");
        before.acknowledge("s1", 1);

        var after = new OutputLedger(3, Duration.ofMinutes(5), clock, dir);
        after.init();

        assertThat(after.replay("s1", 0))
                .extracting(OutputLedger.LedgerEntry::payload)
                .containsExactly("{\"seq\":2}", "{\"seq\":3}");
        assertThat(after.lastSeq("s1")).isEqualTo(3);
    }

    @Test
    void restartAppliesCapacityAndSkipsTornLine(@TempDir Path dir) throws Exception {
        var before = new OutputLedger(3, Duration.ofMinutes(5), clock, dir);
        before.init();
        for (long seq = 1; seq <= 5; seq++) {
            before.append("s1", "output", seq, "p" + seq);
        }
        Files.writeString(dir.resolve("s1.jsonl"), "{\"kind\":\"out", StandardOpenOption.APPEND);

        var after = new OutputLedger(3, Duration.ofMinutes(5), clock, dir);
        after.init();

        assertThat(after.replay("s1", 0)).extracting(OutputLedger.LedgerEntry::seq).containsExactly(3L, 4L, 5L);
    }

    @Test
    void pruneDeletesFileOfEmptiedSession(@TempDir Path dir) {
        var persisted = new OutputLedger(3, Duration.ofMinutes(5), clock, dir);
        persisted.init();
        persisted.append("s1", "output", 1, "a");
        persisted.append("s2", "output", 1, "b");
        persisted.acknowledge("s1", 1);

        persisted.prune();

        assertThat(dir.resolve("s1.jsonl")).doesNotExist();
        assertThat(dir.resolve("s2.jsonl")).exists();
        var reloaded = new OutputLedger(3, Duration.ofMinutes(5), clock, dir);
        reloaded.init();
        assertThat(reloaded.size("s1")).isZero();
        assertThat(reloaded.size("s2")).isEqualTo(1);
    }
}
