package club.ppmc.sessionhub.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.sessionhub.model.PermissionProfile;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileSessionRecordStoreTest {

    @TempDir
    Path directory;

    private JsonFileSessionRecordStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileSessionRecordStore(directory);
        store.init();
    }

    @Test
    void createPersistsAndReloads() {
        store.create(SessionRecord.builder()
                .id("s1")
                .permissionProfile(PermissionProfile.AUTO)
                .prompt("hello")
                .build());
        store.update("s1", r -> {
            r.setStatus(SessionStatus.RUNNING);
            r.setStartedAt(Instant.parse("2024-05-01T10:00:00Z"));
        });

        var reloaded = new JsonFileSessionRecordStore(directory);
        reloaded.init();

        SessionRecord record = reloaded.findById("s1").orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(record.getPermissionProfile()).isEqualTo(PermissionProfile.AUTO);
        assertThat(record.getStartedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(record.getCreatedAt()).isNotNull();
    }

    @Test
    void recordFileUsesLowercaseStatus() throws Exception {
        store.create(SessionRecord.builder().id("s1").build());

        assertThat(Files.readString(directory.resolve("s1.json"))).contains("\"status\" : \"pending\"");
    }

    @Test
    void duplicateCreateIsRejected() {
        store.create(SessionRecord.builder().id("s1").build());

        assertThatThrownBy(() -> store.create(SessionRecord.builder().id("s1").build()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void returnedRecordsAreCopies() {
        store.create(SessionRecord.builder().id("s1").build());

        store.findById("s1").orElseThrow().setStatus(SessionStatus.KILLED);

        assertThat(store.findById("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.PENDING);
    }

    @Test
    void updateOfMissingRecordIsEmpty() {
        assertThat(store.update("missing", r -> r.setStatus(SessionStatus.FAILED))).isEmpty();
        assertThat(directory.resolve("missing.json")).doesNotExist();
    }

    @Test
    void unchangedUpdateDoesNotRewriteFile() throws Exception {
        store.create(SessionRecord.builder().id("s1").status(SessionStatus.COMPLETED).build());
        Files.delete(directory.resolve("s1.json"));

        store.update("s1", r -> {
            if (!r.getStatus().isTerminal()) {
                r.setStatus(SessionStatus.KILLED);
            }
        });
        assertThat(directory.resolve("s1.json")).doesNotExist();

        store.update("s1", r -> r.setExitCode(0));
        assertThat(directory.resolve("s1.json")).exists();
    }

    @Test
    void findByStatusAndRecent() {
        store.create(SessionRecord.builder().id("a").createdAt(Instant.parse("2024-01-01T00:00:00Z")).build());
        store.create(SessionRecord.builder().id("b").createdAt(Instant.parse("2024-01-02T00:00:00Z")).build());
        store.create(SessionRecord.builder().id("c").createdAt(Instant.parse("2024-01-03T00:00:00Z")).build());
        store.update("b", r -> r.setStatus(SessionStatus.RUNNING));

        assertThat(store.findByStatus(SessionStatus.RUNNING)).extracting(SessionRecord::getId).containsExactly("b");
        assertThat(store.findRecent(2)).extracting(SessionRecord::getId).containsExactly("c", "b");
    }

    @Test
    void corruptFileIsSkipped() throws Exception {
        Files.writeString(directory.resolve("broken.json"), "{not json");
        store.create(SessionRecord.builder().id("ok").build());

        var reloaded = new JsonFileSessionRecordStore(directory);
        reloaded.init();

        assertThat(reloaded.findById("ok")).isPresent();
        assertThat(reloaded.findById("broken")).isEmpty();
    }
}
