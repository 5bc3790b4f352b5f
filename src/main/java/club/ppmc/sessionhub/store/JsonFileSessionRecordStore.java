/**
 * JsonFileSessionRecordStore.java
 *
 * 把每条会话记录保存为目录中的一个 JSON 文件（{id}.json），启动时全部加载到内存中。
 * 读操作只访问内存；写操作先写临时文件再原子替换，进程在写入途中崩溃也不会留下半个文件。
 * 对外返回的总是副本，调用方修改返回值不会影响存储。
 */
package club.ppmc.sessionhub.store;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileSessionRecordStore implements SessionRecordStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileSessionRecordStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<String, SessionRecord> records = new ConcurrentHashMap<>();

    @Autowired
    public JsonFileSessionRecordStore(SessionHubProperties properties) {
        this(Paths.get(properties.getStore().getDirectory()));
    }

    public JsonFileSessionRecordStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建会话记录目录 " + directory, e);
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).forEach(this::load);
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取会话记录目录 " + directory, e);
        }
        LOGGER.info("已从 {} 加载 {} 条会话记录。", directory, records.size());
    }

    private void load(Path file) {
        try {
            SessionRecord record = objectMapper.readValue(file.toFile(), SessionRecord.class);
            if (record.getId() != null) {
                records.put(record.getId(), record);
            }
        } catch (IOException e) {
            // 单个损坏的文件不影响其它记录
            LOGGER.error("读取会话记录文件 {} 失败，将跳过。", file, e);
        }
    }

    @Override
    public Optional<SessionRecord> findById(String id) {
        return Optional.ofNullable(records.get(id)).map(SessionRecord::copy);
    }

    @Override
    public List<SessionRecord> findByStatus(SessionStatus status) {
        return records.values().stream()
                .filter(r -> r.getStatus() == status)
                .map(SessionRecord::copy)
                .toList();
    }

    @Override
    public List<SessionRecord> findRecent(int limit) {
        Comparator<SessionRecord> byCreated = Comparator.comparing(
                r -> r.getCreatedAt() != null ? r.getCreatedAt() : Instant.EPOCH);
        return records.values().stream()
                .sorted(byCreated.reversed())
                .limit(limit)
                .map(SessionRecord::copy)
                .toList();
    }

    @Override
    public SessionRecord create(SessionRecord record) {
        SessionRecord stored = record.copy();
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(Instant.now());
        }
        SessionRecord previous = records.putIfAbsent(stored.getId(), stored);
        if (previous != null) {
            throw new IllegalStateException("会话记录已存在: " + stored.getId());
        }
        write(stored);
        return stored.copy();
    }

    @Override
    public Optional<SessionRecord> update(String id, Consumer<SessionRecord> mutator) {
        SessionRecord updated = records.computeIfPresent(id, (key, current) -> {
            SessionRecord next = current.copy();
            mutator.accept(next);
            if (next.equals(current)) {
                // 没有变化的更新不落盘
                return current;
            }
            write(next);
            return next;
        });
        return Optional.ofNullable(updated).map(SessionRecord::copy);
    }

    private void write(SessionRecord record) {
        Path target = directory.resolve(record.getId() + SUFFIX);
        Path temp = directory.resolve(record.getId() + SUFFIX + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), record);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            LOGGER.error("将会话记录 {} 写入 {} 失败", record.getId(), target, e);
            throw new UncheckedIOException(e);
        }
    }
}
