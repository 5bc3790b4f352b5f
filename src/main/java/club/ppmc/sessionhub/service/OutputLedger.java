/**
 * OutputLedger.java
 *
 * 每个会话一份按序号索引、可重放的输出消息日志。
 * 每条发往查看者的消息在发送前都会追加到这里；查看者断线重连后用 replay_request 取回错过的部分，
 * 用 output_ack 告知已经收到的最高序号，低于等于该序号的条目随即释放。
 *
 * <p>保留策略：每个会话最多 maxEntries 条（超出时丢弃最旧的），且超过 TTL 的条目会被定期清除。
 * 因此重放只保证返回仍被保留的那部分后缀：无缺口、无重复、按序号递增。
 *
 * <p>配置了目录时账本同时落盘：每个会话一个 JSON Lines 文件（{id}.jsonl），条目和确认标记只追加，
 * 定期清理时按内存中的内容重写压缩。进程重启后从文件恢复，重放仍能取回重启前发出的消息。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.config.SessionHubProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class OutputLedger {

    private static final String SUFFIX = ".jsonl";
    // 文件中的确认标记，seq 为确认到的序号
    private static final String ACK_MARKER = "ack";

    /**
     * 一条已发送的协议消息。
     *
     * @param kind 消息内容的类别（output / waiting_state / exit）。
     * @param seq 会话内严格递增的序号。
     * @param payload 已序列化好的完整消息，重放时原样发送。
     */
    public record LedgerEntry(String kind, long seq, String payload, Instant createdAt) {}

    private static final class SessionLog {
        final Deque<LedgerEntry> entries = new ArrayDeque<>();
        long lastSeq;
    }

    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;
    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<String, SessionLog> logs = new ConcurrentHashMap<>();

    @Autowired
    public OutputLedger(SessionHubProperties properties) {
        this(properties.getLedger().getMaxEntries(), properties.getLedger().getTtl(), Clock.systemUTC(),
                Paths.get(properties.getLedger().getDirectory()));
    }

    /** 仅在内存中保留的账本。 */
    public OutputLedger(int maxEntries, Duration ttl, Clock clock) {
        this(maxEntries, ttl, clock, null);
    }

    public OutputLedger(int maxEntries, Duration ttl, Clock clock, Path directory) {
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.clock = clock;
        this.directory = directory != null ? directory.toAbsolutePath().normalize() : null;
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** 从目录恢复所有会话的账本，随后按 TTL 清理一次。 */
    @PostConstruct
    public void init() {
        if (directory == null) {
            return;
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建账本目录 " + directory, e);
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).forEach(this::load);
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取账本目录 " + directory, e);
        }
        prune();
        log.info("已从 {} 恢复 {} 个会话的输出账本。", directory, logs.size());
    }

    private void load(Path file) {
        String name = file.getFileName().toString();
        String sessionId = name.substring(0, name.length() - SUFFIX.length());
        var sessionLog = new SessionLog();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("读取账本文件 {} 失败，将跳过。", file, e);
            return;
        }
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                LedgerEntry entry = objectMapper.readValue(line, LedgerEntry.class);
                if (ACK_MARKER.equals(entry.kind())) {
                    release(sessionLog, entry.seq());
                } else {
                    addEntry(sessionLog, entry);
                }
            } catch (IOException e) {
                // 崩溃时可能留下写了一半的最后一行
                log.warn("账本文件 {} 中有无法解析的行，已跳过: {}", file, e.getMessage());
            }
        }
        logs.put(sessionId, sessionLog);
    }

    public void append(String sessionId, String kind, long seq, String payload) {
        SessionLog sessionLog = logs.computeIfAbsent(sessionId, k -> new SessionLog());
        synchronized (sessionLog) {
            if (seq <= sessionLog.lastSeq) {
                // 序号必须严格递增，否则重放会出现重复
                log.warn("会话 {} 的账本拒绝了非递增的序号 {} (当前最大 {})", sessionId, seq, sessionLog.lastSeq);
                return;
            }
            var entry = new LedgerEntry(kind, seq, payload, clock.instant());
            addEntry(sessionLog, entry);
            persist(sessionId, entry);
        }
    }

    private void addEntry(SessionLog sessionLog, LedgerEntry entry) {
        if (entry.seq() <= sessionLog.lastSeq) {
            return;
        }
        sessionLog.entries.addLast(entry);
        sessionLog.lastSeq = entry.seq();
        while (sessionLog.entries.size() > maxEntries) {
            sessionLog.entries.pollFirst();
        }
    }

    /** 返回序号大于 {@code fromSeq} 的所有保留条目，按序号升序。 */
    public List<LedgerEntry> replay(String sessionId, long fromSeq) {
        SessionLog sessionLog = logs.get(sessionId);
        if (sessionLog == null) {
            return List.of();
        }
        synchronized (sessionLog) {
            return sessionLog.entries.stream().filter(e -> e.seq() > fromSeq).toList();
        }
    }

    /** 释放序号小于等于 {@code ackSeq} 的条目。 */
    public void acknowledge(String sessionId, long ackSeq) {
        SessionLog sessionLog = logs.get(sessionId);
        if (sessionLog == null) {
            return;
        }
        synchronized (sessionLog) {
            if (release(sessionLog, ackSeq) > 0) {
                persist(sessionId, new LedgerEntry(ACK_MARKER, ackSeq, null, clock.instant()));
            }
        }
    }

    private int release(SessionLog sessionLog, long ackSeq) {
        int released = 0;
        while (!sessionLog.entries.isEmpty() && sessionLog.entries.peekFirst().seq() <= ackSeq) {
            sessionLog.entries.pollFirst();
            released++;
        }
        return released;
    }

    /** 会话写入过的最大序号（含已释放的条目），没有记录时为 0。 */
    public long lastSeq(String sessionId) {
        SessionLog sessionLog = logs.get(sessionId);
        if (sessionLog == null) {
            return 0;
        }
        synchronized (sessionLog) {
            return sessionLog.lastSeq;
        }
    }

    public int size(String sessionId) {
        SessionLog sessionLog = logs.get(sessionId);
        if (sessionLog == null) {
            return 0;
        }
        synchronized (sessionLog) {
            return sessionLog.entries.size();
        }
    }

    /**
     * 清除过期条目并压缩账本文件；已经清空的会话连同文件一起移除。
     */
    @Scheduled(fixedDelayString = "${app.ledger.prune-interval:PT1M}")
    public void prune() {
        Instant cutoff = clock.instant().minus(ttl);
        var removed = new AtomicInteger();
        for (String sessionId : logs.keySet()) {
            logs.computeIfPresent(sessionId, (key, sessionLog) -> {
                synchronized (sessionLog) {
                    while (!sessionLog.entries.isEmpty()
                            && sessionLog.entries.peekFirst().createdAt().isBefore(cutoff)) {
                        sessionLog.entries.pollFirst();
                        removed.incrementAndGet();
                    }
                    if (sessionLog.entries.isEmpty()) {
                        deleteFile(key);
                        return null;
                    }
                    compact(key, sessionLog);
                    return sessionLog;
                }
            });
        }
        if (removed.get() > 0) {
            log.debug("账本清理: 移除了 {} 条过期消息，剩余 {} 个会话", removed.get(), logs.size());
        }
    }

    // ---------------------------------------------------------------------------------------
    // 落盘。写入失败只记录日志，内存中的账本照常工作。
    // ---------------------------------------------------------------------------------------

    private Path fileOf(String sessionId) {
        return directory.resolve(sessionId + SUFFIX);
    }

    private void persist(String sessionId, LedgerEntry entry) {
        if (directory == null) {
            return;
        }
        try {
            String line = objectMapper.writeValueAsString(entry) + "\n";
            Files.writeString(fileOf(sessionId), line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("会话 {} 的账本条目 {} 落盘失败: {}", sessionId, entry.seq(), e.getMessage());
        }
    }

    private void compact(String sessionId, SessionLog sessionLog) {
        if (directory == null) {
            return;
        }
        Path target = fileOf(sessionId);
        Path temp = directory.resolve(sessionId + SUFFIX + ".tmp");
        try {
            List<String> lines = new ArrayList<>(sessionLog.entries.size());
            for (LedgerEntry entry : sessionLog.entries) {
                lines.add(objectMapper.writeValueAsString(entry));
            }
            Files.write(temp, lines, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("压缩会话 {} 的账本文件失败: {}", sessionId, e.getMessage());
        }
    }

    private void deleteFile(String sessionId) {
        if (directory == null) {
            return;
        }
        try {
            Files.deleteIfExists(fileOf(sessionId));
        } catch (IOException e) {
            log.warn("删除会话 {} 的账本文件失败: {}", sessionId, e.getMessage());
        }
    }
}
