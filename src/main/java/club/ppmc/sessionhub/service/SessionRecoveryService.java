/**
 * SessionRecoveryService.java
 *
 * 恢复管理：服务重启后重新附加仍然存活的 tmux 会话。
 *
 * <p>启动时：tmux 不可用则所有 running 记录都标记为 failed；否则逐个尝试重新附加，
 * 会话已不存在的标记为 failed。之后再扫描一遍本服务的 tmux 会话，
 * 记录为 failed 但会话实际仍存活的也会被恢复（failed → running 只允许在这里发生）。
 *
 * <p>查看者附加到一个“记录为 running 但本机没有句柄”的会话时，也会按需调用 {@link #tryRecover}。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.detect.ConfirmationPromptDetector;
import club.ppmc.sessionhub.exception.RecoveryFailureException;
import club.ppmc.sessionhub.exception.SpawnConflictException;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.store.SessionRecordStore;
import club.ppmc.sessionhub.terminal.TerminalMultiplexer;
import club.ppmc.sessionhub.terminal.TerminalProcess;
import java.io.IOException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class SessionRecoveryService {

    /** 一次启动恢复的结果。 */
    public record RecoveryReport(int recovered, int failed) {}

    private final SessionRecordStore store;
    private final ProcessSupervisor supervisor;
    private final TerminalMultiplexer multiplexer;
    private final ConfirmationPromptDetector promptDetector;
    private final SessionHubProperties properties;

    public SessionRecoveryService(
            SessionRecordStore store,
            ProcessSupervisor supervisor,
            TerminalMultiplexer multiplexer,
            ConfirmationPromptDetector promptDetector,
            SessionHubProperties properties) {
        this.store = store;
        this.supervisor = supervisor;
        this.multiplexer = multiplexer;
        this.promptDetector = promptDetector;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (!properties.getSupervisor().isRecoverOnStartup()) {
            log.info("已禁用启动时恢复。");
            return;
        }
        try {
            RecoveryReport report = recoverAll();
            log.info("启动恢复完成: 恢复 {} 个会话，{} 个标记为失败", report.recovered(), report.failed());
        } catch (RuntimeException e) {
            log.error("启动恢复出错", e);
        }
    }

    public RecoveryReport recoverAll() {
        int recovered = 0;
        int failed = 0;

        if (!multiplexer.isAvailable()) {
            for (SessionRecord record : store.findByStatus(SessionStatus.RUNNING)) {
                if (isLocal(record) && !supervisor.isActive(record.getId())) {
                    try {
                        markStale(record.getId(), "tmux 不可用，进程已随服务重启结束");
                    } catch (RuntimeException e) {
                        log.error("标记会话 {} 为失败时出错，继续处理其余会话", record.getId(), e);
                    }
                    failed++;
                }
            }
            return new RecoveryReport(recovered, failed);
        }

        for (SessionRecord record : store.findByStatus(SessionStatus.RUNNING)) {
            if (!isLocal(record) || supervisor.isActive(record.getId())) {
                continue;
            }
            boolean ok;
            try {
                ok = tryRecover(record);
            } catch (RuntimeException e) {
                // 单个会话的意外错误不影响其余会话的恢复
                log.error("恢复会话 {} 时发生意外错误，继续处理其余会话", record.getId(), e);
                ok = false;
            }
            if (ok) {
                recovered++;
            } else {
                failed++;
            }
        }

        // 记录为 failed 但 tmux 会话其实还活着的，同样恢复
        for (String sessionId : multiplexer.listSessionIds()) {
            var record = store.findById(sessionId);
            if (record.isPresent()
                    && record.get().getStatus() == SessionStatus.FAILED
                    && isLocal(record.get())
                    && !supervisor.isActive(sessionId)) {
                try {
                    recover(record.get());
                    recovered++;
                    log.info("会话 {} 被记录为失败，但 tmux 会话仍然存活，已恢复为运行中", sessionId);
                } catch (RecoveryFailureException e) {
                    log.warn("无法恢复 tmux 会话 {}: {}", sessionId, e.getMessage());
                } catch (RuntimeException e) {
                    log.error("恢复 tmux 会话 {} 时发生意外错误，继续处理其余会话", sessionId, e);
                }
            }
        }
        return new RecoveryReport(recovered, failed);
    }

    /**
     * 尝试恢复一个会话。失败时把 running 记录标记为 failed。
     *
     * @return 恢复成功（或已经有活跃句柄）时返回 true。
     */
    public boolean tryRecover(SessionRecord record) {
        if (!isLocal(record)) {
            return false;
        }
        try {
            recover(record);
            return true;
        } catch (RecoveryFailureException e) {
            log.warn("恢复会话 {} 失败: {}", record.getId(), e.getMessage());
            markStale(record.getId(), e.getMessage());
            return false;
        }
    }

    SessionRecord recover(SessionRecord record) {
        String sessionId = record.getId();
        if (!multiplexer.isAvailable()) {
            throw new RecoveryFailureException(sessionId, "tmux 不可用");
        }
        String name = StringUtils.hasText(record.getMultiplexName())
                ? record.getMultiplexName()
                : multiplexer.sessionName(sessionId);
        if (!multiplexer.exists(name)) {
            throw new RecoveryFailureException(sessionId, "tmux 会话 " + name + " 已不存在");
        }

        String pane = multiplexer.capturePane(name).orElse("");
        String initialOutput = pane.isBlank() ? record.getOutputLog() : pane;
        boolean waiting = promptDetector.looksLikeWaitingForConfirmation(pane);

        TerminalProcess client;
        try {
            client = multiplexer.attach(
                    name,
                    properties.getSupervisor().getDefaultCols(),
                    properties.getSupervisor().getDefaultRows());
        } catch (IOException e) {
            throw new RecoveryFailureException(sessionId, "无法附加到 tmux 会话 " + name, e);
        }

        SessionRecord target = record.copy();
        target.setMultiplexName(name);
        try {
            SessionRecord restored = supervisor.adoptRecovered(target, client, initialOutput, waiting);
            log.info("已重新附加会话 {} (tmux: {}, 等待输入: {})", sessionId, name, waiting);
            return restored;
        } catch (SpawnConflictException e) {
            // 另一个并发的恢复已经接管
            log.debug("会话 {} 已被其它请求恢复", sessionId);
            return store.findById(sessionId).orElse(record);
        } catch (RuntimeException e) {
            client.destroy();
            throw e;
        }
    }

    private void markStale(String sessionId, String reason) {
        Instant now = Instant.now();
        store.update(sessionId, r -> {
            if (r.getStatus() == SessionStatus.RUNNING) {
                r.setStatus(SessionStatus.FAILED);
                r.setCompletedAt(now);
                log.info("会话 {} 已标记为失败: {}", sessionId, reason);
            }
        });
    }

    private static boolean isLocal(SessionRecord record) {
        return !StringUtils.hasText(record.getWorkerId());
    }
}
