/**
 * AgentSessionService.java
 *
 * 管理端的派发层：创建会话记录，再把会话交给指定的 worker 或本地进程监督器去启动。
 * 同时提供续跑（resume）、终止与查询。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.detect.TerminalText;
import club.ppmc.sessionhub.exception.ProcessUnavailableException;
import club.ppmc.sessionhub.exception.SessionNotFoundException;
import club.ppmc.sessionhub.exception.SpawnConflictException;
import club.ppmc.sessionhub.exception.SpawnFailureException;
import club.ppmc.sessionhub.model.DispatchRequest;
import club.ppmc.sessionhub.model.PermissionProfile;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.model.SpawnRequest;
import club.ppmc.sessionhub.model.WorkerInfo;
import club.ppmc.sessionhub.model.protocol.WorkerCommands;
import club.ppmc.sessionhub.store.SessionRecordStore;
import com.google.gson.Gson;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class AgentSessionService {

    /** 续跑提示词中携带的父会话输出尾部长度（字符）。 */
    static final int RESUME_OUTPUT_TAIL = 4000;

    private static final String RESUME_PREAMBLE =
            "You are resuming a task that a previous agent session worked on but did not fully complete. "
                    + "The user wants you to continue making progress.";

    private static final String RESUME_INSTRUCTIONS =
            "IMPORTANT: The previous session may have made partial progress. Check the current state "
                    + "(git status, git diff, etc.) then continue working on anything that is still incomplete or broken. "
                    + "Do NOT just summarize what was done. Actually do more work. If everything appears complete, "
                    + "verify by running tests or checking the build, and fix any issues you find.";

    private final SessionRecordStore store;
    private final WorkerRegistry workers;
    private final SupervisorClient supervisorClient;
    private final AdminBridgeRouter router;
    private final Gson gson;
    private final SessionHubProperties.Supervisor supervisorConfig;

    public AgentSessionService(
            SessionRecordStore store,
            WorkerRegistry workers,
            SupervisorClient supervisorClient,
            AdminBridgeRouter router,
            Gson gson,
            SessionHubProperties properties) {
        this.store = store;
        this.workers = workers;
        this.supervisorClient = supervisorClient;
        this.router = router;
        this.gson = gson;
        this.supervisorConfig = properties.getSupervisor();
    }

    /**
     * 创建并启动一个新会话。请求指定了在线 worker 时发给该 worker，否则通过本地监督器启动。
     *
     * @return 新建会话的记录。
     * @throws ProcessUnavailableException 监督器不可达，记录已被标记为 failed。
     * @throws SpawnFailureException 监督器启动失败，记录已被标记为 failed。
     */
    public SessionRecord dispatch(DispatchRequest request) {
        String sessionId = UUID.randomUUID().toString();
        Optional<WorkerInfo> worker = StringUtils.hasText(request.workerId())
                ? workers.getLiveWorker(request.workerId())
                : Optional.empty();
        if (StringUtils.hasText(request.workerId()) && worker.isEmpty()) {
            log.warn("指定的 worker {} 不在线，会话 {} 改为本地启动", request.workerId(), sessionId);
        }

        store.create(SessionRecord.builder()
                .id(sessionId)
                .status(SessionStatus.PENDING)
                .permissionProfile(request.permissionProfile())
                .workerId(worker.map(WorkerInfo::getId).orElse(null))
                .cwd(request.cwd())
                .prompt(request.prompt())
                .allowedTools(request.allowedTools())
                .agentSessionId(request.agentSessionId())
                .build());

        if (worker.isPresent() && sendToWorker(worker.get(), sessionId, request)) {
            return get(sessionId);
        }
        if (worker.isPresent()) {
            store.update(sessionId, r -> r.setWorkerId(null));
        }
        spawnLocal(new SpawnRequest(
                sessionId,
                request.prompt(),
                request.cwd(),
                request.permissionProfile(),
                request.allowedTools(),
                request.agentSessionId(),
                null,
                supervisorConfig.getDefaultCols(),
                supervisorConfig.getDefaultRows()));
        return get(sessionId);
    }

    private boolean sendToWorker(WorkerInfo worker, String sessionId, DispatchRequest request) {
        var launch = new WorkerCommands.LaunchSession(
                sessionId,
                request.prompt(),
                request.cwd(),
                request.permissionProfile(),
                request.allowedTools(),
                request.agentSessionId(),
                supervisorConfig.getDefaultCols(),
                supervisorConfig.getDefaultRows());
        try {
            worker.send(gson.toJson(launch));
            workers.addSession(worker.getId(), sessionId);
            log.info("会话 {} 已发往 worker {}", sessionId, worker.getId());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("向 worker {} 发送会话 {} 失败，改为本地启动", worker.getId(), sessionId, e);
            return false;
        }
    }

    private void spawnLocal(SpawnRequest request) {
        try {
            supervisorClient.spawn(request);
            log.info("会话 {} 已通过监督器启动 ({})", request.sessionId(), request.permissionProfile().name().toLowerCase());
        } catch (SpawnConflictException e) {
            // 记录已经存在并在运行，不能改写它
            throw e;
        } catch (ProcessUnavailableException | SpawnFailureException e) {
            log.error("启动会话 {} 失败: {}", request.sessionId(), e.getMessage());
            markFailed(request.sessionId());
            throw e;
        }
    }

    private void markFailed(String sessionId) {
        Instant now = Instant.now();
        store.update(sessionId, r -> {
            if (r.getStatus().canTransitionTo(SessionStatus.FAILED, false)) {
                r.setStatus(SessionStatus.FAILED);
                r.setCompletedAt(now);
            }
        });
    }

    /**
     * 基于一个已结束的会话创建续跑会话。续跑会话总是 interactive，提示词包含父会话输出的尾部与原始任务。
     *
     * @throws SessionNotFoundException 父会话不存在。
     * @throws IllegalStateException 父会话仍在活跃中。
     */
    public SessionRecord resume(String parentSessionId) {
        SessionRecord parent = get(parentSessionId);
        if (!parent.getStatus().isTerminal()) {
            throw new IllegalStateException("会话 " + parentSessionId + " 仍在活跃中，不能续跑");
        }

        String sessionId = UUID.randomUUID().toString();
        String prompt = buildResumePrompt(parent);
        store.create(SessionRecord.builder()
                .id(sessionId)
                .status(SessionStatus.PENDING)
                .permissionProfile(PermissionProfile.INTERACTIVE)
                .parentSessionId(parentSessionId)
                .cwd(parent.getCwd())
                // 保留原始任务，再次续跑时不会层层嵌套
                .prompt(parent.getPrompt())
                .allowedTools(parent.getAllowedTools())
                .build());
        log.info("会话 {} 续跑为新会话 {}", parentSessionId, sessionId);

        spawnLocal(new SpawnRequest(
                sessionId,
                prompt,
                parent.getCwd() != null ? parent.getCwd() : System.getProperty("user.dir"),
                PermissionProfile.INTERACTIVE,
                parent.getAllowedTools(),
                null,
                null,
                supervisorConfig.getDefaultCols(),
                supervisorConfig.getDefaultRows()));
        return get(sessionId);
    }

    static String buildResumePrompt(SessionRecord parent) {
        String output = TerminalText.stripControlSequences(parent.getOutputLog() != null ? parent.getOutputLog() : "");
        String tail = output.length() > RESUME_OUTPUT_TAIL
                ? "...(truncated)\n" + output.substring(output.length() - RESUME_OUTPUT_TAIL)
                : output;
        String original = parent.getPrompt() != null ? parent.getPrompt() : "";
        return RESUME_PREAMBLE
                + "\n\nPrevious session output:\n---\n" + tail + "\n---\n\n"
                + "Original task:\n" + original + "\n\n"
                + RESUME_INSTRUCTIONS;
    }

    public boolean kill(String sessionId) {
        if (store.findById(sessionId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        return router.kill(sessionId);
    }

    public SessionRecord get(String sessionId) {
        return store.findById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public List<SessionRecord> list(int limit) {
        return store.findRecent(limit);
    }
}
