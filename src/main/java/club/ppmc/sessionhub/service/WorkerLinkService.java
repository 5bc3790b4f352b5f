/**
 * WorkerLinkService.java
 *
 * 处理 worker 通过 /ws/worker 共享连接发来的消息：注册、心跳以及会话的启动、输出与结束事件。
 * 会话事件会写入记录存储，输出和退出通知转交给路由器分发给经由该 worker 附加的查看者。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.model.WorkerInfo;
import club.ppmc.sessionhub.model.protocol.MessageTypes;
import club.ppmc.sessionhub.model.protocol.WorkerCommands;
import club.ppmc.sessionhub.model.protocol.WorkerMessage;
import club.ppmc.sessionhub.store.SessionRecordStore;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketSession;

@Service
@Slf4j
public class WorkerLinkService {

    private final WorkerRegistry registry;
    private final SessionRecordStore store;
    private final AdminBridgeRouter router;
    private final ViewerMessenger messenger;
    private final Gson gson;

    /** 连接 ID → 在该连接上注册的 worker ID。 */
    private final Map<String, String> workerByConnection = new ConcurrentHashMap<>();

    public WorkerLinkService(
            WorkerRegistry registry,
            SessionRecordStore store,
            AdminBridgeRouter router,
            ViewerMessenger messenger,
            Gson gson) {
        this.registry = registry;
        this.store = store;
        this.router = router;
        this.messenger = messenger;
        this.gson = gson;
    }

    public void handleMessage(WebSocketSession connection, String payload) {
        WorkerMessage message;
        try {
            message = gson.fromJson(payload, WorkerMessage.class);
        } catch (JsonParseException e) {
            log.debug("丢弃来自连接 {} 的无法解析的 worker 消息: {}", connection.getId(), e.getMessage());
            return;
        }
        if (message == null || message.type() == null) {
            return;
        }

        switch (message.type()) {
            case MessageTypes.LAUNCHER_REGISTER -> register(connection, message);
            case MessageTypes.LAUNCHER_HEARTBEAT -> withWorker(connection, workerId ->
                    registry.updateHeartbeat(workerId, message.activeSessions() != null ? message.activeSessions() : List.of()));
            case MessageTypes.LAUNCHER_SESSION_STARTED -> withWorker(connection, workerId -> sessionStarted(workerId, message));
            case MessageTypes.LAUNCHER_SESSION_OUTPUT -> withWorker(connection, workerId -> {
                if (message.sessionId() != null && message.output() != null) {
                    router.deliverToRoutedViewers(message.sessionId(), gson.toJson(message.output()));
                }
            });
            case MessageTypes.LAUNCHER_SESSION_ENDED -> withWorker(connection, workerId -> sessionEnded(workerId, message));
            default -> log.debug("连接 {} 收到未知类型的 worker 消息: {}", connection.getId(), message.type());
        }
    }

    private void register(WebSocketSession connection, WorkerMessage message) {
        if (!StringUtils.hasText(message.id())) {
            messenger.send(connection, new WorkerCommands.Registered(false, "缺少 worker id"));
            return;
        }
        var worker = new WorkerInfo(
                message.id(),
                message.name() != null ? message.name() : message.id(),
                message.hostname(),
                connection,
                message.capabilities(),
                registry.now());
        if (message.activeSessions() != null) {
            worker.getActiveSessions().addAll(message.activeSessions());
        }
        registry.register(worker);
        workerByConnection.put(connection.getId(), worker.getId());
        messenger.send(connection, new WorkerCommands.Registered(true, null));
    }

    private void sessionStarted(String workerId, WorkerMessage message) {
        String sessionId = message.sessionId();
        if (sessionId == null) {
            return;
        }
        registry.addSession(workerId, sessionId);
        var now = registry.now();
        store.update(sessionId, r -> {
            if (r.getStatus().canTransitionTo(SessionStatus.RUNNING, false)) {
                r.setStatus(SessionStatus.RUNNING);
                r.setStartedAt(now);
            }
            r.setWorkerId(workerId);
            r.setProcessId(message.pid());
            r.setMultiplexName(message.tmuxSessionName());
        });
        log.info("worker {} 已启动会话 {} (pid {})", workerId, sessionId, message.pid());
    }

    private void sessionEnded(String workerId, WorkerMessage message) {
        String sessionId = message.sessionId();
        if (sessionId == null) {
            return;
        }
        registry.removeSession(workerId, sessionId);
        int exitCode = message.exitCode() != null ? message.exitCode() : ProcessSupervisor.KILLED_EXIT_CODE;
        SessionStatus status = message.status() != null && message.status().isTerminal()
                ? message.status()
                : exitCode == 0 ? SessionStatus.COMPLETED : SessionStatus.FAILED;
        var now = registry.now();
        store.update(sessionId, r -> {
            if (r.getStatus().canTransitionTo(status, false)) {
                r.setStatus(status);
                r.setExitCode(exitCode);
                r.setCompletedAt(now);
                if (message.outputLog() != null) {
                    r.setOutputLog(message.outputLog());
                }
            }
        });
        router.notifyRoutedExit(sessionId, exitCode, status);
        log.info("worker {} 上的会话 {} 已结束，退出码 {}，状态 {}", workerId, sessionId, exitCode, status.wireName());
    }

    /** 尚未注册的连接发来的会话事件被丢弃。 */
    private void withWorker(WebSocketSession connection, Consumer<String> action) {
        String workerId = workerByConnection.get(connection.getId());
        if (workerId == null) {
            log.debug("连接 {} 尚未注册，丢弃消息", connection.getId());
            return;
        }
        action.accept(workerId);
    }

    public void connectionClosed(WebSocketSession connection) {
        String workerId = workerByConnection.remove(connection.getId());
        if (workerId != null) {
            registry.unregisterConnection(workerId, connection);
        }
    }
}
