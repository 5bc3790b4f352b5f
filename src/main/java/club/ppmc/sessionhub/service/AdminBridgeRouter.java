/**
 * AdminBridgeRouter.java
 *
 * 管理端的桥接路由：把一个查看者连接接到本地进程监督器，或者接到运行该会话的远程 worker。
 *
 * <p>本地桥接：为每个查看者打开一条到监督器查看者端点的上游连接，双向原样转发。
 * 远程桥接：查看者登记在会话的 worker 路由集合中，输出由 worker 共享连接送来后分发，
 * 输入被包装成 input_to_session 发给 worker。
 *
 * <p>同时负责终止会话（worker 优先，其次监督器，最后直接写 killed 作为兜底）
 * 以及定期清理孤儿会话。清理只在权威信号可达时才会把记录判为失败。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.exception.ProcessUnavailableException;
import club.ppmc.sessionhub.model.BridgeEntry;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.model.WorkerInfo;
import club.ppmc.sessionhub.model.protocol.ExitMessage;
import club.ppmc.sessionhub.model.protocol.HistoryMessage;
import club.ppmc.sessionhub.model.protocol.WorkerCommands;
import club.ppmc.sessionhub.store.SessionRecordStore;
import club.ppmc.sessionhub.terminal.TerminalMultiplexer;
import club.ppmc.sessionhub.websocket.CloseCodes;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Service
@Slf4j
public class AdminBridgeRouter {

    private final SessionRecordStore store;
    private final WorkerRegistry workers;
    private final SupervisorClient supervisorClient;
    private final WebSocketClient webSocketClient;
    private final TerminalMultiplexer multiplexer;
    private final ViewerMessenger messenger;
    private final Gson gson;
    private final SessionHubProperties.Supervisor supervisorConfig;

    /** 查看者连接 ID → 桥接。 */
    private final Map<String, BridgeEntry> bridges = new ConcurrentHashMap<>();

    /** 会话 ID → 经由 worker 路由的查看者。 */
    private final Map<String, Set<WebSocketSession>> routedViewers = new ConcurrentHashMap<>();

    public AdminBridgeRouter(
            SessionRecordStore store,
            WorkerRegistry workers,
            SupervisorClient supervisorClient,
            WebSocketClient webSocketClient,
            TerminalMultiplexer multiplexer,
            ViewerMessenger messenger,
            Gson gson,
            SessionHubProperties properties) {
        this.store = store;
        this.workers = workers;
        this.supervisorClient = supervisorClient;
        this.webSocketClient = webSocketClient;
        this.multiplexer = multiplexer;
        this.messenger = messenger;
        this.gson = gson;
        this.supervisorConfig = properties.getSupervisor();
    }

    // ---------------------------------------------------------------------------------------
    // 附加与分离
    // ---------------------------------------------------------------------------------------

    public void attach(String sessionId, WebSocketSession viewer) {
        Optional<SessionRecord> found = store.findById(sessionId);
        if (found.isEmpty()) {
            messenger.close(viewer, CloseCodes.SESSION_NOT_FOUND);
            return;
        }
        SessionRecord record = found.get();
        if (StringUtils.hasText(record.getWorkerId())
                && workers.getLiveWorker(record.getWorkerId()).isPresent()) {
            attachToWorker(record, viewer);
            return;
        }
        attachToSupervisor(sessionId, viewer);
    }

    private void attachToWorker(SessionRecord record, WebSocketSession viewer) {
        String sessionId = record.getId();
        routedViewers.computeIfAbsent(sessionId, k -> ConcurrentHashMap.newKeySet()).add(viewer);
        bridges.put(viewer.getId(), BridgeEntry.remote(record.getWorkerId(), sessionId));
        log.info("查看者 {} 经由 worker {} 附加到会话 {}", viewer.getId(), record.getWorkerId(), sessionId);
        sendStoredHistory(viewer, record);
    }

    private void attachToSupervisor(String sessionId, WebSocketSession viewer) {
        var upstreamHandler = new UpstreamHandler(sessionId, viewer);
        webSocketClient.execute(upstreamHandler, null, supervisorClient.viewerSocketUri(sessionId))
                .whenComplete((upstream, ex) -> {
                    if (ex != null) {
                        onUpstreamUnreachable(sessionId, viewer, ex);
                    }
                });
    }

    private void onUpstreamUnreachable(String sessionId, WebSocketSession viewer, Throwable cause) {
        log.warn("无法连接进程监督器 (会话 {}): {}", sessionId, cause.getMessage());
        bridges.remove(viewer.getId());
        Optional<SessionRecord> found = store.findById(sessionId);
        if (found.isEmpty()) {
            messenger.close(viewer, CloseCodes.SESSION_NOT_FOUND);
            return;
        }
        SessionRecord record = found.get();
        if (record.getStatus().isActive()) {
            // 会话可能仍在运行，让查看者稍后重连
            messenger.close(viewer, CloseCodes.SUPERVISOR_UNREACHABLE);
            return;
        }
        sendStoredHistory(viewer, record);
    }

    private void sendStoredHistory(WebSocketSession viewer, SessionRecord record) {
        String history = record.getOutputLog() != null ? record.getOutputLog() : "";
        messenger.send(viewer, new HistoryMessage(history, record.getLastInputSeq(), null));
        if (record.getStatus().isTerminal()) {
            int exitCode = record.getExitCode() != null ? record.getExitCode() : ProcessSupervisor.KILLED_EXIT_CODE;
            messenger.send(viewer, new ExitMessage(exitCode, record.getStatus()));
        }
    }

    public void detach(String sessionId, WebSocketSession viewer) {
        BridgeEntry entry = bridges.remove(viewer.getId());
        if (entry != null && entry.kind() == BridgeEntry.Kind.LOCAL) {
            messenger.close(entry.upstream(), CloseStatus.NORMAL);
        }
        Set<WebSocketSession> routed = routedViewers.get(sessionId);
        if (routed != null) {
            routed.remove(viewer);
            routedViewers.computeIfPresent(sessionId, (k, set) -> set.isEmpty() ? null : set);
        }
    }

    /**
     * 转发查看者发来的一条消息。本地桥接原样转发；worker 路由时解析后包装成 input_to_session，
     * 无法解析的消息被丢弃。
     */
    public void forward(WebSocketSession viewer, String payload) {
        BridgeEntry entry = bridges.get(viewer.getId());
        if (entry == null) {
            log.debug("查看者 {} 没有可用的桥接，丢弃消息", viewer.getId());
            return;
        }
        if (entry.kind() == BridgeEntry.Kind.LOCAL) {
            messenger.sendRaw(entry.upstream(), payload);
            return;
        }

        JsonElement input;
        try {
            input = JsonParser.parseString(payload);
        } catch (JsonParseException e) {
            log.debug("丢弃会话 {} 的无法解析的查看者消息: {}", entry.sessionId(), e.getMessage());
            return;
        }
        Optional<WorkerInfo> worker = workers.getLiveWorker(entry.workerId());
        if (worker.isEmpty()) {
            log.warn("会话 {} 的 worker {} 已离线，丢弃输入", entry.sessionId(), entry.workerId());
            return;
        }
        try {
            worker.get().send(gson.toJson(new WorkerCommands.InputToSession(entry.sessionId(), input)));
        } catch (IOException | RuntimeException e) {
            log.warn("向 worker {} 转发会话 {} 的输入失败: {}", entry.workerId(), entry.sessionId(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------------------------------
    // worker 路由的输出
    // ---------------------------------------------------------------------------------------

    /** 把 worker 送来的一条消息原样分发给该会话的所有 worker 路由查看者。 */
    public void deliverToRoutedViewers(String sessionId, String payload) {
        Set<WebSocketSession> viewers = routedViewers.get(sessionId);
        if (viewers == null) {
            return;
        }
        for (WebSocketSession viewer : List.copyOf(viewers)) {
            if (!messenger.sendRaw(viewer, payload)) {
                viewers.remove(viewer);
                bridges.remove(viewer.getId());
            }
        }
    }

    public void notifyRoutedExit(String sessionId, int exitCode, SessionStatus status) {
        deliverToRoutedViewers(sessionId, messenger.toJson(new ExitMessage(exitCode, status)));
    }

    int routedViewerCount(String sessionId) {
        Set<WebSocketSession> viewers = routedViewers.get(sessionId);
        return viewers == null ? 0 : viewers.size();
    }

    Optional<BridgeEntry> bridgeOf(WebSocketSession viewer) {
        return Optional.ofNullable(bridges.get(viewer.getId()));
    }

    // ---------------------------------------------------------------------------------------
    // 终止与清理
    // ---------------------------------------------------------------------------------------

    /**
     * 终止一个会话：会话在在线 worker 上时发送 kill_session；否则请求监督器终止。
     * 无论哪条路径，只要记录还没有结束就直接写为 killed，防止进程已经不在而记录一直停在 running。
     *
     * @return 任一路径成功，或记录被兜底标记为 killed 时返回 true。
     */
    public boolean kill(String sessionId) {
        Optional<SessionRecord> found = store.findById(sessionId);
        boolean killed = false;

        Optional<WorkerInfo> worker = found.map(SessionRecord::getWorkerId).flatMap(workers::getLiveWorker);
        if (worker.isPresent()) {
            try {
                worker.get().send(gson.toJson(new WorkerCommands.KillSession(sessionId)));
                killed = true;
                log.info("已请求 worker {} 终止会话 {}", worker.get().getId(), sessionId);
            } catch (IOException | RuntimeException e) {
                log.warn("向 worker {} 发送终止指令失败: {}", worker.get().getId(), e.getMessage());
            }
        }
        if (!killed) {
            try {
                killed = supervisorClient.kill(sessionId);
            } catch (ProcessUnavailableException e) {
                log.warn("通过监督器终止会话 {} 失败: {}", sessionId, e.getMessage());
            }
        }

        if (found.isEmpty() || found.get().getStatus().isTerminal()) {
            return killed;
        }
        Instant now = Instant.now();
        boolean[] markedKilled = {false};
        store.update(sessionId, r -> {
            if (!r.getStatus().isTerminal()) {
                r.setStatus(SessionStatus.KILLED);
                r.setCompletedAt(now);
                markedKilled[0] = true;
            }
        });
        if (markedKilled[0]) {
            log.info("会话 {} 已直接标记为 killed", sessionId);
        }
        return killed || markedKilled[0];
    }

    /**
     * 把所有信号都显示已不存在的 running 记录标记为 failed。
     * 本地会话以监督器为权威信号，worker 会话以其所属 worker 为权威信号；权威信号不可达时跳过，
     * 存活状态未知绝不等于死亡。
     */
    @Scheduled(
            initialDelayString = "${app.router.cleanup-interval:PT60S}",
            fixedDelayString = "${app.router.cleanup-interval:PT60S}")
    public void cleanupOrphanedSessions() {
        try {
            List<SessionRecord> running = store.findByStatus(SessionStatus.RUNNING);
            if (running.isEmpty()) {
                return;
            }
            Optional<Set<String>> supervisorActive = supervisorClient.activeSessionIds();
            Set<String> tmuxLive = multiplexer.isAvailable() ? Set.copyOf(multiplexer.listSessionIds()) : Set.of();

            int marked = 0;
            for (SessionRecord record : running) {
                String sessionId = record.getId();
                if (StringUtils.hasText(record.getWorkerId())) {
                    Optional<WorkerInfo> owner = workers.getLiveWorker(record.getWorkerId());
                    if (owner.isEmpty() || owner.get().getActiveSessions().contains(sessionId)) {
                        continue;
                    }
                } else if (supervisorActive.isEmpty()) {
                    continue;
                }
                boolean alive = supervisorActive.map(ids -> ids.contains(sessionId)).orElse(false)
                        || workers.isReportedByLiveWorker(sessionId)
                        || tmuxLive.contains(sessionId);
                if (!alive && markOrphanFailed(sessionId)) {
                    marked++;
                }
            }
            if (marked > 0) {
                log.info("孤儿会话清理: {} 个会话被标记为失败", marked);
            }
        } catch (RuntimeException e) {
            log.error("孤儿会话清理出错", e);
        }
    }

    private boolean markOrphanFailed(String sessionId) {
        Instant now = Instant.now();
        boolean[] marked = {false};
        store.update(sessionId, r -> {
            if (r.getStatus() == SessionStatus.RUNNING) {
                r.setStatus(SessionStatus.FAILED);
                r.setCompletedAt(now);
                marked[0] = true;
            }
        });
        if (marked[0]) {
            log.warn("会话 {} 已没有任何存活的进程，标记为失败", sessionId);
        }
        return marked[0];
    }

    // ---------------------------------------------------------------------------------------
    // 上游连接
    // ---------------------------------------------------------------------------------------

    /**
     * 到监督器查看者端点的上游连接，每个本地桥接一个。
     */
    private class UpstreamHandler extends TextWebSocketHandler {

        private final String sessionId;
        private final WebSocketSession viewer;

        UpstreamHandler(String sessionId, WebSocketSession viewer) {
            this.sessionId = sessionId;
            this.viewer = viewer;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            WebSocketSession upstream = new ConcurrentWebSocketSessionDecorator(
                    session, supervisorConfig.getViewerSendTimeLimitMs(), supervisorConfig.getViewerBufferSizeLimit());
            if (!viewer.isOpen()) {
                // 查看者在上游建立之前已经离开
                messenger.close(upstream, CloseStatus.NORMAL);
                return;
            }
            bridges.put(viewer.getId(), BridgeEntry.local(sessionId, upstream));
            log.debug("查看者 {} 已桥接到监督器 (会话 {})", viewer.getId(), sessionId);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            if (!messenger.sendRaw(viewer, message.getPayload())) {
                messenger.close(session, CloseStatus.NORMAL);
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            bridges.computeIfPresent(viewer.getId(), (k, entry) -> entry.kind() == BridgeEntry.Kind.LOCAL ? null : entry);
            if (!viewer.isOpen()) {
                return;
            }
            // 缺参数或会话不存在时原样转告查看者，其余情况让查看者重连
            int code = status.getCode();
            if (code == CloseCodes.MISSING_SESSION_ID.getCode() || code == CloseCodes.SESSION_NOT_FOUND.getCode()) {
                messenger.close(viewer, status);
            } else {
                messenger.close(viewer, CloseCodes.UPSTREAM_CLOSED);
            }
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.warn("会话 {} 的上游连接出错: {}", sessionId, exception.getMessage());
        }
    }
}
