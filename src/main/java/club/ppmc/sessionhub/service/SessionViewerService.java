/**
 * SessionViewerService.java
 *
 * 进程监督器一侧的查看者连接逻辑：附加时决定发送什么，之后处理查看者发来的消息。
 *
 * <p>附加规则：
 * <ul>
 *   <li>本机有活跃进程：发送 history（尾部、已确认输入序号、等待状态），随后接收实时输出；</li>
 *   <li>记录为 pending：发送空 history，进程启动后自动转为实时输出；</li>
 *   <li>记录为 running 但本机没有进程：尝试按需恢复；恢复失败时记录被标记为 failed，发送 history + exit；</li>
 *   <li>记录已结束：发送 history + exit。</li>
 * </ul>
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.model.protocol.ExitMessage;
import club.ppmc.sessionhub.model.protocol.HistoryMessage;
import club.ppmc.sessionhub.model.protocol.InputAck;
import club.ppmc.sessionhub.model.protocol.MessageTypes;
import club.ppmc.sessionhub.model.protocol.ViewerMessage;
import club.ppmc.sessionhub.store.SessionRecordStore;
import club.ppmc.sessionhub.websocket.CloseCodes;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

@Service
@Slf4j
public class SessionViewerService {

    private final SessionRecordStore store;
    private final ProcessSupervisor supervisor;
    private final SessionRecoveryService recoveryService;
    private final OutputLedger ledger;
    private final ViewerMessenger messenger;
    private final Gson gson;

    public SessionViewerService(
            SessionRecordStore store,
            ProcessSupervisor supervisor,
            SessionRecoveryService recoveryService,
            OutputLedger ledger,
            ViewerMessenger messenger,
            Gson gson) {
        this.store = store;
        this.supervisor = supervisor;
        this.recoveryService = recoveryService;
        this.ledger = ledger;
        this.messenger = messenger;
        this.gson = gson;
    }

    public void attach(String sessionId, WebSocketSession viewer) {
        Optional<SessionRecord> found = store.findById(sessionId);
        boolean pending = found.map(r -> r.getStatus() == SessionStatus.PENDING).orElse(false);
        if (supervisor.attachViewer(sessionId, viewer, pending) != ProcessSupervisor.AttachOutcome.NONE) {
            return;
        }
        if (found.isEmpty()) {
            log.info("查看者请求的会话 {} 不存在", sessionId);
            messenger.close(viewer, CloseCodes.SESSION_NOT_FOUND);
            return;
        }

        SessionRecord record = found.get();
        if (record.getStatus() == SessionStatus.RUNNING) {
            // 记录为 running 但本机没有句柄：服务重启过，或 tmux 客户端掉线
            if (recoveryService.tryRecover(record)
                    && supervisor.attachViewer(sessionId, viewer, false) == ProcessSupervisor.AttachOutcome.LIVE) {
                return;
            }
            record = store.findById(sessionId).orElse(record);
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
        supervisor.detachViewer(sessionId, viewer);
    }

    /**
     * 处理查看者发来的一条消息。无法解析的消息直接丢弃，不影响连接。
     */
    public void handleMessage(String sessionId, WebSocketSession viewer, String payload) {
        ViewerMessage message;
        try {
            message = gson.fromJson(payload, ViewerMessage.class);
        } catch (JsonParseException e) {
            log.debug("丢弃会话 {} 的无法解析的查看者消息: {}", sessionId, e.getMessage());
            return;
        }
        if (message == null || message.type() == null) {
            return;
        }

        switch (message.type()) {
            case MessageTypes.SEQUENCED_INPUT -> {
                if (message.seq() == null) {
                    return;
                }
                long ackSeq = supervisor.handleSequencedInput(sessionId, message.seq(), message.content());
                messenger.send(viewer, new InputAck(sessionId, ackSeq));
            }
            case MessageTypes.OUTPUT_ACK -> {
                if (message.ackSeq() != null) {
                    ledger.acknowledge(sessionId, message.ackSeq());
                }
            }
            case MessageTypes.REPLAY_REQUEST -> {
                long fromSeq = message.fromSeq() != null ? message.fromSeq() : 0L;
                for (OutputLedger.LedgerEntry entry : ledger.replay(sessionId, fromSeq)) {
                    if (!messenger.sendRaw(viewer, entry.payload())) {
                        break;
                    }
                }
            }
            case MessageTypes.LEGACY_INPUT -> supervisor.write(sessionId, message.data());
            case MessageTypes.LEGACY_RESIZE -> {
                if (message.cols() != null && message.rows() != null) {
                    supervisor.resize(sessionId, message.cols(), message.rows());
                }
            }
            case MessageTypes.LEGACY_KILL -> supervisor.kill(sessionId);
            default -> log.debug("会话 {} 收到未知类型的查看者消息: {}", sessionId, message.type());
        }
    }
}
