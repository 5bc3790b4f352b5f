/**
 * SessionViewerSocketHandler.java
 *
 * 查看者 WebSocket 端点的公共部分：从查询参数中读取 sessionId，缺失时以 4001 关闭；
 * 把连接包装成带发送时限与缓冲上限的并发装饰器，之后的收发都使用这个包装后的连接。
 */
package club.ppmc.sessionhub.websocket;

import club.ppmc.sessionhub.config.SessionHubProperties;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

@Slf4j
public abstract class SessionViewerSocketHandler extends TextWebSocketHandler {

    static final String SESSION_ID_PARAM = "sessionId";

    private final SessionHubProperties.Supervisor limits;

    /** 原始连接 ID → 包装后的查看者连接及其会话 ID。 */
    private final Map<String, AttachedViewer> viewers = new ConcurrentHashMap<>();

    private record AttachedViewer(String sessionId, WebSocketSession viewer) {}

    protected SessionViewerSocketHandler(SessionHubProperties properties) {
        this.limits = properties.getSupervisor();
    }

    protected abstract void onAttach(String sessionId, WebSocketSession viewer);

    protected abstract void onMessage(String sessionId, WebSocketSession viewer, String payload);

    protected abstract void onDetach(String sessionId, WebSocketSession viewer);

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Optional<String> sessionId = sessionIdOf(session.getUri());
        if (sessionId.isEmpty()) {
            session.close(CloseCodes.MISSING_SESSION_ID);
            return;
        }
        WebSocketSession viewer = new ConcurrentWebSocketSessionDecorator(
                session, limits.getViewerSendTimeLimitMs(), limits.getViewerBufferSizeLimit());
        viewers.put(session.getId(), new AttachedViewer(sessionId.get(), viewer));
        log.debug("查看者 {} 连接到会话 {}", session.getId(), sessionId.get());
        onAttach(sessionId.get(), viewer);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        AttachedViewer attached = viewers.get(session.getId());
        if (attached != null) {
            onMessage(attached.sessionId(), attached.viewer(), message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("查看者 {} 的连接出错: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        AttachedViewer attached = viewers.remove(session.getId());
        if (attached != null) {
            onDetach(attached.sessionId(), attached.viewer());
        }
    }

    static Optional<String> sessionIdOf(URI uri) {
        if (uri == null) {
            return Optional.empty();
        }
        String value = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(SESSION_ID_PARAM);
        return StringUtils.hasText(value) ? Optional.of(value) : Optional.empty();
    }
}
