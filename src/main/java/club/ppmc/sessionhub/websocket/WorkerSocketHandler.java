/**
 * WorkerSocketHandler.java
 *
 * worker 的共享连接端点 /ws/worker。每个 worker 一条连接，承载它上面所有会话的指令与事件。
 */
package club.ppmc.sessionhub.websocket;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.service.WorkerLinkService;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class WorkerSocketHandler extends TextWebSocketHandler {

    private final WorkerLinkService linkService;
    private final SessionHubProperties.Supervisor limits;
    private final Map<String, WebSocketSession> links = new ConcurrentHashMap<>();

    public WorkerSocketHandler(WorkerLinkService linkService, SessionHubProperties properties) {
        this.linkService = linkService;
        this.limits = properties.getSupervisor();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        links.put(session.getId(), new ConcurrentWebSocketSessionDecorator(
                session, limits.getViewerSendTimeLimitMs(), limits.getViewerBufferSizeLimit()));
        log.info("worker 连接已建立: {} ({})", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSession link = links.get(session.getId());
        if (link != null) {
            linkService.handleMessage(link, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("worker 连接 {} 出错: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSession link = links.remove(session.getId());
        if (link != null) {
            linkService.connectionClosed(link);
        }
        log.info("worker 连接已关闭: {} ({})", session.getId(), status);
    }
}
