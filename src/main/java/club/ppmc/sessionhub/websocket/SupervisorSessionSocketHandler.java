/**
 * SupervisorSessionSocketHandler.java
 *
 * 进程监督器的查看者端点 /ws/agent-session?sessionId=…，直接附加到本机的进程句柄。
 */
package club.ppmc.sessionhub.websocket;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.service.SessionViewerService;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
public class SupervisorSessionSocketHandler extends SessionViewerSocketHandler {

    private final SessionViewerService viewerService;

    public SupervisorSessionSocketHandler(SessionViewerService viewerService, SessionHubProperties properties) {
        super(properties);
        this.viewerService = viewerService;
    }

    @Override
    protected void onAttach(String sessionId, WebSocketSession viewer) {
        viewerService.attach(sessionId, viewer);
    }

    @Override
    protected void onMessage(String sessionId, WebSocketSession viewer, String payload) {
        viewerService.handleMessage(sessionId, viewer, payload);
    }

    @Override
    protected void onDetach(String sessionId, WebSocketSession viewer) {
        viewerService.detach(sessionId, viewer);
    }
}
