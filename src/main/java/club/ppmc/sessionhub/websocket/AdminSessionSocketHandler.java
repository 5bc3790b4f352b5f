/**
 * AdminSessionSocketHandler.java
 *
 * 管理端的查看者端点 /ws/admin/agent-session?sessionId=…，经由路由器桥接到监督器或 worker。
 */
package club.ppmc.sessionhub.websocket;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.service.AdminBridgeRouter;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
public class AdminSessionSocketHandler extends SessionViewerSocketHandler {

    private final AdminBridgeRouter router;

    public AdminSessionSocketHandler(AdminBridgeRouter router, SessionHubProperties properties) {
        super(properties);
        this.router = router;
    }

    @Override
    protected void onAttach(String sessionId, WebSocketSession viewer) {
        router.attach(sessionId, viewer);
    }

    @Override
    protected void onMessage(String sessionId, WebSocketSession viewer, String payload) {
        router.forward(viewer, payload);
    }

    @Override
    protected void onDetach(String sessionId, WebSocketSession viewer) {
        router.detach(sessionId, viewer);
    }
}
