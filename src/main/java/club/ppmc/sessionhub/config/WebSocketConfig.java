/**
 * WebSocketConfig.java
 *
 * 注册原始 WebSocket 端点（文本帧，JSON 消息）：
 * 监督器查看者端点、管理端查看者端点以及 worker 链路端点。
 */
package club.ppmc.sessionhub.config;

import club.ppmc.sessionhub.websocket.AdminSessionSocketHandler;
import club.ppmc.sessionhub.websocket.SupervisorSessionSocketHandler;
import club.ppmc.sessionhub.websocket.WorkerSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SupervisorSessionSocketHandler supervisorHandler;
    private final AdminSessionSocketHandler adminHandler;
    private final WorkerSocketHandler workerHandler;

    public WebSocketConfig(
            SupervisorSessionSocketHandler supervisorHandler,
            AdminSessionSocketHandler adminHandler,
            WorkerSocketHandler workerHandler) {
        this.supervisorHandler = supervisorHandler;
        this.adminHandler = adminHandler;
        this.workerHandler = workerHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(supervisorHandler, "/ws/agent-session").setAllowedOriginPatterns("*");
        registry.addHandler(adminHandler, "/ws/admin/agent-session").setAllowedOriginPatterns("*");
        registry.addHandler(workerHandler, "/ws/worker").setAllowedOriginPatterns("*");
    }
}
