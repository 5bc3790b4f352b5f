/**
 * WorkerInfo.java
 *
 * 一个已连接的远程 worker 主机。
 * 每个 worker 只有一条共享的 WebSocket 连接，发往其上所有会话的指令都经由这条连接发送；
 * 它通过心跳上报自己当前活跃的会话集合。
 */
package club.ppmc.sessionhub.model;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@Getter
public class WorkerInfo {

    private final String id;
    private final String name;
    private final String hostname;
    private final WebSocketSession connection;
    private final Instant connectedAt;
    private final Capabilities capabilities;
    private final Set<String> activeSessions = ConcurrentHashMap.newKeySet();
    private volatile Instant lastHeartbeat;

    public WorkerInfo(
            String id,
            String name,
            String hostname,
            WebSocketSession connection,
            Capabilities capabilities,
            Instant connectedAt) {
        this.id = id;
        this.name = name;
        this.hostname = hostname;
        this.connection = connection;
        this.capabilities = capabilities != null ? capabilities : new Capabilities(1, false, true);
        this.connectedAt = connectedAt;
        this.lastHeartbeat = connectedAt;
    }

    public boolean isLive() {
        return connection.isOpen();
    }

    public void send(String payload) throws IOException {
        connection.sendMessage(new TextMessage(payload));
    }

    public void heartbeat(Collection<String> reportedSessions, Instant at) {
        this.lastHeartbeat = at;
        activeSessions.retainAll(reportedSessions);
        activeSessions.addAll(reportedSessions);
    }

    /**
     * worker 注册时上报的能力。
     *
     * @param maxSessions 可同时运行的最大会话数。
     * @param hasTmux worker 主机上是否安装了 tmux。
     * @param hasAgentCli worker 主机上是否安装了 Agent 命令行。
     */
    public record Capabilities(int maxSessions, boolean hasTmux, boolean hasAgentCli) {}
}
