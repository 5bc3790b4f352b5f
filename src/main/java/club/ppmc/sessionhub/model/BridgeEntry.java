/**
 * BridgeEntry.java
 *
 * 路由器为每个查看者连接保存的一条桥接记录。
 * 本地桥接持有一条通往进程监督器的上游连接；远程桥接只记录 worker 与会话 ID，
 * 数据经由 worker 共享的那条连接收发。生命周期与查看者连接相同。
 */
package club.ppmc.sessionhub.model;

import org.springframework.web.socket.WebSocketSession;

public record BridgeEntry(Kind kind, WebSocketSession upstream, String workerId, String sessionId) {

    public enum Kind {
        LOCAL,
        REMOTE
    }

    public static BridgeEntry local(String sessionId, WebSocketSession upstream) {
        return new BridgeEntry(Kind.LOCAL, upstream, null, sessionId);
    }

    public static BridgeEntry remote(String workerId, String sessionId) {
        return new BridgeEntry(Kind.REMOTE, null, workerId, sessionId);
    }
}
