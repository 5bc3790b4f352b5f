/**
 * CloseCodes.java
 *
 * 应用自定义的 WebSocket 关闭码（4000-4999 为应用保留区间）。
 */
package club.ppmc.sessionhub.websocket;

import org.springframework.web.socket.CloseStatus;

public final class CloseCodes {

    /** 连接地址缺少 sessionId 参数。 */
    public static final CloseStatus MISSING_SESSION_ID = new CloseStatus(4001, "missing sessionId");

    /** 会话不存在。 */
    public static final CloseStatus SESSION_NOT_FOUND = new CloseStatus(4004, "session not found");

    /** 上游（进程监督器）连接在建立后断开，查看者应当重连。 */
    public static final CloseStatus UPSTREAM_CLOSED = new CloseStatus(4005, "upstream closed");

    /** 进程监督器不可达，而会话仍是 pending/running，查看者应当稍后重连。 */
    public static final CloseStatus SUPERVISOR_UNREACHABLE = new CloseStatus(4006, "supervisor unreachable");

    /** 同一 worker ID 重新注册，旧连接被替换。 */
    public static final CloseStatus WORKER_REPLACED = new CloseStatus(4010, "replaced by new connection");

    /** worker 心跳超时。 */
    public static final CloseStatus WORKER_STALE = new CloseStatus(4011, "stale heartbeat");

    /** 管理员强制断开 worker。 */
    public static final CloseStatus WORKER_FORCE_DISCONNECTED = new CloseStatus(4012, "force disconnected by admin");

    private CloseCodes() {}
}
