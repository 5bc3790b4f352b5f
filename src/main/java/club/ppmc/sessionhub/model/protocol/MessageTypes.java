/**
 * MessageTypes.java
 *
 * 会话 WebSocket 协议与 worker 链路协议中使用的消息类型常量。
 */
package club.ppmc.sessionhub.model.protocol;

public final class MessageTypes {

    // --- 服务端 → 查看者 ---
    public static final String HISTORY = "history";
    public static final String SEQUENCED_OUTPUT = "sequenced_output";
    public static final String INPUT_ACK = "input_ack";
    public static final String EXIT = "exit";

    // --- 查看者 → 服务端 ---
    public static final String SEQUENCED_INPUT = "sequenced_input";
    public static final String OUTPUT_ACK = "output_ack";
    public static final String REPLAY_REQUEST = "replay_request";

    // 旧版无序号消息，仍然接受
    public static final String LEGACY_INPUT = "input";
    public static final String LEGACY_RESIZE = "resize";
    public static final String LEGACY_KILL = "kill";

    // --- worker → 服务端 ---
    public static final String LAUNCHER_REGISTER = "launcher_register";
    public static final String LAUNCHER_HEARTBEAT = "launcher_heartbeat";
    public static final String LAUNCHER_SESSION_STARTED = "launcher_session_started";
    public static final String LAUNCHER_SESSION_OUTPUT = "launcher_session_output";
    public static final String LAUNCHER_SESSION_ENDED = "launcher_session_ended";

    // --- 服务端 → worker ---
    public static final String LAUNCHER_REGISTERED = "launcher_registered";
    public static final String LAUNCH_SESSION = "launch_session";
    public static final String KILL_SESSION = "kill_session";
    public static final String INPUT_TO_SESSION = "input_to_session";

    private MessageTypes() {}
}
