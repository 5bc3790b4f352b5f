/**
 * WorkerCommands.java
 *
 * 控制面发往 worker 的指令。worker 只有一条共享连接，因此每条指令都显式携带目标会话 ID。
 */
package club.ppmc.sessionhub.model.protocol;

import club.ppmc.sessionhub.model.PermissionProfile;
import com.google.gson.JsonElement;

public final class WorkerCommands {

    private WorkerCommands() {}

    public record Registered(String type, boolean ok, String error) {
        public Registered(boolean ok, String error) {
            this(MessageTypes.LAUNCHER_REGISTERED, ok, error);
        }
    }

    public record LaunchSession(
            String type,
            String sessionId,
            String prompt,
            String cwd,
            PermissionProfile permissionProfile,
            String allowedTools,
            String agentSessionId,
            int cols,
            int rows) {
        public LaunchSession(
                String sessionId,
                String prompt,
                String cwd,
                PermissionProfile permissionProfile,
                String allowedTools,
                String agentSessionId,
                int cols,
                int rows) {
            this(
                    MessageTypes.LAUNCH_SESSION,
                    sessionId,
                    prompt,
                    cwd,
                    permissionProfile,
                    allowedTools,
                    agentSessionId,
                    cols,
                    rows);
        }
    }

    public record KillSession(String type, String sessionId) {
        public KillSession(String sessionId) {
            this(MessageTypes.KILL_SESSION, sessionId);
        }
    }

    /** 将查看者的原始输入包装成指向具体会话的信封。 */
    public record InputToSession(String type, String sessionId, JsonElement input) {
        public InputToSession(String sessionId, JsonElement input) {
            this(MessageTypes.INPUT_TO_SESSION, sessionId, input);
        }
    }
}
