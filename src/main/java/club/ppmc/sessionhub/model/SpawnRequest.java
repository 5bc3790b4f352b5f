/**
 * SpawnRequest.java
 *
 * 进程监督器的启动请求。上游派发层负责决定 profile、提示词和工作目录，监督器只负责执行。
 */
package club.ppmc.sessionhub.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SpawnRequest(
        @NotBlank String sessionId,
        String prompt,
        @NotBlank String cwd,
        @NotNull PermissionProfile permissionProfile,
        String allowedTools,
        String agentSessionId,
        String resumeAgentSessionId,
        Integer cols,
        Integer rows) {

    public SpawnRequest withSessionId(String newSessionId) {
        return new SpawnRequest(
                newSessionId,
                prompt,
                cwd,
                permissionProfile,
                allowedTools,
                agentSessionId,
                resumeAgentSessionId,
                cols,
                rows);
    }
}
