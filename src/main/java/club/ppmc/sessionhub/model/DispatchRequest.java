/**
 * DispatchRequest.java
 *
 * 管理端创建新会话的请求。workerId 为空时在本地监督器中启动。
 */
package club.ppmc.sessionhub.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record DispatchRequest(
        String prompt,
        @NotBlank String cwd,
        @NotNull PermissionProfile permissionProfile,
        String allowedTools,
        String agentSessionId,
        String workerId) {}
