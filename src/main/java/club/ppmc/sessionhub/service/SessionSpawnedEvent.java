/**
 * SessionSpawnedEvent.java
 *
 * 监督器成功启动一个新进程后发布的 Spring 应用事件。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.model.PermissionProfile;

public record SessionSpawnedEvent(String sessionId, PermissionProfile permissionProfile) {}
