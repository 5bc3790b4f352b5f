/**
 * SupervisorStatus.java
 *
 * 进程监督器对单个会话的状态报告。healthy 为 null 表示会话已不在内存中，无法判断。
 */
package club.ppmc.sessionhub.model;

public record SupervisorStatus(
        SessionStatus status,
        boolean active,
        long outputSeq,
        long totalBytes,
        Boolean healthy,
        Boolean waiting) {}
