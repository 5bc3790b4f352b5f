/**
 * WorkerSummary.java
 *
 * 管理接口返回的 worker 信息（不包含连接对象本身）。
 */
package club.ppmc.sessionhub.model;

import java.time.Instant;
import java.util.List;

public record WorkerSummary(
        String id,
        String name,
        String hostname,
        Instant connectedAt,
        Instant lastHeartbeat,
        List<String> activeSessions,
        WorkerInfo.Capabilities capabilities,
        boolean online) {

    public static WorkerSummary of(WorkerInfo worker) {
        return new WorkerSummary(
                worker.getId(),
                worker.getName(),
                worker.getHostname(),
                worker.getConnectedAt(),
                worker.getLastHeartbeat(),
                worker.getActiveSessions().stream().sorted().toList(),
                worker.getCapabilities(),
                worker.isLive());
    }
}
