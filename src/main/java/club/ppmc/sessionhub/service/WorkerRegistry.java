/**
 * WorkerRegistry.java
 *
 * 已连接的远程 worker 的注册表。
 * 同一 ID 重新注册时旧连接会被关闭（4010）；超过 staleTimeout 没有心跳的 worker 会被定期移除并断开（4011）。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.model.WorkerInfo;
import club.ppmc.sessionhub.websocket.CloseCodes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

@Service
@Slf4j
public class WorkerRegistry {

    private final Map<String, WorkerInfo> workers = new ConcurrentHashMap<>();
    private final ViewerMessenger messenger;
    private final Duration staleTimeout;
    private final Clock clock;

    @Autowired
    public WorkerRegistry(ViewerMessenger messenger, SessionHubProperties properties) {
        this(messenger, properties.getWorker().getStaleTimeout(), Clock.systemUTC());
    }

    public WorkerRegistry(ViewerMessenger messenger, Duration staleTimeout, Clock clock) {
        this.messenger = messenger;
        this.staleTimeout = staleTimeout;
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public void register(WorkerInfo worker) {
        WorkerInfo existing = workers.put(worker.getId(), worker);
        if (existing != null && existing.getConnection() != worker.getConnection()) {
            messenger.close(existing.getConnection(), CloseCodes.WORKER_REPLACED);
        }
        log.info("worker 已注册: {} ({}@{})", worker.getId(), worker.getName(), worker.getHostname());
    }

    public void unregister(String workerId) {
        if (workers.remove(workerId) != null) {
            log.info("worker 已注销: {}", workerId);
        }
    }

    /**
     * 仅当注册表中的条目仍是这个连接时才注销，避免旧连接的关闭事件误删新连接。
     */
    public void unregisterConnection(String workerId, WebSocketSession connection) {
        workers.computeIfPresent(workerId, (id, current) -> {
            if (current.getConnection() == connection) {
                log.info("worker {} 的连接已关闭", workerId);
                return null;
            }
            return current;
        });
    }

    public Optional<WorkerInfo> getWorker(String workerId) {
        return workerId == null ? Optional.empty() : Optional.ofNullable(workers.get(workerId));
    }

    /** 已注册且连接仍然打开的 worker。 */
    public Optional<WorkerInfo> getLiveWorker(String workerId) {
        return getWorker(workerId).filter(WorkerInfo::isLive);
    }

    public List<WorkerInfo> listWorkers() {
        return workers.values().stream().sorted(Comparator.comparing(WorkerInfo::getId)).toList();
    }

    /** 负载最低且未满的在线 worker。 */
    public Optional<WorkerInfo> findAvailableWorker() {
        return workers.values().stream()
                .filter(WorkerInfo::isLive)
                .filter(w -> w.getActiveSessions().size() < w.getCapabilities().maxSessions())
                .min(Comparator.comparingInt(w -> w.getActiveSessions().size()));
    }

    public void updateHeartbeat(String workerId, Collection<String> activeSessions) {
        WorkerInfo worker = workers.get(workerId);
        if (worker != null) {
            worker.heartbeat(activeSessions != null ? activeSessions : List.of(), clock.instant());
        }
    }

    public void addSession(String workerId, String sessionId) {
        getWorker(workerId).ifPresent(w -> w.getActiveSessions().add(sessionId));
    }

    public void removeSession(String workerId, String sessionId) {
        getWorker(workerId).ifPresent(w -> w.getActiveSessions().remove(sessionId));
    }

    /** 在线 worker 自报的活跃会话中是否包含该会话。 */
    public boolean isReportedByLiveWorker(String sessionId) {
        return workers.values().stream()
                .filter(WorkerInfo::isLive)
                .anyMatch(w -> w.getActiveSessions().contains(sessionId));
    }

    @Scheduled(fixedDelayString = "${app.worker.prune-interval:PT30S}")
    public void pruneStaleWorkers() {
        Instant cutoff = clock.instant().minus(staleTimeout);
        workers.values().removeIf(worker -> {
            if (worker.getLastHeartbeat().isBefore(cutoff)) {
                log.warn("移除心跳超时的 worker: {}", worker.getId());
                messenger.close(worker.getConnection(), CloseCodes.WORKER_STALE);
                return true;
            }
            return false;
        });
    }
}
