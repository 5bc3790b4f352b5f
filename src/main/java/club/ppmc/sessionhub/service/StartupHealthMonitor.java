/**
 * StartupHealthMonitor.java
 *
 * 启动健康检查：新会话启动一段时间后检查一次它的输出。
 * 找不到命令、参数错误之类的静默失败往往不会马上以非零码退出，进程就挂在那里没有任何输出；
 * 这样的会话会被强制终止并标记为 failed。plain（shell）会话不做检查。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.detect.StartupHealthJudge;
import club.ppmc.sessionhub.detect.TerminalText;
import club.ppmc.sessionhub.exception.StartupHealthFailureException;
import club.ppmc.sessionhub.model.PermissionProfile;
import club.ppmc.sessionhub.model.SessionStatus;
import jakarta.annotation.PreDestroy;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class StartupHealthMonitor {

    private final ProcessSupervisor supervisor;
    private final StartupHealthJudge judge;
    private final long checkDelayMillis;
    private final ScheduledExecutorService scheduler;

    @Autowired
    public StartupHealthMonitor(
            ProcessSupervisor supervisor, StartupHealthJudge judge, SessionHubProperties properties) {
        this(supervisor, judge, properties.getHealth().getCheckDelay().toMillis(),
                Executors.newSingleThreadScheduledExecutor());
    }

    StartupHealthMonitor(
            ProcessSupervisor supervisor,
            StartupHealthJudge judge,
            long checkDelayMillis,
            ScheduledExecutorService scheduler) {
        this.supervisor = supervisor;
        this.judge = judge;
        this.checkDelayMillis = checkDelayMillis;
        this.scheduler = scheduler;
    }

    @EventListener
    public void onSessionSpawned(SessionSpawnedEvent event) {
        if (event.permissionProfile() == PermissionProfile.PLAIN) {
            return;
        }
        scheduler.schedule(() -> check(event.sessionId()), checkDelayMillis, TimeUnit.MILLISECONDS);
    }

    void check(String sessionId) {
        try {
            Optional<ProcessHandle> handle = supervisor.getHandle(sessionId).filter(ProcessHandle::isRunning);
            if (handle.isEmpty()) {
                return;
            }
            String output = handle.get().getOutputSnapshot();
            if (judge.isHealthy(output)) {
                log.debug("会话 {} 通过启动健康检查", sessionId);
                return;
            }
            var failure = new StartupHealthFailureException(sessionId, TerminalText.countVisible(output));
            log.warn("启动健康检查失败，终止会话 {}", sessionId, failure);
            supervisor.kill(sessionId, SessionStatus.FAILED);
        } catch (RuntimeException e) {
            log.error("会话 {} 的启动健康检查出错", sessionId, e);
        }
    }

    /**
     * 对活跃会话当前的输出做一次健康判断；会话不活跃时返回 null。
     */
    public Boolean assess(String sessionId) {
        return supervisor.getHandle(sessionId)
                .filter(ProcessHandle::isRunning)
                .map(h -> judge.isHealthy(h.getOutputSnapshot()))
                .orElse(null);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
