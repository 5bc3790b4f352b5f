/**
 * SupervisorController.java
 *
 * 进程监督器的 HTTP 接口：健康状态、启动、终止、写入、调整尺寸以及单个会话的状态查询。
 * 管理端通过 SupervisorClient 调用这些接口。
 */
package club.ppmc.sessionhub.controller;

import club.ppmc.sessionhub.exception.SpawnConflictException;
import club.ppmc.sessionhub.exception.SpawnFailureException;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SpawnRequest;
import club.ppmc.sessionhub.model.SupervisorStatus;
import club.ppmc.sessionhub.model.TerminalInputRequest;
import club.ppmc.sessionhub.model.TerminalResizeRequest;
import club.ppmc.sessionhub.service.ProcessHandle;
import club.ppmc.sessionhub.service.ProcessSupervisor;
import club.ppmc.sessionhub.service.StartupHealthMonitor;
import club.ppmc.sessionhub.store.SessionRecordStore;
import club.ppmc.sessionhub.terminal.TerminalMultiplexer;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/supervisor")
@Slf4j
public class SupervisorController {

    private final ProcessSupervisor supervisor;
    private final StartupHealthMonitor healthMonitor;
    private final SessionRecordStore store;
    private final TerminalMultiplexer multiplexer;

    public SupervisorController(
            ProcessSupervisor supervisor,
            StartupHealthMonitor healthMonitor,
            SessionRecordStore store,
            TerminalMultiplexer multiplexer) {
        this.supervisor = supervisor;
        this.healthMonitor = healthMonitor;
        this.store = store;
        this.multiplexer = multiplexer;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Set<String> active = supervisor.activeSessionIds();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("tmux", multiplexer.isAvailable());
        body.put("activeSessions", active.size());
        body.put("sessions", active.stream().sorted().toList());
        return ResponseEntity.ok(body);
    }

    /**
     * 启动一个会话。会话已在运行时返回 409，启动失败时返回 500。
     */
    @PostMapping("/spawn")
    public ResponseEntity<?> spawn(@Valid @RequestBody SpawnRequest request) {
        try {
            SessionRecord record = supervisor.spawn(request);
            return ResponseEntity.ok(record);
        } catch (SpawnConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (SpawnFailureException e) {
            log.error("启动会话 {} 失败", request.sessionId(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/kill/{id}")
    public ResponseEntity<Map<String, Object>> kill(@PathVariable String id) {
        if (!supervisor.kill(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "会话不活跃: " + id));
        }
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @PostMapping("/resize/{id}")
    public ResponseEntity<Map<String, Object>> resize(
            @PathVariable String id, @Valid @RequestBody TerminalResizeRequest request) {
        if (!supervisor.resize(id, request.cols(), request.rows())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "会话不活跃: " + id));
        }
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @PostMapping("/input/{id}")
    public ResponseEntity<Map<String, Object>> input(
            @PathVariable String id, @Valid @RequestBody TerminalInputRequest request) {
        if (!supervisor.isActive(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "会话不活跃: " + id));
        }
        return ResponseEntity.ok(Map.of("ok", supervisor.write(id, request.data())));
    }

    /**
     * 单个会话的状态。会话不在内存中时从记录中取状态，healthy 与 waiting 为 null。
     */
    @GetMapping("/status/{id}")
    public ResponseEntity<?> status(@PathVariable String id) {
        Optional<ProcessHandle> handle = supervisor.getHandle(id);
        if (handle.isPresent()) {
            ProcessHandle h = handle.get();
            return ResponseEntity.ok(new SupervisorStatus(
                    h.getStatus(),
                    h.isRunning(),
                    h.getOutputSeq(),
                    h.getTotalBytes(),
                    healthMonitor.assess(id),
                    h.isWaitingForInput()));
        }
        return store.findById(id)
                .<ResponseEntity<?>>map(r -> ResponseEntity.ok(new SupervisorStatus(
                        r.getStatus(), false, r.getLastOutputSeq(), r.getOutputBytes(), null, null)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "会话不存在: " + id)));
    }

    /**
     * 所有活跃会话的输入状态：waiting 表示进程正在等待用户输入，active 表示仍在输出。
     */
    @GetMapping("/waiting")
    public ResponseEntity<Map<String, Map<String, String>>> waiting() {
        Set<String> waitingIds = Set.copyOf(supervisor.waitingSessionIds());
        Map<String, Map<String, String>> body = new LinkedHashMap<>();
        supervisor.activeSessionIds().stream().sorted().forEach(id ->
                body.put(id, Map.of("inputState", waitingIds.contains(id) ? "waiting" : "active")));
        return ResponseEntity.ok(body);
    }
}
