/**
 * AgentSessionController.java
 *
 * 管理端的会话接口：列出、派发、查询、终止与续跑。
 */
package club.ppmc.sessionhub.controller;

import club.ppmc.sessionhub.exception.ProcessUnavailableException;
import club.ppmc.sessionhub.exception.SessionNotFoundException;
import club.ppmc.sessionhub.exception.SpawnConflictException;
import club.ppmc.sessionhub.exception.SpawnFailureException;
import club.ppmc.sessionhub.model.DispatchRequest;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.service.AgentSessionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/agent-sessions")
@Slf4j
public class AgentSessionController {

    private final AgentSessionService sessionService;

    public AgentSessionController(AgentSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping
    public ResponseEntity<List<SessionRecord>> list(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(sessionService.list(Math.max(1, Math.min(limit, 500))));
    }

    /**
     * 派发一个新会话。监督器不可达返回 503，已存在返回 409，启动失败返回 500；
     * 后两种情况下记录已被标记为 failed。
     */
    @PostMapping
    public ResponseEntity<?> dispatch(@Valid @RequestBody DispatchRequest request) {
        try {
            return ResponseEntity.ok(sessionService.dispatch(request));
        } catch (ProcessUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.toErrorData());
        } catch (SpawnConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (SpawnFailureException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        try {
            return ResponseEntity.ok(sessionService.get(id));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{id}/kill")
    public ResponseEntity<Map<String, Object>> kill(@PathVariable String id) {
        try {
            boolean killed = sessionService.kill(id);
            return ResponseEntity.ok(Map.of("ok", killed));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<?> resume(@PathVariable String id) {
        try {
            SessionRecord record = sessionService.resume(id);
            return ResponseEntity.ok(Map.of("sessionId", record.getId()));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (ProcessUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.toErrorData());
        } catch (SpawnConflictException | SpawnFailureException e) {
            log.error("续跑会话 {} 失败", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }
}
