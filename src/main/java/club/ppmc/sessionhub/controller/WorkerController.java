/**
 * WorkerController.java
 *
 * 管理端的 worker 接口：列出、查询以及强制断开。
 */
package club.ppmc.sessionhub.controller;

import club.ppmc.sessionhub.model.WorkerInfo;
import club.ppmc.sessionhub.model.WorkerSummary;
import club.ppmc.sessionhub.service.ViewerMessenger;
import club.ppmc.sessionhub.service.WorkerRegistry;
import club.ppmc.sessionhub.websocket.CloseCodes;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/workers")
public class WorkerController {

    private final WorkerRegistry registry;
    private final ViewerMessenger messenger;

    public WorkerController(WorkerRegistry registry, ViewerMessenger messenger) {
        this.registry = registry;
        this.messenger = messenger;
    }

    @GetMapping
    public ResponseEntity<List<WorkerSummary>> list() {
        return ResponseEntity.ok(registry.listWorkers().stream().map(WorkerSummary::of).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return registry.getWorker(id)
                .<ResponseEntity<?>>map(w -> ResponseEntity.ok(WorkerSummary.of(w)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "worker 不存在: " + id)));
    }

    /** 强制断开一个 worker（4012）并将其从注册表中移除。 */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> disconnect(@PathVariable String id) {
        Optional<WorkerInfo> worker = registry.getWorker(id);
        if (worker.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "worker 不存在: " + id));
        }
        messenger.close(worker.get().getConnection(), CloseCodes.WORKER_FORCE_DISCONNECTED);
        registry.unregister(id);
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
