/**
 * ProcessSupervisor.java
 *
 * 进程监督器：每个会话 ID 至多一个交互式进程。
 * 它负责启动进程（直接在 PTY 上，或在可分离的 tmux 会话中）、读取输出并按序号分发给所有查看者、
 * 处理序号输入、周期性持久化，以及在进程退出或被终止时落盘最终状态。
 *
 * <p>输出流水线在句柄锁内按顺序执行：追加尾部与计数 → 等待状态检测 → 写入账本 → 分发。
 * 进程退出的处理等待输出读取线程把流读完，保证退出消息之后不会再有输出。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.detect.WaitingStateDetector;
import club.ppmc.sessionhub.exception.SessionNotFoundException;
import club.ppmc.sessionhub.exception.SpawnConflictException;
import club.ppmc.sessionhub.exception.SpawnFailureException;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.model.SpawnRequest;
import club.ppmc.sessionhub.model.protocol.ExitMessage;
import club.ppmc.sessionhub.model.protocol.HistoryMessage;
import club.ppmc.sessionhub.model.protocol.InputContent;
import club.ppmc.sessionhub.model.protocol.OutputContent;
import club.ppmc.sessionhub.model.protocol.SequencedOutput;
import club.ppmc.sessionhub.store.SessionRecordStore;
import club.ppmc.sessionhub.terminal.AgentCommandBuilder;
import club.ppmc.sessionhub.terminal.LaunchCommand;
import club.ppmc.sessionhub.terminal.TerminalLauncher;
import club.ppmc.sessionhub.terminal.TerminalMultiplexer;
import club.ppmc.sessionhub.terminal.TerminalProcess;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

@Service
@Slf4j
public class ProcessSupervisor {

    /** 被终止的会话在 exit 消息中使用的退出码。 */
    public static final int KILLED_EXIT_CODE = -1;

    public enum AttachOutcome {
        /** 已附加到活跃进程。 */
        LIVE,
        /** 会话仍在 pending，查看者将在进程启动后自动转入。 */
        PENDING,
        /** 本机没有这个会话的进程。 */
        NONE
    }

    private final SessionRecordStore store;
    private final OutputLedger ledger;
    private final TerminalMultiplexer multiplexer;
    private final TerminalLauncher launcher;
    private final AgentCommandBuilder commandBuilder;
    private final ViewerMessenger messenger;
    private final ApplicationEventPublisher events;
    private final SessionHubProperties properties;
    private final Executor readerExecutor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Map<String, ProcessHandle> handles = new ConcurrentHashMap<>();
    private final Set<String> spawning = ConcurrentHashMap.newKeySet();
    // 由自身监视器保护；与 handles 的注册一起加锁，避免查看者落在两者之间
    private final Map<String, Set<WebSocketSession>> pendingViewers = new HashMap<>();
    private volatile boolean shuttingDown;

    @Autowired
    public ProcessSupervisor(
            SessionRecordStore store,
            OutputLedger ledger,
            TerminalMultiplexer multiplexer,
            TerminalLauncher launcher,
            AgentCommandBuilder commandBuilder,
            ViewerMessenger messenger,
            ApplicationEventPublisher events,
            SessionHubProperties properties) {
        this(store, ledger, multiplexer, launcher, commandBuilder, messenger, events, properties,
                Executors.newCachedThreadPool(), Executors.newSingleThreadScheduledExecutor(), Clock.systemUTC());
    }

    ProcessSupervisor(
            SessionRecordStore store,
            OutputLedger ledger,
            TerminalMultiplexer multiplexer,
            TerminalLauncher launcher,
            AgentCommandBuilder commandBuilder,
            ViewerMessenger messenger,
            ApplicationEventPublisher events,
            SessionHubProperties properties,
            Executor readerExecutor,
            ScheduledExecutorService scheduler,
            Clock clock) {
        this.store = store;
        this.ledger = ledger;
        this.multiplexer = multiplexer;
        this.launcher = launcher;
        this.commandBuilder = commandBuilder;
        this.messenger = messenger;
        this.events = events;
        this.properties = properties;
        this.readerExecutor = readerExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------------------------
    // 启动
    // ---------------------------------------------------------------------------------------

    /**
     * 为一个会话启动进程。记录不存在时按请求创建一条 pending 记录。
     *
     * @throws SpawnConflictException 该会话已有进程、正在启动，或记录已不是 pending。
     * @throws SpawnFailureException 进程无法启动，记录被标记为 failed。
     */
    public SessionRecord spawn(SpawnRequest request) {
        String sessionId = request.sessionId();
        if (handles.containsKey(sessionId) || !spawning.add(sessionId)) {
            throw new SpawnConflictException(sessionId);
        }
        try {
            if (handles.containsKey(sessionId)) {
                throw new SpawnConflictException(sessionId);
            }
            SessionRecord record = store.findById(sessionId).orElseGet(() -> store.create(newRecord(request)));
            if (record.getStatus() != SessionStatus.PENDING) {
                throw new SpawnConflictException(
                        sessionId, "会话 " + sessionId + " 当前状态为 " + record.getStatus().wireName() + "，不能再次启动");
            }

            LaunchCommand command = commandBuilder.build(request);
            int cols = request.cols() != null ? request.cols() : properties.getSupervisor().getDefaultCols();
            int rows = request.rows() != null ? request.rows() : properties.getSupervisor().getDefaultRows();

            String multiplexName = null;
            TerminalProcess process;
            try {
                if (multiplexer.isAvailable()) {
                    multiplexName = multiplexer.sessionName(sessionId);
                    multiplexer.createSession(multiplexName, command, request.cwd(), cols, rows);
                    process = multiplexer.attach(multiplexName, cols, rows);
                } else {
                    process = launcher.launch(command.toList(), request.cwd(), cols, rows);
                }
            } catch (IOException | RuntimeException e) {
                log.error("启动会话 {} 的进程失败: {}", sessionId, command.toList(), e);
                if (multiplexName != null) {
                    multiplexer.kill(multiplexName);
                }
                markSpawnFailed(sessionId);
                throw new SpawnFailureException(sessionId, "启动会话 " + sessionId + " 失败: " + e.getMessage(), e);
            }

            var handle = new ProcessHandle(
                    sessionId,
                    process,
                    request.permissionProfile(),
                    multiplexName,
                    properties.getSupervisor().getMaxOutputLog(),
                    newDetector());
            Instant now = clock.instant();
            String recordedName = multiplexName;
            registerHandle(handle);
            SessionRecord running = store.update(sessionId, r -> {
                        if (r.getStatus() == SessionStatus.PENDING) {
                            r.setStatus(SessionStatus.RUNNING);
                        }
                        r.setProcessId(process.pid());
                        r.setStartedAt(now);
                        r.setMultiplexName(recordedName);
                    })
                    .orElseThrow(() -> {
                        handles.remove(sessionId, handle);
                        process.destroy();
                        return new SessionNotFoundException(sessionId);
                    });
            startHandle(handle);
            log.info("会话 {} 已启动 (PID: {}, 模式: {}, tmux: {})",
                    sessionId, process.pid(), request.permissionProfile().name().toLowerCase(), recordedName);
            events.publishEvent(new SessionSpawnedEvent(sessionId, request.permissionProfile()));
            return running;
        } finally {
            spawning.remove(sessionId);
        }
    }

    /**
     * 接管一个由恢复流程重新附加的进程。序号与计数从记录中继续，等待状态由面板文本推断。
     */
    public SessionRecord adoptRecovered(
            SessionRecord record, TerminalProcess process, String initialOutput, boolean waitingForInput) {
        String sessionId = record.getId();
        if (handles.containsKey(sessionId) || !spawning.add(sessionId)) {
            process.destroy();
            throw new SpawnConflictException(sessionId);
        }
        try {
            var handle = new ProcessHandle(
                    sessionId,
                    process,
                    record.getPermissionProfile(),
                    record.getMultiplexName(),
                    properties.getSupervisor().getMaxOutputLog(),
                    newDetector());
            // 记录中的序号按周期刷新，可能落后于已落盘的账本
            long outputSeq = Math.max(record.getLastOutputSeq(), ledger.lastSeq(sessionId));
            handle.seed(initialOutput, record.getOutputBytes(), outputSeq, record.getLastInputSeq());
            handle.seedWaiting(
                    waitingForInput, clock.millis(), properties.getWaiting().getReattachGrace().toMillis());

            registerHandle(handle);
            SessionRecord restored = store.update(sessionId, r -> {
                        if (r.getStatus().canTransitionTo(SessionStatus.RUNNING, true)) {
                            r.setStatus(SessionStatus.RUNNING);
                            r.setCompletedAt(null);
                            r.setExitCode(null);
                        }
                        r.setProcessId(process.pid());
                        r.setMultiplexName(record.getMultiplexName());
                    })
                    .orElseThrow(() -> {
                        handles.remove(sessionId, handle);
                        process.destroy();
                        return new SessionNotFoundException(sessionId);
                    });
            startHandle(handle);
            return restored;
        } finally {
            spawning.remove(sessionId);
        }
    }

    private SessionRecord newRecord(SpawnRequest request) {
        return SessionRecord.builder()
                .id(request.sessionId())
                .status(SessionStatus.PENDING)
                .permissionProfile(request.permissionProfile())
                .createdAt(clock.instant())
                .cwd(request.cwd())
                .prompt(request.prompt())
                .allowedTools(request.allowedTools())
                .agentSessionId(request.agentSessionId())
                .build();
    }

    private WaitingStateDetector newDetector() {
        var waiting = properties.getWaiting();
        return new WaitingStateDetector(waiting.getClearThreshold(), waiting.getBellGrace().toMillis());
    }

    private void registerHandle(ProcessHandle handle) {
        String sessionId = handle.getSessionId();
        synchronized (pendingViewers) {
            handles.put(sessionId, handle);
            Set<WebSocketSession> waiting = pendingViewers.remove(sessionId);
            if (waiting != null) {
                waiting.forEach(handle::addViewer);
            }
        }
    }

    private void startHandle(ProcessHandle handle) {
        long interval = properties.getSupervisor().getFlushInterval().toMillis();
        handle.setFlushTask(scheduler.scheduleAtFixedRate(() -> flush(handle), interval, interval, TimeUnit.MILLISECONDS));
        startReader(handle);
    }

    private void markSpawnFailed(String sessionId) {
        Instant now = clock.instant();
        store.update(sessionId, r -> {
            if (r.getStatus().canTransitionTo(SessionStatus.FAILED, false)) {
                r.setStatus(SessionStatus.FAILED);
                r.setCompletedAt(now);
            }
        });
        Set<WebSocketSession> waiting;
        synchronized (pendingViewers) {
            waiting = pendingViewers.remove(sessionId);
        }
        if (waiting != null) {
            waiting.forEach(v -> messenger.send(v, new ExitMessage(KILLED_EXIT_CODE, SessionStatus.FAILED)));
        }
    }

    // ---------------------------------------------------------------------------------------
    // 输出与退出
    // ---------------------------------------------------------------------------------------

    private void startReader(ProcessHandle handle) {
        CompletableFuture<Void> readerFuture = CompletableFuture.runAsync(() -> readOutput(handle), readerExecutor);
        // 进程退出并且输出流被完全读取后才处理退出，避免丢失末尾的输出
        handle.getProcess()
                .onExit()
                .thenCombine(readerFuture, (code, v) -> code)
                .thenAccept(code -> processExit(handle, code))
                .exceptionally(ex -> {
                    log.error("处理会话 {} 的进程退出时出错", handle.getSessionId(), ex);
                    return null;
                });
    }

    private void readOutput(ProcessHandle handle) {
        try (var reader = new InputStreamReader(handle.getProcess().getOutput(), StandardCharsets.UTF_8)) {
            char[] buffer = new char[8192];
            int charsRead;
            while ((charsRead = reader.read(buffer)) != -1) {
                processOutput(handle, new String(buffer, 0, charsRead));
            }
        } catch (IOException e) {
            // 进程退出后 PTY 读取会抛出 EIO，这是正常现象
            log.debug("会话 {} 的输出流已关闭: {}", handle.getSessionId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("处理会话 {} 的输出时出错", handle.getSessionId(), e);
        }
    }

    void processOutput(ProcessHandle handle, String chunk) {
        if (chunk.isEmpty()) {
            return;
        }
        synchronized (handle) {
            if (!handle.isRunning()) {
                return;
            }
            handle.appendOutput(chunk);
            var transition = handle.detectWaiting(chunk, clock.millis());
            if (transition == WaitingStateDetector.Transition.STARTED_WAITING) {
                emit(handle, OutputContent.waitingState(true));
            } else if (transition == WaitingStateDetector.Transition.STOPPED_WAITING) {
                emit(handle, OutputContent.waitingState(false));
            }
            emit(handle, OutputContent.output(chunk));
        }
    }

    void processExit(ProcessHandle handle, int exitCode) {
        String sessionId = handle.getSessionId();
        String multiplexName = handle.getMultiplexName();
        int code = exitCode;
        if (multiplexName != null) {
            if (shuttingDown) {
                log.info("服务关闭中，会话 {} 的 tmux 会话 {} 被保留", sessionId, multiplexName);
                return;
            }
            if (handle.isRunning() && multiplexer.exists(multiplexName)) {
                onClientDetached(handle);
                return;
            }
            code = multiplexer.exitStatus(multiplexName).orElse(exitCode);
        }

        SessionStatus finalStatus;
        synchronized (handle) {
            if (!handle.isRunning()) {
                // 已被终止，退出消息已经发出
                return;
            }
            finalStatus = code == 0 ? SessionStatus.COMPLETED : SessionStatus.FAILED;
            handle.setStatus(finalStatus);
            emit(handle, OutputContent.exit(code, finalStatus));
        }
        handle.cancelFlushTask();
        handles.remove(sessionId, handle);
        if (multiplexName != null) {
            multiplexer.kill(multiplexName);
        }
        persistFinal(handle, finalStatus, code);
        log.info("会话 {} 的进程已退出，退出码 {}，状态 {}", sessionId, code, finalStatus.wireName());
    }

    /**
     * tmux 附加客户端退出了，但 tmux 会话仍然存活。记录保持 running，
     * 查看者被断开后重连时会触发按需恢复，重新附加一个客户端。
     */
    private void onClientDetached(ProcessHandle handle) {
        String sessionId = handle.getSessionId();
        List<WebSocketSession> viewers;
        synchronized (handle) {
            if (!handle.isRunning()) {
                return;
            }
            viewers = handle.viewerSnapshot();
        }
        handle.cancelFlushTask();
        flush(handle);
        handles.remove(sessionId, handle);
        log.warn("会话 {} 的 tmux 客户端意外退出，但 tmux 会话仍然存活，等待下次附加时恢复", sessionId);
        viewers.forEach(v -> messenger.close(v, CloseStatus.SERVICE_RESTARTED));
    }

    /** 在句柄锁内调用：分配序号、写入账本并分发给所有查看者。 */
    private void emit(ProcessHandle handle, OutputContent content) {
        String sessionId = handle.getSessionId();
        long seq = handle.nextSeq();
        String payload = messenger.toJson(new SequencedOutput(sessionId, seq, content, clock.instant().toString()));
        ledger.append(sessionId, content.kind(), seq, payload);
        for (WebSocketSession viewer : handle.viewerSnapshot()) {
            if (!messenger.sendRaw(viewer, payload)) {
                handle.removeViewer(viewer);
                log.info("查看者 {} 发送失败，已从会话 {} 中移除", viewer.getId(), sessionId);
            }
        }
    }

    // ---------------------------------------------------------------------------------------
    // 终止、输入与尺寸
    // ---------------------------------------------------------------------------------------

    public boolean kill(String sessionId) {
        return kill(sessionId, SessionStatus.KILLED);
    }

    /**
     * 终止一个活跃会话，并以给定的终态结束它（用户终止为 killed，健康检查失败为 failed）。
     *
     * @return 会话不活跃时返回 false。
     */
    public boolean kill(String sessionId, SessionStatus finalStatus) {
        ProcessHandle handle = handles.get(sessionId);
        if (handle == null) {
            return false;
        }
        synchronized (handle) {
            if (!handle.isRunning()) {
                return false;
            }
            handle.setStatus(finalStatus);
            emit(handle, OutputContent.exit(KILLED_EXIT_CODE, finalStatus));
        }
        handle.cancelFlushTask();
        handles.remove(sessionId, handle);
        handle.getProcess().destroy();
        if (handle.getMultiplexName() != null) {
            multiplexer.kill(handle.getMultiplexName());
        }
        persistFinal(handle, finalStatus, KILLED_EXIT_CODE);
        log.info("会话 {} 已被终止，状态 {}", sessionId, finalStatus.wireName());
        return true;
    }

    public boolean write(String sessionId, String data) {
        ProcessHandle handle = runningHandle(sessionId);
        if (handle == null || data == null || data.isEmpty()) {
            return false;
        }
        try {
            handle.getProcess().write(data);
            return true;
        } catch (IOException e) {
            log.warn("向会话 {} 的进程写入失败: {}", sessionId, e.getMessage());
            return false;
        }
    }

    public boolean resize(String sessionId, int cols, int rows) {
        ProcessHandle handle = runningHandle(sessionId);
        if (handle == null || cols <= 0 || rows <= 0) {
            return false;
        }
        handle.getProcess().resize(cols, rows);
        return true;
    }

    /**
     * 处理一条序号输入。只有序号大于已处理的最大值时才会执行，重复的输入被忽略。
     *
     * @return 应答给查看者的 ackSeq，总是收到的序号本身（重复的也一样），客户端据此逐条清除待确认的输入。
     */
    public long handleSequencedInput(String sessionId, long seq, InputContent content) {
        ProcessHandle handle = handles.get(sessionId);
        if (handle == null) {
            return seq;
        }
        if (handle.acceptInput(seq) && content != null) {
            applyInput(sessionId, content);
        }
        return seq;
    }

    public void applyInput(String sessionId, InputContent content) {
        if (content.isWrite()) {
            write(sessionId, content.data());
        } else if (content.isResize()) {
            resize(sessionId, content.cols(), content.rows());
        } else if (content.isKill()) {
            kill(sessionId);
        } else {
            log.debug("会话 {} 收到无法识别的输入类型: {}", sessionId, content.kind());
        }
    }

    // ---------------------------------------------------------------------------------------
    // 查看者
    // ---------------------------------------------------------------------------------------

    /**
     * 把查看者附加到本机的进程上。活跃会话先发送 history（尾部、已确认的输入序号、等待状态）再加入分发集合，
     * 两步都在该会话的句柄锁内完成，查看者不会漏掉或重复收到其间的输出。
     * 全局的等待表锁只保护表本身，发送都在它之外进行，一个会话的慢查看者不会拖住其它会话的附加。
     *
     * @param recordPending 记录是否仍为 pending；是则让查看者等待进程启动。
     */
    public AttachOutcome attachViewer(String sessionId, WebSocketSession viewer, boolean recordPending) {
        ProcessHandle handle = handles.get(sessionId);
        if (handle == null && recordPending) {
            messenger.send(viewer, HistoryMessage.of(""));
            synchronized (pendingViewers) {
                handle = handles.get(sessionId);
                if (handle == null) {
                    pendingViewers.computeIfAbsent(sessionId, k -> new LinkedHashSet<>()).add(viewer);
                    return AttachOutcome.PENDING;
                }
            }
            // 进程恰好在此期间注册，改为直接附加，随后的 history 覆盖前面的空白画面
        }
        if (handle != null) {
            synchronized (handle) {
                if (handle.isRunning()) {
                    messenger.send(viewer, new HistoryMessage(
                            handle.getOutputSnapshot(), handle.getLastAckedInputSeq(), handle.isWaitingForInput()));
                    handle.addViewer(viewer);
                    return AttachOutcome.LIVE;
                }
            }
        }
        return AttachOutcome.NONE;
    }

    public void detachViewer(String sessionId, WebSocketSession viewer) {
        ProcessHandle handle = handles.get(sessionId);
        if (handle != null) {
            handle.removeViewer(viewer);
        }
        synchronized (pendingViewers) {
            Set<WebSocketSession> waiting = pendingViewers.get(sessionId);
            if (waiting != null) {
                waiting.remove(viewer);
                if (waiting.isEmpty()) {
                    pendingViewers.remove(sessionId);
                }
            }
        }
    }

    // ---------------------------------------------------------------------------------------
    // 查询
    // ---------------------------------------------------------------------------------------

    public Optional<ProcessHandle> getHandle(String sessionId) {
        return Optional.ofNullable(handles.get(sessionId));
    }

    public boolean isActive(String sessionId) {
        return runningHandle(sessionId) != null;
    }

    public Set<String> activeSessionIds() {
        return Set.copyOf(handles.keySet());
    }

    public List<String> waitingSessionIds() {
        return handles.values().stream()
                .filter(h -> h.isRunning() && h.isWaitingForInput())
                .map(ProcessHandle::getSessionId)
                .sorted()
                .toList();
    }

    private ProcessHandle runningHandle(String sessionId) {
        ProcessHandle handle = handles.get(sessionId);
        return handle != null && handle.isRunning() ? handle : null;
    }

    // ---------------------------------------------------------------------------------------
    // 持久化与关闭
    // ---------------------------------------------------------------------------------------

    void flush(ProcessHandle handle) {
        try {
            ProcessHandle.Counters counters = handle.counters();
            store.update(handle.getSessionId(), r -> applyCounters(counters, r));
        } catch (RuntimeException e) {
            log.error("持久化会话 {} 的输出时出错", handle.getSessionId(), e);
        }
    }

    private void persistFinal(ProcessHandle handle, SessionStatus status, int exitCode) {
        Instant now = clock.instant();
        ProcessHandle.Counters counters = handle.counters();
        try {
            store.update(handle.getSessionId(), r -> {
                if (r.getStatus().canTransitionTo(status, false)) {
                    r.setStatus(status);
                    r.setExitCode(exitCode);
                    r.setCompletedAt(now);
                }
                applyCounters(counters, r);
            });
        } catch (RuntimeException e) {
            log.error("保存会话 {} 的最终状态时出错", handle.getSessionId(), e);
        }
    }

    private static void applyCounters(ProcessHandle.Counters counters, SessionRecord record) {
        record.setOutputLog(counters.outputLog());
        record.setOutputBytes(counters.totalBytes());
        record.setLastOutputSeq(counters.outputSeq());
        record.setLastInputSeq(counters.lastInputSeq());
    }

    /**
     * 服务关闭：保存所有会话的状态。tmux 会话只分离客户端而保留会话本身，
     * 以便下次启动时恢复；直接运行在 PTY 上的进程随服务一起结束。
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        log.info("正在关闭进程监督器，活跃会话 {} 个。", handles.size());
        for (ProcessHandle handle : handles.values()) {
            handle.cancelFlushTask();
            flush(handle);
            if (handle.getMultiplexName() != null) {
                multiplexer.detachClients(handle.getMultiplexName());
            }
            handle.getProcess().destroy();
        }
        handles.clear();
        scheduler.shutdownNow();
        if (readerExecutor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }
}
