/**
 * ProcessHandle.java
 *
 * 监督器为每个活跃会话在内存中保存的状态：进程引用、有界输出尾部、字节计数、
 * 输出序号、已处理的最大输入序号、查看者集合以及等待输入检测器。
 *
 * <p>所有可变字段都由句柄自身的监视器保护，调用方通过 {@code synchronized (handle)} 串行化
 * “追加尾部 → 检测等待状态 → 写入账本 → 分发给查看者”这条输出流水线，
 * 不同会话之间互不阻塞。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.detect.WaitingStateDetector;
import club.ppmc.sessionhub.model.PermissionProfile;
import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.terminal.TerminalProcess;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import lombok.Getter;
import org.springframework.web.socket.WebSocketSession;

public class ProcessHandle {

    @Getter private final String sessionId;
    @Getter private final TerminalProcess process;
    @Getter private final PermissionProfile permissionProfile;
    @Getter private final String multiplexName;
    private final int maxOutput;

    private final StringBuilder output = new StringBuilder();
    private final WaitingStateDetector detector;
    private final Set<WebSocketSession> viewers = new LinkedHashSet<>();

    private long totalBytes;
    private long outputSeq;
    private long lastAckedInputSeq;
    private SessionStatus status = SessionStatus.RUNNING;
    private ScheduledFuture<?> flushTask;

    public ProcessHandle(
            String sessionId,
            TerminalProcess process,
            PermissionProfile permissionProfile,
            String multiplexName,
            int maxOutput,
            WaitingStateDetector detector) {
        this.sessionId = sessionId;
        this.process = process;
        this.permissionProfile = permissionProfile;
        this.multiplexName = multiplexName;
        this.maxOutput = maxOutput;
        this.detector = detector;
    }

    /**
     * 用已持久化的计数恢复句柄状态。输出序号从记录中的 lastOutputSeq 继续，永不复用。
     */
    synchronized void seed(String initialOutput, long totalBytes, long outputSeq, long lastAckedInputSeq) {
        output.setLength(0);
        if (initialOutput != null) {
            output.append(initialOutput);
            trimOutput();
        }
        this.totalBytes = totalBytes;
        this.outputSeq = outputSeq;
        this.lastAckedInputSeq = lastAckedInputSeq;
    }

    synchronized void appendOutput(String chunk) {
        output.append(chunk);
        totalBytes += chunk.getBytes(StandardCharsets.UTF_8).length;
        trimOutput();
    }

    private void trimOutput() {
        int overflow = output.length() - maxOutput;
        if (overflow > 0) {
            output.delete(0, overflow);
        }
    }

    synchronized long nextSeq() {
        return ++outputSeq;
    }

    /**
     * 记录一条序号输入。只有序号大于已处理的最大值时才返回 true，重复或过期的输入被忽略。
     */
    synchronized boolean acceptInput(long seq) {
        if (seq <= lastAckedInputSeq) {
            return false;
        }
        lastAckedInputSeq = seq;
        return true;
    }

    synchronized WaitingStateDetector.Transition detectWaiting(String chunk, long nowMillis) {
        return detector.onOutput(chunk, nowMillis);
    }

    synchronized void seedWaiting(boolean waiting, long nowMillis, long graceMillis) {
        detector.seed(waiting, nowMillis, graceMillis);
    }

    public synchronized boolean isWaitingForInput() {
        return detector.isWaiting();
    }

    public synchronized String getOutputSnapshot() {
        return output.toString();
    }

    public synchronized boolean isRunning() {
        return status == SessionStatus.RUNNING;
    }

    synchronized void addViewer(WebSocketSession viewer) {
        viewers.add(viewer);
    }

    synchronized boolean removeViewer(WebSocketSession viewer) {
        return viewers.remove(viewer);
    }

    synchronized List<WebSocketSession> viewerSnapshot() {
        return List.copyOf(viewers);
    }

    public synchronized int getViewerCount() {
        return viewers.size();
    }

    /** 一次性取出需要持久化的计数，保证几个字段彼此一致。 */
    synchronized Counters counters() {
        return new Counters(output.toString(), totalBytes, outputSeq, lastAckedInputSeq);
    }

    record Counters(String outputLog, long totalBytes, long outputSeq, long lastInputSeq) {}

    public synchronized long getTotalBytes() {
        return totalBytes;
    }

    public synchronized long getOutputSeq() {
        return outputSeq;
    }

    public synchronized long getLastAckedInputSeq() {
        return lastAckedInputSeq;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    synchronized void setStatus(SessionStatus status) {
        this.status = status;
    }

    synchronized void setFlushTask(ScheduledFuture<?> flushTask) {
        this.flushTask = flushTask;
    }

    synchronized void cancelFlushTask() {
        if (flushTask != null) {
            flushTask.cancel(false);
            flushTask = null;
        }
    }
}
