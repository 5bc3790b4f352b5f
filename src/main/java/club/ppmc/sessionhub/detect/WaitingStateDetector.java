/**
 * WaitingStateDetector.java
 *
 * 推断“进程正阻塞在交互式确认上”的两状态机，每个进程句柄一个实例。
 *
 * <p>not-waiting → waiting: 新到达的输出中出现单独的 BEL。重复的响铃不会产生新的事件。
 * <p>waiting → not-waiting: 宽限期结束后，自触发响铃以来收到的可见字符数达到阈值。
 * 宽限期内的输出不计数，这样响铃后立即出现的状态栏重绘不会造成误清除或来回抖动。
 *
 * <p>输出按块到达，块尾未结束的转义序列会留到下一块拼接后再判断，
 * 否则被拆开的 OSC 标题的 BEL 终止符会被误认为响铃。
 *
 * <p>本类不是线程安全的，调用方（进程句柄）需持有自己的锁。
 */
package club.ppmc.sessionhub.detect;

public class WaitingStateDetector {

    public enum Transition {
        NONE,
        STARTED_WAITING,
        STOPPED_WAITING
    }

    // 一个 OSC 标题不会超过这个长度，更长的未结束序列直接丢弃
    static final int MAX_CARRY = 4096;

    private final long clearThreshold;
    private final long bellGraceMillis;

    private String carry = "";

    private boolean waiting;
    private long bytesSinceBell;
    private long bellClearAfter;

    public WaitingStateDetector(long clearThreshold, long bellGraceMillis) {
        this.clearThreshold = clearThreshold;
        this.bellGraceMillis = bellGraceMillis;
    }

    public Transition onOutput(String chunk, long nowMillis) {
        String text = carry.isEmpty() ? chunk : carry + chunk;
        int cut = TerminalText.incompleteEscapeStart(text);
        if (cut >= 0) {
            String tail = text.substring(cut);
            carry = tail.length() <= MAX_CARRY ? tail : "";
            text = text.substring(0, cut);
        } else {
            carry = "";
        }
        return evaluate(text, nowMillis);
    }

    private Transition evaluate(String chunk, long nowMillis) {
        boolean bell = TerminalText.containsBareBell(chunk);
        if (!waiting) {
            if (bell) {
                waiting = true;
                bytesSinceBell = 0;
                bellClearAfter = nowMillis + bellGraceMillis;
                return Transition.STARTED_WAITING;
            }
            return Transition.NONE;
        }

        if (bell || nowMillis < bellClearAfter) {
            return Transition.NONE;
        }
        bytesSinceBell += TerminalText.countVisible(chunk);
        if (bytesSinceBell >= clearThreshold) {
            waiting = false;
            bytesSinceBell = 0;
            return Transition.STOPPED_WAITING;
        }
        return Transition.NONE;
    }

    /**
     * 直接设定状态。用于重新附加 tmux 后：此时拿不到响铃字节，只能根据面板文本推断，
     * 同时设置一个宽限期来吸收 tmux 附加时的整屏重绘。
     */
    public void seed(boolean waitingForInput, long nowMillis, long graceMillis) {
        this.waiting = waitingForInput;
        this.carry = "";
        this.bytesSinceBell = 0;
        this.bellClearAfter = nowMillis + graceMillis;
    }

    public boolean isWaiting() {
        return waiting;
    }

    public long getBytesSinceBell() {
        return bytesSinceBell;
    }

    public long getBellClearAfter() {
        return bellClearAfter;
    }
}
