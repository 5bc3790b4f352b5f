/**
 * HistoryMessage.java
 *
 * 查看者连接时立即收到的完整历史快照。
 * lastInputAckSeq 让客户端从正确的位置继续输入序号；waiting 为当前的等待输入标志。
 */
package club.ppmc.sessionhub.model.protocol;

public record HistoryMessage(String type, String data, Long lastInputAckSeq, Boolean waiting) {

    public HistoryMessage(String data, Long lastInputAckSeq, Boolean waiting) {
        this(MessageTypes.HISTORY, data, lastInputAckSeq, waiting);
    }

    public static HistoryMessage of(String data) {
        return new HistoryMessage(data != null ? data : "", null, null);
    }
}
