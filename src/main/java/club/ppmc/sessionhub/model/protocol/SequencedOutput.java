/**
 * SequencedOutput.java
 *
 * 发往查看者的有序输出信封：携带会话 ID、会话内严格递增的序号和时间戳。
 */
package club.ppmc.sessionhub.model.protocol;

public record SequencedOutput(
        String type, String sessionId, long seq, OutputContent content, String timestamp) {

    public SequencedOutput(String sessionId, long seq, OutputContent content, String timestamp) {
        this(MessageTypes.SEQUENCED_OUTPUT, sessionId, seq, content, timestamp);
    }
}
