/**
 * InputAck.java
 *
 * 对查看者有序输入的确认。无论该序号是否重复，都会回复确认，发送方可以安全重传。
 */
package club.ppmc.sessionhub.model.protocol;

public record InputAck(String type, String sessionId, long ackSeq) {

    public InputAck(String sessionId, long ackSeq) {
        this(MessageTypes.INPUT_ACK, sessionId, ackSeq);
    }
}
