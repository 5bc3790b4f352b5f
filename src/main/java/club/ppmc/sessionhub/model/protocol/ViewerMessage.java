/**
 * ViewerMessage.java
 *
 * 查看者发来的任意消息。不同 type 使用不同的字段：
 * sequenced_input 使用 seq/content，output_ack 使用 ackSeq，replay_request 使用 fromSeq，
 * 旧版的 input/resize/kill 直接使用 data/cols/rows。
 */
package club.ppmc.sessionhub.model.protocol;

public record ViewerMessage(
        String type,
        Long seq,
        InputContent content,
        Long ackSeq,
        Long fromSeq,
        String data,
        Integer cols,
        Integer rows) {}
