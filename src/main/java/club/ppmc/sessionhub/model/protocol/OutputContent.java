/**
 * OutputContent.java
 *
 * 一条有序输出消息的内容部分。不同 kind 只使用其中的部分字段，其余为 null，
 * Gson 序列化时会自动省略 null 字段。
 */
package club.ppmc.sessionhub.model.protocol;

import club.ppmc.sessionhub.model.SessionStatus;

public record OutputContent(
        String kind, String data, Integer exitCode, SessionStatus status, Boolean waiting) {

    public static final String KIND_OUTPUT = "output";
    public static final String KIND_EXIT = "exit";
    public static final String KIND_WAITING_STATE = "waiting_state";

    public static OutputContent output(String data) {
        return new OutputContent(KIND_OUTPUT, data, null, null, null);
    }

    public static OutputContent exit(int exitCode, SessionStatus status) {
        return new OutputContent(KIND_EXIT, null, exitCode, status, null);
    }

    public static OutputContent waitingState(boolean waiting) {
        return new OutputContent(KIND_WAITING_STATE, null, null, null, waiting);
    }
}
