/**
 * ExitMessage.java
 *
 * 非有序的终止通知，用于会话已经处于终态时（查看者从记录存储拿到历史之后）。
 */
package club.ppmc.sessionhub.model.protocol;

import club.ppmc.sessionhub.model.SessionStatus;

public record ExitMessage(String type, Integer exitCode, SessionStatus status) {

    public ExitMessage(Integer exitCode, SessionStatus status) {
        this(MessageTypes.EXIT, exitCode, status);
    }
}
