/**
 * RecoveryFailureException.java
 *
 * tmux 会话无法重新附加。这是一个终态：会话只能通过上游显式创建新的续跑（resume）会话来继续。
 */
package club.ppmc.sessionhub.exception;

import lombok.Getter;

@Getter
public class RecoveryFailureException extends RuntimeException {

    private final String sessionId;

    public RecoveryFailureException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public RecoveryFailureException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }
}
