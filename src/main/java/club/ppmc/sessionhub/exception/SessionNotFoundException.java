/**
 * SessionNotFoundException.java
 *
 * 记录存储中找不到指定会话时抛出。
 */
package club.ppmc.sessionhub.exception;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("会话不存在: " + sessionId);
        this.sessionId = sessionId;
    }
}
