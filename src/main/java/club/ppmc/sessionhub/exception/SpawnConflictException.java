/**
 * SpawnConflictException.java
 *
 * 当同一会话 ID 已经存在进程句柄（或正在启动）时抛出。
 * 监督器保证每个会话 ID 在本机上至多只有一个进程。
 */
package club.ppmc.sessionhub.exception;

import lombok.Getter;

@Getter
public class SpawnConflictException extends RuntimeException {

    private final String sessionId;

    public SpawnConflictException(String sessionId) {
        super("会话 " + sessionId + " 已在运行");
        this.sessionId = sessionId;
    }

    public SpawnConflictException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }
}
