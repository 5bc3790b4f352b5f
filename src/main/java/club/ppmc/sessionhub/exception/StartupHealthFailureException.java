/**
 * StartupHealthFailureException.java
 *
 * 启动健康检查判定会话在宽限期内没有产生可信输出（例如找不到可执行文件或参数错误），
 * 会话已被强制终止。该异常只用于记录日志和携带诊断信息，不会抛给调用方。
 */
package club.ppmc.sessionhub.exception;

import lombok.Getter;

@Getter
public class StartupHealthFailureException extends RuntimeException {

    private final String sessionId;
    private final long visibleChars;

    public StartupHealthFailureException(String sessionId, long visibleChars) {
        super(String.format("会话 %s 在启动宽限期内没有产生可信输出 (可见字符: %d)，已强制终止", sessionId, visibleChars));
        this.sessionId = sessionId;
        this.visibleChars = visibleChars;
    }
}
