/**
 * ProcessUnavailableException.java
 *
 * 进程或进程监督器不可用。
 * 这里的存活状态总是 UNKNOWN（例如监督器不可达）：已确认不存在的进程由正常的响应表达，
 * 不走异常。清理流程绝不会因为 UNKNOWN 而把会话标记为失败。
 */
package club.ppmc.sessionhub.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class ProcessUnavailableException extends RuntimeException {

    public enum Liveness {
        UNKNOWN
    }

    private final String sessionId;
    private final Liveness liveness;

    public ProcessUnavailableException(String message, String sessionId, Liveness liveness, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
        this.liveness = liveness;
    }

    public static ProcessUnavailableException unreachable(String sessionId, Throwable cause) {
        return new ProcessUnavailableException(
                "进程监督器不可达: " + (cause != null ? cause.getMessage() : "未知原因"),
                sessionId,
                Liveness.UNKNOWN,
                cause);
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "error", getMessage(),
                "liveness", liveness.name().toLowerCase(),
                "sessionId", sessionId != null ? sessionId : "");
    }
}
