/**
 * SpawnFailureException.java
 *
 * 进程无法启动（可执行文件不存在、工作目录无效、tmux 会话创建失败等）。
 * 启动是同步的，这个异常直接返回给调用方，对应的会话记录会被标记为 failed。
 */
package club.ppmc.sessionhub.exception;

import lombok.Getter;

@Getter
public class SpawnFailureException extends RuntimeException {

    private final String sessionId;

    public SpawnFailureException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }
}
