/**
 * SessionRecord.java
 *
 * 会话的持久化记录，由进程监督器与记录存储共同维护。
 * 它是一个可变的 POJO，以便于 Jackson 读写记录文件；
 * 存储层对外只返回副本（{@link #copy()}），修改必须通过存储的原子更新完成。
 */
package club.ppmc.sessionhub.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    private String id;

    @Builder.Default
    private SessionStatus status = SessionStatus.PENDING;

    @Builder.Default
    private PermissionProfile permissionProfile = PermissionProfile.INTERACTIVE;

    private Long processId;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Integer exitCode;

    /** 输出的有界尾部（最多 MAX_OUTPUT_LOG 个字符）。 */
    private String outputLog;

    /** 真实的累计输出字节数，不受尾部上限影响。 */
    private long outputBytes;

    private long lastOutputSeq;
    private long lastInputSeq;

    /** 如果会话被路由到远程 worker，这里记录 worker 的 ID。 */
    private String workerId;

    /** 如果会话运行在可分离的 tmux 会话中，这里记录 tmux 会话名。 */
    private String multiplexName;

    /** 续跑会话的来源会话。 */
    private String parentSessionId;

    // --- 派发时的输入，供续跑（resume）重建命令使用 ---
    private String cwd;
    private String prompt;
    private String allowedTools;
    private String agentSessionId;

    public SessionRecord copy() {
        return toBuilder().build();
    }
}
