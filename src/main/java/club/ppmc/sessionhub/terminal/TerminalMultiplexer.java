/**
 * TerminalMultiplexer.java
 *
 * 可分离的终端复用器（tmux）。进程运行在复用器的会话里，服务重启后仍然存活，
 * 之后可以重新附加一个新的 PTY 客户端继续观察它。
 *
 * <p>复用器是可选能力：{@link #isAvailable()} 为 false 时监督器直接在 PTY 上启动进程，
 * 其余方法都不应被调用。
 */
package club.ppmc.sessionhub.terminal;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

public interface TerminalMultiplexer {

    boolean isAvailable();

    /** 由会话 ID 得到复用器中的会话名。 */
    String sessionName(String sessionId);

    /** 创建一个分离状态的会话并在其中运行命令。 */
    void createSession(String name, LaunchCommand command, String cwd, int cols, int rows) throws IOException;

    /** 附加一个新的 PTY 客户端。客户端退出不会结束会话。 */
    TerminalProcess attach(String name, int cols, int rows) throws IOException;

    boolean exists(String name);

    void kill(String name);

    /** 抓取整个面板（含回滚历史）的文本。 */
    Optional<String> capturePane(String name);

    /** 本服务创建且仍然存活的会话，返回会话 ID（已去掉前缀）。 */
    List<String> listSessionIds();

    /** 分离会话上的所有客户端，会话本身保留。 */
    void detachClients(String name);

    /** 会话中命令的真实退出码；命令尚未结束或无法得知时为空。 */
    OptionalInt exitStatus(String name);
}
