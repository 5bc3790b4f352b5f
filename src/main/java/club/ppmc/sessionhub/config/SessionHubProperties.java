/**
 * SessionHubProperties.java
 *
 * 应用的全部可调参数，绑定 application.properties 中的 app.* 配置。
 * 等待输入检测的阈值、宽限期以及启动健康检查的判断标准都是启发式参数，
 * 因此全部放在这里而不是写死在代码中。
 */
package club.ppmc.sessionhub.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app")
public class SessionHubProperties {

    private Supervisor supervisor = new Supervisor();
    private Agent agent = new Agent();
    private Ledger ledger = new Ledger();
    private Waiting waiting = new Waiting();
    private Health health = new Health();
    private Tmux tmux = new Tmux();
    private Store store = new Store();
    private Router router = new Router();
    private Worker worker = new Worker();

    @Data
    public static class Supervisor {
        /** 管理端访问进程监督器的 HTTP 地址。 */
        private String url = "http://localhost:8080";

        /** 启动时是否尝试恢复仍然存活的 tmux 会话。 */
        private boolean recoverOnStartup = true;

        /** 输出尾部的上限（字符数），超出部分从最旧处丢弃。 */
        private int maxOutputLog = 500 * 1024;

        /** 周期性持久化的间隔。 */
        private Duration flushInterval = Duration.ofSeconds(10);

        private int defaultCols = 120;
        private int defaultRows = 40;

        /** 查看者连接的发送超时与缓冲上限，超过后该查看者会被丢弃。 */
        private int viewerSendTimeLimitMs = 5_000;
        private int viewerBufferSizeLimit = 1024 * 1024;
    }

    @Data
    public static class Agent {
        /** Agent 命令行的可执行文件。 */
        private String command = "claude";

        /** plain 模式下启动的交互式 shell；为空时按操作系统选择。 */
        private List<String> shell = new ArrayList<>();
    }

    @Data
    public static class Ledger {
        /** 每个会话最多保留的未确认消息条数。 */
        private int maxEntries = 1000;

        /** 未确认消息的保留时间。 */
        private Duration ttl = Duration.ofMinutes(5);

        private Duration pruneInterval = Duration.ofMinutes(1);

        /** 账本落盘目录，每个会话一个 JSON Lines 文件。 */
        private String directory = "./data/ledger";
    }

    @Data
    public static class Waiting {
        /** 响铃之后需要收到多少个可见字符才认为进程已恢复输出。 */
        private int clearThreshold = 200;

        /** 响铃之后的宽限期，期间的重绘噪声不计入。 */
        private Duration bellGrace = Duration.ofSeconds(2);

        /** 重新附加 tmux 之后的宽限期，用于吸收整屏重绘。 */
        private Duration reattachGrace = Duration.ofSeconds(5);

        /** 恢复时扫描面板末尾的行数。 */
        private int promptScanLines = 15;

        /** 表示“正在等待确认”的文本片段（不区分大小写）。 */
        private List<String> confirmationPhrases = new ArrayList<>(List.of(
                "do you want to",
                "(y/n)",
                "[y/n]",
                "yes, and don't ask again",
                "press enter to continue",
                "allow this",
                "continue?",
                "proceed?"));
    }

    @Data
    public static class Health {
        /** 启动后多久进行健康检查。 */
        private Duration checkDelay = Duration.ofSeconds(30);

        /** 可见字符超过该值即认为健康。 */
        private int minVisibleChars = 100;

        /** 出现任一片段即认为进程已正常启动（不区分大小写）。 */
        private List<String> startupMarkers = new ArrayList<>(List.of(
                "claude",
                "welcome",
                "type your",
                "? for shortcuts",
                "> ",
                "$ "));
    }

    @Data
    public static class Tmux {
        /** tmux 可执行文件。 */
        private String executable = "tmux";

        /** 私有的 tmux socket 名，避免与用户自己的 tmux 会话混在一起。 */
        private String socketName = "session-hub";

        /** tmux 会话名前缀，恢复时据此识别本服务创建的会话。 */
        private String sessionPrefix = "sh-";

        /** 可选的 tmux 配置文件路径。 */
        private String configFile;

        /** 单条 tmux 命令的超时时间。 */
        private Duration commandTimeout = Duration.ofSeconds(5);

        /** tmux new-session 的命令长度上限，超出时改为写启动脚本。 */
        private int commandLengthLimit = 1500;
    }

    @Data
    public static class Store {
        /** 会话记录 JSON 文件所在目录。 */
        private String directory = "./data/sessions";
    }

    @Data
    public static class Router {
        /** 孤儿会话清理的周期。 */
        private Duration cleanupInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Worker {
        /** 超过该时间没有心跳的 worker 会被移除。 */
        private Duration staleTimeout = Duration.ofSeconds(90);

        private Duration pruneInterval = Duration.ofSeconds(30);
    }
}
