/**
 * StartupHealthJudge.java
 *
 * 判断一个新启动的会话是否“健康”：可见输出量超过阈值，或者输出中出现了可识别的启动/提示符文本。
 * 找不到可执行文件、参数错误等静默失败通常不会很快以非零码退出，只能靠这里识别。
 */
package club.ppmc.sessionhub.detect;

import club.ppmc.sessionhub.config.SessionHubProperties;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class StartupHealthJudge {

    private final long minVisibleChars;
    private final List<String> startupMarkers;

    @Autowired
    public StartupHealthJudge(SessionHubProperties properties) {
        this(properties.getHealth().getMinVisibleChars(), properties.getHealth().getStartupMarkers());
    }

    public StartupHealthJudge(long minVisibleChars, List<String> startupMarkers) {
        this.minVisibleChars = minVisibleChars;
        this.startupMarkers = startupMarkers.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
    }

    public boolean isHealthy(String output) {
        if (output == null || output.isEmpty()) {
            return false;
        }
        if (TerminalText.countVisible(output) > minVisibleChars) {
            return true;
        }
        String visible = TerminalText.stripControlSequences(output).toLowerCase(Locale.ROOT);
        return startupMarkers.stream().anyMatch(visible::contains);
    }
}
