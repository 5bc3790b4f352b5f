/**
 * ConfirmationPromptDetector.java
 *
 * 重新附加 tmux 时没有响铃字节可用，只能扫描面板末尾几行，
 * 看是否有交互式确认的措辞（例如 "Do you want to ..."、"(y/n)"），以此推断是否正在等待输入。
 */
package club.ppmc.sessionhub.detect;

import club.ppmc.sessionhub.config.SessionHubProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class ConfirmationPromptDetector {

    private final int scanLines;
    private final List<String> phrases;

    @Autowired
    public ConfirmationPromptDetector(SessionHubProperties properties) {
        this(properties.getWaiting().getPromptScanLines(), properties.getWaiting().getConfirmationPhrases());
    }

    public ConfirmationPromptDetector(int scanLines, List<String> phrases) {
        this.scanLines = scanLines;
        this.phrases = phrases.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    }

    public boolean looksLikeWaitingForConfirmation(String paneContent) {
        if (paneContent == null || paneContent.isBlank()) {
            return false;
        }
        String tail = String.join("\n", lastNonBlankLines(TerminalText.stripControlSequences(paneContent)))
                .toLowerCase(Locale.ROOT);
        return phrases.stream().anyMatch(tail::contains);
    }

    private List<String> lastNonBlankLines(String text) {
        String[] lines = text.split("\r?\n|\r");
        var picked = new ArrayList<String>();
        for (int i = lines.length - 1; i >= 0 && picked.size() < scanLines; i--) {
            if (!lines[i].isBlank()) {
                picked.add(0, lines[i]);
            }
        }
        return picked;
    }
}
