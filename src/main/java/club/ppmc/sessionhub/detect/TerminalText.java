/**
 * TerminalText.java
 *
 * 处理原始终端输出的纯函数工具。
 * 终端输出中混有大量控制序列（CSI 光标移动、OSC 标题设置、字符集切换等），
 * 等待输入检测、启动健康检查和恢复时的提示词识别都需要先把它们剥离，只看“可见”内容。
 *
 * 注意 BEL(0x07) 有两种含义：单独出现时是响铃，出现在 OSC 序列末尾时只是终止符
 * （例如 ESC ] 0 ; title BEL）。只有前者才算响铃。
 */
package club.ppmc.sessionhub.detect;

public final class TerminalText {

    public static final char BEL = 0x07;
    private static final char ESC = 0x1B;
    private static final char CSI_8BIT = 0x9B;
    private static final char DEL = 0x7F;

    private TerminalText() {}

    /**
     * 剥离所有转义序列和除换行、回车、制表符以外的 C0 控制字符。
     */
    public static String stripControlSequences(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        var out = new StringBuilder(raw.length());
        scan(raw, out);
        return out.toString();
    }

    /**
     * 是否包含单独出现的 BEL（不计 OSC 终止符）。
     */
    public static boolean containsBareBell(String raw) {
        if (raw == null || raw.indexOf(BEL) < 0) {
            return false;
        }
        return scan(raw, null);
    }

    /**
     * 末尾未结束的转义序列的起始下标，没有则返回 -1。
     * 输出按块读取，一个 OSC 序列可能被拆在两块之间，调用方需要把这一段留到下一块再判断。
     */
    public static int incompleteEscapeStart(String raw) {
        if (raw == null) {
            return -1;
        }
        int n = raw.length();
        int i = 0;
        while (i < n) {
            char c = raw.charAt(i);
            int end;
            if (c == ESC) {
                if (i + 1 >= n) {
                    return i;
                }
                end = switch (raw.charAt(i + 1)) {
                    case '[' -> skipCsi(raw, i + 2);
                    case ']' -> skipControlString(raw, i + 2, true);
                    case 'P', 'X', '^', '_' -> skipControlString(raw, i + 2, false);
                    case '(', ')', '*', '+', '#', '%' -> i + 3 <= n ? i + 3 : -1;
                    default -> i + 2;
                };
            } else if (c == CSI_8BIT) {
                end = skipCsi(raw, i + 1);
            } else {
                i++;
                continue;
            }
            if (end < 0) {
                return i;
            }
            i = end;
        }
        return -1;
    }

    /**
     * 可见字符数：剥离控制序列后，非空白字符的个数。
     * 空白字符不计入，因为重绘时的填充空格不代表真正的新输出。
     */
    public static long countVisible(String raw) {
        if (raw == null || raw.isEmpty()) {
            return 0;
        }
        String stripped = stripControlSequences(raw);
        long count = 0;
        for (int i = 0; i < stripped.length(); i++) {
            if (!Character.isWhitespace(stripped.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    /**
     * 单次扫描：跳过转义序列，把可见字符写入 {@code out}（可为 null），返回是否遇到单独的 BEL。
     */
    private static boolean scan(String s, StringBuilder out) {
        boolean bell = false;
        int n = s.length();
        int i = 0;
        while (i < n) {
            char c = s.charAt(i);
            if (c == ESC) {
                if (i + 1 >= n) {
                    break;
                }
                char next = s.charAt(i + 1);
                switch (next) {
                    case '[' -> i = orEnd(skipCsi(s, i + 2), n);
                    case ']' -> i = orEnd(skipControlString(s, i + 2, true), n);
                    case 'P', 'X', '^', '_' -> i = orEnd(skipControlString(s, i + 2, false), n);
                    case '(', ')', '*', '+', '#', '%' -> i = Math.min(n, i + 3);
                    default -> i += 2;
                }
                continue;
            }
            if (c == CSI_8BIT) {
                i = orEnd(skipCsi(s, i + 1), n);
                continue;
            }
            if (c == BEL) {
                bell = true;
                i++;
                continue;
            }
            if ((c < 0x20 && c != '\n' && c != '\r' && c != '\t') || c == DEL) {
                i++;
                continue;
            }
            if (out != null) {
                out.append(c);
            }
            i++;
        }
        return bell;
    }

    private static int orEnd(int end, int length) {
        return end < 0 ? length : end;
    }

    // CSI: 参数字节与中间字节，直到 0x40-0x7E 的终止字节；未结束返回 -1
    private static int skipCsi(String s, int from) {
        int i = from;
        while (i < s.length()) {
            char ch = s.charAt(i++);
            if (ch >= 0x40 && ch <= 0x7E) {
                return i;
            }
        }
        return -1;
    }

    // OSC/DCS 等控制串：以 ST (ESC \) 结束，OSC 也可以用 BEL 结束；未结束返回 -1
    private static int skipControlString(String s, int from, boolean belTerminates) {
        int i = from;
        while (i < s.length()) {
            char ch = s.charAt(i);
            if (belTerminates && ch == BEL) {
                return i + 1;
            }
            if (ch == ESC && i + 1 < s.length() && s.charAt(i + 1) == '\\') {
                return i + 2;
            }
            i++;
        }
        return -1;
    }
}
