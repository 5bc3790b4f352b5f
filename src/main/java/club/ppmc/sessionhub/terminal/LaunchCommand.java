/**
 * LaunchCommand.java
 *
 * 一条待执行的命令：可执行文件加参数列表。
 */
package club.ppmc.sessionhub.terminal;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public record LaunchCommand(String executable, List<String> args) {

    public LaunchCommand {
        args = List.copyOf(args);
    }

    public List<String> toList() {
        var all = new ArrayList<String>(args.size() + 1);
        all.add(executable);
        all.addAll(args);
        return all;
    }

    /**
     * 转换成一条 POSIX shell 命令行，每个参数都用单引号包裹。
     * tmux new-session 只接受一个由 shell 解释的字符串，提示词中可能含有任意字符。
     */
    public String toShellString() {
        return toList().stream().map(LaunchCommand::quote).collect(Collectors.joining(" "));
    }

    static String quote(String arg) {
        return "'" + arg.replace("'", "'\\''") + "'";
    }
}
