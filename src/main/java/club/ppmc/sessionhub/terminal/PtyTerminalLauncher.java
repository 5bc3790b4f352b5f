/**
 * PtyTerminalLauncher.java
 *
 * 基于 pty4j 的伪终端启动器。
 * 与普通的 ProcessBuilder 不同，PTY 让子进程认为自己连接在一个真实终端上，
 * 交互式程序（Agent 命令行、bash -i、tmux 客户端）才会输出颜色、光标控制和响铃。
 */
package club.ppmc.sessionhub.terminal;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class PtyTerminalLauncher implements TerminalLauncher {

    @Override
    public TerminalProcess launch(List<String> command, String cwd, int cols, int rows) throws IOException {
        var env = new HashMap<>(System.getenv());
        env.put("TERM", "xterm-256color");
        env.putIfAbsent("LANG", "en_US.UTF-8");
        // 服务本身运行在 tmux 中时，附加客户端会拒绝嵌套
        env.remove("TMUX");

        PtyProcess process = new PtyProcessBuilder(command.toArray(String[]::new))
                .setDirectory(cwd)
                .setEnvironment(env)
                .setInitialColumns(cols)
                .setInitialRows(rows)
                .setRedirectErrorStream(true)
                .start();
        log.info("已在目录 {} 中启动 PTY 进程 (PID: {}, {}x{}): {}", cwd, process.pid(), cols, rows, String.join(" ", command));
        return new PtyTerminalProcess(process);
    }
}
