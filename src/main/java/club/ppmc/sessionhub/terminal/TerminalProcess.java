/**
 * TerminalProcess.java
 *
 * 一个运行在伪终端上的进程。监督器只通过这个接口与进程交互，
 * 具体实现可以是直接启动的 PTY 进程，也可以是附加到 tmux 会话上的 PTY 客户端。
 */
package club.ppmc.sessionhub.terminal;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

public interface TerminalProcess {

    /** 终端输出流（PTY 会合并 stdout 与 stderr）。 */
    InputStream getOutput();

    void write(String data) throws IOException;

    void resize(int cols, int rows);

    /** 进程退出时以退出码完成。 */
    CompletableFuture<Integer> onExit();

    long pid();

    void destroy();
}
