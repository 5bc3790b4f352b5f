/**
 * PtyTerminalProcess.java
 *
 * {@link TerminalProcess} 的 pty4j 实现。
 */
package club.ppmc.sessionhub.terminal;

import com.pty4j.PtyProcess;
import com.pty4j.WinSize;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PtyTerminalProcess implements TerminalProcess {

    private final PtyProcess process;
    private final Writer writer;

    public PtyTerminalProcess(PtyProcess process) {
        this.process = process;
        this.writer = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
    }

    @Override
    public InputStream getOutput() {
        return process.getInputStream();
    }

    @Override
    public synchronized void write(String data) throws IOException {
        writer.write(data);
        writer.flush();
    }

    @Override
    public void resize(int cols, int rows) {
        try {
            process.setWinSize(new WinSize(cols, rows));
        } catch (IllegalStateException e) {
            // 进程已退出
            log.debug("调整终端大小失败 (PID {}): {}", process.pid(), e.getMessage());
        }
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return process.onExit().thenApply(Process::exitValue);
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public void destroy() {
        if (process.isAlive()) {
            process.destroy();
        }
    }
}
