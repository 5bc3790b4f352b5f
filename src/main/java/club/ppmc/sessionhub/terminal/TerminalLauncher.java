/**
 * TerminalLauncher.java
 *
 * 在伪终端中启动一个命令。
 */
package club.ppmc.sessionhub.terminal;

import java.io.IOException;
import java.util.List;

public interface TerminalLauncher {

    TerminalProcess launch(List<String> command, String cwd, int cols, int rows) throws IOException;
}
