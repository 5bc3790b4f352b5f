/**
 * TmuxMultiplexer.java
 *
 * 使用 tmux 实现的 {@link TerminalMultiplexer}。
 * 所有命令都走一个私有 socket（-L），会话名带统一前缀，因此不会与用户自己的 tmux 会话互相干扰。
 *
 * <p>tmux 客户端退出时总是返回 0，拿不到会话内命令的退出码。
 * 因此启动时让 shell 在命令结束后把退出码写入一个状态文件，监督器在客户端退出后读取它。
 */
package club.ppmc.sessionhub.terminal;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.util.SystemCommandExecutor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@Slf4j
public class TmuxMultiplexer implements TerminalMultiplexer {

    private final SystemCommandExecutor executor;
    private final TerminalLauncher launcher;
    private final SessionHubProperties.Tmux config;
    private final Path stateDir;
    private volatile Boolean available;

    public TmuxMultiplexer(SystemCommandExecutor executor, TerminalLauncher launcher, SessionHubProperties properties) {
        this.executor = executor;
        this.launcher = launcher;
        this.config = properties.getTmux();
        this.stateDir = Paths.get(System.getProperty("java.io.tmpdir"), "session-hub-" + config.getSocketName());
    }

    @Override
    public boolean isAvailable() {
        Boolean cached = available;
        if (cached == null) {
            var result = executor.run(List.of(config.getExecutable(), "-V"), config.getCommandTimeout());
            cached = result.isSuccess();
            available = cached;
            log.info(cached ? "检测到 tmux: {}" : "未检测到 tmux，会话将不会在服务重启后保留。{}", result.output().trim());
        }
        return cached;
    }

    @Override
    public String sessionName(String sessionId) {
        return config.getSessionPrefix() + sessionId;
    }

    @Override
    public void createSession(String name, LaunchCommand command, String cwd, int cols, int rows) throws IOException {
        Files.createDirectories(stateDir);
        Path statusFile = statusFile(name);
        Files.deleteIfExists(statusFile);

        String shellCommand = command.toShellString() + "; echo $? > " + LaunchCommand.quote(statusFile.toString());
        Path script = null;
        if (shellCommand.length() > config.getCommandLengthLimit()) {
            // tmux new-session 的命令长度有限，长提示词改为写入启动脚本
            script = stateDir.resolve(name + ".sh");
            Files.writeString(script,
                    "#!/bin/sh\ncd " + LaunchCommand.quote(cwd) + "\n" + shellCommand + "\n",
                    StandardCharsets.UTF_8);
            script.toFile().setExecutable(true);
            shellCommand = LaunchCommand.quote(script.toString());
        }

        var args = new ArrayList<String>();
        if (StringUtils.hasText(config.getConfigFile())) {
            args.addAll(List.of("-f", config.getConfigFile()));
        }
        args.addAll(List.of(
                "new-session", "-d",
                "-s", name,
                "-x", String.valueOf(cols),
                "-y", String.valueOf(rows),
                "-c", cwd,
                shellCommand));
        var result = executor.run(tmux(args), config.getCommandTimeout());
        if (!result.isSuccess()) {
            if (script != null) {
                Files.deleteIfExists(script);
            }
            throw new IOException("创建 tmux 会话 " + name + " 失败: " + result.output());
        }
        log.info("已创建 tmux 会话 {} (工作目录: {})", name, cwd);
    }

    @Override
    public TerminalProcess attach(String name, int cols, int rows) throws IOException {
        if (!exists(name)) {
            throw new IOException("tmux 会话 " + name + " 不存在");
        }
        String home = System.getProperty("user.home");
        return launcher.launch(tmux(List.of("attach-session", "-t", name)), home, cols, rows);
    }

    @Override
    public boolean exists(String name) {
        return executor.run(tmux(List.of("has-session", "-t", name)), config.getCommandTimeout()).isSuccess();
    }

    @Override
    public void kill(String name) {
        var result = executor.run(tmux(List.of("kill-session", "-t", name)), config.getCommandTimeout());
        if (result.isSuccess()) {
            log.info("已结束 tmux 会话 {}", name);
        }
        cleanupState(name);
    }

    @Override
    public Optional<String> capturePane(String name) {
        var result = executor.run(
                tmux(List.of("capture-pane", "-t", name, "-p", "-S", "-")), config.getCommandTimeout());
        return result.isSuccess() ? Optional.of(result.output()) : Optional.empty();
    }

    @Override
    public List<String> listSessionIds() {
        var result = executor.run(
                tmux(List.of("list-sessions", "-F", "#{session_name}")), config.getCommandTimeout());
        if (!result.isSuccess()) {
            // 没有任何会话时 tmux server 不存在，同样返回非零
            return List.of();
        }
        String prefix = config.getSessionPrefix();
        return Arrays.stream(result.output().split("\n"))
                .map(String::trim)
                .filter(s -> s.startsWith(prefix))
                .map(s -> s.substring(prefix.length()))
                .toList();
    }

    @Override
    public void detachClients(String name) {
        executor.run(tmux(List.of("detach-client", "-s", name)), config.getCommandTimeout());
    }

    @Override
    public OptionalInt exitStatus(String name) {
        Path statusFile = statusFile(name);
        try {
            if (!Files.exists(statusFile)) {
                return OptionalInt.empty();
            }
            String text = Files.readString(statusFile, StandardCharsets.UTF_8).trim();
            cleanupState(name);
            return OptionalInt.of(Integer.parseInt(text));
        } catch (IOException | NumberFormatException e) {
            log.warn("读取 tmux 会话 {} 的退出码失败: {}", name, e.getMessage());
            return OptionalInt.empty();
        }
    }

    private List<String> tmux(List<String> args) {
        var command = new ArrayList<String>(args.size() + 3);
        command.add(config.getExecutable());
        command.add("-L");
        command.add(config.getSocketName());
        command.addAll(args);
        return command;
    }

    private Path statusFile(String name) {
        return stateDir.resolve(name + ".exit");
    }

    private void cleanupState(String name) {
        try {
            Files.deleteIfExists(statusFile(name));
            Files.deleteIfExists(stateDir.resolve(name + ".sh"));
        } catch (IOException e) {
            log.debug("清理 tmux 会话 {} 的状态文件失败: {}", name, e.getMessage());
        }
    }
}
