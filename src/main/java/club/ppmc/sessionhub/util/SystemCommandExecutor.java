/**
 * SystemCommandExecutor.java
 *
 * 以跨平台、安全的方式执行短小的外部系统命令（主要是 tmux 的管理命令）。
 * 它接受一个命令列表（而不是单个字符串）以避免因参数中存在空格或引号而导致的解析问题，
 * 并且每次执行都带有超时：一个卡住的外部命令不能拖住调用方。
 */
package club.ppmc.sessionhub.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SystemCommandExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemCommandExecutor.class);

    /** 命令无法启动、被中断或超时时使用的退出码。 */
    public static final int FAILED_TO_RUN = -1;

    /**
     * 同步执行一个系统命令并收集其全部输出（标准错误合并到标准输出）。
     *
     * @param commandList 要执行的命令及其参数列表 (e.g., ["tmux", "-L", "hub", "ls"])。
     * @param timeout 最长等待时间，超时后进程被强制终止。
     * @return 执行结果；命令无法执行时退出码为 {@link #FAILED_TO_RUN}。
     */
    public CommandResult run(List<String> commandList, Duration timeout) {
        if (commandList == null || commandList.isEmpty()) {
            return new CommandResult(FAILED_TO_RUN, "致命错误: 执行的命令不能为空。");
        }
        Process process;
        try {
            var processBuilder = new ProcessBuilder(commandList).redirectErrorStream(true); // 将错误流重定向到标准输出流
            processBuilder.environment().remove("TMUX");
            process = processBuilder.start();
        } catch (IOException e) {
            LOGGER.debug("无法启动命令 {}: {}", commandList, e.getMessage());
            return new CommandResult(FAILED_TO_RUN, e.getMessage());
        }

        // 在独立线程中读取输出，防止输出缓冲区写满导致子进程阻塞
        CompletableFuture<String> outputFuture = CompletableFuture.supplyAsync(() -> {
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("命令执行超时 ({} ms)，将强制终止: {}", timeout.toMillis(), String.join(" ", commandList));
                process.destroyForcibly();
                return new CommandResult(FAILED_TO_RUN, "timeout");
            }
            String output = outputFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            LOGGER.debug("命令 {} 执行完毕，退出码: {}", commandList, exitCode);
            return new CommandResult(exitCode, output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // 重新设置中断状态
            process.destroyForcibly();
            return new CommandResult(FAILED_TO_RUN, "interrupted");
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("读取命令 {} 的输出时出错: {}", commandList, e.getMessage());
            return new CommandResult(process.exitValue(), "");
        }
    }

    /**
     * 一次命令执行的结果。
     */
    public record CommandResult(int exitCode, String output) {
        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
