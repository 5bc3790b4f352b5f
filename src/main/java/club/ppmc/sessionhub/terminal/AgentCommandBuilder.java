/**
 * AgentCommandBuilder.java
 *
 * 根据权限模式和续跑信息构造要执行的命令行。
 *
 * <ul>
 *   <li>续跑：{@code claude --resume <id> [prompt]}</li>
 *   <li>interactive：{@code claude [--session-id id] [--allowedTools t] [prompt]}</li>
 *   <li>auto：{@code claude -p <prompt> --output-format stream-json --verbose [--session-id id] [--allowedTools t]}</li>
 *   <li>yolo：{@code claude -p <prompt> --dangerously-skip-permissions [--session-id id]}</li>
 *   <li>plain：配置的交互式 shell，不涉及 Agent 命令行</li>
 * </ul>
 */
package club.ppmc.sessionhub.terminal;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.model.PermissionProfile;
import club.ppmc.sessionhub.model.SpawnRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class AgentCommandBuilder {

    private static final boolean IS_WINDOWS =
            System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");

    private final SessionHubProperties.Agent config;

    public AgentCommandBuilder(SessionHubProperties properties) {
        this.config = properties.getAgent();
    }

    public LaunchCommand build(SpawnRequest request) {
        if (StringUtils.hasText(request.resumeAgentSessionId())) {
            var args = new ArrayList<String>(List.of("--resume", request.resumeAgentSessionId()));
            if (StringUtils.hasText(request.prompt())) {
                args.add(request.prompt());
            }
            return new LaunchCommand(config.getCommand(), args);
        }

        PermissionProfile profile = request.permissionProfile();
        return switch (profile) {
            case PLAIN -> shell();
            case INTERACTIVE -> interactive(request);
            case AUTO -> auto(request);
            case YOLO -> yolo(request);
        };
    }

    private LaunchCommand interactive(SpawnRequest request) {
        var args = new ArrayList<String>();
        addSessionId(args, request);
        addAllowedTools(args, request);
        if (StringUtils.hasText(request.prompt())) {
            args.add(request.prompt());
        }
        return new LaunchCommand(config.getCommand(), args);
    }

    private LaunchCommand auto(SpawnRequest request) {
        var args = new ArrayList<String>(List.of(
                "-p", nullToEmpty(request.prompt()), "--output-format", "stream-json", "--verbose"));
        addSessionId(args, request);
        addAllowedTools(args, request);
        return new LaunchCommand(config.getCommand(), args);
    }

    private LaunchCommand yolo(SpawnRequest request) {
        var args = new ArrayList<String>(List.of("-p", nullToEmpty(request.prompt()), "--dangerously-skip-permissions"));
        addSessionId(args, request);
        return new LaunchCommand(config.getCommand(), args);
    }

    private LaunchCommand shell() {
        List<String> shell = config.getShell();
        if (shell == null || shell.isEmpty()) {
            shell = IS_WINDOWS ? List.of("cmd.exe") : List.of("bash", "-i");
        }
        return new LaunchCommand(shell.get(0), shell.subList(1, shell.size()));
    }

    private static void addSessionId(List<String> args, SpawnRequest request) {
        if (StringUtils.hasText(request.agentSessionId())) {
            args.add("--session-id");
            args.add(request.agentSessionId());
        }
    }

    private static void addAllowedTools(List<String> args, SpawnRequest request) {
        if (StringUtils.hasText(request.allowedTools())) {
            args.add("--allowedTools");
            args.add(request.allowedTools());
        }
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
