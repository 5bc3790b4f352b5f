/**
 * WorkerMessage.java
 *
 * worker 通过其共享连接发给控制面的消息。各字段按 type 取用：
 * 注册消息带身份与能力，心跳带活跃会话列表，会话事件带会话 ID 以及对应的输出、退出码或尾部日志。
 */
package club.ppmc.sessionhub.model.protocol;

import club.ppmc.sessionhub.model.SessionStatus;
import club.ppmc.sessionhub.model.WorkerInfo;
import com.google.gson.JsonObject;
import java.util.List;

public record WorkerMessage(
        String type,
        String id,
        String name,
        String hostname,
        WorkerInfo.Capabilities capabilities,
        List<String> activeSessions,
        String sessionId,
        Long pid,
        String tmuxSessionName,
        JsonObject output,
        Integer exitCode,
        SessionStatus status,
        String outputLog) {}
