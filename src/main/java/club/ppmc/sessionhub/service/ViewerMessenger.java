/**
 * ViewerMessenger.java
 *
 * 统一的 WebSocket 消息发送出口。
 * 所有发往查看者、上游连接和 worker 的消息都经由这里用 Gson 序列化后发送，
 * 发送失败只返回 false 并记录日志，由调用方决定是否丢弃该连接。
 */
package club.ppmc.sessionhub.service;

import com.google.gson.Gson;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@Service
@Slf4j
public class ViewerMessenger {

    private final Gson gson;

    public ViewerMessenger(Gson gson) {
        this.gson = gson;
    }

    public String toJson(Object message) {
        return gson.toJson(message);
    }

    /**
     * 序列化并发送一个消息对象。
     *
     * @return 发送成功返回 true；连接已关闭或发送出错返回 false。
     */
    public boolean send(WebSocketSession session, Object message) {
        return sendRaw(session, gson.toJson(message));
    }

    /**
     * 原样发送一个已经序列化好的 JSON 文本。
     * 查看者连接被 ConcurrentWebSocketSessionDecorator 包装，超出发送时限或缓冲上限时会抛出运行时异常，
     * 同样视为发送失败。
     */
    public boolean sendRaw(WebSocketSession session, String payload) {
        if (session == null || !session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(payload));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("向连接 {} 发送消息失败: {}", session.getId(), e.getMessage());
            return false;
        }
    }

    /** 关闭连接，关闭时的错误只记录日志。 */
    public void close(WebSocketSession session, CloseStatus status) {
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("关闭连接 {} 时出错: {}", session.getId(), e.getMessage());
        }
    }
}
