package club.ppmc.sessionhub.service;

import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

/** 模拟查看者连接，并取出发给它的 JSON 消息。 */
final class TestViewers {

    private TestViewers() {}

    static WebSocketSession open(String id) {
        WebSocketSession viewer = mock(WebSocketSession.class);
        when(viewer.getId()).thenReturn(id);
        when(viewer.isOpen()).thenReturn(true);
        return viewer;
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    static List<JsonObject> sent(WebSocketSession viewer) {
        ArgumentCaptor<WebSocketMessage> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        try {
            verify(viewer, atLeast(0)).sendMessage(captor.capture());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return captor.getAllValues().stream()
                .map(m -> JsonParser.parseString(String.valueOf(m.getPayload())).getAsJsonObject())
                .toList();
    }

    static List<String> types(WebSocketSession viewer) {
        return sent(viewer).stream().map(TestViewers::typeOf).toList();
    }

    /** sequenced_output 取内容的 kind，其余取 type。 */
    static String typeOf(JsonObject message) {
        String type = message.get("type").getAsString();
        return "sequenced_output".equals(type) ? message.getAsJsonObject("content").get("kind").getAsString() : type;
    }
}
