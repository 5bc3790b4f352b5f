/**
 * AppConfig.java
 *
 * 应用级别的 Bean 定义。
 * RestTemplate 供管理端调用进程监督器的 HTTP 接口，Gson 用于所有 WebSocket 消息的序列化，
 * WebSocketClient 供路由器建立到监督器查看者端点的上游连接。
 */
package club.ppmc.sessionhub.config;

import com.google.gson.Gson;
import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

@Configuration
public class AppConfig {

    /**
     * 调用监督器的 HTTP 客户端。设置有限的超时，监督器无响应时尽快判定为不可达。
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    /**
     * 全局 Gson，默认不输出 null 字段。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }

    @Bean
    public WebSocketClient webSocketClient() {
        return new StandardWebSocketClient();
    }
}
