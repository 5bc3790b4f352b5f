/**
 * SupervisorClient.java
 *
 * 管理端调用进程监督器 HTTP 接口的客户端。
 * 监督器与管理端可以部署在同一进程内，也可以是不同主机；两者之间只通过 HTTP 与 WebSocket 通信。
 *
 * <p>区分“不可达”（网络错误，存活状态未知）与“明确拒绝”（409/404 等）：
 * 前者绝不能被当成会话已经死亡的证据。
 */
package club.ppmc.sessionhub.service;

import club.ppmc.sessionhub.config.SessionHubProperties;
import club.ppmc.sessionhub.exception.ProcessUnavailableException;
import club.ppmc.sessionhub.exception.SpawnConflictException;
import club.ppmc.sessionhub.exception.SpawnFailureException;
import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SpawnRequest;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Service
@Slf4j
public class SupervisorClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public SupervisorClient(RestTemplate restTemplate, SessionHubProperties properties) {
        this.restTemplate = restTemplate;
        String url = properties.getSupervisor().getUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * 请求监督器启动一个会话。
     *
     * @throws ProcessUnavailableException 监督器不可达。
     * @throws SpawnConflictException 会话已在运行。
     * @throws SpawnFailureException 监督器拒绝或启动失败。
     */
    public SessionRecord spawn(SpawnRequest request) {
        try {
            return restTemplate.postForObject(baseUrl + "/api/supervisor/spawn", request, SessionRecord.class);
        } catch (ResourceAccessException e) {
            throw ProcessUnavailableException.unreachable(request.sessionId(), e);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                throw new SpawnConflictException(request.sessionId());
            }
            throw new SpawnFailureException(
                    request.sessionId(), "监督器拒绝启动会话: " + e.getResponseBodyAsString(), e);
        }
    }

    /**
     * @return 监督器终止了该会话返回 true；会话在监督器上不活跃返回 false。
     * @throws ProcessUnavailableException 监督器不可达。
     */
    public boolean kill(String sessionId) {
        try {
            restTemplate.postForEntity(baseUrl + "/api/supervisor/kill/{id}", null, Map.class, sessionId);
            return true;
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return false;
            }
            throw new ProcessUnavailableException(
                    "监督器终止会话失败: " + e.getStatusCode(), sessionId,
                    ProcessUnavailableException.Liveness.UNKNOWN, e);
        } catch (ResourceAccessException e) {
            throw ProcessUnavailableException.unreachable(sessionId, e);
        }
    }

    /**
     * 监督器上当前活跃的会话 ID。监督器不可达时为空，调用方必须把它当作“未知”而不是“没有会话”。
     */
    public Optional<Set<String>> activeSessionIds() {
        try {
            Map<String, Object> health = restTemplate
                    .exchange(baseUrl + "/api/supervisor/health", HttpMethod.GET, null, JSON_MAP)
                    .getBody();
            if (health == null || !(health.get("sessions") instanceof List<?> sessions)) {
                return Optional.empty();
            }
            return Optional.of(Set.copyOf(sessions.stream().map(String::valueOf).toList()));
        } catch (RestClientException e) {
            log.warn("无法从监督器获取活跃会话列表: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** 监督器查看者端点的 WebSocket 地址。 */
    public URI viewerSocketUri(String sessionId) {
        String wsBase = baseUrl.replaceFirst("^http", "ws");
        return UriComponentsBuilder.fromUriString(wsBase + "/ws/agent-session")
                .queryParam("sessionId", sessionId)
                .encode()
                .build()
                .toUri();
    }
}
