/**
 * SessionHubApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 同一个进程中同时运行进程监督器（PTY 会话、tmux 恢复、查看者端点）和管理端（派发、路由、worker 链路）。
 * 清理、刷新、worker 心跳超时等周期任务依赖 @EnableScheduling。
 */
package club.ppmc.sessionhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class SessionHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionHubApplication.class, args);
    }
}
