/**
 * DevServerApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动远程开发会话服务器：WebSocket 端点、连接调度器以及持久化终端进程注册表。
 * WebSocket 的启用放在 WebSocketConfig 中，以便控制器的切片测试不必加载整个握手链路。
 */
package club.ppmc.devserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DevServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevServerApplication.class, args);
    }
}
