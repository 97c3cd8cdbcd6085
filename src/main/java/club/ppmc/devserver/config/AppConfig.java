/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的 Bean：用于协议消息的 Gson、持久化终端计时器使用的调度线程池、
 * 以及从 application.properties 读取的重连参数。
 */
package club.ppmc.devserver.config;

import club.ppmc.devserver.terminal.ReconnectConstants;
import com.google.gson.Gson;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 握手帧、终端 RPC 请求/回复以及事件都通过它序列化，保证与前端的 JSON 格式一致。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }

    /**
     * 持久化终端的宽限期计时器与孤儿探测屏障共用的调度线程池。
     * 计时器的回调只做状态转换和进程关闭，两个线程足够。
     */
    @Bean(name = "terminalTaskScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler terminalTaskScheduler() {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.setThreadNamePrefix("pty-timer-");
        taskScheduler.setRemoveOnCancelPolicy(true);
        taskScheduler.initialize();
        return taskScheduler;
    }

    @Bean
    public ReconnectConstants reconnectConstants(
            @Value("${app.terminal.reconnection-grace-time:3h}") Duration graceTime,
            @Value("${app.terminal.reconnection-short-grace-time:6s}") Duration shortGraceTime,
            @Value("${app.terminal.orphan-question-timeout:4s}") Duration orphanQuestionTimeout,
            @Value("${app.terminal.orphan-reply-window:500ms}") Duration orphanReplyWindow,
            @Value("${app.terminal.recorder-max-chars:1000000}") int recorderMaxChars) {
        return new ReconnectConstants(
                graceTime, shortGraceTime, orphanQuestionTimeout, orphanReplyWindow, recorderMaxChars);
    }

    /** 连接离线时间戳使用的时钟。 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
