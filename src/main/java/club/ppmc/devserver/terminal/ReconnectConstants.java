/**
 * ReconnectConstants.java
 *
 * 持久化终端的时间与容量参数。由 AppConfig 从 application.properties 构建，
 * 测试中可以直接构造更短的时间窗口。
 *
 * @param graceTime 客户端断开后，持久化终端等待重连的长宽限期。
 * @param shortGraceTime 确认客户端几乎不可能返回时改用的短宽限期。
 * @param orphanQuestionTimeout 孤儿探测屏障自动打开的超时时间。
 * @param orphanReplyWindow 屏障打开时，回复必须落在此窗口内才算"非孤儿"。
 * @param recorderMaxChars 输出记录器保留的最大字符数，超出后丢弃最旧的条目。
 */
package club.ppmc.devserver.terminal;

import java.time.Duration;

public record ReconnectConstants(
        Duration graceTime,
        Duration shortGraceTime,
        Duration orphanQuestionTimeout,
        Duration orphanReplyWindow,
        int recorderMaxChars) {

    public static final Duration DEFAULT_GRACE_TIME = Duration.ofHours(3);
    public static final Duration DEFAULT_SHORT_GRACE_TIME = Duration.ofSeconds(6);
    public static final Duration DEFAULT_ORPHAN_QUESTION_TIMEOUT = Duration.ofSeconds(4);
    public static final Duration DEFAULT_ORPHAN_REPLY_WINDOW = Duration.ofMillis(500);
    public static final int DEFAULT_RECORDER_MAX_CHARS = 1_000_000;

    public static ReconnectConstants defaults() {
        return new ReconnectConstants(
                DEFAULT_GRACE_TIME,
                DEFAULT_SHORT_GRACE_TIME,
                DEFAULT_ORPHAN_QUESTION_TIMEOUT,
                DEFAULT_ORPHAN_REPLY_WINDOW,
                DEFAULT_RECORDER_MAX_CHARS);
    }
}
