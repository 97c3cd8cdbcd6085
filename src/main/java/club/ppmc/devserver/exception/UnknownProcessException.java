/**
 * UnknownProcessException.java
 *
 * 调用方引用了一个不存在（或已经关闭）的持久化终端 ID。
 * 注册表的每个按 ID 操作都会在找不到进程时抛出此异常，而不是静默忽略。
 */
package club.ppmc.devserver.exception;

import lombok.Getter;

@Getter
public class UnknownProcessException extends RuntimeException {

    private final int processId;

    public UnknownProcessException(int processId) {
        super("Could not find pty with id \"" + processId + "\"");
        this.processId = processId;
    }
}
