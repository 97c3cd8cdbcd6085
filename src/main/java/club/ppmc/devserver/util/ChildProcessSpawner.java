/**
 * ChildProcessSpawner.java
 *
 * 启动操作系统子进程的抽象。终端进程与扩展宿主进程都通过它创建，
 * 测试中可以替换为返回内存进程的实现。
 */
package club.ppmc.devserver.util;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

public interface ChildProcessSpawner {

    /**
     * 启动一个子进程，标准错误合并到标准输出。
     *
     * @param command 命令及其参数列表。
     * @param workingDirectory 工作目录。
     * @param env 追加到继承环境之上的环境变量。
     * @return 已启动的进程。
     * @throws IOException 进程无法启动时抛出。
     */
    Process spawn(List<String> command, File workingDirectory, Map<String, String> env)
            throws IOException;
}
