/**
 * ServerEnvironment.java
 *
 * 服务器进程级别的环境配置：路径、默认 shell 以及扩展宿主的启动命令。
 * 由 EnvironmentService 从 application.properties 中的默认值构建，
 * 并可被用户数据目录下的 environment.json 覆盖。保持可变，以便 Jackson 反序列化。
 */
package club.ppmc.devserver.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class ServerEnvironment {

    /**
     * 工作区根目录。终端未指定 cwd 时在此启动。
     * 默认值为 "./workspace"。
     */
    private String workspaceRoot = "./workspace";

    /** 用户数据目录，存放 environment.json 等文件。 */
    private String userDataDir = "./.devserver";

    /** 未指定可执行文件时使用的 shell。为空时按操作系统选择 bash 或 cmd.exe。 */
    private String defaultShell;

    /**
     * 扩展宿主进程的启动命令及参数，例如 ["node", "extensionHost.js"]。
     * 为空时 ExtensionHost 连接会被拒绝。
     */
    private List<String> extensionHostCommand = new ArrayList<>();

    /** 传递给扩展宿主进程的额外环境变量。 */
    private Map<String, String> extensionHostEnv = new HashMap<>();
}
