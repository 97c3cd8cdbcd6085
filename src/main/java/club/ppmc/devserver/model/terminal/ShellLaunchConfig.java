/**
 * ShellLaunchConfig.java
 *
 * 描述如何启动一个终端子进程：可执行文件、参数、附加环境变量以及显示名称。
 * 由终端前端通过管理连接发送，Gson 负责反序列化，因此保持为可变 POJO。
 */
package club.ppmc.devserver.model.terminal;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class ShellLaunchConfig {

    /** 终端的显示名称，同时作为初始标题。为空时使用可执行文件名。 */
    private String name;

    /** 要启动的 shell。为空时使用服务器环境中配置的默认 shell。 */
    private String executable;

    private List<String> args = new ArrayList<>();

    private Map<String, String> env = new HashMap<>();

    /**
     * 如果设置，表示这是一个"附加到已有持久化终端"的描述符，而不是创建请求。
     * 此类描述符不能用于创建进程。
     */
    private Integer attachPersistentProcess;
}
