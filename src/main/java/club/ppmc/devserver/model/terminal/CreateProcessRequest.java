/**
 * CreateProcessRequest.java
 *
 * createProcess 命令的参数。
 */
package club.ppmc.devserver.model.terminal;

import java.util.HashMap;
import java.util.Map;
import lombok.Data;

@Data
public class CreateProcessRequest {

    private ShellLaunchConfig shellLaunchConfig = new ShellLaunchConfig();
    private String cwd;
    private int cols = 80;
    private int rows = 30;
    private Map<String, String> env = new HashMap<>();
    private boolean shouldPersist;
    private String workspaceId;
    private String workspaceName;
}
