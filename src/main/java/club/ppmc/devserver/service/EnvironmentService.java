/**
 * EnvironmentService.java
 *
 * 该服务是服务器进程级别的环境提供者：工作区路径、用户数据目录、默认 shell 以及扩展宿主的启动命令。
 * 默认值来自 application.properties；如果用户数据目录下存在 environment.json，
 * 则在启动时用它覆盖默认值（只读取，不回写）。
 * 需要这些路径或命令的组件都应依赖此服务，而不是直接使用 @Value 注解。
 */
package club.ppmc.devserver.service;

import club.ppmc.devserver.model.ServerEnvironment;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class EnvironmentService {

    static final String ENVIRONMENT_FILE_NAME = "environment.json";

    private final ObjectMapper objectMapper;
    private final String initialWorkspaceRoot;
    private final String initialUserDataDir;
    private final String initialDefaultShell;
    private final List<String> initialExtensionHostCommand;
    private volatile ServerEnvironment environment;

    public EnvironmentService(
            @Value("${app.workspace-root:./workspace}") String initialWorkspaceRoot,
            @Value("${app.user-data-dir:./.devserver}") String initialUserDataDir,
            @Value("${app.terminal.default-shell:}") String initialDefaultShell,
            @Value("${app.extension-host.command:}") List<String> initialExtensionHostCommand) {
        this.initialWorkspaceRoot = initialWorkspaceRoot;
        this.initialUserDataDir = initialUserDataDir;
        this.initialDefaultShell = initialDefaultShell;
        this.initialExtensionHostCommand = initialExtensionHostCommand;
        this.objectMapper =
                new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.environment = createDefaultEnvironment();
    }

    @PostConstruct
    public void init() {
        Path environmentFile = getUserDataDir().resolve(ENVIRONMENT_FILE_NAME);
        if (Files.exists(environmentFile)) {
            try {
                this.environment = objectMapper.readValue(environmentFile.toFile(), ServerEnvironment.class);
                log.info("已成功从 {} 加载服务器环境配置。", environmentFile);
            } catch (IOException e) {
                log.error("读取环境配置文件 {} 时出错。将使用默认配置。", environmentFile, e);
            }
        }
        try {
            Files.createDirectories(getWorkspaceRoot());
        } catch (IOException e) {
            log.warn("无法创建工作区目录 {}: {}", getWorkspaceRoot(), e.getMessage());
        }
    }

    public ServerEnvironment getEnvironment() {
        return environment;
    }

    public Path getWorkspaceRoot() {
        return Paths.get(environment.getWorkspaceRoot()).toAbsolutePath().normalize();
    }

    public Path getUserDataDir() {
        return Paths.get(environment.getUserDataDir()).toAbsolutePath().normalize();
    }

    /**
     * 解析终端的启动目录。未指定时使用工作区根目录，相对路径相对于工作区根目录解析。
     *
     * @param cwd 客户端请求的目录，可以为空。
     * @return 绝对路径字符串。
     */
    public String resolveTerminalCwd(String cwd) {
        if (!StringUtils.hasText(cwd)) {
            return getWorkspaceRoot().toString();
        }
        return getWorkspaceRoot().resolve(cwd).normalize().toString();
    }

    public String getDefaultShell() {
        return environment.getDefaultShell();
    }

    public List<String> getExtensionHostCommand() {
        return environment.getExtensionHostCommand();
    }

    public boolean isExtensionHostAvailable() {
        List<String> command = getExtensionHostCommand();
        return command != null && !command.isEmpty();
    }

    private ServerEnvironment createDefaultEnvironment() {
        var defaults = new ServerEnvironment();
        defaults.setWorkspaceRoot(initialWorkspaceRoot);
        defaults.setUserDataDir(initialUserDataDir);
        if (StringUtils.hasText(initialDefaultShell)) {
            defaults.setDefaultShell(initialDefaultShell);
        }
        if (initialExtensionHostCommand != null) {
            List<String> command = new ArrayList<>();
            initialExtensionHostCommand.stream().filter(StringUtils::hasText).forEach(command::add);
            defaults.setExtensionHostCommand(command);
        }
        return defaults;
    }
}
