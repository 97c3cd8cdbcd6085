/**
 * ConfiguredDebugPortProvider.java
 *
 * 从 application.properties 的 app.extension-host.debug-port 读取调试端口。
 * 未配置或配置为非正数时表示不启用调试。
 */
package club.ppmc.devserver.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfiguredDebugPortProvider implements DebugPortProvider {

    private final Integer debugPort;

    public ConfiguredDebugPortProvider(@Value("${app.extension-host.debug-port:#{null}}") Integer debugPort) {
        this.debugPort = debugPort != null && debugPort > 0 ? debugPort : null;
    }

    @Override
    public Integer getDebugPort() {
        return debugPort;
    }
}
