package club.ppmc.devserver.terminal;

import club.ppmc.devserver.model.terminal.ShellLaunchConfig;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeTerminalProcessFactory implements TerminalProcessFactory {

    public final List<FakeTerminalProcess> created = new CopyOnWriteArrayList<>();
    public volatile RuntimeException createFailure;

    @Override
    public TerminalProcess create(
            ShellLaunchConfig launchConfig, String cwd, int cols, int rows, Map<String, String> env) {
        if (createFailure != null) {
            throw createFailure;
        }
        var process = new FakeTerminalProcess(cwd != null ? cwd : "/work");
        created.add(process);
        return process;
    }

    public FakeTerminalProcess last() {
        return created.get(created.size() - 1);
    }
}
