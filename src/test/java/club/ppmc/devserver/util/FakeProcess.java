package club.ppmc.devserver.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/** 预置标准输出内容、可手动结束的子进程替身。 */
public class FakeProcess extends Process {

    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
    private final InputStream stdout;
    private final CompletableFuture<Process> exit = new CompletableFuture<>();
    private volatile boolean destroyed;

    public FakeProcess(String stdoutText) {
        this.stdout = new ByteArrayInputStream(stdoutText.getBytes(StandardCharsets.UTF_8));
    }

    public void terminate() {
        exit.complete(this);
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public String stdinText() {
        synchronized (stdin) {
            return stdin.toString(StandardCharsets.UTF_8);
        }
    }

    @Override
    public OutputStream getOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) {
                synchronized (stdin) {
                    stdin.write(b);
                }
            }

            @Override
            public void write(byte[] b, int off, int len) {
                synchronized (stdin) {
                    stdin.write(b, off, len);
                }
            }
        };
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public int waitFor() {
        exit.join();
        return 0;
    }

    @Override
    public int exitValue() {
        if (!exit.isDone()) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return 0;
    }

    @Override
    public void destroy() {
        destroyed = true;
        exit.complete(this);
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public CompletableFuture<Process> onExit() {
        return exit;
    }

    @Override
    public long pid() {
        return 4242;
    }
}
