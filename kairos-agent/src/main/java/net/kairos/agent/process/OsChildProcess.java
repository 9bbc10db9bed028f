package net.kairos.agent.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * {@link Process} 위의 {@link ChildProcess}.
 * JDK 는 SIGINT 를 보낼 수 없으므로 kill -INT 를 실행하고, 실패하면 destroy(SIGTERM)로 대신한다.
 * 강제 종료는 자손 프로세스까지 죽인다.
 */
public final class OsChildProcess implements ChildProcess {
    private static final Logger log = LoggerFactory.getLogger(OsChildProcess.class);

    private static final long KILL_COMMAND_WAIT_SECONDS = 2;

    private final Process process;

    public OsChildProcess(Process process) {
        this.process = process;
    }

    public Process process() {
        return process;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public OptionalInt poll() {
        return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
    }

    @Override
    public void signal(Signal signal) throws Exception {
        if (!process.isAlive()) return;
        switch (signal) {
            case GRACEFUL -> interrupt();
            case FORCED -> {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        }
    }

    @Override
    public OptionalInt waitFor(Duration timeout) throws InterruptedException {
        if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return OptionalInt.of(process.exitValue());
        }
        return OptionalInt.empty();
    }

    private void interrupt() throws InterruptedException {
        try {
            Process kill = new ProcessBuilder("kill", "-INT", Long.toString(process.pid()))
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (kill.waitFor(KILL_COMMAND_WAIT_SECONDS, TimeUnit.SECONDS) && kill.exitValue() == 0) return;
            kill.destroyForcibly();
            log.debug("kill -INT {} did not succeed, falling back to destroy", process.pid());
        } catch (IOException e) {
            log.debug("kill command unavailable ({}), falling back to destroy", e.getMessage());
        }
        process.destroy();
    }
}
