package net.kairos.agent.task;

import com.fasterxml.jackson.databind.JsonNode;
import net.kairos.agent.process.ChildProcess;
import net.kairos.agent.process.OsChildProcess;
import net.kairos.agent.process.ProcessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * 헤드리스 명령을 한 번 실행한다. 상태가 없으므로 동시에 여러 개가 돌 수 있다.
 *
 * <p>프로세스는 호출자가 준 실행 id 로 레지스트리에 등록되고, 어떤 경로로 끝나든 해제된다.
 * 메시지는 stdin 으로 넘기고 stdout 의 stream-json 을 파싱한다. stderr 는 실패 메시지에만 쓴다.
 */
public class HeadlessTaskRunner {
    private static final Logger log = LoggerFactory.getLogger(HeadlessTaskRunner.class);

    static final Duration STREAM_DRAIN_WAIT = Duration.ofSeconds(5);
    static final Duration KILL_WAIT = Duration.ofSeconds(2);
    static final int ERROR_PREVIEW_CHARS = 200;

    private final List<String> command;
    private final Path mcpConfig;
    private final ProcessRegistry registry;
    private final StreamJsonParser parser;
    private final ExecutorService streams;
    private final Duration defaultTimeout;
    private final Duration maxTimeout;

    /**
     * @param mcpConfig 존재하면 --mcp-config 로 넘긴다. null 가능
     * @param streams   stdin/stdout/stderr 입출력용 스레드
     */
    public HeadlessTaskRunner(List<String> command,
                              Path mcpConfig,
                              ProcessRegistry registry,
                              StreamJsonParser parser,
                              ExecutorService streams,
                              Duration defaultTimeout,
                              Duration maxTimeout) {
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("command must not be empty");
        this.command = List.copyOf(command);
        this.mcpConfig = mcpConfig;
        this.registry = registry;
        this.parser = parser;
        this.streams = streams;
        this.defaultTimeout = defaultTimeout;
        this.maxTimeout = maxTimeout;
    }

    public TaskOutcome run(TaskRequest req) throws TaskTimeoutException, TaskExecutionException {
        String executionId = req.executionId() != null && !req.executionId().isBlank()
                ? req.executionId()
                : UUID.randomUUID().toString();
        Duration timeout = effectiveTimeout(req.timeoutSeconds());
        List<String> cmd = buildCommand(req);

        Process process;
        try {
            process = new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            throw new TaskCommandUnavailableException("Task command is not available: " + cmd.get(0), e);
        }
        OsChildProcess child = new OsChildProcess(process);
        registry.register(executionId, child, Map.of(
                "type", "task",
                "message_preview", ProcessRegistry.preview(req.message())));
        log.info("Started task {} (pid {}, timeout {}s)", executionId, child.pid(), timeout.toSeconds());

        try {
            StreamJsonParser.Accumulator acc = parser.newAccumulator();
            List<String> stderrLines = Collections.synchronizedList(new ArrayList<>());

            streams.submit(() -> writeStdin(process.getOutputStream(), req.message(), executionId));
            Future<?> stdout = streams.submit(() -> readLines(process.getInputStream(), line -> {
                JsonNode msg = acc.accept(line);
                if (msg != null) registry.publishLogEntry(executionId, msg);
            }, executionId));
            Future<?> stderr = streams.submit(() -> readLines(process.getErrorStream(), stderrLines::add, executionId));

            int rc = awaitExit(child, timeout, executionId);
            drain(stdout, process.getInputStream(), executionId);
            drain(stderr, process.getErrorStream(), executionId);

            if (rc != 0) {
                String transcript = String.join("\n", stderrLines);
                String preview = transcript.isEmpty() ? "Unknown error" : abbreviate(transcript, ERROR_PREVIEW_CHARS);
                log.error("Task {} failed (exit {}): {}", executionId, rc, preview);
                throw new TaskExecutionException("Task execution failed: " + preview, rc);
            }

            String response = acc.response();
            if (response.isEmpty()) {
                throw new TaskExecutionException("Task returned empty response", rc);
            }

            TaskMetadata metadata = acc.metadata(executionId);
            String sessionId = acc.sessionId() != null ? acc.sessionId() : executionId;
            List<JsonNode> raw = acc.rawMessages();
            if (raw.isEmpty()) {
                log.warn("Task {} completed without any stream messages", executionId);
            } else {
                log.info("Task {} completed: cost={}, duration={}ms, tools={}, messages={}",
                        executionId, metadata.costUsd(), metadata.durationMs(), metadata.toolCount(), raw.size());
            }
            return new TaskOutcome(response, raw, metadata, sessionId);
        } finally {
            registry.unregister(executionId);
        }
    }

    Duration effectiveTimeout(Integer timeoutSeconds) {
        if (timeoutSeconds == null || timeoutSeconds <= 0) return defaultTimeout;
        Duration requested = Duration.ofSeconds(timeoutSeconds);
        return requested.compareTo(maxTimeout) > 0 ? maxTimeout : requested;
    }

    List<String> buildCommand(TaskRequest req) {
        List<String> cmd = new ArrayList<>(command);
        if (mcpConfig != null && Files.exists(mcpConfig)) {
            cmd.add("--mcp-config");
            cmd.add(mcpConfig.toString());
        }
        if (req.model() != null && !req.model().isBlank()) {
            cmd.add("--model");
            cmd.add(req.model());
        }
        if (req.allowedTools() != null && !req.allowedTools().isEmpty()) {
            cmd.add("--allowedTools");
            cmd.add(String.join(",", req.allowedTools()));
        }
        if (req.systemPrompt() != null && !req.systemPrompt().isBlank()) {
            cmd.add("--append-system-prompt");
            cmd.add(req.systemPrompt());
        }
        if (req.maxTurns() != null) {
            cmd.add("--max-turns");
            cmd.add(req.maxTurns().toString());
        }
        return cmd;
    }

    private int awaitExit(ChildProcess child, Duration timeout, String executionId)
            throws TaskTimeoutException, TaskExecutionException {
        try {
            var rc = child.waitFor(timeout);
            if (rc.isPresent()) return rc.getAsInt();

            log.error("Task {} timed out after {}s, killing pid {}", executionId, timeout.toSeconds(), child.pid());
            killQuietly(child, executionId);
            throw new TaskTimeoutException(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killQuietly(child, executionId);
            throw new TaskExecutionException("Task execution interrupted", e);
        }
    }

    private static void killQuietly(ChildProcess child, String executionId) {
        try {
            child.signal(ChildProcess.Signal.FORCED);
            child.waitFor(KILL_WAIT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Failed to kill task {}: {}", executionId, e.toString());
        }
    }

    private static void writeStdin(OutputStream stdin, String message, String executionId) {
        try (stdin) {
            stdin.write(message.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // 명령이 stdin 을 읽지 않고 끝난 경우
            log.debug("Could not write prompt to task {}: {}", executionId, e.getMessage());
        }
    }

    private static void readLines(InputStream in, Consumer<String> sink, String executionId) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                sink.accept(line);
            }
        } catch (IOException e) {
            log.debug("Stream of task {} closed: {}", executionId, e.getMessage());
        }
    }

    // 손자 프로세스가 파이프를 쥐고 있으면 EOF 가 오지 않는다. 일정 시간 뒤 스트림을 닫아 리더를 끝낸다
    private static void drain(Future<?> reader, InputStream stream, String executionId) {
        try {
            reader.get(STREAM_DRAIN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Output of task {} still open {}s after exit, closing it", executionId, STREAM_DRAIN_WAIT.toSeconds());
            closeQuietly(stream, executionId);
            reader.cancel(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(stream, executionId);
        } catch (ExecutionException e) {
            log.warn("Reading output of task {} failed: {}", executionId, e.getCause().toString());
        }
    }

    private static void closeQuietly(InputStream stream, String executionId) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Closing output of task {} failed: {}", executionId, e.getMessage());
        }
    }

    private static String abbreviate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
