package net.kairos.agent.process;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 실행 id 로 자식 프로세스를 찾아 종료할 수 있게 하는 표.
 *
 * <p>맵 접근은 모두 내부 락 아래에서 한다. 신호를 보내고 기다리는 동안에는 락을 잡지 않는다.
 *
 * <p>등록된 실행마다 실시간 로그 채널을 둔다. 최근 {@value #LOG_BUFFER_SIZE}개 항목을 버퍼해
 * 늦게 붙은 구독자에게 먼저 보내고, {@link #unregister} 에서 구독자에게 stream_end 를 보낸 뒤 버퍼를 버린다.
 */
public class ProcessRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    public static final Duration DEFAULT_GRACEFUL_TIMEOUT = Duration.ofSeconds(5);
    static final Duration KILL_WAIT = Duration.ofSeconds(2);
    static final int PREVIEW_CHARS = 100;
    static final int LOG_BUFFER_SIZE = 1000;

    private record Entry(ChildProcess process, Map<String, Object> metadata, Instant startedAt) {}

    private static final class LogChannel {
        final Deque<JsonNode> buffer = new ArrayDeque<>();
        final List<LogSubscription> subscribers = new ArrayList<>();
    }

    private final Object lock = new Object();
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, LogChannel> channels = new LinkedHashMap<>();
    private final Clock clock;

    public ProcessRegistry(Clock clock) {
        this.clock = clock;
    }

    public void register(String executionId, ChildProcess process, Map<String, Object> metadata) {
        Entry entry = new Entry(process, metadata == null ? Map.of() : Map.copyOf(metadata), clock.instant());
        LogChannel replaced;
        synchronized (lock) {
            Entry previous = entries.put(executionId, entry);
            if (previous != null) {
                log.warn("Execution {} was already registered (pid {}), replacing it", executionId, previous.process().pid());
            }
            replaced = channels.put(executionId, new LogChannel());
        }
        if (replaced != null) endSubscribers(replaced);
        log.info("Registered execution {} (pid {})", executionId, process.pid());
    }

    /** 표에서 빼고 로그 구독자에게 stream_end 를 보낸다 */
    public void unregister(String executionId) {
        boolean removed;
        LogChannel channel;
        synchronized (lock) {
            removed = entries.remove(executionId) != null;
            channel = channels.remove(executionId);
        }
        if (channel != null) endSubscribers(channel);
        if (removed) log.info("Unregistered execution {}", executionId);
    }

    /** 실행 중인 작업의 출력 한 줄. 등록되지 않은 실행이면 버린다 */
    public void publishLogEntry(String executionId, JsonNode entry) {
        synchronized (lock) {
            LogChannel channel = channels.get(executionId);
            if (channel == null) return;
            channel.buffer.addLast(entry);
            if (channel.buffer.size() > LOG_BUFFER_SIZE) channel.buffer.removeFirst();
            for (LogSubscription sub : channel.subscribers) {
                if (!sub.offer(entry)) {
                    log.warn("Log queue full for execution {}, dropping entry", executionId);
                }
            }
        }
    }

    /**
     * 로그 구독. 버퍼된 항목을 먼저 채운 뒤 새 항목을 받는다.
     * @return 등록되지 않은 실행이면 empty
     */
    public Optional<LogSubscription> subscribeLogs(String executionId) {
        synchronized (lock) {
            LogChannel channel = channels.get(executionId);
            if (channel == null) return Optional.empty();
            LogSubscription sub = new LogSubscription(executionId, this::unsubscribe);
            for (JsonNode entry : channel.buffer) {
                if (!sub.offer(entry)) break;
            }
            channel.subscribers.add(sub);
            log.debug("New log subscriber for execution {} ({} buffered)", executionId, channel.buffer.size());
            return Optional.of(sub);
        }
    }

    public Optional<List<JsonNode>> getBufferedLogs(String executionId) {
        synchronized (lock) {
            LogChannel channel = channels.get(executionId);
            return channel == null ? Optional.empty() : Optional.of(List.copyOf(channel.buffer));
        }
    }

    private void unsubscribe(LogSubscription sub) {
        synchronized (lock) {
            LogChannel channel = channels.get(sub.executionId());
            if (channel != null) channel.subscribers.remove(sub);
        }
    }

    private void endSubscribers(LogChannel channel) {
        List<LogSubscription> subs;
        synchronized (lock) {
            subs = List.copyOf(channel.subscribers);
        }
        subs.forEach(LogSubscription::end);
    }

    public TerminationOutcome terminate(String executionId) {
        return terminate(executionId, DEFAULT_GRACEFUL_TIMEOUT);
    }

    /**
     * SIGINT 후 gracefulTimeout 동안 기다리고, 그래도 살아 있으면 강제 종료 후 최대 2초 더 기다린다.
     * 실패는 예외 대신 {@link TerminationOutcome.Status#ERROR} 로 돌려준다.
     */
    public TerminationOutcome terminate(String executionId, Duration gracefulTimeout) {
        Entry entry;
        synchronized (lock) {
            entry = entries.get(executionId);
            if (entry == null) return TerminationOutcome.notFound();
            OptionalInt rc = entry.process().poll();
            if (rc.isPresent()) {
                entries.remove(executionId);
                return TerminationOutcome.alreadyFinished(rc.getAsInt());
            }
        }

        ChildProcess process = entry.process();
        try {
            log.info("Sending SIGINT to execution {} (pid {})", executionId, process.pid());
            process.signal(ChildProcess.Signal.GRACEFUL);
            OptionalInt rc = process.waitFor(gracefulTimeout);
            if (rc.isPresent()) {
                log.info("Execution {} terminated gracefully", executionId);
            } else {
                log.warn("Execution {} ignored SIGINT for {}s, force killing", executionId, gracefulTimeout.toSeconds());
                process.signal(ChildProcess.Signal.FORCED);
                rc = process.waitFor(KILL_WAIT);
                if (rc.isEmpty()) log.warn("Execution {} still alive {}ms after SIGKILL", executionId, KILL_WAIT.toMillis());
            }

            synchronized (lock) {
                entries.remove(executionId, entry);
            }
            return TerminationOutcome.terminated(rc.isPresent() ? rc.getAsInt() : null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while terminating {}", executionId);
            return TerminationOutcome.error("interrupted");
        } catch (Exception e) {
            log.error("Error terminating {}: {}", executionId, e.toString());
            return TerminationOutcome.error(e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    public Optional<ProcessStatus> getStatus(String executionId) {
        synchronized (lock) {
            Entry entry = entries.get(executionId);
            return entry == null ? Optional.empty() : Optional.of(status(executionId, entry));
        }
    }

    public List<ProcessStatus> listRunning() {
        synchronized (lock) {
            List<ProcessStatus> out = new ArrayList<>();
            entries.forEach((id, entry) -> {
                ProcessStatus s = status(id, entry);
                if (s.running()) out.add(s);
            });
            return out;
        }
    }

    public boolean isRunning(String executionId) {
        synchronized (lock) {
            return entries.containsKey(executionId);
        }
    }

    /**
     * 실행 id 를 모르는 호출자를 위한 추정.
     * 메시지 미리보기가 일치하는 실행이 하나면 그것, 아니면 실행 중인 것이 정확히 하나일 때 그것.
     */
    public Optional<String> inferExecutionId(String messageHint) {
        List<ProcessStatus> running = listRunning();
        if (messageHint != null && !messageHint.isBlank()) {
            String hint = preview(messageHint);
            List<String> matched = running.stream()
                    .filter(s -> hint.equals(s.metadata().get("message_preview")))
                    .map(ProcessStatus::executionId)
                    .toList();
            if (matched.size() == 1) return Optional.of(matched.get(0));
        }
        return running.size() == 1 ? Optional.of(running.get(0).executionId()) : Optional.empty();
    }

    public int cleanupFinished() {
        int removed = 0;
        synchronized (lock) {
            Iterator<Entry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().process().poll().isPresent()) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) log.info("Cleaned up {} finished processes", removed);
        return removed;
    }

    public static String preview(String message) {
        return message.length() > PREVIEW_CHARS ? message.substring(0, PREVIEW_CHARS) : message;
    }

    private static ProcessStatus status(String id, Entry entry) {
        OptionalInt rc = entry.process().poll();
        return new ProcessStatus(id, rc.isEmpty(), rc.isPresent() ? rc.getAsInt() : null, entry.startedAt(), entry.metadata());
    }
}
