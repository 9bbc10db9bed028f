package net.kairos.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@ConfigurationProperties("kairos")
public class KairosProperties {
    /** 비어 있으면 호스트명 + 임의 접미사 */
    private String instanceId;
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Lock lock = new Lock();
    private Sync sync = new Sync();
    private Dispatch dispatch = new Dispatch();
    private Heartbeat heartbeat = new Heartbeat();
    private Target target = new Target();
    private Events events = new Events();

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Sync getSync() {
        return sync;
    }

    public void setSync(Sync sync) {
        this.sync = sync;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    public void setHeartbeat(Heartbeat heartbeat) {
        this.heartbeat = heartbeat;
    }

    public Target getTarget() {
        return target;
    }

    public void setTarget(Target target) {
        this.target = target;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public static class Scheduler {
        /** false면 타이머/주기 작업 없이 API만 뜬다 */
        private boolean enabled = true;
        private int timerThreads = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTimerThreads() {
            return timerThreads;
        }

        public void setTimerThreads(int timerThreads) {
            this.timerThreads = timerThreads;
        }
    }

    public static class Lock {
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration ttl = Duration.ofSeconds(600);
        private boolean autoRenewal = true;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public boolean isAutoRenewal() {
            return autoRenewal;
        }

        public void setAutoRenewal(boolean autoRenewal) {
            this.autoRenewal = autoRenewal;
        }
    }

    public static class Sync {
        // @Scheduled 딜레이는 ${kairos.sync.interval-ms}로 직접 읽힘
        private long intervalMs = 60_000;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Dispatch {
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeout = Duration.ofSeconds(900);
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeoutBuffer = Duration.ofSeconds(10);
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration controlTimeout = Duration.ofSeconds(10);
        private int maxConcurrent = 32;
        /** 종료 요청으로 끊긴 디스패치가 취소 결과를 기다리는 최대 시간 */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration cancelWait = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getTimeoutBuffer() {
            return timeoutBuffer;
        }

        public void setTimeoutBuffer(Duration timeoutBuffer) {
            this.timeoutBuffer = timeoutBuffer;
        }

        public Duration getControlTimeout() {
            return controlTimeout;
        }

        public void setControlTimeout(Duration controlTimeout) {
            this.controlTimeout = controlTimeout;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public Duration getCancelWait() {
            return cancelWait;
        }

        public void setCancelWait(Duration cancelWait) {
            this.cancelWait = cancelWait;
        }
    }

    public static class Heartbeat {
        private long intervalMs = 30_000;
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration ttl = Duration.ofSeconds(60);

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Target {
        /** {name} 자리에 대상 이름이 들어간다 */
        private String urlTemplate = "http://agent-{name}:8000";

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }
    }

    public static class Events {
        private boolean enabled = true;
        private String channel = "scheduler:events";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }
    }
}
