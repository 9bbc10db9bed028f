package net.kairos.core.error;

public class ScheduleNotFoundException extends RuntimeException {
    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule " + scheduleId + " not found");
        this.scheduleId = scheduleId;
    }

    public String scheduleId() { return scheduleId; }
}
