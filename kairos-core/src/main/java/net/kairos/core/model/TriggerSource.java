package net.kairos.core.model;

public enum TriggerSource {
    SCHEDULE, MANUAL, API;

    public static TriggerSource from(String s) {
        if (s == null) return SCHEDULE;
        try { return TriggerSource.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return SCHEDULE; }
    }
    public String code() { return name().toLowerCase(); }
}
