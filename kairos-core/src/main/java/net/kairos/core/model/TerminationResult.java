package net.kairos.core.model;

public record TerminationResult(
        Status status,
        Integer returnCode,
        String error
) {
    public enum Status {
        TERMINATED, ALREADY_FINISHED, NOT_FOUND, ERROR;

        public static Status from(String s) {
            if (s == null) return ERROR;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return ERROR; }
        }
        public String code() { return name().toLowerCase(); }
    }
}
