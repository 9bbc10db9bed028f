package net.kairos.core.error;

public class TargetRequestException extends TargetException {
    private final int statusCode;

    public TargetRequestException(String target, int statusCode, String detail) {
        super(target, detail, null);
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }

    @Override
    public String describe() {
        return "Agent returned HTTP " + statusCode + ": " + getMessage();
    }
}
