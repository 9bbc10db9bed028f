package net.kairos.agent.process;

public record TerminationOutcome(Status status, Integer returncode, String error) {

    public enum Status {
        TERMINATED, ALREADY_FINISHED, NOT_FOUND, ERROR;

        public String code() {
            return name().toLowerCase();
        }
    }

    static TerminationOutcome terminated(Integer returncode) {
        return new TerminationOutcome(Status.TERMINATED, returncode, null);
    }

    static TerminationOutcome alreadyFinished(int returncode) {
        return new TerminationOutcome(Status.ALREADY_FINISHED, returncode, null);
    }

    static TerminationOutcome notFound() {
        return new TerminationOutcome(Status.NOT_FOUND, null, null);
    }

    static TerminationOutcome error(String error) {
        return new TerminationOutcome(Status.ERROR, null, error);
    }
}
