package in.signaltruth.domain.common;

/**
 * Outcome of offering a tracker to the registry.
 */
public record AdmissionResult(Status status, String reason) {

    public enum Status {
        ADMITTED,
        ALREADY_PROCESSED,
        REJECTED
    }

    private static final AdmissionResult ADMITTED = new AdmissionResult(Status.ADMITTED, null);
    private static final AdmissionResult ALREADY_PROCESSED =
        new AdmissionResult(Status.ALREADY_PROCESSED, "signal already resolved");

    public static AdmissionResult admitted() {
        return ADMITTED;
    }

    public static AdmissionResult alreadyProcessed() {
        return ALREADY_PROCESSED;
    }

    public static AdmissionResult rejected(String reason) {
        return new AdmissionResult(Status.REJECTED, reason);
    }

    public boolean isAdmitted() {
        return status == Status.ADMITTED;
    }
}
