package de.caluga.topology.driver;

/**
 * well known error labels. Labels are attached to errors (either by the server or by the driver) so
 * that retry helpers can react on them without knowing the concrete exception class.
 */
public enum ErrorLabel {
    TRANSIENT_TRANSACTION_ERROR("TransientTransactionError"),
    UNKNOWN_TRANSACTION_COMMIT_RESULT("UnknownTransactionCommitResult"),
    RETRYABLE_WRITE_ERROR("RetryableWriteError"),
    NO_WRITES_PERFORMED("NoWritesPerformed");

    private final String label;

    ErrorLabel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ErrorLabel findByLabel(String l) {
        for (ErrorLabel e : values()) {
            if (e.label.equals(l)) {
                return e;
            }
        }

        return null;
    }
}
