package io.tally.api.report;

/**
 * Discrete result of a report operation.
 */
public enum ReportStatus {
    OK,
    /** The format does not implement the requested operation. Not an error. */
    NOT_SUPPORTED,
    OPEN_FAILED,
    CLOSE_FAILED;

    public boolean isSuccess() {
        return this == OK || this == NOT_SUPPORTED;
    }
}
