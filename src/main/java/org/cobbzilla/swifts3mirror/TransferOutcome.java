package org.cobbzilla.swifts3mirror;

public enum TransferOutcome {
    UPLOADED, SKIPPED_UP_TO_DATE, MARKER_CREATED, FAILED
}
