package org.cobbzilla.swifts3mirror;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor @ToString
public class TransferResult {

    @Getter private final String key;
    @Getter private final TransferOutcome outcome;
    /** Null unless the outcome is {@link TransferOutcome#FAILED}. */
    @Getter private final String reason;

    public static TransferResult of(String key, TransferOutcome outcome) {
        return new TransferResult(key, outcome, null);
    }

    public static TransferResult failed(String key, String reason) {
        return new TransferResult(key, TransferOutcome.FAILED, reason);
    }
}
