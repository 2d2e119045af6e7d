package org.cobbzilla.swifts3mirror;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Outcomes of one transfer pass, recorded concurrently by the jobs.
 */
public class TransferSummary {

    private final Map<String, TransferResult> results = new ConcurrentHashMap<String, TransferResult>();

    public void record(TransferResult result) {
        results.put(result.getKey(), result);
    }

    public TransferResult getResult(String key) { return results.get(key); }

    public TransferOutcome getOutcome(String key) {
        final TransferResult result = results.get(key);
        return result == null ? null : result.getOutcome();
    }

    public int size() { return results.size(); }

    public int count(TransferOutcome outcome) {
        return (int) results.values().stream().filter(r -> r.getOutcome() == outcome).count();
    }

    public Map<TransferOutcome, Integer> getCounts() {
        final Map<TransferOutcome, Integer> counts = new EnumMap<TransferOutcome, Integer>(TransferOutcome.class);
        for (TransferOutcome outcome : TransferOutcome.values()) {
            counts.put(outcome, count(outcome));
        }
        return counts;
    }

    public boolean hasFailures() { return count(TransferOutcome.FAILED) > 0; }

    public List<TransferResult> getFailures() {
        final List<TransferResult> failures = results.values().stream()
                .filter(r -> r.getOutcome() == TransferOutcome.FAILED)
                .collect(Collectors.toCollection(ArrayList::new));
        failures.sort((a, b) -> a.getKey().compareTo(b.getKey()));
        return Collections.unmodifiableList(failures);
    }

    @Override
    public String toString() { return "TransferSummary" + getCounts(); }
}
