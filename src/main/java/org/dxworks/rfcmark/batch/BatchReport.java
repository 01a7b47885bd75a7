package org.dxworks.rfcmark.batch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Outcomes of a batch run, ordered by document number.
 */
public class BatchReport {

    private final List<DocumentOutcome> outcomes;

    public BatchReport(List<DocumentOutcome> outcomes) {
        List<DocumentOutcome> sorted = new ArrayList<>(outcomes);
        sorted.sort(Comparator.comparingInt(outcome -> outcome.rfc));
        this.outcomes = List.copyOf(sorted);
    }

    public List<DocumentOutcome> getOutcomes() {
        return outcomes;
    }

    public long getConvertedCount() {
        return outcomes.stream().filter(DocumentOutcome::isConverted).count();
    }

    public long getFailedCount() {
        return outcomes.size() - getConvertedCount();
    }

    public long getWarningCount() {
        return outcomes.stream().mapToLong(outcome -> outcome.warnings.size()).sum();
    }

    public boolean isSuccessful() {
        return getFailedCount() == 0;
    }
}
