package de.upb.sse.casegen.stats;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SynthesisStats {
    private int recordedSuccesses;
    private int recordedFailures;
    private int duplicatesSkipped;
    private int timeouts;
    private int constructionFailures;
    private int analysisFaults;
    private int rejectedCalls;

    // descriptions of candidates dropped because the oracle overran its deadline
    private final List<String> timedOut = new ArrayList<>();

    public void incrementRecordedSuccesses() {
        recordedSuccesses++;
    }

    public void incrementRecordedFailures() {
        recordedFailures++;
    }

    public void incrementDuplicatesSkipped() {
        duplicatesSkipped++;
    }

    public void incrementConstructionFailures() {
        constructionFailures++;
    }

    public void incrementRejectedCalls() {
        rejectedCalls++;
    }

    public void addAnalysisFaults(int amount) {
        analysisFaults += amount;
    }

    public void recordTimeout(String candidate) {
        timeouts++;
        timedOut.add(candidate);
    }

    public int totalRecorded() {
        return recordedSuccesses + recordedFailures;
    }
}
