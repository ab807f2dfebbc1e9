package com.deepansh.explorer.observability;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PhaseStats {

    private int count;
    private long totalMs;
    private double avgMs;
    private long maxMs;
    private double successRate;

    static PhaseStats of(List<TraceRecord> records) {
        if (records.isEmpty()) {
            return new PhaseStats(0, 0, 0.0, 0, 0.0);
        }
        long total = 0;
        long max = 0;
        int succeeded = 0;
        for (TraceRecord record : records) {
            total += record.getDurationMs();
            max = Math.max(max, record.getDurationMs());
            if (record.isSuccess()) {
                succeeded++;
            }
        }
        return new PhaseStats(records.size(), total, (double) total / records.size(), max,
                (double) succeeded / records.size());
    }
}
