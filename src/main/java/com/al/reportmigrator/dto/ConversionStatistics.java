package com.al.reportmigrator.dto;

import com.al.reportmigrator.model.enums.ConversionOutcome;
import com.al.reportmigrator.model.enums.ConversionStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-report tally. Every converted element is recorded exactly once, under
 * one of the three outcomes.
 */
@Data
@NoArgsConstructor
public class ConversionStatistics {

    private int converted;

    private int convertedWithWarning;

    private int failed;

    public void record(ConversionOutcome outcome) {
        switch (outcome) {
            case CONVERTED:
                converted++;
                break;
            case CONVERTED_WITH_WARNING:
                convertedWithWarning++;
                break;
            case FAILED:
            default:
                failed++;
        }
    }

    public int getTotal() {
        return converted + convertedWithWarning + failed;
    }

    /**
     * Share of elements that produced output, 0-100. An empty report counts
     * as complete.
     */
    public double getCompletionPercentage() {
        int total = getTotal();
        if (total == 0) {
            return 100.0;
        }
        return Math.round((converted + convertedWithWarning) * 10000.0 / total) / 100.0;
    }

    public ConversionStatus getStatus() {
        if (failed == 0 && convertedWithWarning == 0) {
            return ConversionStatus.SUCCESS;
        }
        if (converted + convertedWithWarning == 0) {
            return ConversionStatus.FAILED;
        }
        return ConversionStatus.PARTIAL;
    }
}
