package tw.gc.icscore.services;

import java.time.LocalDate;
import java.util.List;

/**
 * @param insufficient tickers scored but left without a displayable score
 * @param failedTickers tickers whose run threw or timed out; no record was written for them
 */
public record BatchRunSummary(LocalDate asOfDate, int requested, int scored, int insufficient,
                              List<String> failedTickers, long elapsedMillis) {

    public BatchRunSummary {
        failedTickers = failedTickers == null ? List.of() : List.copyOf(failedTickers);
    }

    public int failed() {
        return failedTickers.size();
    }
}
