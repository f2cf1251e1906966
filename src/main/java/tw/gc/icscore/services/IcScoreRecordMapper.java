package tw.gc.icscore.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.icscore.entities.IcScoreRecord;
import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.enums.ScoreRating;
import tw.gc.icscore.enums.ScoreRunType;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.services.scoring.AggregateScore;
import tw.gc.icscore.services.scoring.ScoringOutcome;
import tw.gc.icscore.services.scoring.StabilizedScore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Converts scoring output to {@link IcScoreRecord} rows and reads factor results back out of them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IcScoreRecordMapper {

    private static final TypeReference<List<FactorResult>> FACTOR_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<FactorChange>> CHANGE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Double>> WEIGHT_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * @param stabilized null when the aggregate has no displayable score
     */
    public IcScoreRecord toRecord(ScoringOutcome outcome, StabilizedScore stabilized, Double previousScore,
                                  ScoreRunType runType, ScoreExplanation explanation) {
        AggregateScore aggregate = outcome.aggregate();
        Double overall = stabilized == null ? null : stabilized.score();

        return IcScoreRecord.builder()
            .ticker(outcome.ticker())
            .sector(outcome.sector())
            .asOfDate(outcome.asOfDate())
            .runType(runType)
            .overallScore(overall)
            .rawScore(aggregate.weightedScore())
            .previousScore(previousScore)
            .qualityScore(aggregate.categoryScore(ScoreCategory.QUALITY))
            .valuationScore(aggregate.categoryScore(ScoreCategory.VALUATION))
            .signalsScore(aggregate.categoryScore(ScoreCategory.SIGNALS))
            .rating(overall == null ? null : ScoreRating.forScore(overall))
            .lifecycleStage(outcome.lifecycle().stage())
            .lifecycleConfidence(outcome.lifecycle().confidence())
            .factorResultsJson(writeJson(outcome.factorResults()))
            .weightsJson(writeJson(new TreeMap<>(outcome.weights())))
            .availableFactors(aggregate.availableFactors())
            .expectedFactors(aggregate.expectedFactors())
            .completenessPct(aggregate.completenessPct())
            .confidenceLevel(aggregate.confidence())
            .smoothingApplied(stabilized != null && stabilized.smoothingApplied())
            .resetEvents(stabilized == null || stabilized.resetEvents().isEmpty() ? null
                : stabilized.resetEvents().stream().map(Enum::name).collect(Collectors.joining(",")))
            .explanation(explanation == null ? null : explanation.summary())
            .changeDriversJson(explanation == null ? null : writeJson(explanation.drivers()))
            .build();
    }

    public Map<String, FactorResult> readFactorResults(IcScoreRecord record) {
        Map<String, FactorResult> byName = new LinkedHashMap<>();
        if (record.getFactorResultsJson() == null || record.getFactorResultsJson().isBlank()) {
            return byName;
        }
        try {
            for (FactorResult result : objectMapper.readValue(record.getFactorResultsJson(), FACTOR_LIST)) {
                byName.put(result.factor(), result);
            }
        } catch (JsonProcessingException e) {
            log.error("❌ Unreadable factor results on record {} for {}: {}", record.getId(), record.getTicker(), e.getMessage());
        }
        return byName;
    }

    /**
     * Rebuilds the explanation stored with a record; null when the record carries none.
     */
    public ScoreExplanation readExplanation(IcScoreRecord record) {
        if (record.getExplanation() == null) {
            return null;
        }
        List<FactorChange> drivers = List.of();
        if (record.getChangeDriversJson() != null && !record.getChangeDriversJson().isBlank()) {
            try {
                drivers = objectMapper.readValue(record.getChangeDriversJson(), CHANGE_LIST);
            } catch (JsonProcessingException e) {
                log.error("❌ Unreadable change drivers on record {} for {}: {}", record.getId(), record.getTicker(), e.getMessage());
            }
        }
        Double previous = record.getPreviousScore();
        Double current = record.getOverallScore();
        double delta = previous == null || current == null ? 0.0 : current - previous;
        return new ScoreExplanation(previous, current, delta, drivers, record.getExplanation());
    }

    Map<String, Double> readWeights(IcScoreRecord record) {
        if (record.getWeightsJson() == null || record.getWeightsJson().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(record.getWeightsJson(), WEIGHT_MAP);
        } catch (JsonProcessingException e) {
            log.error("❌ Unreadable weights on record {} for {}: {}", record.getId(), record.getTicker(), e.getMessage());
            return Map.of();
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize score record payload", e);
        }
    }
}
