package tw.gc.icscore.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.entities.IcScoreRecord;
import tw.gc.icscore.enums.ConfidenceLevel;
import tw.gc.icscore.enums.ScoreEventType;
import tw.gc.icscore.enums.ScoreRating;
import tw.gc.icscore.enums.ScoreRunType;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.factor.FactorRegistry;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.services.lifecycle.LifecycleClassifier;
import tw.gc.icscore.services.lifecycle.WeightAdjuster;
import tw.gc.icscore.services.scoring.ScoreAggregator;
import tw.gc.icscore.services.scoring.ScoreStabilizer;
import tw.gc.icscore.services.scoring.ScoringOutcome;
import tw.gc.icscore.services.scoring.ScoringPipeline;
import tw.gc.icscore.services.scoring.StabilizedScore;
import tw.gc.icscore.testutil.ScoringTestData;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IcScoreRecordMapper Tests")
class IcScoreRecordMapperTest {

    private IcScoreRecordMapper mapper;
    private ScoringOutcome outcome;

    @BeforeEach
    void setUp() {
        IcScoreProperties properties = new IcScoreProperties();
        LifecycleClassifier classifier = new LifecycleClassifier(properties);
        ScoringPipeline pipeline = new ScoringPipeline(new FactorRegistry(ScoringTestData.allCalculators(), properties),
            classifier, new WeightAdjuster(classifier), new ScoreAggregator(properties), properties);
        outcome = pipeline.score("2330", ScoringTestData.completeSnapshot("2330"), ScoringTestData.linearStats());
        mapper = new IcScoreRecordMapper(new ObjectMapper());
    }

    @Test
    @DisplayName("Should copy the aggregate, lifecycle and stabilized score onto the record")
    void mapsRecord() {
        StabilizedScore stabilized = new StabilizedScore(66.6, 66.64, 60.0, ScoreStabilizer.State.STABLE, false,
            List.of(ScoreEventType.EARNINGS_RELEASE, ScoreEventType.GUIDANCE_UPDATE));

        IcScoreRecord record = mapper.toRecord(outcome, stabilized, 60.0, ScoreRunType.FULL,
            new ScoreExplanation(60.0, 66.6, 6.6, List.of(), "2330 moved"));

        assertThat(record.getTicker()).isEqualTo("2330");
        assertThat(record.getSector()).isEqualTo(ScoringTestData.SECTOR);
        assertThat(record.getOverallScore()).isEqualTo(66.6);
        assertThat(record.getRawScore()).isEqualTo(outcome.aggregate().weightedScore());
        assertThat(record.getRating()).isEqualTo(ScoreRating.BUY);
        assertThat(record.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(record.getLifecycleStage()).isEqualTo(outcome.lifecycle().stage());
        assertThat(record.getResetEvents()).isEqualTo("EARNINGS_RELEASE,GUIDANCE_UPDATE");
        assertThat(record.getExplanation()).isEqualTo("2330 moved");
        assertThat(record.getQualityScore()).isNotNull();
        assertThat(record.getExpectedFactors()).isEqualTo(12);
    }

    @Test
    @DisplayName("Factor results and weights read back from the stored JSON")
    void readsBackJson() {
        IcScoreRecord record = mapper.toRecord(outcome, null, null, ScoreRunType.FULL, null);

        Map<String, FactorResult> factors = mapper.readFactorResults(record);
        Map<String, Double> weights = mapper.readWeights(record);

        assertThat(factors).hasSize(12);
        assertThat(factors.get(FactorNames.GROWTH)).isEqualTo(outcome.factorResults().stream()
            .filter(r -> r.factor().equals(FactorNames.GROWTH)).findFirst().orElseThrow());
        assertThat(weights).containsOnlyKeys(outcome.weights().keySet());
        assertThat(record.getOverallScore()).isNull();
        assertThat(record.getRating()).isNull();
    }

    @Test
    @DisplayName("Factor-level change drivers are stored and read back with the summary")
    void storesChangeDrivers() {
        List<FactorChange> drivers = List.of(
            new FactorChange(FactorNames.GROWTH, 40.0, 70.0, 30.0, 0.12, 3.6),
            new FactorChange(FactorNames.MOMENTUM, 65.0, 50.0, -15.0, 0.09, -1.35));
        StabilizedScore stabilized = new StabilizedScore(62.0, 62.0, 60.0, ScoreStabilizer.State.STABLE, false, List.of());

        IcScoreRecord record = mapper.toRecord(outcome, stabilized, 60.0, ScoreRunType.FULL,
            new ScoreExplanation(60.0, 62.0, 2.0, drivers, "2330 improved"));
        ScoreExplanation readBack = mapper.readExplanation(record);

        assertThat(record.getChangeDriversJson()).contains(FactorNames.GROWTH);
        assertThat(readBack.drivers()).isEqualTo(drivers);
        assertThat(readBack.summary()).isEqualTo("2330 improved");
        assertThat(readBack.previousScore()).isEqualTo(60.0);
        assertThat(readBack.currentScore()).isEqualTo(62.0);
        assertThat(readBack.delta()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("Record without an explanation reads back as none")
    void noExplanation() {
        IcScoreRecord record = mapper.toRecord(outcome, null, null, ScoreRunType.FULL, null);

        assertThat(record.getChangeDriversJson()).isNull();
        assertThat(mapper.readExplanation(record)).isNull();
    }

    @Test
    @DisplayName("Unreadable JSON yields empty maps instead of failing the run")
    void unreadableJson() {
        IcScoreRecord record = IcScoreRecord.builder().ticker("2330").factorResultsJson("{not json").weightsJson("[")
            .explanation("2330 unchanged").changeDriversJson("{").build();

        assertThat(mapper.readFactorResults(record)).isEmpty();
        assertThat(mapper.readWeights(record)).isEmpty();
        assertThat(mapper.readExplanation(record).drivers()).isEmpty();
    }
}
