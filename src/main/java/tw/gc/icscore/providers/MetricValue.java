package tw.gc.icscore.providers;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A metric value together with the date it became known.
 */
public record MetricValue(double value, LocalDate observedOn) {

    public MetricValue {
        Objects.requireNonNull(observedOn, "observedOn");
    }
}
