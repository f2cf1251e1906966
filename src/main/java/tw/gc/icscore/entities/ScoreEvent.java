package tw.gc.icscore.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.icscore.enums.ScoreEventType;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * ScoreEvent Entity
 *
 * Dated occurrence detected by an external collaborator. Read-only to the engine.
 */
@Entity
@Table(name = "score_events", indexes = {
    @Index(name = "idx_score_events_ticker_date", columnList = "ticker, event_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticker", nullable = false, length = 20)
    private String ticker;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private ScoreEventType eventType;

    @Column(name = "event_date", nullable = false)
    private LocalDate eventDate;

    @Column(name = "description", length = 500)
    private String description;

    /** Relative magnitude reported by the detector, e.g. EPS surprise percent */
    @Column(name = "impact")
    private Double impact;

    @Column(name = "created_at")
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
