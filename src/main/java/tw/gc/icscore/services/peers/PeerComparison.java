package tw.gc.icscore.services.peers;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A ticker's latest IC Score next to its closest same-sector peers. Sector rank, size and percentile
 * come from the ticker's latest record.
 */
public record PeerComparison(String ticker, String sector, Double icScore, List<PeerScore> peers,
                             Integer sectorRank, Integer sectorSize, Double sectorPercentile) {

    public PeerComparison {
        peers = peers == null ? List.of() : List.copyOf(peers);
    }

    /**
     * Mean of the peers' displayable scores, or null if none has one.
     */
    public Double peerAverageScore() {
        OptionalDouble average = peers.stream()
            .map(PeerScore::icScore)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average();
        return average.isPresent() ? average.getAsDouble() : null;
    }
}
