package tw.gc.icscore.services.peers;

import java.util.Map;

/**
 * @param similarity        0-1, 1 being the closest match
 * @param similarityFactors per-dimension similarity behind {@code similarity}
 * @param icScore           peer's latest displayable score, null when it has none
 * @param delta             peer score minus the ticker's score, null when either is missing
 */
public record PeerScore(String ticker, Double marketCap, double similarity, Map<String, Double> similarityFactors,
                        Double icScore, Double delta) {

    public PeerScore {
        similarityFactors = similarityFactors == null ? Map.of() : Map.copyOf(similarityFactors);
    }
}
