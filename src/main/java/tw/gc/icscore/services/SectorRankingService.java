package tw.gc.icscore.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import tw.gc.icscore.entities.IcScoreRecord;
import tw.gc.icscore.repositories.IcScoreRecordRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks displayable scores within a sector: rank 1 is the highest score, ties share a rank, and the
 * percentile is the share of peers ranked below (100 for the top, 0 for the bottom).
 */
@Service
@RequiredArgsConstructor
public class SectorRankingService {

    private final IcScoreRecordRepository recordRepository;

    /**
     * Sets rank, size and percentile on every displayable record of the group. Records without a
     * displayable score get no rank.
     */
    public void rank(Collection<IcScoreRecord> sectorRecords) {
        List<IcScoreRecord> ranked = new ArrayList<>(sectorRecords.stream()
            .filter(IcScoreRecord::hasDisplayableScore)
            .toList());
        ranked.sort(Comparator.comparingDouble(IcScoreRecord::getOverallScore).reversed());

        int size = ranked.size();
        int rank = 0;
        Double lastScore = null;
        for (int i = 0; i < size; i++) {
            IcScoreRecord record = ranked.get(i);
            if (lastScore == null || record.getOverallScore().compareTo(lastScore) != 0) {
                rank = i + 1;
                lastScore = record.getOverallScore();
            }
            record.setSectorRank(rank);
            record.setSectorSize(size);
            record.setSectorPercentile(size <= 1 ? 100.0 : (double) (size - rank) / (size - 1) * 100.0);
        }
    }

    /**
     * Ranks a freshly computed record against the latest same-day record of every other ticker in its sector.
     * Only {@code record} is modified.
     */
    public void rankAgainstPeers(IcScoreRecord record) {
        if (record.getSector() == null || !record.hasDisplayableScore()) {
            return;
        }
        Map<String, IcScoreRecord> latestByTicker = new HashMap<>();
        for (IcScoreRecord peer : recordRepository.findBySectorAndAsOfDate(record.getSector(), record.getAsOfDate())) {
            latestByTicker.merge(peer.getTicker(), peer,
                (a, b) -> a.getCalculatedAt().isAfter(b.getCalculatedAt()) ? a : b);
        }
        latestByTicker.remove(record.getTicker());

        List<IcScoreRecord> group = new ArrayList<>();
        for (IcScoreRecord peer : latestByTicker.values()) {
            group.add(IcScoreRecord.builder()
                .ticker(peer.getTicker())
                .overallScore(peer.getOverallScore())
                .confidenceLevel(peer.getConfidenceLevel())
                .build());
        }
        group.add(record);
        rank(group);
    }
}
