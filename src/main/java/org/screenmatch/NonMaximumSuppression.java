package org.screenmatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collapses overlapping detections to the best-scoring one of each cluster.
 */
public final class NonMaximumSuppression {
    public static final double OVERLAP_THRESHOLD = 0.5;

    private NonMaximumSuppression() {
    }

    public static List<Match> suppress(List<Match> matches) {
        if (matches.size() <= 1) {
            return new ArrayList<>(matches);
        }

        List<Match> sorted = new ArrayList<>(matches);
        sorted.sort(Comparator.comparingDouble(Match::getScore).reversed());

        List<Match> kept = new ArrayList<>();
        boolean[] suppressed = new boolean[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            if (suppressed[i]) {
                continue;
            }
            Match current = sorted.get(i);
            kept.add(current);
            for (int j = i + 1; j < sorted.size(); j++) {
                if (!suppressed[j] && current.getRegion().overlap(sorted.get(j).getRegion()) > OVERLAP_THRESHOLD) {
                    suppressed[j] = true;
                }
            }
        }
        return kept;
    }
}
