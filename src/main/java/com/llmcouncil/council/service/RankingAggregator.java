package com.llmcouncil.council.service;

import com.llmcouncil.council.model.AggregateEntry;
import com.llmcouncil.council.model.LabelMapping;
import com.llmcouncil.council.model.Stage2Critique;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns parsed peer rankings into a leaderboard. The result depends only on the set of parsed
 * critiques, not on their order.
 *
 * <p>Ordering: average rank ascending, then number of rankings descending, then model id
 * ascending.
 */
@Service
public class RankingAggregator {

    private static final Comparator<Tally> LEADERBOARD_ORDER = Comparator
            .comparingDouble(Tally::average)
            .thenComparing(Comparator.comparingInt(Tally::count).reversed())
            .thenComparing(Tally::model);

    public List<AggregateEntry> aggregate(Collection<Stage2Critique> critiques, LabelMapping mapping) {
        Map<String, Tally> tallies = new HashMap<>();
        for (Stage2Critique critique : critiques) {
            if (critique == null || !critique.isParsed()) {
                continue;
            }
            List<String> ranking = critique.parsedRanking();
            for (int position = 1; position <= ranking.size(); position++) {
                String model = mapping.modelFor(ranking.get(position - 1));
                if (model == null) {
                    continue;
                }
                tallies.computeIfAbsent(model, Tally::new).add(position);
            }
        }
        List<Tally> ordered = new ArrayList<>(tallies.values());
        ordered.sort(LEADERBOARD_ORDER);
        return ordered.stream()
                .map(tally -> new AggregateEntry(tally.model(), round(tally.average()), tally.count()))
                .toList();
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class Tally {
        private final String model;
        private int positionSum;
        private int count;

        Tally(String model) {
            this.model = model;
        }

        void add(int position) {
            positionSum += position;
            count++;
        }

        String model() {
            return model;
        }

        int count() {
            return count;
        }

        double average() {
            return (double) positionSum / count;
        }
    }
}
