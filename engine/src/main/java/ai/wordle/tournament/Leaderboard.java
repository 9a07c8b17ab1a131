package ai.wordle.tournament;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Points-based standings across rounds.
 * <p>
 * In each round the strategies with results are ranked by mean guesses, fewest first. With N
 * such strategies, rank r earns {@code N - r + 1} points; strategies whose means are exactly
 * equal share the average of the points their positions would have earned, so a round always
 * hands out {@code N(N+1)/2} points in total. Points are summed over all rounds. The final order
 * is by total points, most first, then by name. Overall solve rate and mean guesses are averaged
 * over the rounds a strategy took part in.
 */
public final class Leaderboard {

    private static final Comparator<StrategyRoundStats> BY_MEAN =
            Comparator.comparingDouble(StrategyRoundStats::meanGuesses).thenComparing(StrategyRoundStats::name);

    private Leaderboard() {
    }

    public static List<LeaderboardEntry> compute(List<RoundResult> rounds) {
        Map<String, Tally> tallies = new LinkedHashMap<>();

        for (RoundResult round : rounds) {
            List<StrategyRoundStats> ranked = new ArrayList<>(round.strategies());
            ranked.sort(BY_MEAN);
            int n = ranked.size();

            int i = 0;
            while (i < n) {
                int j = i;
                while (j < n && ranked.get(j).meanGuesses() == ranked.get(i).meanGuesses()) {
                    j++;
                }
                // Positions i..j-1 are tied; position k earns n - k points.
                double shared = 0.0;
                for (int k = i; k < j; k++) {
                    shared += n - k;
                }
                shared /= (j - i);
                for (int k = i; k < j; k++) {
                    StrategyRoundStats stats = ranked.get(k);
                    Tally tally = tallies.computeIfAbsent(stats.name(), Tally::new);
                    tally.total += shared;
                    tally.roundPoints.put(round.roundId(), shared);
                    tally.solveRates += stats.solveRate();
                    tally.meanGuesses += stats.meanGuesses();
                    tally.rounds++;
                }
                i = j;
            }
        }

        List<Tally> ordered = new ArrayList<>(tallies.values());
        ordered.sort(Comparator.comparingDouble((Tally t) -> -t.total).thenComparing(t -> t.name));

        List<LeaderboardEntry> entries = new ArrayList<>(ordered.size());
        int rank = 1;
        for (Tally tally : ordered) {
            entries.add(new LeaderboardEntry(rank++, tally.name, tally.total, tally.roundPoints,
                    tally.solveRates / tally.rounds, tally.meanGuesses / tally.rounds));
        }
        return entries;
    }

    private static final class Tally {
        private final String name;
        private final Map<String, Double> roundPoints = new LinkedHashMap<>();
        private double total;
        private double solveRates;
        private double meanGuesses;
        private int rounds;

        private Tally(String name) {
            this.name = name;
        }
    }
}
