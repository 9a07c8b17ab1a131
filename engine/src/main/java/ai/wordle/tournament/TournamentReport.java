package ai.wordle.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * The tournament artifact read by the dashboard.
 *
 * @param config the knobs the tournament ran with
 */
public record TournamentReport(
        @JsonProperty("tournament_id") String tournamentId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("config") Map<String, Object> config,
        @JsonProperty("rounds") List<RoundResult> rounds,
        @JsonProperty("leaderboard") List<LeaderboardEntry> leaderboard) {
}
