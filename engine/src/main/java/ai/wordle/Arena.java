package ai.wordle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point. What runs is chosen with a Spring profile:
 * <ul>
 *   <li>{@code tournament}: every registered strategy through the round matrix, writing the
 *       leaderboard report;</li>
 *   <li>{@code precompute}: build (or resume) the decision trees used by the entropy strategy;</li>
 *   <li>{@code experiment}: one strategy with a per-step trace.</li>
 * </ul>
 * Example: {@code java -jar engine.jar --spring.profiles.active=tournament --tournament.num-games=100}
 */
@SpringBootApplication
public class Arena {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Arena.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }
}
