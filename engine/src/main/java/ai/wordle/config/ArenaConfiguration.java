package ai.wordle.config;

import ai.wordle.game.LexiconLoader;
import ai.wordle.strategy.StrategyRegistry;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Shared beans: the strategy registry and the word-list loader.
 */
@Configuration
public class ArenaConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ArenaConfiguration.class);

    @Bean
    public StrategyRegistry strategyRegistry(StrategyProperties properties) {
        StrategyRegistry registry = StrategyRegistry.withBuiltIns(Path.of(properties.getTreeDirectory()));
        if (properties.isLoadPlugins()) {
            int plugins = registry.loadPlugins();
            if (plugins > 0) {
                log.info("Loaded {} strategy plugin(s)", plugins);
            }
        }
        return registry;
    }

    @Bean
    public LexiconLoader lexiconLoader(LexiconProperties properties) {
        return new LexiconLoader(Path.of(properties.getDirectory()));
    }

    /**
     * Without an explicit profile there is nothing to run; say how to pick one.
     */
    @Bean
    @Profile("default")
    public CommandLineRunner usage(StrategyRegistry registry) {
        return args -> log.info("No profile active. Use --spring.profiles.active=tournament|precompute|experiment. "
                + "Registered strategies: {}", registry.names());
    }
}
