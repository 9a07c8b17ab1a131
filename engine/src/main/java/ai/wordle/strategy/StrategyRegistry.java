package ai.wordle.strategy;

import ai.wordle.strategy.entropy.EntropyStrategy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit registry of the strategies that can be entered into a tournament.
 * <p>
 * Built-in strategies are registered statically by {@link #withBuiltIns(Path)}; additional ones
 * arrive through {@link StrategyProvider} plugins found by {@link #loadPlugins()}. Registration
 * order is preserved and names are matched case-insensitively.
 * <p>
 * A plugin that fails to load, or whose name collides with an existing entry, is skipped with
 * a warning; the remaining strategies stay usable.
 */
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private record Entry(String name, Supplier<? extends Strategy> factory) {
    }

    /**
     * Registry with {@code MaxProb}, {@code Random} and {@code Entropy}.
     *
     * @param treeDirectory where precomputed decision trees live; may be null for none
     */
    public static StrategyRegistry withBuiltIns(Path treeDirectory) {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(MaxProbabilityStrategy.NAME, MaxProbabilityStrategy::new);
        registry.register(RandomStrategy.NAME, RandomStrategy::new);
        registry.register(EntropyStrategy.NAME, () -> new EntropyStrategy(treeDirectory));
        return registry;
    }

    /**
     * Adds a strategy factory.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public StrategyRegistry register(String name, Supplier<? extends Strategy> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name cannot be blank");
        }
        String key = key(name);
        if (entries.containsKey(key)) {
            throw new IllegalArgumentException("Strategy already registered: " + name);
        }
        entries.put(key, new Entry(name, factory));
        return this;
    }

    /**
     * Registers every {@link StrategyProvider} visible to the context class loader.
     *
     * @return number of plugins registered
     */
    public int loadPlugins() {
        return loadPlugins(ServiceLoader.load(StrategyProvider.class));
    }

    int loadPlugins(Iterable<StrategyProvider> providers) {
        int loaded = 0;
        Iterator<StrategyProvider> it = providers.iterator();
        while (true) {
            StrategyProvider provider;
            try {
                if (!it.hasNext()) {
                    break;
                }
                provider = it.next();
            } catch (ServiceConfigurationError e) {
                log.warn("Skipping strategy plugin that failed to load: {}", e.getMessage());
                continue;
            }
            try {
                register(provider.name(), provider::create);
                loaded++;
                if (log.isDebugEnabled()) {
                    log.debug("Registered strategy plugin {} ({})", provider.name(), provider.getClass().getName());
                }
            } catch (RuntimeException e) {
                log.warn("Skipping strategy plugin {}: {}", provider.getClass().getName(), e.getMessage());
            }
        }
        return loaded;
    }

    /**
     * Creates a fresh instance of the named strategy.
     *
     * @throws IllegalArgumentException if no strategy has that name
     */
    public Strategy create(String name) {
        Entry entry = name == null ? null : entries.get(key(name));
        if (entry == null) {
            throw new IllegalArgumentException("Unknown strategy '" + name + "'. Available: " + names());
        }
        return entry.factory().get();
    }

    /**
     * Factory for repeated instantiation of one strategy.
     */
    public Supplier<Strategy> factory(String name) {
        if (!contains(name)) {
            throw new IllegalArgumentException("Unknown strategy '" + name + "'. Available: " + names());
        }
        return () -> create(name);
    }

    public boolean contains(String name) {
        return name != null && entries.containsKey(key(name));
    }

    /**
     * Registered names in registration order.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Entry entry : entries.values()) {
            names.add(entry.name());
        }
        return names;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
