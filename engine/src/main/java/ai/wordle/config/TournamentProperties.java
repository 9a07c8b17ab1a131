package ai.wordle.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for tournaments.
 * 
 * Defaults run the canonical six rounds ({4,5,6} letters x {uniform, frequency}) once, with every
 * registered strategy in its own child JVM.
 * 
 * Usage:
 * {@code java -jar engine.jar --spring.profiles.active=tournament --tournament.repetitions=5 --tournament.shock=0.05}
 */
@Component
@ConfigurationProperties(prefix = "tournament")
public class TournamentProperties {
  private String name;
  private double gameTimeoutSeconds = 5.0;
  private int memoryLimitMb = 2048;
  private int workers = 0;
  private int repetitions = 1;
  private double shock = 0.0;
  private Long seed;
  private Integer numGames;
  private int maxGuesses = 6;
  private boolean allowNonWords = true;
  private String isolation = "process";
  private String outputDir = "results";
  private List<String> strategies = new ArrayList<>();
  private List<Integer> wordLengths = new ArrayList<>(List.of(4, 5, 6));
  private List<String> modes = new ArrayList<>(List.of("uniform", "frequency"));

  /**
   * Returns the optional human-readable tournament name stored in the report.
   * @return name, or null
   */
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  /**
   * Returns the wall-clock budget of a single game.
   * @return seconds per game
   */
  public double getGameTimeoutSeconds() {
    return gameTimeoutSeconds;
  }

  public void setGameTimeoutSeconds(double gameTimeoutSeconds) {
    this.gameTimeoutSeconds = gameTimeoutSeconds;
  }

  /**
   * Returns the heap cap of each worker JVM.
   * @return megabytes passed as {@code -Xmx}
   */
  public int getMemoryLimitMb() {
    return memoryLimitMb;
  }

  public void setMemoryLimitMb(int memoryLimitMb) {
    this.memoryLimitMb = memoryLimitMb;
  }

  /**
   * Returns how many strategies run at once; 0 means min(strategies, processors, 4).
   * @return configured workers
   */
  public int getWorkers() {
    return workers;
  }

  public void setWorkers(int workers) {
    this.workers = workers;
  }

  public int getRepetitions() {
    return repetitions;
  }

  public void setRepetitions(int repetitions) {
    this.repetitions = repetitions;
  }

  /**
   * Returns the noise scale applied to frequency-mode distributions each round.
   * @return 0.0 for none, 0.05 for +/-5%
   */
  public double getShock() {
    return shock;
  }

  public void setShock(double shock) {
    this.shock = shock;
  }

  /**
   * Returns the master seed; round seeds are drawn from it.
   * @return seed, or null for a random one
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns the number of secrets per round.
   * @return secret count, or null for the whole vocabulary
   */
  public Integer getNumGames() {
    return numGames;
  }

  public void setNumGames(Integer numGames) {
    this.numGames = numGames;
  }

  public int getMaxGuesses() {
    return maxGuesses;
  }

  public void setMaxGuesses(int maxGuesses) {
    this.maxGuesses = maxGuesses;
  }

  /**
   * Returns whether guesses outside the vocabulary are accepted.
   * @return true to accept any string of the right length
   */
  public boolean isAllowNonWords() {
    return allowNonWords;
  }

  public void setAllowNonWords(boolean allowNonWords) {
    this.allowNonWords = allowNonWords;
  }

  /**
   * Returns how workers are isolated: {@code process} (child JVM per strategy) or
   * {@code thread} (in-process, for development).
   * @return isolation mode
   */
  public String getIsolation() {
    return isolation;
  }

  public void setIsolation(String isolation) {
    this.isolation = isolation;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(String outputDir) {
    this.outputDir = outputDir;
  }

  /**
   * Returns the names of the strategies to enter.
   * @return strategy names; empty enters every registered strategy
   */
  public List<String> getStrategies() {
    return strategies;
  }

  public void setStrategies(List<String> strategies) {
    this.strategies = strategies;
  }

  public List<Integer> getWordLengths() {
    return wordLengths;
  }

  public void setWordLengths(List<Integer> wordLengths) {
    this.wordLengths = wordLengths;
  }

  public List<String> getModes() {
    return modes;
  }

  public void setModes(List<String> modes) {
    this.modes = modes;
  }
}
