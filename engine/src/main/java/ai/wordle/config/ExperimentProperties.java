package ai.wordle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for single-strategy experiments.
 * 
 * Usage:
 * {@code java -jar engine.jar --spring.profiles.active=experiment --experiment.strategy=MaxProb --experiment.num-games=50}
 */
@Component
@ConfigurationProperties(prefix = "experiment")
public class ExperimentProperties {
  private String strategy = "Entropy";
  private int wordLength = 5;
  private String mode = "uniform";
  private int numGames = 20;
  private long seed = 42L;
  private int maxGuesses = 6;
  private boolean allowNonWords = true;
  private String output = "results/experiment.json";

  /**
   * Returns the registry name of the strategy under test.
   * @return strategy name
   */
  public String getStrategy() {
    return strategy;
  }

  public void setStrategy(String strategy) {
    this.strategy = strategy;
  }

  public int getWordLength() {
    return wordLength;
  }

  public void setWordLength(int wordLength) {
    this.wordLength = wordLength;
  }

  /**
   * Returns the probability mode key.
   * @return {@code uniform} or {@code frequency}
   */
  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public int getNumGames() {
    return numGames;
  }

  public void setNumGames(int numGames) {
    this.numGames = numGames;
  }

  /**
   * Returns the seed used to sample the secrets.
   * @return sampling seed
   */
  public long getSeed() {
    return seed;
  }

  public void setSeed(long seed) {
    this.seed = seed;
  }

  public int getMaxGuesses() {
    return maxGuesses;
  }

  public void setMaxGuesses(int maxGuesses) {
    this.maxGuesses = maxGuesses;
  }

  public boolean isAllowNonWords() {
    return allowNonWords;
  }

  public void setAllowNonWords(boolean allowNonWords) {
    this.allowNonWords = allowNonWords;
  }

  /**
   * Returns where the JSON trace is written.
   * @return output file path
   */
  public String getOutput() {
    return output;
  }

  public void setOutput(String output) {
    this.output = output;
  }
}
