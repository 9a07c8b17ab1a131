package ai.wordle.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for decision-tree precomputation.
 * 
 * One tree is built per (word length, mode) pair. Interrupted builds resume from the
 * checkpoint on the next run.
 * 
 * Usage:
 * {@code java -jar engine.jar --spring.profiles.active=precompute --precompute.word-lengths=5 --precompute.max-depth=3}
 */
@Component
@ConfigurationProperties(prefix = "precompute")
public class PrecomputeProperties {
  private int maxDepth = 4;
  private int minCandidates = 15;
  private int workers = 0;
  private int checkpointEvery = 10;
  private List<Integer> wordLengths = new ArrayList<>(List.of(4, 5, 6));
  private List<String> modes = new ArrayList<>(List.of("uniform", "frequency"));

  /**
   * Returns the deepest feedback path that gets a precomputed guess.
   * @return maximum depth (root is depth 0)
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  public void setMaxDepth(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  /**
   * Returns the candidate count a child must exceed to be expanded.
   * @return minimum candidates
   */
  public int getMinCandidates() {
    return minCandidates;
  }

  public void setMinCandidates(int minCandidates) {
    this.minCandidates = minCandidates;
  }

  /**
   * Returns the worker thread count; 0 means one per available processor.
   * @return configured workers
   */
  public int getWorkers() {
    return workers;
  }

  public void setWorkers(int workers) {
    this.workers = workers;
  }

  /**
   * Resolves {@link #getWorkers()} against the machine.
   * @return effective worker count, at least 1
   */
  public int effectiveWorkers() {
    return workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  /**
   * Returns how many completed nodes are allowed between mid-depth checkpoint writes.
   * @return checkpoint interval in nodes
   */
  public int getCheckpointEvery() {
    return checkpointEvery;
  }

  public void setCheckpointEvery(int checkpointEvery) {
    this.checkpointEvery = checkpointEvery;
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
