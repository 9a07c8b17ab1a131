package ai.wordle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for word-list loading.
 * 
 * The directory holds {@code spanish_<L>letter.csv} files (word,count) and the
 * {@code mini_spanish_<L>.txt} fallbacks.
 * 
 * Usage:
 * {@code java -jar engine.jar --spring.profiles.active=tournament --lexicon.directory=/data/words}
 */
@Component
@ConfigurationProperties(prefix = "lexicon")
public class LexiconProperties {
  private String directory = "data";

  /**
   * Returns the directory containing the word lists.
   * @return directory path, relative to the working directory unless absolute
   */
  public String getDirectory() {
    return directory;
  }

  /**
   * Sets the directory containing the word lists.
   * @param directory directory path
   */
  public void setDirectory(String directory) {
    this.directory = directory;
  }
}
