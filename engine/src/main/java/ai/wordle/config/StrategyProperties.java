package ai.wordle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties shared by the built-in strategies.
 */
@Component
@ConfigurationProperties(prefix = "strategies")
public class StrategyProperties {
  private String treeDirectory = "data/trees";
  private boolean loadPlugins = true;

  /**
   * Returns where precomputed decision trees are read from and written to.
   * @return tree directory path
   */
  public String getTreeDirectory() {
    return treeDirectory;
  }

  public void setTreeDirectory(String treeDirectory) {
    this.treeDirectory = treeDirectory;
  }

  /**
   * Returns whether {@code StrategyProvider} plugins on the classpath are registered.
   * @return true to scan for plugins
   */
  public boolean isLoadPlugins() {
    return loadPlugins;
  }

  public void setLoadPlugins(boolean loadPlugins) {
    this.loadPlugins = loadPlugins;
  }
}
