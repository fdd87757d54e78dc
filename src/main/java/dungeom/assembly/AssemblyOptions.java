package dungeom.assembly;

import java.util.Random;

import dungeom.graph.CompletionCheck;
import dungeom.graph.PinnedFirstEdgeStart;
import dungeom.graph.StartSelector;
import dungeom.graph.ZeroResidualCheck;

/**
 * Settings for the EulerianAssembler.
 *
 * The setters return this so options can be chained.
 */
public class AssemblyOptions {
  public static final int DEFAULT_MAX_ATTEMPTS = 100;

  private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
  // Wall clock budget for the retry loop in milliseconds. 0 means no limit.
  private long timeoutMillis = 0;
  private Random random = new Random();
  private StartSelector startSelector = new PinnedFirstEdgeStart();
  private CompletionCheck completionCheck = new ZeroResidualCheck();

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public AssemblyOptions setMaxAttempts(int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException(
          "max attempts must be at least 1 but was " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    return this;
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  public AssemblyOptions setTimeoutMillis(long timeoutMillis) {
    if (timeoutMillis < 0) {
      throw new IllegalArgumentException(
          "timeout can't be negative: " + timeoutMillis);
    }
    this.timeoutMillis = timeoutMillis;
    return this;
  }

  public Random getRandom() {
    return random;
  }

  public AssemblyOptions setRandom(Random random) {
    this.random = random;
    return this;
  }

  /**
   * Convenience method to use a generator seeded with seed.
   */
  public AssemblyOptions setSeed(long seed) {
    this.random = new Random(seed);
    return this;
  }

  public StartSelector getStartSelector() {
    return startSelector;
  }

  public AssemblyOptions setStartSelector(StartSelector startSelector) {
    this.startSelector = startSelector;
    return this;
  }

  public CompletionCheck getCompletionCheck() {
    return completionCheck;
  }

  public AssemblyOptions setCompletionCheck(CompletionCheck completionCheck) {
    this.completionCheck = completionCheck;
    return this;
  }
}
