package dungeom;

/**
 * Accumulates wall clock time.
 *
 * Call start and stop around each piece of work; the time in between is
 * added to the total.
 */
public class Timer {
  private final String name;

  private long startTime;
  private long runTime = 0;
  private boolean running = false;

  public Timer(String name) {
    this.name = name;
  }

  public void start() {
    startTime = System.currentTimeMillis();
    running = true;
  }

  public void stop() {
    if (!running) {
      return;
    }
    runTime += System.currentTimeMillis() - startTime;
    running = false;
  }

  /**
   * Milliseconds accumulated so far, including the current interval if the
   * timer is running.
   */
  public long elapsedMillis() {
    if (running) {
      return runTime + (System.currentTimeMillis() - startTime);
    }
    return runTime;
  }

  /**
   * Returns the runtime in seconds.
   */
  public double toSeconds() {
    return elapsedMillis() / 1000.0;
  }

  @Override
  public String toString() {
    return String.format("%s: %.3f s", name, toSeconds());
  }
}
