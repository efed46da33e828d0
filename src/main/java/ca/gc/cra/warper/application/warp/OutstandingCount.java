package ca.gc.cra.warper.application.warp;

/**
 * Number of items submitted but not yet drained.
 * <p>Owned by the control thread; not thread-safe.</p>
 *
 * @since WARPER 0.1
 */
public final class OutstandingCount {
  private int value;

  /** Records a submission. */
  public void increment() {
    value++;
  }

  /**
   * Records a drained result.
   *
   * @throws IllegalStateException if nothing is outstanding
   */
  public void decrement() {
    if (value == 0) {
      throw new IllegalStateException("outstanding count would drop below zero");
    }
    value--;
  }

  /** @return current count, never negative */
  public int get() {
    return value;
  }

  /** @return {@code true} when no item is outstanding */
  public boolean isZero() {
    return value == 0;
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}
