package org.wikipedia.history;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of a computation with the time it took.
 */
public final class Timed<T> {

  private final String label;
  private final T value;
  private final Duration duration;

  private Timed(String label, T value, Duration duration) {
    this.label = label;
    this.value = value;
    this.duration = duration;
  }

  public static <T> Timed<T> run(String label, Supplier<T> code) {
    long start = System.nanoTime();
    T value = code.get();
    return new Timed<>(label, value, Duration.ofNanos(System.nanoTime() - start));
  }

  /**
   * @return the same label and duration with a value derived from this one, for example a summary to report
   */
  public <R> Timed<R> map(Function<? super T, ? extends R> mapper) {
    return new Timed<>(label, mapper.apply(value), duration);
  }

  public String getLabel() {
    return label;
  }

  public T getValue() {
    return value;
  }

  public Duration getDuration() {
    return duration;
  }

  @Override
  public String toString() {
    return "Processing " + label + " took " + duration.toMillis() + " ms.";
  }
}
