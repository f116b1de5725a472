package com.example.rdsbroker.core.engines;

import static java.lang.System.Logger.Level.DEBUG;

import java.sql.SQLException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/** Retry of SQL units of work that can lose a race with a concurrent binding. */
final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Supplier that can throw {@link SQLException}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface SqlExceptionSupplier<T> {
    T get() throws SQLException;
  }

  /**
   * Retry policy.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1
   * @param maxDelayMillis upper bound of the random delay between attempts, must be >= 0
   */
  record Policy(int maxAttempts, long maxDelayMillis) {

    Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (maxDelayMillis < 0) throw new IllegalArgumentException("maxDelayMillis must be >= 0");
    }

    /** Uniformly random delay in {@code [0, maxDelayMillis)}. */
    long nextDelay() {
      return maxDelayMillis == 0 ? 0L : ThreadLocalRandom.current().nextLong(maxDelayMillis);
    }
  }

  /**
   * Executes the supplier up to {@link Policy#maxAttempts()} times, sleeping a random delay
   * between attempts, as long as {@code shouldRetry} accepts the failure.
   *
   * @throws SQLException the last failure, or the first one that is not retryable
   */
  static <T> T onException(
      final SqlExceptionSupplier<T> supplier,
      final Predicate<SQLException> shouldRetry,
      final Policy policy)
      throws SQLException {
    var attempt = 0;
    while (true) {
      attempt++;
      try {
        return supplier.get();
      } catch (final SQLException ex) {
        if (!shouldRetry.test(ex) || attempt >= policy.maxAttempts()) throw ex;

        LOGGER.log(
            DEBUG, "Attempt {0} failed with SQLState {1}, retrying...", attempt, ex.getSQLState());
        final var delay = policy.nextDelay();
        if (delay > 0) {
          try {
            Thread.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw ex;
          }
        }
      }
    }
  }
}
