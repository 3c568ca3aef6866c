package dev.henneberger.vertx.livesync.core;

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * How a {@link ChangeListener} re-establishes a dropped channel. Attempts count from the last
 * successful connection.
 */
public final class ReconnectPolicy {

  public static final long DEFAULT_INITIAL_DELAY_MS = 1000L;
  public static final long DEFAULT_MAX_DELAY_MS = 30000L;

  private Duration initialDelay = Duration.ofMillis(DEFAULT_INITIAL_DELAY_MS);
  private Duration maxDelay = Duration.ofMillis(DEFAULT_MAX_DELAY_MS);
  private double multiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxAttempts;
  private Predicate<Throwable> reconnectOn = err -> true;
  private final boolean enabled;

  private ReconnectPolicy(boolean enabled) {
    this.enabled = enabled;
  }

  /**
   * Never reconnect; the first failure leaves the listener {@link ListenerState#FAILED}.
   */
  public static ReconnectPolicy never() {
    return new ReconnectPolicy(false);
  }

  public static ReconnectPolicy exponentialBackoff() {
    return new ReconnectPolicy(true);
  }

  public static ReconnectPolicy fixedDelay(Duration delay) {
    Objects.requireNonNull(delay, "delay");
    return new ReconnectPolicy(true)
      .setInitialDelay(delay)
      .setMaxDelay(delay)
      .setMultiplier(1.0d)
      .setJitter(0.0d);
  }

  public static ReconnectPolicy fromJson(JsonObject json) {
    if (json == null) {
      return exponentialBackoff();
    }
    if (!json.getBoolean("enabled", true)) {
      return never();
    }
    return exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(json.getLong("initialDelayMs", DEFAULT_INITIAL_DELAY_MS)))
      .setMaxDelay(Duration.ofMillis(json.getLong("maxDelayMs", DEFAULT_MAX_DELAY_MS)))
      .setMultiplier(json.getDouble("multiplier", 2.0d))
      .setJitter(json.getDouble("jitter", 0.2d))
      .setMaxAttempts(json.getLong("maxAttempts", 0L));
  }

  public ReconnectPolicy copy() {
    ReconnectPolicy copy = new ReconnectPolicy(enabled);
    copy.initialDelay = initialDelay;
    copy.maxDelay = maxDelay;
    copy.multiplier = multiplier;
    copy.jitter = jitter;
    copy.maxAttempts = maxAttempts;
    copy.reconnectOn = reconnectOn;
    return copy;
  }

  public ReconnectPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public ReconnectPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public ReconnectPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  public ReconnectPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  /**
   * Consecutive failed attempts tolerated before giving up; {@code 0} means keep trying.
   */
  public ReconnectPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public ReconnectPolicy setReconnectOn(Predicate<Throwable> reconnectOn) {
    this.reconnectOn = Objects.requireNonNull(reconnectOn, "reconnectOn");
    return this;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public double getJitter() {
    return jitter;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  public boolean shouldReconnect(Throwable error, long failedAttempts) {
    if (!enabled || !reconnectOn.test(error)) {
      return false;
    }
    return maxAttempts == 0 || failedAttempts < maxAttempts;
  }

  public long delayMillis(long failedAttempts) {
    double base = initialDelay.toMillis() * Math.pow(Math.max(1.0d, multiplier), Math.max(0, failedAttempts - 1));
    long capped = Math.min((long) base, maxDelay.toMillis());
    if (jitter == 0.0d || capped == 0L) {
      return capped;
    }
    long spread = (long) (capped * jitter);
    return ThreadLocalRandom.current().nextLong(Math.max(0L, capped - spread), capped + spread + 1);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("enabled", enabled)
      .put("initialDelayMs", initialDelay.toMillis())
      .put("maxDelayMs", maxDelay.toMillis())
      .put("multiplier", multiplier)
      .put("jitter", jitter)
      .put("maxAttempts", maxAttempts);
  }

  public void validate() {
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0");
    }
  }
}
