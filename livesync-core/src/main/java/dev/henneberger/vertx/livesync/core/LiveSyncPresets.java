package dev.henneberger.vertx.livesync.core;

import java.time.Duration;
import java.util.Objects;

public final class LiveSyncPresets {

  private LiveSyncPresets() {
  }

  public static void applyProductionDefaults(LiveSyncOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setLockTtl(LiveSyncOptions.DEFAULT_LOCK_TTL)
      .setLockSweepInterval(LiveSyncOptions.DEFAULT_LOCK_SWEEP_INTERVAL)
      .setReconnectPolicy(
        ReconnectPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(500))
          .setMaxDelay(Duration.ofSeconds(30))
          .setMultiplier(2.0d)
          .setJitter(0.2d)
      );
  }

  public static void applyLocalDevDefaults(LiveSyncOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setLockTtl(Duration.ofMinutes(5))
      .setLockSweepInterval(Duration.ofSeconds(10))
      .setReconnectPolicy(
        ReconnectPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(200))
          .setMaxDelay(Duration.ofSeconds(5))
          .setMultiplier(1.5d)
          .setJitter(0.1d)
      );
  }
}
