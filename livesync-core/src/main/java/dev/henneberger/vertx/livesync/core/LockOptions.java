package dev.henneberger.vertx.livesync.core;

import java.time.Duration;

public final class LockOptions {

  private Duration ttl;

  public static LockOptions defaults() {
    return new LockOptions();
  }

  /**
   * Lifetime of the lock; {@code null} uses the manager default and {@link Duration#ZERO} means
   * it never expires.
   */
  public Duration getTtl() {
    return ttl;
  }

  public LockOptions setTtl(Duration ttl) {
    if (ttl != null && ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be >= 0");
    }
    this.ttl = ttl;
    return this;
  }
}
