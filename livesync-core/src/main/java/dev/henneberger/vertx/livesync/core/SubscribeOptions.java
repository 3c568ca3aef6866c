package dev.henneberger.vertx.livesync.core;

public final class SubscribeOptions {

  private String subscriptionId;
  private boolean merge;

  public static SubscribeOptions defaults() {
    return new SubscribeOptions();
  }

  public String getSubscriptionId() {
    return subscriptionId;
  }

  /**
   * Uses a caller-chosen id instead of a generated one.
   */
  public SubscribeOptions setSubscriptionId(String subscriptionId) {
    this.subscriptionId = subscriptionId;
    return this;
  }

  public boolean isMerge() {
    return merge;
  }

  /**
   * Deliver incremental change data and let the client decide whether to re-fetch.
   */
  public SubscribeOptions setMerge(boolean merge) {
    this.merge = merge;
    return this;
  }
}
