package dev.henneberger.vertx.livesync.core;

public final class ListenerStateChange {
  private final String tenantId;
  private final ListenerState previousState;
  private final ListenerState state;
  private final Throwable cause;
  private final long attempt;

  public ListenerStateChange(String tenantId,
                             ListenerState previousState,
                             ListenerState state,
                             Throwable cause,
                             long attempt) {
    this.tenantId = tenantId;
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
  }

  public String tenantId() {
    return tenantId;
  }

  public ListenerState previousState() {
    return previousState;
  }

  public ListenerState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  public long attempt() {
    return attempt;
  }

  @Override
  public String toString() {
    return "ListenerStateChange{tenant=" + tenantId + ", " + previousState + " -> " + state
      + ", attempt=" + attempt + (cause == null ? "" : ", cause=" + cause) + '}';
  }
}
