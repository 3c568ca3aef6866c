package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * A live subscription to one tenant's change-notification channel. Decoded messages go to the
 * {@link ChangeReceiver} the listener was created with, in channel order.
 */
public interface ChangeListener extends AutoCloseable {

  String tenantId();

  /**
   * Opens the channel. The returned future completes once the first subscription is
   * established and fails if the first attempt fails; in that case the listener keeps
   * reconnecting in the background for as long as its policy allows. Calling it again while
   * connecting returns the same future.
   */
  Future<Void> start();

  ListenerState state();

  Registration onStateChange(Handler<ListenerStateChange> handler);

  @Override
  void close();
}
