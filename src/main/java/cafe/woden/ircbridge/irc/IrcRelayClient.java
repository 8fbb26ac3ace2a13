package cafe.woden.ircbridge.irc;

import io.reactivex.rxjava3.core.Flowable;

/**
 * The bridge's single IRC connection.
 *
 * <p>Implementations reconnect on their own, forever, with a fixed delay.
 */
public interface IrcRelayClient {

  Flowable<IrcSessionEvent> events();

  /** Starts the connect loop. Idempotent. */
  void start();

  /**
   * Sends one line on the live connection.
   *
   * <p>Silently dropped while no registered connection exists, or when the line needs a
   * capability the server did not acknowledge. Never queued or retried.
   */
  void write(IrcLine line);
}
