package cafe.woden.ircbridge.irc;

import java.util.Objects;

/** What the IRC connection reports to the bridge. */
public sealed interface IrcSessionEvent
    permits IrcSessionEvent.Connected, IrcSessionEvent.LineReceived, IrcSessionEvent.Disconnected {

  /** A new TCP/TLS session is being registered. */
  record Connected(String host, int port) implements IrcSessionEvent {}

  /**
   * One inbound protocol line.
   *
   * @param selfNick the bridge's nick at the time the line was read
   */
  record LineReceived(IrcLine line, String selfNick) implements IrcSessionEvent {
    public LineReceived {
      Objects.requireNonNull(line, "line");
      selfNick = Objects.toString(selfNick, "");
    }
  }

  record Disconnected(String reason) implements IrcSessionEvent {
    public Disconnected {
      reason = Objects.toString(reason, "Disconnected");
    }
  }
}
