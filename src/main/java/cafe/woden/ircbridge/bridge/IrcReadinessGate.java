package cafe.woden.ircbridge.bridge;

import cafe.woden.ircbridge.config.ChannelMap;
import cafe.woden.ircbridge.irc.IrcLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks IRC registration and decides when relaying may start.
 *
 * <p>On welcome (001) every configured channel is joined. After ISUPPORT (005) the bridge marks
 * itself as a bot when the server offers a {@code BOT} mode, then sends {@code PING ready}; the
 * matching {@code PONG} arrives after all joins have completed, which keeps join bursts and
 * channel history replays out of Discord.
 */
@ApplicationLayer
@Component
public class IrcReadinessGate {

  private static final Logger log = LoggerFactory.getLogger(IrcReadinessGate.class);

  static final String READY_TOKEN = "ready";

  /** What to do with one inbound line. */
  public record Outcome(boolean consumed, List<RelayAction> actions) {
    public Outcome {
      actions = (actions == null) ? List.of() : List.copyOf(actions);
    }

    static Outcome pass() {
      return new Outcome(false, List.of());
    }

    static Outcome consumed(List<RelayAction> actions) {
      return new Outcome(true, actions);
    }
  }

  private final ChannelMap channels;
  private IrcConnectionPhase phase = IrcConnectionPhase.DISCONNECTED;
  private boolean readyPingSent;

  public IrcReadinessGate(ChannelMap channels) {
    this.channels = Objects.requireNonNull(channels, "channels");
  }

  public synchronized IrcConnectionPhase phase() {
    return phase;
  }

  public synchronized void onConnected() {
    phase = IrcConnectionPhase.HANDSHAKING;
    readyPingSent = false;
  }

  public synchronized void onDisconnected() {
    if (phase != IrcConnectionPhase.DISCONNECTED) {
      log.info("[ircbridge] IRC relay paused until the next session is ready");
    }
    phase = IrcConnectionPhase.DISCONNECTED;
    readyPingSent = false;
  }

  /**
   * Handles registration lines.
   *
   * @return {@code consumed == true} when the line must not be relayed, either because it is part
   *     of the handshake or because the session is not ready yet
   */
  public synchronized Outcome onLine(IrcLine line, String selfNick) {
    switch (line.command()) {
      case "001" -> {
        if (phase == IrcConnectionPhase.DISCONNECTED) phase = IrcConnectionPhase.HANDSHAKING;
        List<RelayAction> joins = new ArrayList<>();
        for (String channel : channels.ircChannels()) {
          joins.add(new RelayAction.SendIrcLine(IrcLine.of("JOIN", channel)));
        }
        return Outcome.consumed(joins);
      }
      case "005" -> {
        return Outcome.consumed(onIsupport(line, selfNick));
      }
      case "PONG" -> {
        if (READY_TOKEN.equals(line.lastParam()) && phase != IrcConnectionPhase.READY) {
          phase = IrcConnectionPhase.READY;
          log.info("[ircbridge] IRC session ready; relaying {} channel(s)", channels.size());
        }
        return Outcome.consumed(List.of());
      }
      default -> {
        return phase == IrcConnectionPhase.READY ? Outcome.pass() : Outcome.consumed(List.of());
      }
    }
  }

  private List<RelayAction> onIsupport(IrcLine line, String selfNick) {
    List<RelayAction> out = new ArrayList<>();
    // 005 <nick> TOKEN[=value]... :are supported by this server
    List<String> params = line.params();
    for (int i = 1; i < params.size() - 1; i++) {
      String token = params.get(i);
      int eq = token.indexOf('=');
      String key = eq < 0 ? token : token.substring(0, eq);
      String value = eq < 0 ? "" : token.substring(eq + 1);
      if ("BOT".equals(key) && !value.isEmpty()) {
        out.add(new RelayAction.SendIrcLine(IrcLine.of("MODE", selfNick, "+" + value)));
      }
    }
    // Servers send several 005 lines; one ready ping per session is enough.
    if (!readyPingSent) {
      readyPingSent = true;
      out.add(new RelayAction.SendIrcLine(IrcLine.of("PING", READY_TOKEN)));
    }
    return out;
  }
}
