package cafe.woden.ircbridge.irc;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;
import org.pircbotx.InputParser;
import org.pircbotx.PircBotX;
import org.pircbotx.exception.IrcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PircBotX input parser that additionally forwards every raw line to the bridge.
 *
 * <p>PircBotX keeps handling the protocol itself (PING replies, CAP negotiation, nick tracking).
 * Its listener API drops IRCv3 tags and commands it does not know ({@code TAGMSG}, {@code
 * REDACT}), so the bridge reads the raw line instead.
 */
final class PircbotxRelayInputParser extends InputParser {

  private static final Logger log = LoggerFactory.getLogger(PircbotxRelayInputParser.class);
  private static final Logger wire = LoggerFactory.getLogger(PircbotxIrcRelayClient.WIRE_LOGGER);

  private final PircBotX bot;
  private final PircbotxSessionState state;
  private final Consumer<IrcSessionEvent> sink;
  private final boolean wireDebug;

  PircbotxRelayInputParser(
      PircBotX bot, PircbotxSessionState state, Consumer<IrcSessionEvent> sink, boolean wireDebug) {
    super(bot);
    this.bot = bot;
    this.state = Objects.requireNonNull(state, "state");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.wireDebug = wireDebug;
  }

  @Override
  public void handleLine(String rawLine) throws IOException, IrcException {
    if (wireDebug) wire.debug("<<< {}", rawLine);

    // Own lines are recognised by the nick we had when they arrived.
    String selfNick = Objects.toString(bot.getNick(), "");
    super.handleLine(rawLine);
    forward(rawLine, selfNick);
  }

  /** Parses {@code rawLine}, tracks session state from it and hands it to the bridge. */
  void forward(String rawLine, String selfNick) {
    IrcLine line;
    try {
      line = IrcLine.parse(rawLine);
    } catch (RuntimeException e) {
      log.warn("[ircbridge] unparseable IRC line ignored: {}", rawLine, e);
      return;
    }
    observe(line);
    sink.accept(new IrcSessionEvent.LineReceived(line, selfNick));
  }

  private void observe(IrcLine line) {
    switch (line.command()) {
      case "001" -> state.markRegistered(bot);
      case "CAP" -> observeCap(line);
      default -> {
        // nothing to track
      }
    }
  }

  private void observeCap(IrcLine line) {
    String sub = line.param(1);
    boolean ack = "ACK".equalsIgnoreCase(sub);
    boolean del = "DEL".equalsIgnoreCase(sub);
    if (!ack && !del) return;
    for (String cap : line.lastParam().trim().split("\\s+")) {
      if (cap.isEmpty()) continue;
      if (del) {
        state.capEnabled(cap, false);
      } else if (cap.startsWith("-")) {
        state.capEnabled(cap.substring(1), false);
      } else {
        state.capEnabled(cap, true);
      }
    }
    log.debug("[ircbridge] CAP {} {}", sub, line.lastParam());
  }
}
