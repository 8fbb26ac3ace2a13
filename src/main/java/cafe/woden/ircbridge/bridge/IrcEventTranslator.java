package cafe.woden.ircbridge.bridge;

import cafe.woden.ircbridge.config.ChannelMap;
import cafe.woden.ircbridge.correlation.MessageCorrelationStore;
import cafe.woden.ircbridge.irc.IrcLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.stereotype.Component;

/**
 * Decides what a relayable IRC line means for Discord.
 *
 * <p>Lines from the bridge's own nick are dropped, except its echoed {@code PRIVMSG}s, whose
 * {@code +discord} tag links the server-assigned msgid to the Discord message they came from.
 */
@ApplicationLayer
@Component
public class IrcEventTranslator {

  static final String TAG_MSGID = "msgid";
  static final String TAG_REPLY = "+draft/reply";
  static final String TAG_DISCORD = "+discord";
  static final String TAG_TYPING = "+typing";

  private static final Pattern MEDIA_LINK =
      Pattern.compile("^https?://[^\\s\\x01-\\x16]+\\.(?:jpg|jpeg|png|gif|mp4|webm)$");
  private static final char CTCP = '\u0001';

  private final ChannelMap channels;
  private final MessageCorrelationStore correlations;

  public IrcEventTranslator(ChannelMap channels, MessageCorrelationStore correlations) {
    this.channels = Objects.requireNonNull(channels, "channels");
    this.correlations = Objects.requireNonNull(correlations, "correlations");
  }

  public List<RelayAction> translate(IrcLine line, String selfNick) {
    String nick = line.sourceNick();
    boolean fromSelf = !nick.isEmpty() && nick.equals(selfNick);
    if (fromSelf && !"PRIVMSG".equals(line.command())) return List.of();

    String msgId = line.tag(TAG_MSGID);
    String replyTo = latest(correlations.lookupBySource(line.tag(TAG_REPLY)));

    switch (line.command()) {
      case "NICK" -> {
        return everyChannel(msgId, RelayNotices.nickChanged(nick, line.param(0)), replyTo);
      }
      case "QUIT" -> {
        String reason = line.params().isEmpty() ? null : line.param(0);
        return everyChannel(msgId, RelayNotices.quit(nick, reason), replyTo);
      }
      case "JOIN" -> {
        return toChannel(line.param(0), msgId, RelayNotices.joined(nick), replyTo);
      }
      case "PART" -> {
        String reason = line.params().size() > 1 ? line.param(1) : null;
        return toChannel(line.param(0), msgId, RelayNotices.left(nick, reason), replyTo);
      }
      case "KICK" -> {
        String reason = line.params().size() > 2 ? line.param(2) : null;
        return toChannel(line.param(0), msgId, RelayNotices.kicked(line.param(1), nick, reason), replyTo);
      }
      case "REDACT" -> {
        return redact(line);
      }
      case "TAGMSG" -> {
        return typing(line);
      }
      case "PRIVMSG" -> {
        return privmsg(line, nick, fromSelf, selfNick, msgId, replyTo);
      }
      default -> {
        // NOTICE and everything else stays on IRC.
        return List.of();
      }
    }
  }

  private List<RelayAction> privmsg(
      IrcLine line, String nick, boolean fromSelf, String selfNick, String msgId, String replyTo) {
    Optional<String> discordChannel = channels.discordChannel(line.param(0));
    if (discordChannel.isEmpty()) return List.of();
    String dc = discordChannel.get();

    if (fromSelf) {
      String discordId = line.tag(TAG_DISCORD);
      if (msgId.isEmpty() || discordId.isEmpty()) return List.of();
      return List.of(new RelayAction.RecordCorrelation(msgId, discordId));
    }

    String body = line.param(1);
    if (!replyTo.isEmpty()) {
      String addressed = selfNick + ": ";
      if (body.startsWith(addressed)) body = body.substring(addressed.length());
    }
    if (!body.isEmpty() && body.charAt(0) == CTCP) {
      String ctcp = trimCtcp(body.substring(1));
      int sp = ctcp.indexOf(' ');
      String verb = sp < 0 ? ctcp : ctcp.substring(0, sp);
      if (!"ACTION".equals(verb)) return List.of();
      body = RelayNotices.action(sp < 0 ? "" : ctcp.substring(sp + 1));
    }
    if (body.isEmpty()) return List.of();

    if (body.indexOf(' ') < 0 && MEDIA_LINK.matcher(body).matches()) {
      // The link goes alone so Discord embeds it.
      return List.of(
          new RelayAction.SendDiscordMessage("", dc, RelayNotices.speaker(nick), replyTo),
          new RelayAction.SendDiscordMessage(msgId, dc, body, replyTo));
    }
    return List.of(new RelayAction.SendDiscordMessage(msgId, dc, RelayNotices.chatLine(nick, body), replyTo));
  }

  private List<RelayAction> redact(IrcLine line) {
    Optional<String> dc = channels.discordChannel(line.param(0));
    if (dc.isEmpty()) return List.of();
    List<RelayAction> out = new ArrayList<>();
    for (String discordId : correlations.lookupBySource(line.param(1))) {
      out.add(new RelayAction.DeleteDiscordMessage(dc.get(), discordId));
    }
    return out;
  }

  private List<RelayAction> typing(IrcLine line) {
    Optional<String> dc = channels.discordChannel(line.param(0));
    if (dc.isEmpty() || !"active".equals(line.tag(TAG_TYPING))) return List.of();
    return List.of(new RelayAction.SendDiscordTyping(dc.get()));
  }

  private List<RelayAction> toChannel(String ircChannel, String msgId, String content, String replyTo) {
    return channels.discordChannel(ircChannel)
        .<List<RelayAction>>map(dc -> List.of(new RelayAction.SendDiscordMessage(msgId, dc, content, replyTo)))
        .orElse(List.of());
  }

  private List<RelayAction> everyChannel(String msgId, String content, String replyTo) {
    List<RelayAction> out = new ArrayList<>();
    for (String dc : channels.discordChannelIds()) {
      out.add(new RelayAction.SendDiscordMessage(msgId, dc, content, replyTo));
    }
    return out;
  }

  private static String latest(List<String> ids) {
    return ids.isEmpty() ? "" : ids.get(ids.size() - 1);
  }

  private static String trimCtcp(String s) {
    int from = 0;
    int to = s.length();
    while (from < to && s.charAt(from) == CTCP) from++;
    while (to > from && s.charAt(to - 1) == CTCP) to--;
    return s.substring(from, to);
  }
}
