package cafe.woden.ircbridge.bridge;

import cafe.woden.ircbridge.irc.IrcLine;
import java.util.Objects;

/**
 * One outbound effect decided by the translators and carried out by {@link RelayActionExecutor}.
 *
 * <p>Translation stays side-effect free; everything that touches a connection or the
 * correlation store is expressed as one of these.
 */
public sealed interface RelayAction permits
    RelayAction.SendDiscordMessage,
    RelayAction.DeleteDiscordMessage,
    RelayAction.SendDiscordTyping,
    RelayAction.RequestGuildMembers,
    RelayAction.SendIrcLine,
    RelayAction.RecordCorrelation {

  /**
   * Post a message to Discord.
   *
   * @param ircMessageId IRC msgid to correlate with the created message; empty for none
   * @param content IRC control-code text, converted to markdown on send
   * @param replyToId Discord message to reply to; empty for none
   */
  record SendDiscordMessage(String ircMessageId, String channelId, String content, String replyToId)
      implements RelayAction {
    public SendDiscordMessage {
      ircMessageId = Objects.toString(ircMessageId, "");
      channelId = Objects.toString(channelId, "");
      content = Objects.toString(content, "");
      replyToId = Objects.toString(replyToId, "");
    }
  }

  record DeleteDiscordMessage(String channelId, String messageId) implements RelayAction {}

  record SendDiscordTyping(String channelId) implements RelayAction {}

  record RequestGuildMembers(String guildId) implements RelayAction {}

  record SendIrcLine(IrcLine line) implements RelayAction {
    public SendIrcLine {
      Objects.requireNonNull(line, "line");
    }
  }

  record RecordCorrelation(String ircMessageId, String discordMessageId) implements RelayAction {}
}
