package cafe.woden.ircbridge.bridge;

import cafe.woden.ircbridge.correlation.MessageCorrelationStore;
import cafe.woden.ircbridge.discord.DiscordGateway;
import cafe.woden.ircbridge.format.ControlCodeFormatter;
import cafe.woden.ircbridge.format.DiscordTextTransformer;
import cafe.woden.ircbridge.irc.IrcRelayClient;
import cafe.woden.ircbridge.roster.RosterSnapshot;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Carries out {@link RelayAction}s in order on the calling thread.
 *
 * <p>Discord sends complete before the next action runs, so a nick line and the media link that
 * follows it arrive in that order. A failed action is logged and does not stop the rest.
 */
@ApplicationLayer
@Component
public class RelayActionExecutor {

  private static final Logger log = LoggerFactory.getLogger(RelayActionExecutor.class);

  private final DiscordGateway discord;
  private final IrcRelayClient irc;
  private final MessageCorrelationStore correlations;
  private final DiscordTextTransformer transformer;
  private final RosterSnapshot roster;

  public RelayActionExecutor(
      DiscordGateway discord,
      IrcRelayClient irc,
      MessageCorrelationStore correlations,
      DiscordTextTransformer transformer,
      RosterSnapshot roster) {
    this.discord = Objects.requireNonNull(discord, "discord");
    this.irc = Objects.requireNonNull(irc, "irc");
    this.correlations = Objects.requireNonNull(correlations, "correlations");
    this.transformer = Objects.requireNonNull(transformer, "transformer");
    this.roster = Objects.requireNonNull(roster, "roster");
  }

  public void executeAll(List<RelayAction> actions) {
    for (RelayAction action : actions) {
      try {
        execute(action);
      } catch (RuntimeException e) {
        log.warn("[ircbridge] relay action failed: {}", action, e);
      }
    }
  }

  public void execute(RelayAction action) {
    if (action instanceof RelayAction.SendDiscordMessage send) {
      sendDiscordMessage(send);
    } else if (action instanceof RelayAction.DeleteDiscordMessage delete) {
      discord.deleteMessage(delete.channelId(), delete.messageId());
    } else if (action instanceof RelayAction.SendDiscordTyping typing) {
      discord.sendTyping(typing.channelId());
    } else if (action instanceof RelayAction.RequestGuildMembers request) {
      discord.requestGuildMembers(request.guildId());
    } else if (action instanceof RelayAction.SendIrcLine send) {
      irc.write(send.line());
    } else if (action instanceof RelayAction.RecordCorrelation record) {
      correlations.recordPair(record.ircMessageId(), record.discordMessageId());
    }
  }

  private void sendDiscordMessage(RelayAction.SendDiscordMessage send) {
    String guildId = roster.guildIdForChannel(send.channelId()).orElse("");
    String content = transformer.transform(guildId, ControlCodeFormatter.format(send.content()));
    if (content.isBlank()) {
      log.debug("[ircbridge] nothing left to send to {} after formatting", send.channelId());
      return;
    }
    discord.sendMessage(send.channelId(), content, send.replyToId()).subscribe(
        discordId -> {
          if (!send.ircMessageId().isEmpty()) {
            correlations.recordPair(send.ircMessageId(), discordId);
          }
        },
        err -> log.warn("[ircbridge] could not send to Discord channel {}", send.channelId(), err));
  }
}
