package cafe.woden.ircbridge.bridge;

import cafe.woden.ircbridge.config.ChannelMap;
import cafe.woden.ircbridge.correlation.MessageCorrelationStore;
import cafe.woden.ircbridge.discord.DiscordEvent;
import cafe.woden.ircbridge.format.IrcNickDecorator;
import cafe.woden.ircbridge.format.MarkdownIrcRenderer;
import cafe.woden.ircbridge.irc.IrcLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.stereotype.Component;

/** Decides what a Discord event means for IRC. Events caused by the bridge itself are dropped. */
@ApplicationLayer
@Component
public class DiscordEventTranslator {

  static final String TAG_DISCORD = "+discord";
  static final String TAG_REPLY = "+draft/reply";
  static final String TAG_REACT = "+draft/react";
  static final String TAG_TYPING = "+typing";

  private final ChannelMap channels;
  private final MessageCorrelationStore correlations;
  private final MarkdownIrcRenderer renderer;

  public DiscordEventTranslator(
      ChannelMap channels, MessageCorrelationStore correlations, MarkdownIrcRenderer renderer) {
    this.channels = Objects.requireNonNull(channels, "channels");
    this.correlations = Objects.requireNonNull(correlations, "correlations");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
  }

  public List<RelayAction> translate(DiscordEvent event, String selfUserId) {
    String self = Objects.toString(selfUserId, "");
    if (event instanceof DiscordEvent.Ready ready) {
      List<RelayAction> out = new ArrayList<>();
      for (String guildId : ready.guildIds()) {
        out.add(new RelayAction.RequestGuildMembers(guildId));
      }
      return out;
    }
    if (event instanceof DiscordEvent.MessageCreated message) {
      if (isSelf(message.authorId(), self)) return List.of();
      return message(message);
    }
    if (event instanceof DiscordEvent.MessageDeleted deleted) {
      return deleted(deleted);
    }
    if (event instanceof DiscordEvent.ReactionAdded reaction) {
      if (isSelf(reaction.userId(), self)) return List.of();
      return reaction(reaction);
    }
    if (event instanceof DiscordEvent.TypingStarted typing) {
      if (isSelf(typing.userId(), self)) return List.of();
      return channels.ircChannel(typing.channelId())
          .<List<RelayAction>>map(ic -> List.of(new RelayAction.SendIrcLine(
              IrcLine.of("TAGMSG", ic).withTag(TAG_TYPING, "active"))))
          .orElse(List.of());
    }
    return List.of();
  }

  private List<RelayAction> message(DiscordEvent.MessageCreated message) {
    Optional<String> ircChannel = channels.ircChannel(message.channelId());
    if (ircChannel.isEmpty()) return List.of();
    String ic = ircChannel.get();

    String replyTo = earliest(correlations.lookupByTarget(message.replyToId()));
    String prefix = IrcNickDecorator.prefix(
        message.displayName(), message.authorUsername(),
        message.roleColor(), message.accentColor());

    List<RelayAction> out = new ArrayList<>();
    if (!message.content().isEmpty()) {
      String body = flattenNewlines(renderer.render(message.guildId(), message.content()));
      out.add(privmsg(ic, prefix + body, message.messageId(), replyTo));
    }
    for (String url : message.attachmentUrls()) {
      out.add(privmsg(ic, prefix + url, message.messageId(), replyTo));
    }
    return out;
  }

  private List<RelayAction> deleted(DiscordEvent.MessageDeleted deleted) {
    Optional<String> ic = channels.ircChannel(deleted.channelId());
    if (ic.isEmpty()) return List.of();
    List<RelayAction> out = new ArrayList<>();
    for (String ircId : correlations.lookupByTarget(deleted.messageId())) {
      out.add(new RelayAction.SendIrcLine(IrcLine.of("REDACT", ic.get(), ircId)));
    }
    return out;
  }

  private List<RelayAction> reaction(DiscordEvent.ReactionAdded reaction) {
    Optional<String> ic = channels.ircChannel(reaction.channelId());
    if (ic.isEmpty() || reaction.emojiName().isEmpty()) return List.of();
    String target = earliest(correlations.lookupByTarget(reaction.messageId()));
    if (target.isEmpty()) return List.of();
    IrcLine line = IrcLine.of("TAGMSG", ic.get())
        .withTag(TAG_REACT, reaction.emojiName())
        .withTag(TAG_REPLY, target);
    return List.of(new RelayAction.SendIrcLine(line));
  }

  private static RelayAction privmsg(String ircChannel, String text, String discordId, String replyTo) {
    IrcLine line = IrcLine.of("PRIVMSG", ircChannel, text).withTag(TAG_DISCORD, discordId);
    if (!replyTo.isEmpty()) line = line.withTag(TAG_REPLY, replyTo);
    return new RelayAction.SendIrcLine(line);
  }

  static String flattenNewlines(String s) {
    return s.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
  }

  private static boolean isSelf(String userId, String selfUserId) {
    return !selfUserId.isEmpty() && selfUserId.equals(userId);
  }

  private static String earliest(List<String> ids) {
    return ids.isEmpty() ? "" : ids.get(0);
  }
}
