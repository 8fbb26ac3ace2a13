package cafe.woden.ircbridge.discord;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.MessageReference;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.message.MessageDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionAddEvent;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.events.user.UserTypingEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps JDA gateway events onto {@link DiscordEvent}s. Direct messages are ignored. */
final class JdaRelayListener extends ListenerAdapter {

  private static final Logger log = LoggerFactory.getLogger(JdaRelayListener.class);

  private final Consumer<DiscordEvent> sink;

  // Raw accent colors by user id; DEFAULT_ACCENT_COLOR_RAW marks unset or pending.
  private final Map<String, Integer> accentColors = new ConcurrentHashMap<>();

  JdaRelayListener(Consumer<DiscordEvent> sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  @Override
  public void onReady(ReadyEvent event) {
    List<String> guildIds = event.getJDA().getGuilds().stream().map(Guild::getId).toList();
    sink.accept(new DiscordEvent.Ready(guildIds));
  }

  @Override
  public void onMessageReceived(MessageReceivedEvent event) {
    if (!event.isFromGuild()) return;
    Message message = event.getMessage();
    User author = event.getAuthor();
    Member member = event.getMember();

    MessageReference ref = message.getMessageReference();
    List<String> attachments =
        message.getAttachments().stream().map(Message.Attachment::getUrl).toList();

    sink.accept(new DiscordEvent.MessageCreated(
        message.getId(),
        event.getChannel().getId(),
        event.getGuild().getId(),
        author.getId(),
        author.getName(),
        member == null ? "" : member.getNickname(),
        roleColor(member),
        accentColor(author),
        message.getContentRaw(),
        ref == null ? "" : ref.getMessageId(),
        attachments));
  }

  @Override
  public void onMessageDelete(MessageDeleteEvent event) {
    if (!event.isFromGuild()) return;
    sink.accept(new DiscordEvent.MessageDeleted(event.getMessageId(), event.getChannel().getId()));
  }

  @Override
  public void onMessageReactionAdd(MessageReactionAddEvent event) {
    if (!event.isFromGuild()) return;
    sink.accept(new DiscordEvent.ReactionAdded(
        event.getMessageId(),
        event.getChannel().getId(),
        event.getUserId(),
        event.getEmoji().getName()));
  }

  @Override
  public void onUserTyping(UserTypingEvent event) {
    if (event.getGuild() == null) return;
    sink.accept(new DiscordEvent.TypingStarted(event.getChannel().getId(), event.getUser().getId()));
  }

  /**
   * Cached profile accent color. The first message from an author starts the profile fetch and
   * gets {@code null}; later messages see the loaded color.
   */
  Integer accentColor(User author) {
    Integer raw = accentColors.get(author.getId());
    if (raw == null) {
      accentColors.putIfAbsent(author.getId(), User.DEFAULT_ACCENT_COLOR_RAW);
      author.retrieveProfile().queue(
          profile -> accentColors.put(author.getId(), profile.getAccentColorRaw()),
          err -> log.debug("[ircbridge] could not load profile for {}", author.getId(), err));
      return null;
    }
    return raw == User.DEFAULT_ACCENT_COLOR_RAW ? null : raw;
  }

  static Integer roleColor(Member member) {
    if (member == null) return null;
    int raw = member.getColorRaw();
    return raw == Role.DEFAULT_COLOR_RAW ? null : raw;
  }
}
