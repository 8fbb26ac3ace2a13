package cafe.woden.ircbridge.discord;

import java.util.List;
import java.util.Objects;

/** Inbound Discord activity the bridge reacts to, detached from JDA types. */
public sealed interface DiscordEvent permits
    DiscordEvent.Ready,
    DiscordEvent.MessageCreated,
    DiscordEvent.MessageDeleted,
    DiscordEvent.ReactionAdded,
    DiscordEvent.TypingStarted {

  record Ready(List<String> guildIds) implements DiscordEvent {
    public Ready {
      guildIds = (guildIds == null) ? List.of() : List.copyOf(guildIds);
    }
  }

  /**
   * A guild message.
   *
   * @param memberNickname guild nickname, empty when unset or unknown
   * @param roleColor RGB color of the member's highest colored role, or {@code null}
   * @param accentColor RGB profile accent color of the author, or {@code null} when unset or
   *     not loaded yet
   * @param replyToId id of the referenced message, empty when not a reply
   */
  record MessageCreated(
      String messageId,
      String channelId,
      String guildId,
      String authorId,
      String authorUsername,
      String memberNickname,
      Integer roleColor,
      Integer accentColor,
      String content,
      String replyToId,
      List<String> attachmentUrls
  ) implements DiscordEvent {
    public MessageCreated {
      messageId = Objects.toString(messageId, "");
      channelId = Objects.toString(channelId, "");
      guildId = Objects.toString(guildId, "");
      authorId = Objects.toString(authorId, "");
      authorUsername = Objects.toString(authorUsername, "");
      memberNickname = Objects.toString(memberNickname, "");
      content = Objects.toString(content, "");
      replyToId = Objects.toString(replyToId, "");
      attachmentUrls = (attachmentUrls == null) ? List.of() : List.copyOf(attachmentUrls);
    }

    /** Nickname, or username when no nickname is set. */
    public String displayName() {
      return memberNickname.isBlank() ? authorUsername : memberNickname;
    }
  }

  record MessageDeleted(String messageId, String channelId) implements DiscordEvent {}

  /** @param emojiName unicode emoji or custom emoji name; may be empty */
  record ReactionAdded(String messageId, String channelId, String userId, String emojiName)
      implements DiscordEvent {
    public ReactionAdded {
      emojiName = Objects.toString(emojiName, "");
    }
  }

  record TypingStarted(String channelId, String userId) implements DiscordEvent {}
}
