package cafe.woden.ircbridge.discord;

import cafe.woden.ircbridge.roster.RosterSnapshot;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;

/** The bridge's Discord bot session. */
public interface DiscordGateway {

  Flowable<DiscordEvent> events();

  /** Logs in, retrying with a fixed delay until it succeeds. Idempotent. */
  void start();

  /**
   * Posts {@code content} to a text channel.
   *
   * @param replyToId message to reply to, or empty for none
   * @return the id of the created message
   */
  Single<String> sendMessage(String channelId, String content, String replyToId);

  void deleteMessage(String channelId, String messageId);

  void sendTyping(String channelId);

  /** Asks Discord for the full member list so mentions can be resolved. */
  void requestGuildMembers(String guildId);

  /** The bot's own user id, or {@code ""} before login. */
  String selfUserId();

  RosterSnapshot roster();
}
