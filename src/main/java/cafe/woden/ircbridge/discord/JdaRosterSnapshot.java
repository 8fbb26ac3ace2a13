package cafe.woden.ircbridge.discord;

import cafe.woden.ircbridge.roster.RosterEmoji;
import cafe.woden.ircbridge.roster.RosterMember;
import cafe.woden.ircbridge.roster.RosterRole;
import cafe.woden.ircbridge.roster.RosterSnapshot;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;
import net.dv8tion.jda.api.entities.emoji.RichCustomEmoji;

/**
 * {@link RosterSnapshot} reading straight from JDA's entity cache.
 *
 * <p>Every call goes to the current JDA instance; nothing is copied ahead of time. Before login
 * everything misses.
 */
final class JdaRosterSnapshot implements RosterSnapshot {

  private final Supplier<JDA> jda;

  JdaRosterSnapshot(Supplier<JDA> jda) {
    this.jda = jda;
  }

  @Override
  public Optional<String> guildIdForChannel(String channelId) {
    return channel(channelId).map(c -> c.getGuild().getId());
  }

  @Override
  public Optional<String> channelName(String channelId) {
    return channel(channelId).map(GuildChannel::getName);
  }

  @Override
  public Optional<RosterMember> member(String guildId, String userId) {
    if (!isSnowflake(userId)) return Optional.empty();
    return guild(guildId).map(g -> g.getMemberById(userId)).map(JdaRosterSnapshot::toMember);
  }

  @Override
  public Optional<RosterRole> role(String guildId, String roleId) {
    if (!isSnowflake(roleId)) return Optional.empty();
    return guild(guildId).map(g -> g.getRoleById(roleId)).map(JdaRosterSnapshot::toRole);
  }

  @Override
  public List<RosterMember> members(String guildId) {
    return guild(guildId)
        .map(g -> g.getMemberCache().stream().map(JdaRosterSnapshot::toMember).toList())
        .orElse(List.of());
  }

  @Override
  public List<RosterRole> roles(String guildId) {
    return guild(guildId)
        .map(g -> g.getRoles().stream().map(JdaRosterSnapshot::toRole).toList())
        .orElse(List.of());
  }

  @Override
  public List<RosterEmoji> emojis(String guildId) {
    return guild(guildId)
        .map(g -> g.getEmojis().stream().map(JdaRosterSnapshot::toEmoji).toList())
        .orElse(List.of());
  }

  private Optional<Guild> guild(String guildId) {
    JDA api = jda.get();
    if (api == null || !isSnowflake(guildId)) return Optional.empty();
    return Optional.ofNullable(api.getGuildById(guildId));
  }

  private Optional<GuildChannel> channel(String channelId) {
    JDA api = jda.get();
    if (api == null || !isSnowflake(channelId)) return Optional.empty();
    return Optional.ofNullable(api.getGuildChannelById(channelId));
  }

  static RosterMember toMember(Member m) {
    User u = m.getUser();
    return new RosterMember(m.getId(), u.getName(), u.getDiscriminator(), m.getNickname());
  }

  static RosterRole toRole(Role r) {
    return new RosterRole(r.getId(), r.getName(), r.isMentionable());
  }

  static RosterEmoji toEmoji(RichCustomEmoji e) {
    return new RosterEmoji(e.getId(), e.getName(), e.isAnimated(), e.isAvailable());
  }

  /** JDA throws on ids that are not numeric snowflakes. */
  static boolean isSnowflake(String id) {
    if (id == null || id.isEmpty() || id.length() > 20) return false;
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }
}
