package cafe.woden.ircbridge.roster;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the Discord side's live state (members, roles, custom emoji, channels).
 *
 * <p>Owned by the Discord connection; callers must not cache what they read. Every method is
 * expected to be cheap and non-blocking, and to return empty results rather than throw when the
 * guild or channel is unknown.
 */
public interface RosterSnapshot {

  /** Guild owning the given channel, if the channel is known. */
  Optional<String> guildIdForChannel(String channelId);

  Optional<String> channelName(String channelId);

  Optional<RosterMember> member(String guildId, String userId);

  Optional<RosterRole> role(String guildId, String roleId);

  List<RosterMember> members(String guildId);

  List<RosterRole> roles(String guildId);

  List<RosterEmoji> emojis(String guildId);

  /** A snapshot that knows nothing; every lookup misses. */
  static RosterSnapshot empty() {
    return EmptyRosterSnapshot.INSTANCE;
  }
}
