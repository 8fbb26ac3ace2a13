package cafe.woden.ircbridge.roster;

import java.util.List;
import java.util.Optional;

enum EmptyRosterSnapshot implements RosterSnapshot {
  INSTANCE;

  @Override
  public Optional<String> guildIdForChannel(String channelId) {
    return Optional.empty();
  }

  @Override
  public Optional<String> channelName(String channelId) {
    return Optional.empty();
  }

  @Override
  public Optional<RosterMember> member(String guildId, String userId) {
    return Optional.empty();
  }

  @Override
  public Optional<RosterRole> role(String guildId, String roleId) {
    return Optional.empty();
  }

  @Override
  public List<RosterMember> members(String guildId) {
    return List.of();
  }

  @Override
  public List<RosterRole> roles(String guildId) {
    return List.of();
  }

  @Override
  public List<RosterEmoji> emojis(String guildId) {
    return List.of();
  }
}
