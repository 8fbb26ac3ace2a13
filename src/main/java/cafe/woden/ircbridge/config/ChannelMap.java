package cafe.woden.ircbridge.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Static 1:1 mapping between Discord channel ids and IRC channel names.
 *
 * <p>Built once from configuration and never mutated, so it is safe to share between the two
 * connection threads without synchronization. IRC channel lookups are case-insensitive.
 */
@ValueObject
public final class ChannelMap {

  private final Map<String, String> ircByDiscordId;
  private final Map<String, String> discordIdByIrcLower;

  private ChannelMap(Map<String, String> ircByDiscordId, Map<String, String> discordIdByIrcLower) {
    this.ircByDiscordId = Collections.unmodifiableMap(ircByDiscordId);
    this.discordIdByIrcLower = Collections.unmodifiableMap(discordIdByIrcLower);
  }

  /**
   * @param discordToIrc Discord channel id to IRC channel name, in configuration order
   * @throws IllegalArgumentException if an entry is blank or an IRC channel is mapped twice
   */
  public static ChannelMap of(Map<String, String> discordToIrc) {
    LinkedHashMap<String, String> forward = new LinkedHashMap<>();
    LinkedHashMap<String, String> reverse = new LinkedHashMap<>();
    if (discordToIrc == null) return new ChannelMap(forward, reverse);

    for (Map.Entry<String, String> e : discordToIrc.entrySet()) {
      String discordId = Objects.toString(e.getKey(), "").trim();
      String irc = Objects.toString(e.getValue(), "").trim();
      if (discordId.isEmpty() || irc.isEmpty()) {
        throw new IllegalArgumentException("bridge.channels has a blank entry: " + e);
      }
      String ircKey = normalizeIrc(irc);
      String previous = reverse.putIfAbsent(ircKey, discordId);
      if (previous != null) {
        throw new IllegalArgumentException(
            "IRC channel " + irc + " is mapped to both " + previous + " and " + discordId);
      }
      forward.put(discordId, irc);
    }
    return new ChannelMap(forward, reverse);
  }

  public Optional<String> ircChannel(String discordChannelId) {
    if (discordChannelId == null) return Optional.empty();
    return Optional.ofNullable(ircByDiscordId.get(discordChannelId.trim()));
  }

  public Optional<String> discordChannel(String ircChannel) {
    if (ircChannel == null) return Optional.empty();
    return Optional.ofNullable(discordIdByIrcLower.get(normalizeIrc(ircChannel)));
  }

  public List<String> discordChannelIds() {
    return List.copyOf(ircByDiscordId.keySet());
  }

  public List<String> ircChannels() {
    return List.copyOf(ircByDiscordId.values());
  }

  public boolean isEmpty() {
    return ircByDiscordId.isEmpty();
  }

  public int size() {
    return ircByDiscordId.size();
  }

  private static String normalizeIrc(String channel) {
    return channel.trim().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "ChannelMap" + ircByDiscordId;
  }
}
