package cafe.woden.ircbridge.roster;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites plain-text {@code @name} mentions and {@code :emoji:} names into Discord's native
 * reference syntax, against a guild's roster snapshot.
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>{@code @name#1234}: case-insensitive username plus exact discriminator, nothing else.</li>
 *   <li>{@code @name}: nickname, then username, then mentionable role name; first match wins.</li>
 *   <li>{@code :name:}: case-insensitive among available custom emoji only.</li>
 * </ul>
 * Anything that does not resolve is returned unchanged. Underscores in names may arrive escaped
 * ({@code \_}) from the control-code formatter; they are unescaped before lookup.
 */
public final class MentionResolver {

  private static final Pattern MENTION =
      Pattern.compile("(?<![\\w\\\\])@((?:[^\\s#*_~`@<>:,;!?()\\[\\]\\\\]|\\\\_)+)(?:#(\\d+))?");
  private static final Pattern EMOJI = Pattern.compile(":((?:\\w|\\\\_)+):");

  private final RosterSnapshot roster;

  public MentionResolver(RosterSnapshot roster) {
    this.roster = Objects.requireNonNull(roster, "roster");
  }

  /** Resolves mentions first, then emoji. */
  public String resolve(String guildId, String text) {
    if (text == null || text.isEmpty() || guildId == null || guildId.isBlank()) {
      return Objects.toString(text, "");
    }
    String withMentions = replaceAll(MENTION, text, m -> resolveMention(guildId, m));
    return replaceAll(EMOJI, withMentions, m -> resolveEmoji(guildId, m));
  }

  Optional<String> mentionFor(String guildId, String name, String discriminator) {
    if (discriminator != null && !discriminator.isEmpty()) {
      for (RosterMember member : roster.members(guildId)) {
        if (name.equalsIgnoreCase(member.username()) && discriminator.equals(member.discriminator())) {
          return Optional.of(member.mention());
        }
      }
      return Optional.empty();
    }
    for (RosterMember member : roster.members(guildId)) {
      if (!member.nickname().isEmpty() && name.equalsIgnoreCase(member.nickname())) {
        return Optional.of(member.mention());
      }
    }
    for (RosterMember member : roster.members(guildId)) {
      if (name.equalsIgnoreCase(member.username())) {
        return Optional.of(member.mention());
      }
    }
    for (RosterRole role : roster.roles(guildId)) {
      if (role.mentionable() && name.equalsIgnoreCase(role.name())) {
        return Optional.of(role.mention());
      }
    }
    return Optional.empty();
  }

  Optional<String> emojiFor(String guildId, String name) {
    for (RosterEmoji emoji : roster.emojis(guildId)) {
      if (emoji.available() && name.equalsIgnoreCase(emoji.name())) {
        return Optional.of(emoji.messageFormat());
      }
    }
    return Optional.empty();
  }

  private String resolveMention(String guildId, Matcher m) {
    String name = m.group(1).replace("\\_", "_");
    return mentionFor(guildId, name, m.group(2)).orElse(m.group());
  }

  private String resolveEmoji(String guildId, Matcher m) {
    String name = m.group(1).replace("\\_", "_");
    return emojiFor(guildId, name).orElse(m.group());
  }

  private static String replaceAll(Pattern pattern, String text, Function<Matcher, String> replacer) {
    Matcher m = pattern.matcher(text);
    if (!m.find()) return text;
    StringBuilder sb = new StringBuilder(text.length() + 16);
    int last = 0;
    do {
      sb.append(text, last, m.start());
      sb.append(replacer.apply(m));
      last = m.end();
    } while (m.find());
    sb.append(text, last, text.length());
    return sb.toString();
  }
}
