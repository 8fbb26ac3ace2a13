package cafe.woden.ircbridge.format;

import cafe.woden.ircbridge.roster.MentionResolver;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Final pass over Discord-bound text: resolves mentions and emoji everywhere except inside
 * backtick-delimited code spans and URLs.
 */
public final class DiscordTextTransformer {

  private final MentionResolver mentions;

  public DiscordTextTransformer(MentionResolver mentions) {
    this.mentions = Objects.requireNonNull(mentions, "mentions");
  }

  public String transform(String guildId, String text) {
    if (text == null || text.isEmpty()) return "";
    StringBuilder sb = new StringBuilder(text.length() + 16);
    Matcher url = ControlCodeFormatter.URL.matcher(text);
    int pos = 0;
    while (pos < text.length()) {
      int open = text.indexOf('`', pos);
      int close = open < 0 ? -1 : text.indexOf('`', open + 1);
      int spanStart = close < 0 ? -1 : open;
      int spanEnd = close < 0 ? -1 : close + 1;
      if (url.find(pos) && (spanStart < 0 || url.start() < spanStart)) {
        spanStart = url.start();
        spanEnd = url.end();
      }
      if (spanStart < 0) {
        sb.append(mentions.resolve(guildId, text.substring(pos)));
        break;
      }
      sb.append(mentions.resolve(guildId, text.substring(pos, spanStart)));
      sb.append(text, spanStart, spanEnd);
      pos = spanEnd;
    }
    return sb.toString();
  }
}
