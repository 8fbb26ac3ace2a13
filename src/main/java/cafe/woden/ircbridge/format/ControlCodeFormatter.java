package cafe.woden.ircbridge.format;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts IRC control-code text into Discord markdown.
 *
 * <p>Bold, italic, underline and strikethrough become markdown runs; colors, monospace and
 * reverse are dropped. Markdown-significant characters are escaped except inside URLs and
 * backtick spans, whose contents pass through untouched.
 */
public final class ControlCodeFormatter {

  static final Pattern URL = Pattern.compile("https?://[^\\s<]+[^<.,:;\"')\\]\\s]");
  private static final int HEX_COLOR_LENGTH = 6;

  private enum ScanMode {
    NORMAL,
    RAW,
    INSIDE_URL
  }

  private ControlCodeFormatter() {}

  public static String format(String text) {
    if (text == null || text.isEmpty()) return "";
    // The trailing reset closes whatever is still open at the end.
    String s = text + IrcControlCodes.RESET;
    int last = s.length() - 1;

    StringBuilder out = new StringBuilder(s.length() + 16);
    StyleState prev = StyleState.PLAIN;
    StyleState next = StyleState.PLAIN;
    ScanMode mode = ScanMode.NORMAL;
    Matcher url = URL.matcher(s);
    int urlEnd = 0;

    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (mode == ScanMode.RAW) {
        // A raw span is only entered when its closing backtick exists.
        if (c != '`') {
          out.append(c);
          continue;
        }
      } else {
        if (i >= urlEnd) {
          url.region(i, s.length());
          if (url.lookingAt()) urlEnd = url.end();
        }
        mode = i < urlEnd ? ScanMode.INSIDE_URL : ScanMode.NORMAL;
      }

      String write = "";
      switch (c) {
        case IrcControlCodes.BOLD -> next = next.withBold();
        case IrcControlCodes.ITALIC -> next = next.withItalic();
        case IrcControlCodes.UNDERLINE -> next = next.withUnderline();
        case IrcControlCodes.STRIKETHROUGH -> next = next.withStrikethrough();
        case IrcControlCodes.RESET -> next = StyleState.PLAIN;
        case IrcControlCodes.MONOSPACE, IrcControlCodes.REVERSE -> {
          continue;
        }
        case IrcControlCodes.COLOR -> {
          i = skipColor(s, i);
          continue;
        }
        case IrcControlCodes.HEX_COLOR -> {
          i = Math.min(i + HEX_COLOR_LENGTH, last - 1);
          continue;
        }
        case '`' -> {
          if (mode == ScanMode.RAW) {
            mode = ScanMode.NORMAL;
            write = "`";
          } else if (s.indexOf('`', i + 1) >= 0) {
            mode = ScanMode.RAW;
            write = "`";
          } else {
            write = "\\`";
          }
        }
        case '\\', '*', '_', '~' -> write = mode == ScanMode.INSIDE_URL ? String.valueOf(c) : "\\" + c;
        default -> write = String.valueOf(c);
      }

      if (write.isEmpty() && i < last) continue;
      if (!prev.equals(next)) {
        String closed = closeAll(prev);
        out.append(closed);
        prev = StyleState.PLAIN;
        if (write.isEmpty()) continue;
        if (!closed.isEmpty()) out.append(IrcControlCodes.ZERO_WIDTH_SPACE);
        out.append(open(next));
        prev = next;
      }
      out.append(write);
    }
    return out.toString();
  }

  /** Index of the last character belonging to the color sequence starting at {@code i}. */
  static int skipColor(String s, int i) {
    if (!isDigit(s, i + 1)) return i;
    i++;
    if (isDigit(s, i + 1)) i++;
    if (i + 1 < s.length() && s.charAt(i + 1) == ',' && isDigit(s, i + 2)) {
      i += 2;
      if (isDigit(s, i + 1)) i++;
    }
    return i;
  }

  private static String closeAll(StyleState style) {
    StringBuilder sb = new StringBuilder();
    if (style.italic()) sb.append('*');
    if (style.bold()) sb.append("**");
    if (style.underline()) sb.append("__");
    if (style.strikethrough()) sb.append("~~");
    return sb.toString();
  }

  private static String open(StyleState style) {
    StringBuilder sb = new StringBuilder();
    if (style.strikethrough()) sb.append("~~");
    if (style.underline()) sb.append("__");
    if (style.bold()) sb.append("**");
    if (style.italic()) sb.append('*');
    return sb.toString();
  }

  private static boolean isDigit(String s, int i) {
    if (i >= s.length()) return false;
    char c = s.charAt(i);
    return c >= '0' && c <= '9';
  }
}
