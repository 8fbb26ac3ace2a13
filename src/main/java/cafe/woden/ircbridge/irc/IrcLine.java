package cafe.woden.ircbridge.irc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One IRC protocol line: IRCv3 tags, optional prefix, command and parameters.
 *
 * <p>Tag keys are kept verbatim (client-only tags keep their {@code +}); values are unescaped.
 * The command is upper-cased. An empty prefix means none.
 */
@ValueObject
public record IrcLine(Map<String, String> tags, String prefix, String command, List<String> params) {

  public IrcLine {
    tags = (tags == null || tags.isEmpty())
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    prefix = Objects.toString(prefix, "");
    command = Objects.toString(command, "").toUpperCase(Locale.ROOT);
    params = (params == null) ? List.of() : List.copyOf(params);
  }

  public static IrcLine of(String command, String... params) {
    return new IrcLine(Map.of(), "", command, Arrays.asList(params));
  }

  /** Copy with {@code key=value} appended (or replaced). */
  public IrcLine withTag(String key, String value) {
    Map<String, String> next = new LinkedHashMap<>(tags);
    next.put(key, Objects.toString(value, ""));
    return new IrcLine(next, prefix, command, params);
  }

  /** Tag value, or {@code ""} when the tag is absent. */
  public String tag(String key) {
    return Objects.toString(tags.get(key), "");
  }

  public boolean hasTag(String key) {
    return tags.containsKey(key);
  }

  /** Parameter at {@code index}, or {@code ""} when there are fewer parameters. */
  public String param(int index) {
    return (index >= 0 && index < params.size()) ? params.get(index) : "";
  }

  public String lastParam() {
    return params.isEmpty() ? "" : params.get(params.size() - 1);
  }

  /** Nick part of the prefix ({@code nick!user@host}), or the whole prefix for servers. */
  public String sourceNick() {
    int end = prefix.length();
    int bang = prefix.indexOf('!');
    if (bang >= 0) end = bang;
    int at = prefix.indexOf('@');
    if (at >= 0 && at < end) end = at;
    return prefix.substring(0, end);
  }

  public static IrcLine parse(String raw) {
    String s = Objects.toString(raw, "");
    while (s.endsWith("\r") || s.endsWith("\n")) s = s.substring(0, s.length() - 1);
    int i = 0;

    Map<String, String> tags = new LinkedHashMap<>();
    if (s.startsWith("@")) {
      int sp = s.indexOf(' ');
      String tagPart = sp < 0 ? s.substring(1) : s.substring(1, sp);
      for (String kv : tagPart.split(";")) {
        if (kv.isEmpty()) continue;
        int eq = kv.indexOf('=');
        if (eq < 0) {
          tags.put(kv, "");
        } else {
          tags.put(kv.substring(0, eq), unescapeTagValue(kv.substring(eq + 1)));
        }
      }
      i = sp < 0 ? s.length() : sp + 1;
    }
    i = skipSpaces(s, i);

    String prefix = "";
    if (i < s.length() && s.charAt(i) == ':') {
      int sp = s.indexOf(' ', i);
      prefix = sp < 0 ? s.substring(i + 1) : s.substring(i + 1, sp);
      i = sp < 0 ? s.length() : sp + 1;
    }
    i = skipSpaces(s, i);

    int sp = s.indexOf(' ', i);
    String command = sp < 0 ? s.substring(i) : s.substring(i, sp);
    i = sp < 0 ? s.length() : sp + 1;

    List<String> params = new ArrayList<>();
    while (i < s.length()) {
      i = skipSpaces(s, i);
      if (i >= s.length()) break;
      if (s.charAt(i) == ':') {
        params.add(s.substring(i + 1));
        break;
      }
      sp = s.indexOf(' ', i);
      params.add(sp < 0 ? s.substring(i) : s.substring(i, sp));
      i = sp < 0 ? s.length() : sp + 1;
    }
    return new IrcLine(tags, prefix, command, params);
  }

  /** Wire form without the trailing CRLF. */
  public String toRawLine() {
    StringBuilder sb = new StringBuilder();
    if (!tags.isEmpty()) {
      sb.append('@');
      boolean first = true;
      for (Map.Entry<String, String> e : tags.entrySet()) {
        if (!first) sb.append(';');
        first = false;
        sb.append(e.getKey());
        if (!e.getValue().isEmpty()) sb.append('=').append(escapeTagValue(e.getValue()));
      }
      sb.append(' ');
    }
    if (!prefix.isEmpty()) sb.append(':').append(prefix).append(' ');
    sb.append(command);
    for (int p = 0; p < params.size(); p++) {
      String param = params.get(p);
      boolean trailing = p == params.size() - 1
          && (param.isEmpty() || param.indexOf(' ') >= 0 || param.startsWith(":"));
      sb.append(' ');
      if (trailing) sb.append(':');
      sb.append(param);
    }
    return sb.toString();
  }

  static String escapeTagValue(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case ';' -> sb.append("\\:");
        case ' ' -> sb.append("\\s");
        case '\\' -> sb.append("\\\\");
        case '\r' -> sb.append("\\r");
        case '\n' -> sb.append("\\n");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  static String unescapeTagValue(String value) {
    if (value.indexOf('\\') < 0) return value;
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      // A trailing lone backslash is dropped.
      if (++i >= value.length()) break;
      char n = value.charAt(i);
      switch (n) {
        case ':' -> sb.append(';');
        case 's' -> sb.append(' ');
        case 'r' -> sb.append('\r');
        case 'n' -> sb.append('\n');
        default -> sb.append(n);
      }
    }
    return sb.toString();
  }

  private static int skipSpaces(String s, int i) {
    while (i < s.length() && s.charAt(i) == ' ') i++;
    return i;
  }
}
