package cafe.woden.ircbridge.format;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Renders Discord {@code <t:epoch:code>} timestamps as plain text for IRC. */
public final class TimestampRenderer {

  public static final String INVALID = "<invalid-timestamp>";

  private static final String RELATIVE = "R";

  private static final Map<String, DateTimeFormatter> FORMATS = Map.of(
      "t", pattern("HH:mm z"),
      "T", pattern("HH:mm:ss z"),
      "d", pattern("yyyy/MM/dd z"),
      "D", pattern("MMMM dd, yyyy z"),
      "f", pattern("MMMM dd, yyyy 'at' HH:mm z"),
      "F", pattern("EEEE, MMMM dd, yyyy 'at' HH:mm z"));

  private final Clock clock;
  private final ZoneId zone;

  public TimestampRenderer(Clock clock, ZoneId zone) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public String render(String epoch, String formatCode) {
    long seconds;
    try {
      seconds = Long.parseLong(Objects.toString(epoch, "").trim());
    } catch (NumberFormatException e) {
      return INVALID;
    }
    Instant instant;
    try {
      instant = Instant.ofEpochSecond(seconds);
    } catch (DateTimeException e) {
      return INVALID;
    }

    if (RELATIVE.equals(formatCode)) {
      Duration d = Duration.between(instant, clock.instant());
      if (d.isNegative()) {
        return "in " + compact(d.negated());
      }
      return compact(d) + " ago";
    }

    DateTimeFormatter formatter = FORMATS.get(formatCode);
    if (formatter == null) return INVALID;
    try {
      return formatter.format(ZonedDateTime.ofInstant(instant, zone));
    } catch (DateTimeException e) {
      return INVALID;
    }
  }

  /** {@code 1h2m3s} style; hours are not folded into days. */
  static String compact(Duration d) {
    long total = d.getSeconds();
    long h = total / 3600;
    long m = (total % 3600) / 60;
    long s = total % 60;
    StringBuilder sb = new StringBuilder();
    if (h > 0) sb.append(h).append('h');
    if (h > 0 || m > 0) sb.append(m).append('m');
    sb.append(s).append('s');
    return sb.toString();
  }

  private static DateTimeFormatter pattern(String pattern) {
    return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
  }
}
