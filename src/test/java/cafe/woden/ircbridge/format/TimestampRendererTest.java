package cafe.woden.ircbridge.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class TimestampRendererTest {

  private static final ZoneId UTC = ZoneId.of("UTC");
  private static final long NOW = 10_000;

  private final TimestampRenderer renderer =
      new TimestampRenderer(Clock.fixed(Instant.ofEpochSecond(NOW), UTC), UTC);

  @Test
  void absoluteFormats() {
    assertEquals("00:00 UTC", renderer.render("0", "t"));
    assertEquals("00:00:00 UTC", renderer.render("0", "T"));
    assertEquals("1970/01/01 UTC", renderer.render("0", "d"));
    assertEquals("January 01, 1970 UTC", renderer.render("0", "D"));
    assertEquals("January 01, 1970 at 00:00 UTC", renderer.render("0", "f"));
    assertEquals("Thursday, January 01, 1970 at 00:00 UTC", renderer.render("0", "F"));
  }

  @Test
  void usesConfiguredZone() {
    TimestampRenderer berlin = new TimestampRenderer(Clock.systemUTC(), ZoneId.of("Europe/Berlin"));
    assertEquals("01:00 CET", berlin.render("0", "t"));
  }

  @Test
  void relativeFormat() {
    assertEquals("1h2m3s ago", renderer.render(String.valueOf(NOW - 3723), "R"));
    assertEquals("in 1m5s", renderer.render(String.valueOf(NOW + 65), "R"));
    assertEquals("0s ago", renderer.render(String.valueOf(NOW), "R"));
  }

  @Test
  void invalidInputRendersPlaceholder() {
    assertEquals(TimestampRenderer.INVALID, renderer.render("0", "Q"));
    assertEquals(TimestampRenderer.INVALID, renderer.render("abc", "f"));
    assertEquals(TimestampRenderer.INVALID, renderer.render("99999999999999999999", "f"));
    assertEquals(TimestampRenderer.INVALID, renderer.render(String.valueOf(Long.MAX_VALUE), "f"));
  }

  @Test
  void compactDuration() {
    assertEquals("5s", TimestampRenderer.compact(Duration.ofSeconds(5)));
    assertEquals("2m0s", TimestampRenderer.compact(Duration.ofMinutes(2)));
    assertEquals("26h0m1s", TimestampRenderer.compact(Duration.ofHours(26).plusSeconds(1)));
  }
}
