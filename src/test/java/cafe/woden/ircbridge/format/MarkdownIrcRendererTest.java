package cafe.woden.ircbridge.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import cafe.woden.ircbridge.markdown.MarkdownDocument;
import cafe.woden.ircbridge.markdown.MarkdownNode;
import cafe.woden.ircbridge.roster.StaticRosterSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class MarkdownIrcRendererTest {

  private static final String GUILD = "100";
  private static final ZoneId UTC = ZoneId.of("UTC");

  private final StaticRosterSnapshot roster = new StaticRosterSnapshot(GUILD)
      .member("1", "alice", "0", "Ally")
      .member("2", "bob", "0", "")
      .role("50", "Mods", true)
      .channel("7", "general");

  private final MarkdownIrcRenderer renderer = new MarkdownIrcRenderer(
      roster, new TimestampRenderer(Clock.fixed(Instant.ofEpochSecond(10_000), UTC), UTC));

  @Test
  void boldTextBecomesToggledBoldBytes() {
    MarkdownDocument doc = MarkdownDocument.of(
        new MarkdownNode.Bold(List.of(new MarkdownNode.Text("hi"))));

    assertEquals("\u0002hi\u0002", renderer.render(GUILD, doc));
  }

  @Test
  void emphasisFromParsedContent() {
    assertEquals("\u0002hi\u0002 there", renderer.render(GUILD, "**hi** there"));
    assertEquals("\u001Dsoft\u001D \u001Funder\u001F \u001Egone\u001E",
        renderer.render(GUILD, "*soft* __under__ ~~gone~~"));
  }

  @Test
  void codeSpoilerAndQuote() {
    assertEquals("\u0011`x = 1`\u0011", renderer.render(GUILD, "`x = 1`"));
    assertEquals("\u0011`java int x;`\u0011", renderer.render(GUILD, "```java\nint x;\n```"));
    assertEquals("\u0016||secret||\u0016", renderer.render(GUILD, "||secret||"));
    assertEquals("“quoted”", renderer.render(GUILD, "> quoted"));
  }

  @Test
  void mentionsResolveAgainstTheRoster() {
    assertEquals("@Ally @bob", renderer.render(GUILD, "<@1> <@!2>"));
    assertEquals("@Mods in #general", renderer.render(GUILD, "<@&50> in <#7>"));
    assertEquals("@everyone", renderer.render(GUILD, "@everyone"));
  }

  @Test
  void unresolvableMentionsBecomePlaceholders() {
    assertEquals("@invalid-user", renderer.render(GUILD, "<@404>"));
    assertEquals("@invalid-role", renderer.render(GUILD, "<@&404>"));
    assertEquals("#invalid-channel", renderer.render(GUILD, "<#404>"));
    assertEquals("@invalid-user", renderer.render("other-guild", "<@1>"));
  }

  @Test
  void customEmojiAndUrls() {
    assertEquals(":blob: https://example.org/a_b",
        renderer.render(GUILD, "<:blob:123> https://example.org/a_b"));
  }

  @Test
  void timestamps() {
    assertEquals("1970/01/01 UTC", renderer.render(GUILD, "<t:0:d>"));
    assertEquals("January 01, 1970 at 00:00 UTC", renderer.render(GUILD, "<t:0>"));
    assertEquals("<invalid-timestamp>", renderer.render(GUILD, "<t:0:Q>"));

    MarkdownDocument bad = MarkdownDocument.of(new MarkdownNode.Timestamp("soon", "f"));
    assertEquals("<invalid-timestamp>", renderer.render(GUILD, bad));
  }

  @Test
  void emptyContentRendersEmpty() {
    assertEquals("", renderer.render(GUILD, ""));
  }
}
