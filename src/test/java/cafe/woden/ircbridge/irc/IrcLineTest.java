package cafe.woden.ircbridge.irc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class IrcLineTest {

  @Test
  void parsesTagsPrefixCommandAndTrailing() {
    IrcLine line = IrcLine.parse(
        "@msgid=abc;+draft/reply=xyz;+typing :alice!a@host privmsg #chan :hello there\r\n");

    assertEquals("abc", line.tag("msgid"));
    assertEquals("xyz", line.tag("+draft/reply"));
    assertTrue(line.hasTag("+typing"));
    assertEquals("", line.tag("+typing"));
    assertEquals("alice!a@host", line.prefix());
    assertEquals("alice", line.sourceNick());
    assertEquals("PRIVMSG", line.command());
    assertEquals(List.of("#chan", "hello there"), line.params());
    assertEquals("hello there", line.lastParam());
  }

  @Test
  void parsesLineWithoutTagsOrPrefix() {
    IrcLine line = IrcLine.parse("PING :irc.example.org");

    assertTrue(line.tags().isEmpty());
    assertEquals("", line.prefix());
    assertEquals("irc.example.org", line.param(0));
    assertEquals("", line.param(3));
  }

  @Test
  void serverPrefixIsItsOwnNick() {
    assertEquals("irc.example.org", IrcLine.parse(":irc.example.org 001 me :Welcome").sourceNick());
    assertEquals("nick", IrcLine.parse(":nick@host JOIN #a").sourceNick());
  }

  @Test
  void tagValuesAreUnescaped() {
    IrcLine line = IrcLine.parse("@+discord=a\\sb\\:c\\\\d\\ PRIVMSG #a :x");
    assertEquals("a b;c\\d", line.tag("+discord"));
  }

  @Test
  void escapeCoversEverySpecialCharacter() {
    assertEquals("a\\sb\\:c\\\\d\\r\\n", IrcLine.escapeTagValue("a b;c\\d\r\n"));
    assertEquals("a b;c\\d\r\n", IrcLine.unescapeTagValue("a\\sb\\:c\\\\d\\r\\n"));
  }

  @Test
  void rawLineAddsColonOnlyWhenNeeded() {
    assertEquals("JOIN #a", IrcLine.of("JOIN", "#a").toRawLine());
    assertEquals("PRIVMSG #a :hi there", IrcLine.of("PRIVMSG", "#a", "hi there").toRawLine());
    assertEquals("PRIVMSG #a ::)", IrcLine.of("PRIVMSG", "#a", ":)").toRawLine());
    assertEquals("TOPIC #a :", IrcLine.of("TOPIC", "#a", "").toRawLine());
  }

  @Test
  void rawLineWritesTagsInInsertionOrder() {
    IrcLine line = IrcLine.of("PRIVMSG", "#a", "hi")
        .withTag("+draft/reply", "m1")
        .withTag("+discord", "x y")
        .withTag("+typing", "");

    assertEquals("@+draft/reply=m1;+discord=x\\sy;+typing PRIVMSG #a hi", line.toRawLine());
  }

  @Test
  void withTagDoesNotMutateOriginal() {
    IrcLine base = IrcLine.of("PRIVMSG", "#a", "hi");
    base.withTag("k", "v");
    assertFalse(base.hasTag("k"));
  }
}
