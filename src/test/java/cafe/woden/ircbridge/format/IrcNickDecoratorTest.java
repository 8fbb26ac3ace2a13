package cafe.woden.ircbridge.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class IrcNickDecoratorTest {

  @Test
  void fnv1MatchesReferenceVectors() {
    assertEquals(0x811C9DC5, IrcNickDecorator.fnv1(""));
    assertEquals(0x050C5D7E, IrcNickDecorator.fnv1("a"));
  }

  @Test
  void fallbackColorIsPickedFromPaletteByUsernameHash() {
    assertEquals("\u000308", IrcNickDecorator.color("alice", null, null));
    assertEquals("\u000309", IrcNickDecorator.color("bob", null, null));
    assertEquals("\u000313", IrcNickDecorator.color("a", 0, 0));
  }

  @Test
  void roleColorIsSentAsHex() {
    assertEquals("\u00043498DB", IrcNickDecorator.color("alice", 0x3498DB, 0x00FF00));
  }

  @Test
  void accentColorIsUsedWhenThereIsNoRoleColor() {
    assertEquals("\u000400FF00", IrcNickDecorator.color("alice", null, 0x00FF00));
    assertEquals("\u000400FF00", IrcNickDecorator.color("alice", 0, 0x00FF00));
    assertEquals("<\u0004ABCDEFa\u200Blice\u000F> ",
        IrcNickDecorator.prefix("alice", "alice", null, 0xABCDEF));
  }

  @Test
  void zeroWidthSpaceGoesAfterFirstCodePoint() {
    assertEquals("a\u200Blice", IrcNickDecorator.breakHighlight("alice"));
    assertEquals("a", IrcNickDecorator.breakHighlight("a"));
    assertEquals("", IrcNickDecorator.breakHighlight(""));
    assertEquals("😀\u200Bbob", IrcNickDecorator.breakHighlight("😀bob"));
  }

  @Test
  void prefixCombinesColorNickAndReset() {
    assertEquals("<\u0004FF0000A\u200Bli\u000F> ",
        IrcNickDecorator.prefix("Ali", "alice", 0xFF0000, null));
    assertEquals("<\u000308a\u200Blice\u000F> ",
        IrcNickDecorator.prefix("alice", "alice", null, null));
  }
}
