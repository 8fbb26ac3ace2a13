package cafe.woden.ircbridge.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ControlCodeFormatterTest {

  private static final String ZWSP = "\u200B";

  @Test
  void resetClosesBoldAndBreaksTheRunBeforePlainText() {
    assertEquals("**hello**" + ZWSP + " world", ControlCodeFormatter.format("\u0002hello\u000F world"));
  }

  @Test
  void plainTextPassesThrough() {
    assertEquals("just words", ControlCodeFormatter.format("just words"));
    assertEquals("", ControlCodeFormatter.format(""));
    assertEquals("", ControlCodeFormatter.format(null));
  }

  @Test
  void openingAStyleAfterPlainTextNeedsNoBreak() {
    assertEquals("plain **bold**", ControlCodeFormatter.format("plain \u0002bold"));
  }

  @Test
  void allFourStylesNestAndCloseInReverseOrder() {
    assertEquals(
        "~~__***all***__~~",
        ControlCodeFormatter.format("\u0002\u001D\u001F\u001Eall\u000F"));
  }

  @Test
  void unclosedStylesAreClosedAtEndOfInput() {
    assertEquals("*slanted*", ControlCodeFormatter.format("\u001Dslanted"));
  }

  @Test
  void switchingStylesClosesThenReopens() {
    assertEquals(
        "**a**" + ZWSP + "*b*",
        ControlCodeFormatter.format("\u0002a\u000F\u001Db"));
  }

  @Test
  void adjacentSpansWithTheSameStyleFormOneRun() {
    assertEquals("**abcd**", ControlCodeFormatter.format("\u0002ab\u000F\u0002cd"));
    assertEquals("**abcd**", ControlCodeFormatter.format("\u0002ab\u0002cd"));
  }

  @Test
  void colorConsumesAtMostTwoForegroundDigits() {
    assertEquals("3", ControlCodeFormatter.format("\u0003123"));
  }

  @Test
  void colorWithBackgroundIsDiscarded() {
    assertEquals("text", ControlCodeFormatter.format("\u000304,12text"));
    assertEquals("text", ControlCodeFormatter.format("\u00034,1text"));
  }

  @Test
  void commaWithoutDigitIsNotPartOfTheColor() {
    assertEquals(",x", ControlCodeFormatter.format("\u00034,x"));
    assertEquals("hi", ControlCodeFormatter.format("\u0003hi"));
  }

  @Test
  void hexColorSkipsSixCharactersButNeverPastTheEnd() {
    assertEquals("red", ControlCodeFormatter.format("\u0004FF0000red"));
    assertEquals("ab", ControlCodeFormatter.format("ab\u0004F"));
  }

  @Test
  void monospaceAndReverseAreDropped() {
    assertEquals("code rev", ControlCodeFormatter.format("\u0011code\u0011 \u0016rev"));
  }

  @Test
  void markdownCharactersAreEscaped() {
    assertEquals("a\\*b\\_c\\~d\\\\e", ControlCodeFormatter.format("a*b_c~d\\e"));
  }

  @Test
  void urlsAreNotEscaped() {
    assertEquals(
        "see https://example.org/a_b*c now \\_",
        ControlCodeFormatter.format("see https://example.org/a_b*c now _"));
  }

  @Test
  void trailingPunctuationIsNotPartOfTheUrl() {
    assertEquals(
        "https://example.org/x_y. \\_",
        ControlCodeFormatter.format("https://example.org/x_y. _"));
  }

  @Test
  void backtickSpansAreCopiedRaw() {
    assertEquals("run `a*b_c` now", ControlCodeFormatter.format("run `a*b_c` now"));
    assertEquals("``", ControlCodeFormatter.format("``"));
  }

  @Test
  void rawSpanIgnoresStyleBytes() {
    assertEquals("**`x\u001Fy`**", ControlCodeFormatter.format("\u0002`x\u001Fy`"));
  }

  @Test
  void loneBacktickIsEscaped() {
    assertEquals("it\\`s", ControlCodeFormatter.format("it`s"));
  }

  @Test
  void skipColorReportsLastConsumedIndex() {
    assertEquals(0, ControlCodeFormatter.skipColor("\u0003", 0));
    assertEquals(2, ControlCodeFormatter.skipColor("\u000312", 0));
    assertEquals(5, ControlCodeFormatter.skipColor("\u000312,34", 0));
  }
}
