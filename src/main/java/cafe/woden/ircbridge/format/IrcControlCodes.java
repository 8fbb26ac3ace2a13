package cafe.woden.ircbridge.format;

/** mIRC-style formatting bytes used in IRC message bodies. */
public final class IrcControlCodes {

  public static final char BOLD = '\u0002';
  public static final char COLOR = '\u0003';
  public static final char HEX_COLOR = '\u0004';
  public static final char RESET = '\u000F';
  public static final char MONOSPACE = '\u0011';
  public static final char REVERSE = '\u0016';
  public static final char ITALIC = '\u001D';
  public static final char STRIKETHROUGH = '\u001E';
  public static final char UNDERLINE = '\u001F';

  /** Inserted to break a markdown run or an IRC nick highlight without visible output. */
  public static final char ZERO_WIDTH_SPACE = '\u200B';

  private IrcControlCodes() {}
}
