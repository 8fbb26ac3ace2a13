package cafe.woden.ircbridge.format;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Builds the {@code <nick>} prefix for Discord messages relayed to IRC.
 *
 * <p>The nick gets a zero-width space after its first code point so that IRC users whose nick
 * matches are not highlighted by every relayed line.
 */
public final class IrcNickDecorator {

  private static final int[] PALETTE = {2, 3, 4, 6, 7, 8, 9, 10, 11, 12, 13};

  private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
  private static final int FNV_PRIME = 0x01000193;

  private IrcNickDecorator() {}

  /**
   * @param displayName nickname, or username when the member has none
   * @param username account name; seeds the fallback color
   * @param roleColor RGB role color, or {@code null} when the member has none
   * @param accentColor RGB profile accent color, used when there is no role color
   */
  public static String prefix(
      String displayName, String username, Integer roleColor, Integer accentColor) {
    return "<" + color(username, roleColor, accentColor) + breakHighlight(displayName)
        + IrcControlCodes.RESET + "> ";
  }

  static String color(String username, Integer roleColor, Integer accentColor) {
    Integer rgb = isSet(roleColor) ? roleColor : isSet(accentColor) ? accentColor : null;
    if (rgb != null) {
      return IrcControlCodes.HEX_COLOR + String.format(Locale.ROOT, "%06X", rgb & 0xFFFFFF);
    }
    int index = (int) (Integer.toUnsignedLong(fnv1(username)) % PALETTE.length);
    return IrcControlCodes.COLOR + String.format(Locale.ROOT, "%02d", PALETTE[index]);
  }

  private static boolean isSet(Integer color) {
    return color != null && color != 0;
  }

  static String breakHighlight(String nick) {
    if (nick == null || nick.codePointCount(0, nick.length()) <= 1) {
      return nick == null ? "" : nick;
    }
    int split = nick.offsetByCodePoints(0, 1);
    return nick.substring(0, split) + IrcControlCodes.ZERO_WIDTH_SPACE + nick.substring(split);
  }

  /** 32-bit FNV-1 (multiply, then xor) over the UTF-8 bytes. */
  static int fnv1(String s) {
    int hash = FNV_OFFSET_BASIS;
    for (byte b : (s == null ? "" : s).getBytes(StandardCharsets.UTF_8)) {
      hash *= FNV_PRIME;
      hash ^= (b & 0xFF);
    }
    return hash;
  }
}
