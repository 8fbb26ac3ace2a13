package cafe.woden.ircbridge.bridge;

import static cafe.woden.ircbridge.format.IrcControlCodes.BOLD;
import static cafe.woden.ircbridge.format.IrcControlCodes.ITALIC;
import static cafe.woden.ircbridge.format.IrcControlCodes.RESET;

/** Control-code text posted to Discord for IRC membership changes and chat lines. */
final class RelayNotices {

  private RelayNotices() {}

  static String nickChanged(String oldNick, String newNick) {
    return ITALIC + oldNick + RESET + " is now known as " + newNick;
  }

  static String joined(String nick) {
    return ITALIC + nick + RESET + " has joined the channel";
  }

  static String left(String nick, String reason) {
    return withReason(ITALIC + nick + RESET + " has left the channel", reason);
  }

  static String kicked(String target, String byNick, String reason) {
    return withReason(ITALIC + target + RESET + " was kicked off the channel by " + byNick, reason);
  }

  static String quit(String nick, String reason) {
    return withReason(ITALIC + nick + RESET + " has quit", reason);
  }

  static String speaker(String nick) {
    return BOLD + "<" + nick + ">";
  }

  static String chatLine(String nick, String body) {
    return speaker(nick) + RESET + " " + body;
  }

  static String action(String text) {
    return ITALIC + text;
  }

  private static String withReason(String base, String reason) {
    return reason == null ? base : base + ": " + reason;
  }
}
