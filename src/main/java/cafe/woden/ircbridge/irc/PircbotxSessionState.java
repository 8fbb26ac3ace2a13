package cafe.woden.ircbridge.irc;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.pircbotx.PircBotX;

/**
 * Mutable state of the one IRC session the bridge keeps open.
 *
 * <p>{@link #liveBot} is only set once the server has welcomed us (001); until then, and after
 * a disconnect, outbound lines have nowhere to go.
 */
final class PircbotxSessionState {
  final AtomicReference<PircBotX> botRef = new AtomicReference<>();
  final AtomicReference<PircBotX> liveBot = new AtomicReference<>();
  final AtomicBoolean started = new AtomicBoolean(false);
  final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  private final Set<String> enabledCaps = ConcurrentHashMap.newKeySet();

  void beginSession(PircBotX bot) {
    botRef.set(bot);
    liveBot.set(null);
    enabledCaps.clear();
  }

  void markRegistered(PircBotX bot) {
    if (botRef.get() == bot) liveBot.set(bot);
  }

  /** Clears the session only if {@code bot} is still the current one. */
  void endSession(PircBotX bot) {
    if (botRef.compareAndSet(bot, null)) {
      liveBot.set(null);
      enabledCaps.clear();
    }
  }

  void capEnabled(String cap, boolean enabled) {
    String c = normalizeCap(cap);
    if (c.isEmpty()) return;
    if (enabled) enabledCaps.add(c);
    else enabledCaps.remove(c);
  }

  boolean isCapEnabled(String cap) {
    return enabledCaps.contains(normalizeCap(cap));
  }

  private static String normalizeCap(String cap) {
    if (cap == null) return "";
    String c = cap.trim();
    // CAP ACK may prefix a capability with '-' (disabled) or carry '=value'.
    int eq = c.indexOf('=');
    if (eq >= 0) c = c.substring(0, eq);
    return c.toLowerCase(Locale.ROOT);
  }
}
