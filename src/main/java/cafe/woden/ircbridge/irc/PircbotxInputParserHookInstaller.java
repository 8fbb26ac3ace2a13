package cafe.woden.ircbridge.irc;

import java.lang.reflect.Field;
import java.util.function.Consumer;
import org.pircbotx.InputParser;
import org.pircbotx.PircBotX;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Swaps a bot's {@link InputParser} for a {@link PircbotxRelayInputParser}.
 *
 * <p>PircBotX has no public API for replacing its parser, so the field is located and set
 * reflectively.
 */
@Component
public class PircbotxInputParserHookInstaller {

  private static final Logger log = LoggerFactory.getLogger(PircbotxInputParserHookInstaller.class);

  boolean install(
      PircBotX bot, PircbotxSessionState state, Consumer<IrcSessionEvent> sink, boolean wireDebug) {
    if (bot == null) return false;
    try {
      boolean swapped = swapInputParser(bot, new PircbotxRelayInputParser(bot, state, sink, wireDebug));
      if (swapped) {
        log.debug("[ircbridge] installed raw line InputParser hook");
      } else {
        log.warn("[ircbridge] could not install InputParser hook (no compatible field found)");
      }
      return swapped;
    } catch (Exception ex) {
      log.warn("[ircbridge] failed to install InputParser hook", ex);
      return false;
    }
  }

  boolean swapInputParser(PircBotX bot, InputParser replacement) throws Exception {
    Field target = null;
    Class<?> c = bot.getClass();
    while (c != null) {
      for (Field f : c.getDeclaredFields()) {
        if (InputParser.class.isAssignableFrom(f.getType())) {
          target = f;
          break;
        }
      }
      if (target != null) break;
      c = c.getSuperclass();
    }
    if (target == null) return false;

    target.setAccessible(true);
    target.set(bot, replacement);
    return true;
  }
}
