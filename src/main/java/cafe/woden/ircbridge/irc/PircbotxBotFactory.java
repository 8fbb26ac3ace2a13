package cafe.woden.ircbridge.irc;

import cafe.woden.ircbridge.config.BridgeProperties;
import java.lang.reflect.Method;
import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import org.pircbotx.Configuration;
import org.pircbotx.PircBotX;
import org.pircbotx.cap.EnableCapHandler;
import org.pircbotx.cap.SASLCapHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the configured {@link PircBotX} instance for the bridge's IRC connection.
 *
 * <p>Channels are not auto-joined here; the bridge joins them itself once registered.
 */
@Component
public class PircbotxBotFactory {

  private static final Logger log = LoggerFactory.getLogger(PircbotxBotFactory.class);

  static final String CAP_MESSAGE_TAGS = "message-tags";
  static final String CAP_ECHO_MESSAGE = "echo-message";
  static final String CAP_MESSAGE_REDACTION = "draft/message-redaction";

  private static final String VERSION = "IRCafe Bridge";

  public PircBotX build(BridgeProperties.Irc irc) {
    SocketFactory socketFactory = irc.tls()
        ? SSLSocketFactory.getDefault()
        : SocketFactory.getDefault();

    Configuration.Builder builder = new Configuration.Builder()
        .setName(irc.nick())
        .setLogin(irc.login())
        .setRealName(irc.realName())
        .setVersion(VERSION)
        .addServer(irc.host(), irc.port())
        .setSocketFactory(socketFactory)
        .setCapEnabled(true)
        // Tags carry msgid, replies, reactions and the +discord id of echoed lines.
        .addCapHandler(new EnableCapHandler(CAP_MESSAGE_TAGS, true))
        // Echoes tell us the msgid the server assigned to our own lines.
        .addCapHandler(new EnableCapHandler(CAP_ECHO_MESSAGE, true))
        .addCapHandler(new EnableCapHandler(CAP_MESSAGE_REDACTION, true))
        .setAutoNickChange(true)
        // Reconnects are driven by PircbotxIrcRelayClient with a fixed delay.
        .setAutoReconnect(false);

    applyMessageDelay(builder, irc.messageDelayMs());

    if (!irc.serverPassword().isBlank()) {
      builder.setServerPassword(irc.serverPassword());
    }

    // SASL (PLAIN)
    if (irc.sasl().enabled()) {
      if (irc.sasl().username().isBlank() || irc.sasl().password().isBlank()) {
        throw new IllegalStateException("SASL enabled but username/password not set");
      }
      builder.addCapHandler(new SASLCapHandler(irc.sasl().username(), irc.sasl().password()));
    }

    return new PircBotX(builder.buildConfiguration());
  }

  /**
   * Applies the outgoing-queue throttle.
   *
   * <p>Older PircBotX releases take {@code setMessageDelay(long)}, newer ones a {@code Delay}
   * object, so both are tried reflectively. On failure PircBotX keeps its default.
   */
  static boolean applyMessageDelay(Configuration.Builder builder, long delayMs) {
    try {
      Method m = builder.getClass().getMethod("setMessageDelay", long.class);
      m.invoke(builder, delayMs);
      return true;
    } catch (ReflectiveOperationException e) {
      log.trace("[ircbridge] setMessageDelay(long) not available", e);
    }

    try {
      Class<?> delayType = Class.forName("org.pircbotx.delay.Delay");
      Class<?> staticDelay = Class.forName("org.pircbotx.delay.StaticDelay");
      Object delay = staticDelay.getConstructor(long.class).newInstance(delayMs);
      builder.getClass().getMethod("setMessageDelay", delayType).invoke(builder, delay);
      return true;
    } catch (ReflectiveOperationException e) {
      log.debug("[ircbridge] could not apply IRC message delay of {}ms; keeping default", delayMs, e);
      return false;
    }
  }
}
