package cafe.woden.ircbridge.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bridge configuration.
 *
 * <p>Example YAML:
 * <pre>
 * bridge:
 *   discord:
 *     token: "..."
 *   irc:
 *     host: irc.example.org
 *     port: 6697
 *     nick: discord
 *   channels:
 *     "123456789012345678": "#example"
 * </pre>
 */
@ConfigurationProperties(prefix = "bridge")
public record BridgeProperties(
    boolean debug,
    long reconnectDelayMs,
    String displayZone,
    Correlation correlation,
    Discord discord,
    Irc irc,
    /** Discord channel id to IRC channel name. */
    Map<String, String> channels
) {

  public static final long DEFAULT_RECONNECT_DELAY_MS = 15_000;

  public BridgeProperties {
    if (reconnectDelayMs <= 0) reconnectDelayMs = DEFAULT_RECONNECT_DELAY_MS;
    if (displayZone == null) displayZone = "";
    if (correlation == null) correlation = new Correlation(Correlation.DEFAULT_MAX_ENTRIES);
    if (discord == null) discord = new Discord("");
    if (irc == null) irc = new Irc(null, 0, true, null, null, null, null, 0, null);
    channels = (channels == null) ? Map.of() : new LinkedHashMap<>(channels);
  }

  /** Bounds the message correlation store. {@code maxEntries == 0} means unbounded. */
  public record Correlation(int maxEntries) {
    public static final int DEFAULT_MAX_ENTRIES = 50_000;

    public Correlation {
      if (maxEntries < 0) maxEntries = 0;
    }
  }

  public record Discord(String token) {
    public Discord {
      if (token == null) token = "";
    }

    public boolean hasToken() {
      return !token.isBlank();
    }
  }

  public record Irc(
      String host,
      int port,
      boolean tls,
      String nick,
      String login,
      String realName,
      String serverPassword,
      long messageDelayMs,
      Sasl sasl
  ) {
    public Irc {
      if (host == null) host = "";
      if (port <= 0) port = tls ? 6697 : 6667;
      if (nick == null) nick = "";
      if (login == null || login.isBlank()) login = "discordircv3";
      if (realName == null || realName.isBlank()) realName = "discord-ircv3 bridge";
      if (serverPassword == null) serverPassword = "";
      if (messageDelayMs <= 0) messageDelayMs = 500;
      if (sasl == null) sasl = new Sasl(false, "", "");
    }

    public record Sasl(boolean enabled, String username, String password) {
      public Sasl {
        if (username == null) username = "";
        if (password == null) password = "";
      }
    }
  }

  /** Fails fast on settings the bridge cannot run without. */
  public void validate() {
    if (!discord.hasToken()) {
      throw new IllegalArgumentException("bridge.discord.token is not set");
    }
    if (irc.host().isBlank()) {
      throw new IllegalArgumentException("bridge.irc.host is not set");
    }
    if (irc.nick().isBlank()) {
      throw new IllegalArgumentException("bridge.irc.nick is not set");
    }
    if (irc.port() > 65535) {
      throw new IllegalArgumentException("bridge.irc.port is invalid: " + irc.port());
    }
    if (irc.sasl().enabled() && (irc.sasl().username().isBlank() || irc.sasl().password().isBlank())) {
      throw new IllegalArgumentException("bridge.irc.sasl.enabled=true but username/password not set");
    }
  }
}
