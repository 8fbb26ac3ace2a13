package cafe.woden.ircbridge.config;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized bridge-owned beans.
 *
 * <p>Each connection loop gets its own single-threaded scheduler so reconnect attempts for one
 * protocol never queue behind the other.
 */
@Configuration
public class BridgeConfig {
  public static final String IRC_CONNECTION_SCHEDULER = "ircConnectionScheduler";
  public static final String DISCORD_LOGIN_SCHEDULER = "discordLoginScheduler";

  @Bean
  public ChannelMap channelMap(BridgeProperties props) {
    return ChannelMap.of(props.channels());
  }

  @Bean
  public Clock bridgeClock() {
    return Clock.systemUTC();
  }

  /** Zone used to render Discord timestamps for IRC. */
  @Bean
  public ZoneId displayZone(BridgeProperties props) {
    String zone = props.displayZone().trim();
    return zone.isEmpty() ? ZoneId.systemDefault() : ZoneId.of(zone);
  }

  @Bean(name = IRC_CONNECTION_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService ircConnectionScheduler() {
    return singleThread("ircbridge-irc");
  }

  @Bean(name = DISCORD_LOGIN_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService discordLoginScheduler() {
    return singleThread("ircbridge-discord-login");
  }

  private static ScheduledExecutorService singleThread(String name) {
    return Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, name);
      t.setDaemon(true);
      return t;
    });
  }
}
