package cafe.woden.ircbridge.bridge;

import cafe.woden.ircbridge.discord.DiscordGateway;
import cafe.woden.ircbridge.format.DiscordTextTransformer;
import cafe.woden.ircbridge.format.MarkdownIrcRenderer;
import cafe.woden.ircbridge.format.TimestampRenderer;
import cafe.woden.ircbridge.roster.MentionResolver;
import cafe.woden.ircbridge.roster.RosterSnapshot;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Text conversion beans, all reading the Discord gateway's live roster. */
@Configuration
public class RelayFormattingConfig {

  @Bean
  public RosterSnapshot rosterSnapshot(DiscordGateway discord) {
    return discord.roster();
  }

  @Bean
  public MentionResolver mentionResolver(RosterSnapshot roster) {
    return new MentionResolver(roster);
  }

  @Bean
  public DiscordTextTransformer discordTextTransformer(MentionResolver mentionResolver) {
    return new DiscordTextTransformer(mentionResolver);
  }

  @Bean
  public TimestampRenderer timestampRenderer(Clock bridgeClock, ZoneId displayZone) {
    return new TimestampRenderer(bridgeClock, displayZone);
  }

  @Bean
  public MarkdownIrcRenderer markdownIrcRenderer(RosterSnapshot roster, TimestampRenderer timestamps) {
    return new MarkdownIrcRenderer(roster, timestamps);
  }
}
