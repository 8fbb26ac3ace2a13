package cafe.woden.ircbridge;

import cafe.woden.ircbridge.config.BridgeProperties;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "IRCafe Bridge",
    sharedModules = {"config"})
@EnableConfigurationProperties(BridgeProperties.class)
public class IrcBridgeApp {

  public static void main(String[] args) {
    new SpringApplicationBuilder(IrcBridgeApp.class)
        .web(WebApplicationType.NONE)
        .run(args);
  }
}
