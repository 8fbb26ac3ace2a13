package cafe.woden.ircbridge.architecture;

import static org.assertj.core.api.Assertions.assertThat;

import cafe.woden.ircbridge.IrcBridgeApp;
import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModule;
import org.springframework.modulith.core.ApplicationModules;

class SpringModulithStructureTest {

  private static final ApplicationModules MODULES = ApplicationModules.of(IrcBridgeApp.class);

  @Test
  void modulesAreDiscovered() {
    assertThat(MODULES.stream().map(ApplicationModule::getName))
        .contains("bridge", "irc", "discord", "format", "markdown", "roster", "correlation", "config");
  }

  @Test
  void moduleDependenciesAreAcyclic() {
    MODULES.verify();
  }
}
