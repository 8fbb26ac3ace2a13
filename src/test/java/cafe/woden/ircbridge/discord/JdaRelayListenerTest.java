package cafe.woden.ircbridge.discord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.function.Consumer;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.requests.restaction.CacheRestAction;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class JdaRelayListenerTest {

  private final JdaRelayListener listener = new JdaRelayListener(event -> {});

  @Test
  @SuppressWarnings("unchecked")
  void accentColorIsFetchedOnceAndUsedOnceLoaded() {
    User user = mock(User.class);
    CacheRestAction<User.Profile> retrieve = mock(CacheRestAction.class);
    User.Profile profile = mock(User.Profile.class);
    when(user.getId()).thenReturn("7");
    when(user.retrieveProfile()).thenReturn(retrieve);
    when(profile.getAccentColorRaw()).thenReturn(0x00FF00);

    assertThat(listener.accentColor(user)).isNull();
    assertThat(listener.accentColor(user)).isNull();

    ArgumentCaptor<Consumer<User.Profile>> onSuccess = ArgumentCaptor.forClass(Consumer.class);
    verify(retrieve).queue(onSuccess.capture(), any());
    onSuccess.getValue().accept(profile);

    assertThat(listener.accentColor(user)).isEqualTo(0x00FF00);
    verify(user, times(1)).retrieveProfile();
  }

  @Test
  @SuppressWarnings("unchecked")
  void unsetAccentColorStaysNull() {
    User user = mock(User.class);
    CacheRestAction<User.Profile> retrieve = mock(CacheRestAction.class);
    User.Profile profile = mock(User.Profile.class);
    when(user.getId()).thenReturn("8");
    when(user.retrieveProfile()).thenReturn(retrieve);
    when(profile.getAccentColorRaw()).thenReturn(User.DEFAULT_ACCENT_COLOR_RAW);

    listener.accentColor(user);
    ArgumentCaptor<Consumer<User.Profile>> onSuccess = ArgumentCaptor.forClass(Consumer.class);
    verify(retrieve).queue(onSuccess.capture(), any());
    onSuccess.getValue().accept(profile);

    assertThat(listener.accentColor(user)).isNull();
  }

  @Test
  void defaultRoleColorMeansNoColor() {
    Member plain = mock(Member.class);
    when(plain.getColorRaw()).thenReturn(Role.DEFAULT_COLOR_RAW);
    Member colored = mock(Member.class);
    when(colored.getColorRaw()).thenReturn(0x3498DB);

    assertThat(JdaRelayListener.roleColor(null)).isNull();
    assertThat(JdaRelayListener.roleColor(plain)).isNull();
    assertThat(JdaRelayListener.roleColor(colored)).isEqualTo(0x3498DB);
  }
}
