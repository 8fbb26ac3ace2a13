package cafe.woden.ircbridge.roster;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A guild member as seen by the roster snapshot.
 *
 * <p>{@code discriminator} is {@code "0000"} or empty for accounts migrated to unique usernames;
 * {@code nickname} is empty when the member has no guild nickname.
 */
@ValueObject
public record RosterMember(String id, String username, String discriminator, String nickname) {

  public RosterMember {
    id = Objects.requireNonNull(id, "id").trim();
    username = Objects.toString(username, "");
    discriminator = Objects.toString(discriminator, "");
    nickname = Objects.toString(nickname, "");
  }

  /** Guild nickname, or the username when no nickname is set. */
  public String displayName() {
    return nickname.isBlank() ? username : nickname;
  }

  public String mention() {
    return "<@" + id + ">";
  }
}
