package cafe.woden.ircbridge.roster;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record RosterRole(String id, String name, boolean mentionable) {

  public RosterRole {
    id = Objects.requireNonNull(id, "id").trim();
    name = Objects.toString(name, "");
  }

  public String mention() {
    return "<@&" + id + ">";
  }
}
