package cafe.woden.ircbridge.roster;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A guild custom emoji. Unavailable emoji (e.g. lost boost tier) cannot be used in messages. */
@ValueObject
public record RosterEmoji(String id, String name, boolean animated, boolean available) {

  public RosterEmoji {
    id = Objects.requireNonNull(id, "id").trim();
    name = Objects.toString(name, "");
  }

  /** Message form, e.g. {@code <:name:id>} or {@code <a:name:id>}. */
  public String messageFormat() {
    return (animated ? "<a:" : "<:") + name + ":" + id + ">";
  }
}
