package cafe.woden.ircbridge.format;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * The text attributes in effect at one position of a control-code string.
 *
 * <p>Color is deliberately absent: Discord markdown has no equivalent, so colors never force a
 * style boundary.
 */
@ValueObject
public record StyleState(boolean bold, boolean italic, boolean underline, boolean strikethrough) {

  public static final StyleState PLAIN = new StyleState(false, false, false, false);

  public StyleState withBold() {
    return new StyleState(true, italic, underline, strikethrough);
  }

  public StyleState withItalic() {
    return new StyleState(bold, true, underline, strikethrough);
  }

  public StyleState withUnderline() {
    return new StyleState(bold, italic, true, strikethrough);
  }

  public StyleState withStrikethrough() {
    return new StyleState(bold, italic, underline, true);
  }
}
