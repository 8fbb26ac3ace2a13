package cafe.woden.ircbridge.markdown;

import java.util.function.Supplier;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Node;
import org.commonmark.node.Text;
import org.commonmark.parser.delimiter.DelimiterProcessor;
import org.commonmark.parser.delimiter.DelimiterRun;

/**
 * Double-character inline delimiters that Discord adds on top of CommonMark: {@code __underline__}
 * and {@code ||spoiler||}.
 *
 * <p>The {@code __} processor is registered next to CommonMark's own {@code _} emphasis; runs of two
 * or more underscores come here, single ones stay italic.
 */
final class DiscordDelimiterProcessor implements DelimiterProcessor {

  static final class Underline extends CustomNode {}

  static final class Spoiler extends CustomNode {}

  private static final int DELIMITER_LENGTH = 2;

  private final char delimiter;
  private final Supplier<Node> nodeFactory;

  private DiscordDelimiterProcessor(char delimiter, Supplier<Node> nodeFactory) {
    this.delimiter = delimiter;
    this.nodeFactory = nodeFactory;
  }

  static DiscordDelimiterProcessor underline() {
    return new DiscordDelimiterProcessor('_', Underline::new);
  }

  static DiscordDelimiterProcessor spoiler() {
    return new DiscordDelimiterProcessor('|', Spoiler::new);
  }

  @Override
  public char getOpeningCharacter() {
    return delimiter;
  }

  @Override
  public char getClosingCharacter() {
    return delimiter;
  }

  @Override
  public int getMinLength() {
    return DELIMITER_LENGTH;
  }

  @Override
  public int process(DelimiterRun openingRun, DelimiterRun closingRun) {
    if (openingRun.length() < DELIMITER_LENGTH || closingRun.length() < DELIMITER_LENGTH) return 0;

    Text opener = openingRun.getOpener();
    Text closer = closingRun.getCloser();
    Node wrapper = nodeFactory.get();
    Node node = opener.getNext();
    while (node != null && node != closer) {
      Node next = node.getNext();
      wrapper.appendChild(node);
      node = next;
    }
    opener.insertAfter(wrapper);
    return DELIMITER_LENGTH;
  }
}
