package cafe.woden.ircbridge.markdown;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/** The top-level nodes of one parsed message. */
@ValueObject
public record MarkdownDocument(List<MarkdownNode> nodes) {

  public MarkdownDocument {
    nodes = (nodes == null) ? List.of() : List.copyOf(nodes);
  }

  public static MarkdownDocument of(MarkdownNode... nodes) {
    return new MarkdownDocument(List.of(nodes));
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /** Pre-order walk of every top-level node. */
  public void walk(MarkdownNode.Visitor visitor) {
    for (MarkdownNode node : nodes) {
      walk(node, visitor);
    }
  }

  public static void walk(MarkdownNode node, MarkdownNode.Visitor visitor) {
    node.accept(visitor, true);
    if (node instanceof MarkdownNode.Container container) {
      for (MarkdownNode child : container.children()) {
        walk(child, visitor);
      }
      node.accept(visitor, false);
    }
  }
}
