package svtopo.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link SyntaxTree} from a token tree.
 * Leaves are tokens with text, inner nodes only have children.
 * The source text is the concatenation of all token texts separated by a single space,
 * and every inner node covers the text from its first to its last token.
 *
 * <pre>
 * SyntaxTree tree = SyntaxTreeBuilder.build(
 *     node("ModuleDeclarationNonansi",
 *          token("Keyword", "module"),
 *          node("ModuleIdentifier", token("SimpleIdentifier", "top")),
 *          token("Symbol", ";"),
 *          token("Keyword", "endmodule")));
 * </pre>
 */
public class SyntaxTreeBuilder {
  /** Description of a node before its span is known. */
  public static class Shape {
    final String type;
    /** Token text, null for inner nodes */
    final String text;
    final List<Shape> children;

    private Shape(String type, String text, List<Shape> children) {
      this.type = Objects.requireNonNull(type, "node type");
      this.text = text;
      this.children = children;
    }

    public String getType() { return type; }
    public boolean isToken() { return text != null; }
  }

  public static Shape token(String type, String text) {
    if (text.isEmpty())
      throw new IllegalArgumentException("Token " + type + " has no text");
    return new Shape(type, text, List.of());
  }

  public static Shape node(String type, Shape... children) { return new Shape(type, null, Arrays.asList(children)); }

  public static Shape node(String type, List<Shape> children) { return new Shape(type, null, new ArrayList<>(children)); }

  public static SyntaxTree build(Shape root) {
    StringBuilder source = new StringBuilder();
    SyntaxNode rootNode = place(root, source);
    return new SyntaxTree(source.toString(), rootNode);
  }

  private static SyntaxNode place(Shape shape, StringBuilder source) {
    if (shape.isToken()) {
      if (source.length() > 0)
        source.append(' ');
      int begin = source.length();
      source.append(shape.text);
      return new SyntaxNode(shape.type, begin, shape.text.length(), List.of());
    }
    List<SyntaxNode> children = new ArrayList<>(shape.children.size());
    for (Shape child : shape.children)
      children.add(place(child, source));
    if (children.isEmpty()) {
      // Empty node: zero-width span at the current position.
      return new SyntaxNode(shape.type, source.length(), 0, children);
    }
    int begin = children.get(0).getBegin();
    int end = children.get(children.size() - 1).getEnd();
    return new SyntaxNode(shape.type, begin, end - begin, children);
  }
}
