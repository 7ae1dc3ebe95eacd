package svtopo.tree;

import java.util.List;

/**
 * A node of a SystemVerilog syntax tree.
 * Each node carries the name of its grammatical category (the tag) and the span of source text it covers.
 * Nodes compare by identity: two structurally equal subtrees at different positions are different nodes.
 */
public class SyntaxNode {
  private final String typeName;
  private final int begin;
  private final int length;
  private final List<SyntaxNode> children;

  /**
   * @param typeName the tag of this node, e.g. "ModuleIdentifier"
   * @param begin offset of the first covered character in the source text
   * @param length number of covered characters
   * @param children the child nodes, in source order
   */
  public SyntaxNode(String typeName, int begin, int length, List<SyntaxNode> children) {
    if (begin < 0 || length < 0)
      throw new IllegalArgumentException("Invalid span [" + begin + ", +" + length + ") for node " + typeName);
    this.typeName = typeName;
    this.begin = begin;
    this.length = length;
    this.children = List.copyOf(children);
  }

  public String getTypeName() { return typeName; }
  public int getBegin() { return begin; }
  public int getLength() { return length; }
  public int getEnd() { return begin + length; }
  public List<SyntaxNode> getChildren() { return children; }
  public boolean isLeaf() { return children.isEmpty(); }

  @Override
  public String toString() {
    return typeName + "[" + begin + "," + getEnd() + ")";
  }
}
