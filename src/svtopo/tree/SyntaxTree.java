package svtopo.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An already-parsed SystemVerilog syntax tree over a source text.
 * Iterating the tree yields all of its nodes flattened in pre-order (document order).
 * Instances are immutable and can be shared across threads.
 */
public class SyntaxTree implements Iterable<SyntaxNode> {
  private final String source;
  private final SyntaxNode root;
  /** All nodes in pre-order, root first. */
  private final List<SyntaxNode> nodes;

  public SyntaxTree(String source, SyntaxNode root) {
    this.source = Objects.requireNonNull(source);
    this.root = Objects.requireNonNull(root);
    if (root.getEnd() > source.length())
      throw new IllegalArgumentException("Root node " + root + " exceeds the source text (" + source.length() + " characters)");
    this.nodes = Collections.unmodifiableList(preorder(root));
  }

  private static List<SyntaxNode> preorder(SyntaxNode start) {
    List<SyntaxNode> ret = new ArrayList<>();
    Deque<SyntaxNode> stack = new ArrayDeque<>();
    stack.push(start);
    while (!stack.isEmpty()) {
      SyntaxNode node = stack.pop();
      ret.add(node);
      List<SyntaxNode> children = node.getChildren();
      for (int i = children.size() - 1; i >= 0; --i)
        stack.push(children.get(i));
    }
    return ret;
  }

  public String getSource() { return source; }
  public SyntaxNode getRoot() { return root; }

  /** Returns the nodes of this tree in pre-order. */
  public List<SyntaxNode> getNodes() { return nodes; }

  @Override
  public Iterator<SyntaxNode> iterator() {
    return nodes.iterator();
  }

  public Stream<SyntaxNode> stream() { return nodes.stream(); }

  /**
   * Returns the source text covered by a node, without trimming.
   * @param node a node of this tree
   */
  public String getStr(SyntaxNode node) {
    if (node.getEnd() > source.length())
      throw new IllegalArgumentException("Node " + node + " is not part of this tree");
    return source.substring(node.getBegin(), node.getEnd());
  }

  /**
   * Structural descendant query.
   * Walks <code>node</code> and its descendants in pre-order and returns the first one whose tag is any of <code>tags</code>.
   * The node itself is considered first.
   * @param node the node to search under
   * @param tags the accepted tags; must not be empty
   * @return the first matching node, or empty if no node under <code>node</code> carries one of the tags
   */
  public Optional<SyntaxNode> unwrapNode(SyntaxNode node, String... tags) {
    if (tags.length == 0)
      throw new IllegalArgumentException("unwrapNode needs at least one tag");
    Set<String> accepted = Arrays.stream(tags).collect(Collectors.toSet());
    Deque<SyntaxNode> stack = new ArrayDeque<>();
    stack.push(node);
    while (!stack.isEmpty()) {
      SyntaxNode cur = stack.pop();
      if (accepted.contains(cur.getTypeName()))
        return Optional.of(cur);
      List<SyntaxNode> children = cur.getChildren();
      for (int i = children.size() - 1; i >= 0; --i)
        stack.push(children.get(i));
    }
    return Optional.empty();
  }

  /**
   * Returns the nodes from <code>from</code> down to <code>target</code>, both included.
   * @return the path, or empty if <code>target</code> is not <code>from</code> or one of its descendants
   */
  public Optional<List<SyntaxNode>> pathTo(SyntaxNode from, SyntaxNode target) {
    List<SyntaxNode> path = new ArrayList<>();
    if (!collectPath(from, target, path))
      return Optional.empty();
    return Optional.of(Collections.unmodifiableList(path));
  }

  private static boolean collectPath(SyntaxNode cur, SyntaxNode target, List<SyntaxNode> path) {
    path.add(cur);
    if (cur == target)
      return true;
    for (SyntaxNode child : cur.getChildren()) {
      if (collectPath(child, target, path))
        return true;
    }
    path.remove(path.size() - 1);
    return false;
  }

  /** Shorthand for the trimmed source text of the first node found by {@link #unwrapNode(SyntaxNode, String...)}. */
  public Optional<String> unwrapStr(SyntaxNode node, String... tags) {
    return unwrapNode(node, tags).map(found -> getStr(found).strip());
  }
}
