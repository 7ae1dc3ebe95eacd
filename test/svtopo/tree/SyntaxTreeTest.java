package svtopo.tree;

import static svtopo.tree.SyntaxTreeBuilder.node;
import static svtopo.tree.SyntaxTreeBuilder.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SyntaxTreeTest {

  private static SyntaxTree smallTree() {
    // a ( b c ) d
    return SyntaxTreeBuilder.build(node("Root", token("A", "a"), node("Group", token("Symbol", "("), node("Inner", token("B", "b"), token("C", "c")), token("Symbol", ")")),
                                        token("D", "d")));
  }

  @Test
  void testPreorder() {
    SyntaxTree tree = smallTree();
    List<String> types = tree.stream().map(SyntaxNode::getTypeName).collect(Collectors.toList());
    Assertions.assertEquals(List.of("Root", "A", "Group", "Symbol", "Inner", "B", "C", "Symbol", "D"), types);
    Assertions.assertSame(tree.getRoot(), tree.getNodes().get(0));
  }

  @Test
  void testSourceAndSpans() {
    SyntaxTree tree = smallTree();
    Assertions.assertEquals("a ( b c ) d", tree.getSource());
    SyntaxNode group = tree.getNodes().get(2);
    Assertions.assertEquals("( b c )", tree.getStr(group));
    SyntaxNode inner = tree.getNodes().get(4);
    Assertions.assertEquals("b c", tree.getStr(inner));
    Assertions.assertEquals(tree.getSource(), tree.getStr(tree.getRoot()));
  }

  @Test
  void testEmptyNodeHasEmptyText() {
    SyntaxTree tree = SyntaxTreeBuilder.build(node("Root", token("A", "a"), node("Nothing"), token("B", "b")));
    SyntaxNode nothing = tree.getNodes().get(2);
    Assertions.assertEquals("Nothing", nothing.getTypeName());
    Assertions.assertEquals("", tree.getStr(nothing));
    Assertions.assertTrue(nothing.isLeaf());
  }

  @Test
  void testUnwrapFindsFirstInPreorder() {
    SyntaxTree tree = smallTree();
    Optional<SyntaxNode> symbol = tree.unwrapNode(tree.getRoot(), "Symbol");
    Assertions.assertTrue(symbol.isPresent());
    Assertions.assertEquals("(", tree.getStr(symbol.get()));

    // Any of the given tags matches; the earliest node wins regardless of tag order.
    Optional<SyntaxNode> cOrB = tree.unwrapNode(tree.getRoot(), "C", "B");
    Assertions.assertEquals("B", cOrB.get().getTypeName());
  }

  @Test
  void testUnwrapIncludesStartNode() {
    SyntaxTree tree = smallTree();
    SyntaxNode inner = tree.getNodes().get(4);
    Assertions.assertSame(inner, tree.unwrapNode(inner, "Inner").get());
  }

  @Test
  void testUnwrapStaysBelowStartNode() {
    SyntaxTree tree = smallTree();
    SyntaxNode inner = tree.getNodes().get(4);
    Assertions.assertTrue(tree.unwrapNode(inner, "D").isEmpty());
    Assertions.assertTrue(tree.unwrapNode(inner, "Symbol").isEmpty());
    Assertions.assertTrue(tree.unwrapNode(tree.getRoot(), "Missing").isEmpty());
  }

  @Test
  void testUnwrapStrTrims() {
    SyntaxTree tree = SVTrees.topAndSub();
    Assertions.assertEquals(Optional.of("sub"), tree.unwrapStr(tree.getRoot(), "ModuleIdentifier"));
  }

  @Test
  void testPathTo() {
    SyntaxTree tree = smallTree();
    List<SyntaxNode> nodes = tree.getNodes();
    SyntaxNode c = nodes.get(6);
    Assertions.assertEquals(List.of(nodes.get(0), nodes.get(2), nodes.get(4), c), tree.pathTo(tree.getRoot(), c).get());
    Assertions.assertEquals(List.of(c), tree.pathTo(c, c).get());
    Assertions.assertTrue(tree.pathTo(nodes.get(4), nodes.get(8)).isEmpty());
  }

  @Test
  void testNodeCopiesChildren() {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(new SyntaxNode("A", 0, 1, List.of()));
    SyntaxNode parent = new SyntaxNode("Root", 0, 1, children);
    children.add(new SyntaxNode("B", 0, 1, List.of()));
    Assertions.assertEquals(1, parent.getChildren().size());
    Assertions.assertEquals(2, new SyntaxTree("a", parent).getNodes().size());
  }

  @Test
  void testUnwrapNeedsTags() {
    SyntaxTree tree = smallTree();
    Assertions.assertThrows(IllegalArgumentException.class, () -> tree.unwrapNode(tree.getRoot()));
  }

  @Test
  void testRootMustFitSource() {
    SyntaxNode root = new SyntaxNode("Root", 0, 10, List.of());
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SyntaxTree("short", root));
  }

  @ParameterizedTest
  @CsvSource({"ModuleDeclarationAnsi, ModuleDeclaration", "ModuleDeclarationNonansi, ModuleDeclaration",
              "AnsiPortDeclarationNet, PortDeclaration", "ListOfPortDeclarations, PortDeclaration",
              "ModuleInstantiation, ModuleInstantiation", "NamedPortConnection, NamedPortConnection",
              "ModuleIdentifier, Other", "ModuleInstantiationFoo, Other", "OrderedPortConnection, Other"})
  void testNodeKind(String typeName, NodeKind expected) {
    Assertions.assertEquals(expected, NodeKind.of(typeName));
  }
}
