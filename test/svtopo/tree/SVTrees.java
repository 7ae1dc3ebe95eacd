package svtopo.tree;

import static svtopo.tree.SyntaxTreeBuilder.node;
import static svtopo.tree.SyntaxTreeBuilder.token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import svtopo.tree.SyntaxTreeBuilder.Shape;

/**
 * Builds syntax trees shaped like the output of a SystemVerilog parser, for tests.
 */
public class SVTrees {
  public static SyntaxTree tree(Shape... descriptions) { return SyntaxTreeBuilder.build(node("SourceText", descriptions)); }

  public static Shape identifier(String wrapper, String name) {
    return node(wrapper, node("Identifier", token("SimpleIdentifier", name)));
  }

  /** module name; items endmodule */
  public static Shape moduleNonansi(String name, Shape... items) {
    List<Shape> children = new ArrayList<>();
    children.add(node("ModuleNonansiHeader", token("Keyword", "module"), identifier("ModuleIdentifier", name), token("Symbol", ";")));
    children.addAll(Arrays.asList(items));
    children.add(token("Keyword", "endmodule"));
    return node("ModuleDeclarationNonansi", children);
  }

  /** module name(ports); items endmodule */
  public static Shape moduleAnsi(String name, List<Shape> ports, Shape... items) {
    List<Shape> portList = new ArrayList<>();
    portList.add(token("Symbol", "("));
    for (int i = 0; i < ports.size(); ++i) {
      if (i > 0)
        portList.add(token("Symbol", ","));
      portList.add(ports.get(i));
    }
    portList.add(token("Symbol", ")"));
    List<Shape> children = new ArrayList<>();
    children.add(node("ModuleAnsiHeader", token("Keyword", "module"), identifier("ModuleIdentifier", name),
                      node("ListOfPortDeclarations", portList), token("Symbol", ";")));
    children.addAll(Arrays.asList(items));
    children.add(token("Keyword", "endmodule"));
    return node("ModuleDeclarationAnsi", children);
  }

  /** direction [netType] name, as in an ANSI port list. netType may be null. */
  public static Shape ansiPort(String direction, String netType, String name) {
    List<Shape> header = new ArrayList<>();
    header.add(node("PortDirection", token("Keyword", direction)));
    if (netType != null)
      header.add(node("NetPortType", node("NetType", token("Keyword", netType))));
    return node("AnsiPortDeclarationNet", node("NetPortHeader", header), identifier("PortIdentifier", name));
  }

  /** moduleName instName(connections); */
  public static Shape instantiation(String moduleName, String instName, Shape... connections) {
    List<Shape> connList = new ArrayList<>();
    for (int i = 0; i < connections.length; ++i) {
      if (i > 0)
        connList.add(token("Symbol", ","));
      connList.add(connections[i]);
    }
    return node("ModuleInstantiation", identifier("ModuleIdentifier", moduleName),
                node("HierarchicalInstance", node("NameOfInstance", identifier("InstanceIdentifier", instName)), token("Symbol", "("),
                     node("ListOfPortConnectionsNamed", connList), token("Symbol", ")")),
                token("Symbol", ";"));
  }

  /** .port(signal) */
  public static Shape named(String port, String signal) {
    return node("NamedPortConnection", token("Symbol", "."), identifier("PortIdentifier", port), token("Symbol", "("),
                node("Expression", node("Primary", node("HierarchicalIdentifier", token("SimpleIdentifier", signal)))),
                token("Symbol", ")"));
  }

  /** .port, which connects the signal of the same name without an explicit expression */
  public static Shape namedImplicit(String port) {
    return node("NamedPortConnection", token("Symbol", "."), identifier("PortIdentifier", port));
  }

  /** wire name; */
  public static Shape wire(String name) {
    return node("NetDeclaration", node("NetType", token("Keyword", "wire")),
                node("ListOfNetDeclAssignments", identifier("NetIdentifier", name)), token("Symbol", ";"));
  }

  /**
   * The design
   * <pre>
   * module sub(input in); endmodule
   * module top; sub s1(.in(x)); endmodule
   * </pre>
   */
  public static SyntaxTree topAndSub() {
    return tree(moduleAnsi("sub", List.of(ansiPort("input", null, "in"))), moduleNonansi("top", instantiation("sub", "s1", named("in", "x"))));
  }
}
