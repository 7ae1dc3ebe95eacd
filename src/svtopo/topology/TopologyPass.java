package svtopo.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import svtopo.tree.NodeKind;
import svtopo.tree.SyntaxNode;
import svtopo.tree.SyntaxTree;

/**
 * Single forward pass over the pre-order node stream of a syntax tree that collects modules, ports, instances and connections.
 * <p>
 * The tree provides no scopes, so the pass carries the enclosing module and instance along the stream:
 * a module declaration opens a module that lasts until the next module declaration,
 * and an instantiation becomes the owner of all named port connections until the next instantiation or module declaration.
 * This relies on each module's content appearing contiguously after its declaration node, which pre-order flattening provides
 * for non-nested module declarations.
 * <p>
 * Events whose identifiers cannot be found under the node are skipped.
 * Instantiations, port declarations and connections outside of any module, and connections without a preceding instantiation
 * in the same module, are skipped with a warning.
 */
public class TopologyPass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** The node kinds for full topology extraction */
  public static final Set<NodeKind> TOPOLOGY_KINDS = Collections.unmodifiableSet(
      EnumSet.of(NodeKind.ModuleDeclaration, NodeKind.PortDeclaration, NodeKind.ModuleInstantiation, NodeKind.NamedPortConnection));
  /** The node kinds needed to map modules to their instances */
  public static final Set<NodeKind> INSTANCE_KINDS =
      Collections.unmodifiableSet(EnumSet.of(NodeKind.ModuleDeclaration, NodeKind.ModuleInstantiation));

  /** The context carried from one node to the next. */
  static record Scope(Optional<String> module, Optional<Instance> instance) {
    static final Scope NONE = new Scope(Optional.empty(), Optional.empty());

    Scope enterModule(String moduleName) { return new Scope(Optional.of(moduleName), Optional.empty()); }
    Scope enterInstance(Instance newInstance) { return new Scope(module, Optional.of(newInstance)); }
  }

  /** What has been collected for one module so far. */
  private static class ModuleEntry {
    final String name;
    final LinkedHashSet<Port> ports = new LinkedHashSet<>();
    final ArrayList<Connection> connections = new ArrayList<>();
    final ArrayList<Instance> instances = new ArrayList<>();
    ModuleEntry(String name) { this.name = name; }
  }

  private final SyntaxTree tree;
  private final Set<NodeKind> kinds;
  /** key: module name, in order of first declaration */
  private final LinkedHashMap<String, ModuleEntry> modules = new LinkedHashMap<>();

  private TopologyPass(SyntaxTree tree, Set<NodeKind> kinds) {
    this.tree = tree;
    this.kinds = kinds;
  }

  /**
   * Runs the pass over a tree.
   * @param tree the tree; not modified
   * @param kinds the node kinds to react to, all others are ignored. Should include {@link NodeKind#ModuleDeclaration}.
   */
  public static TopologyPass run(SyntaxTree tree, Set<NodeKind> kinds) {
    if (tree == null)
      throw new IllegalArgumentException("tree must not be null");
    TopologyPass pass = new TopologyPass(tree, kinds);
    Scope scope = Scope.NONE;
    for (SyntaxNode node : tree)
      scope = pass.step(scope, node);
    logger.debug("Collected {} module(s) from {} node(s)", pass.modules.size(), tree.getNodes().size());
    return pass;
  }

  Scope step(Scope scope, SyntaxNode node) {
    NodeKind kind = NodeKind.of(node);
    if (!kinds.contains(kind))
      return scope;
    switch (kind) {
    case ModuleDeclaration:
      return onModuleDeclaration(scope, node);
    case PortDeclaration:
      return onPortDeclaration(scope, node);
    case ModuleInstantiation:
      return onModuleInstantiation(scope, node);
    case NamedPortConnection:
      return onNamedPortConnection(scope, node);
    default:
      return scope;
    }
  }

  private Scope onModuleDeclaration(Scope scope, SyntaxNode node) {
    Optional<String> name_opt = tree.unwrapStr(node, "ModuleIdentifier");
    if (name_opt.isEmpty()) {
      logger.trace("No module identifier under {}", node);
      return scope;
    }
    String name = name_opt.get();
    if (!modules.containsKey(name)) {
      modules.put(name, new ModuleEntry(name));
      logger.trace("Module {}", name);
    }
    return scope.enterModule(name);
  }

  private Scope onPortDeclaration(Scope scope, SyntaxNode node) {
    Optional<SyntaxNode> portId_opt = tree.unwrapNode(node, "PortIdentifier");
    if (portId_opt.isEmpty()) {
      logger.trace("No port identifier under {}", node);
      return scope;
    }
    // Port lists are port declarations themselves; read direction and type only from the declaration owning the identifier.
    SyntaxNode owner = owningPortDeclaration(node, portId_opt.get());
    String name = tree.getStr(portId_opt.get()).strip();
    Optional<String> dir_opt = tree.unwrapStr(owner, "PortDirection");
    if (dir_opt.isEmpty()) {
      logger.trace("No port direction under {}", owner);
      return scope;
    }
    Optional<PortDirection> direction = PortDirection.fromKeyword(dir_opt.get());
    if (direction.isEmpty()) {
      logger.debug("Ignoring port {} with direction '{}'", name, dir_opt.get());
      return scope;
    }
    Optional<ModuleEntry> module = currentModule(scope, node, "Port declaration " + name);
    if (module.isEmpty())
      return scope;
    String type = tree.unwrapStr(owner, "NetType", "DataType").orElse("");
    module.get().ports.add(new Port(name, type, direction.get()));
    return scope;
  }

  /** The innermost port declaration between <code>node</code> and the port identifier below it. */
  private SyntaxNode owningPortDeclaration(SyntaxNode node, SyntaxNode portId) {
    List<SyntaxNode> path = tree.pathTo(node, portId).orElse(List.of(node));
    for (int i = path.size() - 1; i >= 0; --i) {
      if (NodeKind.of(path.get(i)) == NodeKind.PortDeclaration)
        return path.get(i);
    }
    return node;
  }

  private Scope onModuleInstantiation(Scope scope, SyntaxNode node) {
    Optional<String> moduleName_opt = tree.unwrapStr(node, "ModuleIdentifier");
    Optional<String> instName_opt = tree.unwrapStr(node, "InstanceIdentifier");
    if (moduleName_opt.isEmpty() || instName_opt.isEmpty()) {
      logger.trace("No module or instance identifier under {}", node);
      return scope;
    }
    Instance instance = new Instance(instName_opt.get(), moduleName_opt.get());
    Optional<ModuleEntry> module = currentModule(scope, node, "Instance " + instance.name());
    if (module.isEmpty())
      return scope;
    module.get().instances.add(instance);
    return scope.enterInstance(instance);
  }

  private Scope onNamedPortConnection(Scope scope, SyntaxNode node) {
    Optional<String> portName_opt = tree.unwrapStr(node, "PortIdentifier");
    Optional<String> expr_opt = tree.unwrapStr(node, "Expression");
    if (portName_opt.isEmpty() || expr_opt.isEmpty()) {
      logger.trace("No port identifier or expression under {}", node);
      return scope;
    }
    Optional<ModuleEntry> module = currentModule(scope, node, "Connection ." + portName_opt.get());
    if (module.isEmpty())
      return scope;
    if (scope.instance().isEmpty()) {
      logger.warn("Connection .{}({}) at offset {} does not follow an instantiation in module {}, ignoring it", portName_opt.get(),
                  expr_opt.get(), node.getBegin(), module.get().name);
      return scope;
    }
    module.get().connections.add(new Connection(expr_opt.get(), portName_opt.get(), scope.instance().get()));
    return scope;
  }

  private Optional<ModuleEntry> currentModule(Scope scope, SyntaxNode node, String what) {
    if (scope.module().isEmpty()) {
      logger.warn("{} at offset {} appears before any module declaration, ignoring it", what, node.getBegin());
      return Optional.empty();
    }
    return Optional.of(modules.get(scope.module().get()));
  }

  /** Returns the names of all declared modules, in order of first declaration. */
  public List<String> getModuleNames() { return new ArrayList<>(modules.keySet()); }

  /** Returns the instances created inside each declared module, in source order. */
  public Map<String, List<Instance>> getInstanceMap() {
    LinkedHashMap<String, List<Instance>> ret = new LinkedHashMap<>();
    modules.forEach((name, entry) -> ret.put(name, Collections.unmodifiableList(new ArrayList<>(entry.instances))));
    return ret;
  }

  /** Returns one {@link Module} per declared module, in order of first declaration. */
  public List<Module> getModules() {
    return modules.values().stream().map(entry -> new Module(entry.name, entry.ports, entry.connections)).collect(Collectors.toList());
  }
}
