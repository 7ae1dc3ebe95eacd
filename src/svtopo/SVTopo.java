package svtopo;

import java.util.List;
import java.util.Map;
import svtopo.topology.Instance;
import svtopo.topology.Module;
import svtopo.topology.TopologyPass;
import svtopo.tree.SyntaxTree;

/**
 * Extracts the module hierarchy and the named connections of a parsed SystemVerilog design.
 * Both operations only read the tree and can run concurrently on independent trees.
 */
public final class SVTopo {
  private SVTopo() {}

  /**
   * Maps every declared module to the instances created inside it.
   * @param tree the parsed design
   * @return module name to its instances in source order; modules in order of declaration
   */
  public static Map<String, List<Instance>> getModuleInstanceMap(SyntaxTree tree) {
    return TopologyPass.run(tree, TopologyPass.INSTANCE_KINDS).getInstanceMap();
  }

  /**
   * Collects the ports and named connections of every declared module.
   * @param tree the parsed design
   * @return one {@link Module} per declared module
   */
  public static List<Module> getCircuitTopology(SyntaxTree tree) {
    return TopologyPass.run(tree, TopologyPass.TOPOLOGY_KINDS).getModules();
  }
}
