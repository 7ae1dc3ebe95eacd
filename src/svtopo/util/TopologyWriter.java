package svtopo.util;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import svtopo.topology.Connection;
import svtopo.topology.Instance;
import svtopo.topology.Module;
import svtopo.topology.Port;

/*
 * Class for writing extraction results as YAML.
 */
public class TopologyWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Yaml yaml;

  public TopologyWriter() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setIndicatorIndent(0);
    this.yaml = new Yaml(options);
  }

  /**
   * Writes a module instance map, e.g.
   * <pre>
   * top:
   * - {name: s1, module: sub}
   * sub: []
   * </pre>
   * (in block style).
   */
  public void WriteInstanceMap(Map<String, List<Instance>> instanceMap, Writer out) throws IOException {
    LinkedHashMap<String, Object> doc = new LinkedHashMap<>();
    instanceMap.forEach((moduleName, instances) -> {
      List<Object> instanceList = new ArrayList<>();
      instances.forEach(instance -> instanceList.add(instanceEntry(instance)));
      doc.put(moduleName, instanceList);
    });
    dump(doc, out);
    logger.debug("Wrote instances of {} module(s)", instanceMap.size());
  }

  /**
   * Writes a circuit topology as a list of modules under the key <code>modules</code>.
   */
  public void WriteTopology(List<Module> modules, Writer out) throws IOException {
    List<Object> moduleList = new ArrayList<>();
    for (Module module : modules) {
      LinkedHashMap<String, Object> moduleEntry = new LinkedHashMap<>();
      moduleEntry.put("name", module.name());
      List<Object> ports = new ArrayList<>();
      for (Port port : module.ports()) {
        LinkedHashMap<String, Object> portEntry = new LinkedHashMap<>();
        portEntry.put("name", port.name());
        portEntry.put("type", port.type());
        portEntry.put("direction", port.direction().name());
        ports.add(portEntry);
      }
      moduleEntry.put("ports", ports);
      List<Object> connections = new ArrayList<>();
      for (Connection connection : module.connections()) {
        LinkedHashMap<String, Object> connectionEntry = new LinkedHashMap<>();
        connectionEntry.put("name", connection.name());
        connectionEntry.put("port", connection.portName());
        connectionEntry.put("instance", instanceEntry(connection.instance()));
        connections.add(connectionEntry);
      }
      moduleEntry.put("connections", connections);
      moduleList.add(moduleEntry);
    }
    LinkedHashMap<String, Object> doc = new LinkedHashMap<>();
    doc.put("modules", moduleList);
    dump(doc, out);
    logger.debug("Wrote topology of {} module(s)", modules.size());
  }

  private static Map<String, Object> instanceEntry(Instance instance) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    ret.put("name", instance.name());
    ret.put("module", instance.moduleName());
    return ret;
  }

  private void dump(Object doc, Writer out) throws IOException {
    try {
      yaml.dump(doc, out);
    } catch (YAMLException e) {
      // SnakeYAML wraps I/O errors of the writer
      if (e.getCause() instanceof IOException)
        throw (IOException)e.getCause();
      throw e;
    }
    out.flush();
  }
}
