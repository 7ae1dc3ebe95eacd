package svtopo.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structure of a module declaration: its ports and the named connections of the instances inside it.
 * The port set carries no meaningful order, the connections are in source order.
 */
public record Module(String name, Set<Port> ports, List<Connection> connections) {
  public Module {
    ports = Collections.unmodifiableSet(new LinkedHashSet<>(ports));
    connections = Collections.unmodifiableList(new ArrayList<>(connections));
  }
}
