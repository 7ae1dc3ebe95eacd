package svtopo.topology;

import java.util.Objects;

/**
 * A named port connection at an instantiation site, e.g. <code>.in(x)</code>.
 * @param name the connected expression in the enclosing module ("x")
 * @param portName the port of the instance ("in")
 * @param instance the instance the port belongs to
 */
public record Connection(String name, String portName, Instance instance) {
  public Connection {
    Objects.requireNonNull(name);
    Objects.requireNonNull(portName);
    Objects.requireNonNull(instance);
  }
}
