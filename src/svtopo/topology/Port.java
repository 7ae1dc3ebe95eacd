package svtopo.topology;

import java.util.Objects;

/**
 * A port of a module declaration. Ports compare by all three fields.
 * @param name the port identifier
 * @param type the declared net or data type, "" if the declaration has none
 * @param direction the port direction
 */
public record Port(String name, String type, PortDirection direction) {
  public Port {
    Objects.requireNonNull(name);
    Objects.requireNonNull(type);
    Objects.requireNonNull(direction);
  }
}
