package svtopo.topology;

import java.util.Objects;

/**
 * One instantiation of a module inside another module.
 * @param name the instance identifier
 * @param moduleName the name of the instantiated module
 */
public record Instance(String name, String moduleName) {
  public Instance {
    Objects.requireNonNull(name);
    Objects.requireNonNull(moduleName);
  }
}
