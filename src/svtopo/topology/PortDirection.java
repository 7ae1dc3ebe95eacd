package svtopo.topology;

import java.util.Optional;
import java.util.stream.Stream;

/** Direction of a module port, named after its SystemVerilog keyword. */
public enum PortDirection {
  input,
  output,
  inout;

  /** Maps a direction keyword to the enum value; empty for keywords such as "ref" that have no value here. */
  public static Optional<PortDirection> fromKeyword(String keyword) {
    return Stream.of(PortDirection.values()).filter(dir -> dir.name().equals(keyword)).findAny();
  }
}
