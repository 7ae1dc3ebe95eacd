package svtopo.parse;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Data-Class to hold the options passed to a {@link SVParser}.
 */
public class SVParseOptions {

  /** Pre-processor defines. A null value defines the macro without a body. */
  public Map<String, String> pre_defines = new LinkedHashMap<>();
  /** Search paths for `include files */
  public List<String> include_paths = new ArrayList<>();
  public boolean ignore_include = false;
  /** Accept source code that ends in the middle of a construct */
  public boolean allow_incomplete = false;

  public Map<String, String> getPre_defines() { return pre_defines; }
  public void setPre_defines(Map<String, String> pre_defines) { this.pre_defines = pre_defines; }
  public List<String> getInclude_paths() { return include_paths; }
  public void setInclude_paths(List<String> include_paths) { this.include_paths = include_paths; }
  public boolean isIgnore_include() { return ignore_include; }
  public void setIgnore_include(boolean ignore_include) { this.ignore_include = ignore_include; }
  public boolean isAllow_incomplete() { return allow_incomplete; }
  public void setAllow_incomplete(boolean allow_incomplete) { this.allow_incomplete = allow_incomplete; }

  /**
   * Loads options from a YAML file with the field names as keys. Missing keys keep their defaults.
   */
  public static SVParseOptions load(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      SVParseOptions ret = new Yaml(new Constructor(SVParseOptions.class, new LoaderOptions())).load(in);
      return ret == null ? new SVParseOptions() : ret;
    } catch (YAMLException e) {
      throw new IOException("Invalid parse options in " + file + ": " + e.getMessage(), e);
    }
  }

  @Override
  public String toString() {
    return "SVParseOptions [pre_defines=" + pre_defines + ", include_paths=" + include_paths + ", ignore_include=" + ignore_include +
        ", allow_incomplete=" + allow_incomplete + "]";
  }
}
