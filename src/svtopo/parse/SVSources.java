package svtopo.parse;

import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import svtopo.tree.SyntaxTree;

/**
 * Parses sources as either top-level or library SystemVerilog.
 */
public final class SVSources {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private SVSources() {}

  /**
   * Parses a SystemVerilog file.
   * @param parser the parser to use
   * @param path path to the file
   * @param options defines, include paths and tolerance flags
   * @param lib parse as a library if set, else as a top-level source
   * @throws SVParseException if no tree can be built; never recovered here
   */
  public static SyntaxTree parseSvFile(SVParser parser, Path path, SVParseOptions options, boolean lib) throws SVParseException {
    logger.debug("Parsing {} as {} ({})", path, lib ? "library" : "source", options);
    if (lib)
      return parser.parseLib(path, options);
    return parser.parseSv(path, options);
  }

  /** Parses a file with default options. */
  public static SyntaxTree parseSvFile(SVParser parser, Path path) throws SVParseException {
    return parseSvFile(parser, path, new SVParseOptions(), false);
  }

  /**
   * Parses SystemVerilog text.
   * @param parser the parser to use
   * @param text the source text
   * @param path the file name the text belongs to, "" if none
   * @param options defines, include paths and tolerance flags
   * @param lib parse as a library if set, else as a top-level source
   * @throws SVParseException if no tree can be built; never recovered here
   */
  public static SyntaxTree parseSvText(SVParser parser, String text, String path, SVParseOptions options, boolean lib)
      throws SVParseException {
    logger.debug("Parsing text{} as {} ({})", path.isEmpty() ? "" : " of " + path, lib ? "library" : "source", options);
    if (lib)
      return parser.parseLibText(text, path, options);
    return parser.parseSvText(text, path, options);
  }

  /** Parses text with default options and no file name. */
  public static SyntaxTree parseSvText(SVParser parser, String text) throws SVParseException {
    return parseSvText(parser, text, "", new SVParseOptions(), false);
  }
}
