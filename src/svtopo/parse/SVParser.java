package svtopo.parse;

import java.nio.file.Path;
import svtopo.tree.SyntaxTree;

/**
 * Entry points of a SystemVerilog parser that produces tagged syntax trees.
 * A source is either a top-level source file or a library source file,
 * given as a file path or as in-memory text.
 */
public interface SVParser {
  SyntaxTree parseSv(Path path, SVParseOptions options) throws SVParseException;

  /**
   * @param text the source text
   * @param path the file name to report and to resolve relative includes against; may be empty
   */
  SyntaxTree parseSvText(String text, String path, SVParseOptions options) throws SVParseException;

  SyntaxTree parseLib(Path path, SVParseOptions options) throws SVParseException;

  SyntaxTree parseLibText(String text, String path, SVParseOptions options) throws SVParseException;
}
