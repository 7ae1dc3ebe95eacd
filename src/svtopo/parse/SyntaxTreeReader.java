package svtopo.parse;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import svtopo.tree.SyntaxTree;
import svtopo.tree.SyntaxTreeBuilder;
import svtopo.tree.SyntaxTreeBuilder.Shape;

/**
 * Reads a syntax tree dumped as YAML.
 * The document holds a single <code>tree</code> entry with the root node. Each node has a <code>type</code>
 * and either a token <code>text</code> or a list of <code>children</code>:
 *
 * <pre>
 * tree:
 *   type: SourceText
 *   children:
 *   - type: ModuleDeclarationNonansi
 *     children:
 *     - {type: Keyword, text: module}
 *     - type: ModuleIdentifier
 *       children:
 *       - {type: SimpleIdentifier, text: top}
 * </pre>
 */
public class SyntaxTreeReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Deepest syntax tree accepted in a dump */
  public static final int MAX_TREE_DEPTH = 2000;
  /** Largest dump accepted, in characters */
  public static final int MAX_DUMP_CODE_POINTS = 256 * 1024 * 1024;

  public SyntaxTree read(Path file) throws SVParseException {
    logger.debug("Reading syntax tree dump {}", file);
    try (Reader reader = Files.newBufferedReader(file)) {
      return read(reader, file.toString());
    } catch (IOException e) {
      throw new SVParseException("Cannot read syntax tree dump " + file, e);
    }
  }

  public SyntaxTree read(InputStream in, String origin) throws SVParseException {
    try {
      Object document = newYaml().load(in);
      return fromDocument(document, origin);
    } catch (YAMLException e) {
      throw new SVParseException("Malformed syntax tree dump " + origin + ": " + e.getMessage(), e);
    }
  }

  public SyntaxTree readText(String yamlText, String origin) throws SVParseException {
    return read(new StringReader(yamlText), origin);
  }

  private SyntaxTree read(Reader reader, String origin) throws SVParseException {
    try {
      Object document = newYaml().load(reader);
      return fromDocument(document, origin);
    } catch (YAMLException e) {
      throw new SVParseException("Malformed syntax tree dump " + origin + ": " + e.getMessage(), e);
    }
  }

  private static Yaml newYaml() {
    LoaderOptions loaderOptions = new LoaderOptions();
    // Every tree level takes two YAML levels (node mapping and children list)
    loaderOptions.setNestingDepthLimit(2 * MAX_TREE_DEPTH + 2);
    loaderOptions.setCodePointLimit(MAX_DUMP_CODE_POINTS);
    return new Yaml(new SafeConstructor(loaderOptions));
  }

  private SyntaxTree fromDocument(Object document, String origin) throws SVParseException {
    if (!(document instanceof Map))
      throw new SVParseException("Syntax tree dump " + origin + " is not a mapping");
    Object rootDesc = ((Map<?, ?>)document).get("tree");
    if (rootDesc == null)
      throw new SVParseException("Syntax tree dump " + origin + " has no 'tree' entry");
    Shape root = toShape(rootDesc, "tree", origin);
    return SyntaxTreeBuilder.build(root);
  }

  private Shape toShape(Object desc, String where, String origin) throws SVParseException {
    if (!(desc instanceof Map))
      throw new SVParseException(origin + ": node at " + where + " is not a mapping");
    Map<?, ?> nodeDesc = (Map<?, ?>)desc;
    Object type = nodeDesc.get("type");
    if (!(type instanceof String) || ((String)type).isEmpty())
      throw new SVParseException(origin + ": node at " + where + " has no type");
    Object text = nodeDesc.get("text");
    Object children = nodeDesc.get("children");
    if (text != null && children != null)
      throw new SVParseException(origin + ": node " + type + " at " + where + " has both text and children");
    if (text != null) {
      // Scalars such as 0 or 1.5 are loaded as numbers; the token text is their literal form.
      String textStr = text.toString();
      if (textStr.isEmpty())
        throw new SVParseException(origin + ": token " + type + " at " + where + " has empty text");
      return SyntaxTreeBuilder.token((String)type, textStr);
    }
    List<Shape> childShapes = new ArrayList<>();
    if (children != null) {
      if (!(children instanceof List))
        throw new SVParseException(origin + ": children of " + type + " at " + where + " are not a list");
      List<?> childList = (List<?>)children;
      for (int i = 0; i < childList.size(); ++i)
        childShapes.add(toShape(childList.get(i), where + "/" + type + "[" + i + "]", origin));
    }
    return SyntaxTreeBuilder.node((String)type, childShapes);
  }
}
