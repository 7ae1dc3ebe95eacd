package svtopo.tree;

/**
 * The node categories that drive topology extraction.
 * Declaration tags come in several flavors (e.g. ModuleDeclarationAnsi, ModuleDeclarationNonansi, AnsiPortDeclaration),
 * so those are matched by containment; instantiations and connections by exact tag.
 */
public enum NodeKind {
  ModuleDeclaration,
  PortDeclaration,
  ModuleInstantiation,
  NamedPortConnection,
  /** Any node the extraction does not react to */
  Other;

  public static NodeKind of(String typeName) {
    if (typeName.contains("ModuleDeclaration"))
      return ModuleDeclaration;
    if (typeName.contains("PortDeclaration"))
      return PortDeclaration;
    if (typeName.equals("ModuleInstantiation"))
      return ModuleInstantiation;
    if (typeName.equals("NamedPortConnection"))
      return NamedPortConnection;
    return Other;
  }

  public static NodeKind of(SyntaxNode node) { return of(node.getTypeName()); }
}
