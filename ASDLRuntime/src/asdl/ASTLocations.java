package asdl;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

public final class ASTLocations {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  public static Optional<String> getSourceSegment(String source, AST node) {
    return getSourceSegment(source, node, false);
  }

  /**
   * Returns the text of {@code source} spanned by {@code node}, from its start position through
   * its end column inclusive.
   *
   * <p>Returns empty if any of the four coordinates is unset or the span does not lie within
   * {@code source}. If {@code padded} is true the first line is returned from column 0, keeping
   * its indentation.
   */
  public static Optional<String> getSourceSegment(String source, AST node, boolean padded) {
    if (!node.hasLocation()) return Optional.empty();

    int startLine = node.startLine;
    int startColumn = padded ? 0 : node.startColumn;
    int endLine = node.endLine;
    int endColumn = node.endColumn;

    List<String> lines = LINE_SPLITTER.splitToList(source);
    if (startLine < 1 || endLine < startLine || endLine > lines.size()) return Optional.empty();

    List<String> span = lines.subList(startLine - 1, endLine);
    String first = span.get(0);
    String last = span.get(span.size() - 1);
    last = last.substring(0, clamp(endColumn + 1, last.length()));
    if (span.size() == 1) {
      return Optional.of(last.substring(clamp(startColumn, last.length())));
    }

    return Optional.of(
        Joiner.on('\n')
            .join(
                ImmutableList.<String>builder()
                    .add(first.substring(clamp(startColumn, first.length())))
                    .addAll(span.subList(1, span.size() - 1))
                    .add(last)
                    .build()));
  }

  @CanIgnoreReturnValue
  public static <T extends AST> T copyLocation(AST from, T to) {
    to.startLine = from.startLine;
    to.startColumn = from.startColumn;
    to.endLine = from.endLine;
    to.endColumn = from.endColumn;
    return to;
  }

  /**
   * Fills unset coordinates top-down. Each node inherits the nearest ancestor's value for every
   * coordinate it lacks, starting from line 1, column 0 at the root.
   */
  @CanIgnoreReturnValue
  public static <T extends AST> T fixMissingLocations(T node) {
    fix(node, 1, 0, 1, 0);
    return node;
  }

  private static void fix(AST node, int startLine, int startColumn, int endLine, int endColumn) {
    if (node.startLine == null) {
      node.startLine = startLine;
    }
    if (node.startColumn == null) {
      node.startColumn = startColumn;
    }
    if (node.endLine == null) {
      node.endLine = endLine;
    }
    if (node.endColumn == null) {
      node.endColumn = endColumn;
    }

    ASTNodeUtils.iterChildNodes(node)
        .forEach(
            child -> fix(child, node.startLine, node.startColumn, node.endLine, node.endColumn));
  }

  @CanIgnoreReturnValue
  public static <T extends AST> T incrementLineno(T node) {
    return incrementLineno(node, 1);
  }

  @CanIgnoreReturnValue
  public static <T extends AST> T incrementLineno(T node, int delta) {
    ASTNodeUtils.walk(node)
        .forEach(
            n -> {
              if (n.startLine != null) n.startLine += delta;
              if (n.endLine != null) n.endLine += delta;
            });
    return node;
  }

  private static int clamp(int index, int length) {
    return Math.max(0, Math.min(index, length));
  }

  private ASTLocations() {}
}
