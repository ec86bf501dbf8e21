package asdl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.collect.ImmutableCollection;

/**
 * A {@link NodeVisitor} that rewrites the tree in place with the values its handlers return.
 *
 * <p>For a node held in a list, a null result drops it and a {@link List} result is spliced in
 * its place. For a node held directly by a name, a null result removes the name. Any other result
 * replaces the visited node.
 *
 * <p>Mutable lists are rewritten in place; an unmodifiable list is replaced by a new list.
 */
public class NodeTransformer extends NodeVisitor {

  @Override
  public Object genericVisit(AST node) {
    rewrite(node, ASTNodeUtils.iterAttributes(node));
    rewrite(node, ASTNodeUtils.iterFields(node));
    return node;
  }

  private void rewrite(AST node, Stream<Map.Entry<String, Object>> entries) {
    // Collected first since rewriting removes names.
    for (Map.Entry<String, Object> entry : entries.collect(Collectors.toList())) {
      Object old = entry.getValue();
      if (old instanceof List) {
        rewriteList(node, entry.getKey(), (List<?>) old);
      } else if (old instanceof AST) {
        node.setValue(entry.getKey(), visit((AST) old));
      }
    }
  }

  @SuppressWarnings("unchecked")
  private void rewriteList(AST node, String name, List<?> old) {
    List<Object> rewritten = new ArrayList<>();
    for (Object value : old) {
      if (!(value instanceof AST)) {
        rewritten.add(value);
        continue;
      }

      Object replacement = visit((AST) value);
      if (replacement instanceof List) {
        rewritten.addAll((List<?>) replacement);
      } else if (replacement != null) {
        rewritten.add(replacement);
      }
    }

    if (old instanceof ImmutableCollection) {
      node.setValue(name, rewritten);
      return;
    }
    List<Object> target = (List<Object>) old;
    try {
      target.clear();
      target.addAll(rewritten);
    } catch (UnsupportedOperationException ex) {
      // Other unmodifiable lists reject clear() before changing anything.
      node.setValue(name, rewritten);
    }
  }
}
