package asdl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Streams;

/** Structural traversal over any {@link AST}, independent of the schema that produced it. */
public final class ASTNodeUtils {

  public static Stream<Map.Entry<String, Object>> iterFields(AST node) {
    return iterNamed(node, node.fieldNames());
  }

  public static Stream<Map.Entry<String, Object>> iterAttributes(AST node) {
    return iterNamed(node, node.attributeNames());
  }

  /**
   * Yields the direct children of {@code node}: attributes first, then fields. Node elements of
   * list values are yielded in list order; scalars are skipped.
   */
  public static Stream<AST> iterChildNodes(AST node) {
    return Stream.concat(iterAttributes(node), iterFields(node))
        .map(Map.Entry::getValue)
        .flatMap(ASTNodeUtils::childNodesOf);
  }

  // Breadth-first, node first.
  public static Stream<AST> walk(AST node) {
    return Streams.stream(
        new AbstractIterator<AST>() {
          private final Deque<AST> todo = new ArrayDeque<>(ImmutableList.of(node));

          @Override
          protected AST computeNext() {
            AST next = todo.pollFirst();
            if (next == null) return endOfData();

            iterChildNodes(next).forEach(todo::addLast);
            return next;
          }
        });
  }

  static ImmutableList<String> declaredNames(AST node) {
    return ImmutableList.<String>builder()
        .addAll(node.attributeNames())
        .addAll(node.fieldNames())
        .build();
  }

  private static Stream<Map.Entry<String, Object>> iterNamed(AST node, List<String> names) {
    return names
        .stream()
        .flatMap(name -> Streams.stream(node.getValue(name)).map(v -> Maps.immutableEntry(name, v)));
  }

  private static Stream<AST> childNodesOf(Object value) {
    if (value instanceof AST) {
      return Stream.of((AST) value);
    } else if (value instanceof List) {
      return ((List<?>) value).stream().filter(AST.class::isInstance).map(AST.class::cast);
    }
    return Stream.empty();
  }

  private ASTNodeUtils() {}
}
