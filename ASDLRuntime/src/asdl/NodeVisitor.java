package asdl;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import com.google.common.base.Preconditions;

/**
 * Walks a tree, calling the handler registered for each node's exact class.
 *
 * <p>Dispatch does not consult the class hierarchy: a handler registered for a sum type's base
 * class is never called for its constructors. Nodes without a handler go to {@link
 * #genericVisit}, which visits every child. A handler that wants the children visited must do so
 * itself, usually by calling {@code genericVisit}.
 */
public class NodeVisitor {
  private final Map<Class<?>, Function<AST, ?>> handlers = new HashMap<>();

  protected final <T extends AST> void on(Class<T> type, Function<? super T, ?> handler) {
    Preconditions.checkNotNull(handler);
    Preconditions.checkState(
        handlers.putIfAbsent(type, node -> handler.apply(type.cast(node))) == null,
        "handler already registered for %s",
        type.getSimpleName());
  }

  public Object visit(AST node) {
    Function<AST, ?> handler = handlers.get(node.getClass());
    if (handler == null) {
      return genericVisit(node);
    }
    return handler.apply(node);
  }

  public Object genericVisit(AST node) {
    ASTNodeUtils.iterChildNodes(node).forEach(this::visit);
    return node;
  }
}
