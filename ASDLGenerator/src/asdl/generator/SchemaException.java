package asdl.generator;

import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Throwables;

/**
 * A schema that could not be parsed. Context such as the enclosing type definition is added by
 * wrapping, so the cause chain reads from the outermost construct to the failing production.
 */
public class SchemaException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Optional<SchemaCursor.Pos> pos;

  public SchemaException(SchemaCursor.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = Optional.of(pos);
  }

  public SchemaException(String errorMsg) {
    super(errorMsg);
    this.pos = Optional.empty();
  }

  public SchemaException(String context, SchemaException cause) {
    super(context, cause);
    this.pos = Optional.empty();
  }

  // Innermost position in the cause chain.
  public Optional<SchemaCursor.Pos> pos() {
    return Throwables.getCausalChain(this)
        .stream()
        .filter(SchemaException.class::isInstance)
        .map(t -> ((SchemaException) t).pos)
        .filter(Optional::isPresent)
        .map(Optional::get)
        .reduce((outer, inner) -> inner);
  }

  public String fullMessage() {
    String chain =
        Throwables.getCausalChain(this)
            .stream()
            .map(Throwable::getMessage)
            .collect(Collectors.joining(": "));
    return pos().map(p -> String.format("%d:%d: %s", p.line(), p.column(), chain)).orElse(chain);
  }

  public void print(String source) {
    System.out.println(String.format("ERROR: %s:%s", source, fullMessage()));
  }
}
