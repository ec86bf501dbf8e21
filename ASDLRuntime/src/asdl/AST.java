package asdl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Base class of every node in a generated syntax tree.
 *
 * <p>A node declares an ordered list of field names and an ordered list of attribute names. Values
 * are stored by name and may be set, replaced or removed at any time; a name with no value is
 * simply absent, and traversal skips it. A value is a scalar, a single {@code AST}, or a {@link
 * List} of nodes and scalars.
 *
 * <p>Locations are 1-based lines and 0-based columns. Each of the four coordinates is optional on
 * its own so that partially located trees can be completed with {@link
 * ASTLocations#fixMissingLocations}.
 */
public abstract class AST {
  private final ImmutableList<String> fieldNames;
  private final ImmutableList<String> attributeNames;
  private final Map<String, Object> values = new HashMap<>();

  private Object symref;

  Integer startLine;
  Integer startColumn;
  Integer endLine;
  Integer endColumn;

  protected AST(ImmutableList<String> fieldNames, ImmutableList<String> attributeNames) {
    this.fieldNames = Preconditions.checkNotNull(fieldNames);
    this.attributeNames = Preconditions.checkNotNull(attributeNames);
  }

  public final ImmutableList<String> fieldNames() {
    return fieldNames;
  }

  public final ImmutableList<String> attributeNames() {
    return attributeNames;
  }

  public final Optional<Object> getValue(String name) {
    return Optional.ofNullable(values.get(name));
  }

  public final boolean hasValue(String name) {
    return values.containsKey(name);
  }

  /** Assigns {@code value} to {@code name}; a null value removes the name. */
  public final void setValue(String name, Object value) {
    Preconditions.checkNotNull(name);
    if (value == null) {
      values.remove(name);
    } else {
      values.put(name, value);
    }
  }

  public final void removeValue(String name) {
    values.remove(name);
  }

  @SuppressWarnings("unchecked")
  protected final <T> T requireValue(String name) {
    Object value = values.get(name);
    if (value == null) {
      throw new IllegalStateException(
          String.format("%s has no value for '%s'", getClass().getSimpleName(), name));
    }
    return (T) value;
  }

  @SuppressWarnings("unchecked")
  protected final <T> Optional<T> optionalValue(String name) {
    return Optional.ofNullable((T) values.get(name));
  }

  // Live list; callers may edit it in place.
  @SuppressWarnings("unchecked")
  protected final <T> List<T> listValue(String name) {
    Object value = values.get(name);
    return value == null ? ImmutableList.of() : (List<T>) value;
  }

  /** Opaque reference to a symbol table entry, owned by whoever resolves names. */
  public final Optional<Object> symref() {
    return Optional.ofNullable(symref);
  }

  public final void setSymref(Object symref) {
    this.symref = symref;
  }

  public final Optional<Integer> startLine() {
    return Optional.ofNullable(startLine);
  }

  public final Optional<Integer> startColumn() {
    return Optional.ofNullable(startColumn);
  }

  public final Optional<Integer> endLine() {
    return Optional.ofNullable(endLine);
  }

  public final Optional<Integer> endColumn() {
    return Optional.ofNullable(endColumn);
  }

  public final void setStartLine(int startLine) {
    this.startLine = startLine;
  }

  public final void setStartColumn(int startColumn) {
    this.startColumn = startColumn;
  }

  public final void setEndLine(int endLine) {
    this.endLine = endLine;
  }

  public final void setEndColumn(int endColumn) {
    this.endColumn = endColumn;
  }

  public final void clearStartLine() {
    this.startLine = null;
  }

  public final void clearStartColumn() {
    this.startColumn = null;
  }

  public final void clearEndLine() {
    this.endLine = null;
  }

  public final void clearEndColumn() {
    this.endColumn = null;
  }

  public final boolean hasLocation() {
    return startLine != null && startColumn != null && endLine != null && endColumn != null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('(');
    String sep = "";
    for (String name : ASTNodeUtils.declaredNames(this)) {
      if (!values.containsKey(name)) continue;
      sb.append(sep).append(name).append('=').append(values.get(name));
      sep = ", ";
    }
    return sb.append(')').toString();
  }
}
