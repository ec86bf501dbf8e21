package asdl.generator;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;

import asdl.generator.Schema.Field;

@AutoValue
public abstract class NodeTypeSpec {
  public enum Kind {
    // A concrete class for a product type.
    PRODUCT,
    // The abstract base class of a sum type; holds the attributes.
    SUM_BASE,
    // A concrete class for one constructor of a sum type.
    CONSTRUCTOR;
  }

  public abstract Kind kind();

  public abstract String name();

  public abstract Optional<String> parent();

  // Inherited from the parent for CONSTRUCTOR, empty for PRODUCT.
  public abstract ImmutableList<Field> attributes();

  public abstract ImmutableList<Field> fields();

  public final boolean isAbstract() {
    return kind() == Kind.SUM_BASE;
  }

  @Memoized
  public ImmutableList<Field> parameters() {
    return ImmutableList.<Field>builder().addAll(attributes()).addAll(fields()).build();
  }

  public static NodeTypeSpec product(String name, List<Field> fields) {
    return new AutoValue_NodeTypeSpec(
        Kind.PRODUCT, name, Optional.empty(), ImmutableList.of(), ImmutableList.copyOf(fields));
  }

  public static NodeTypeSpec sumBase(String name, List<Field> attributes) {
    return new AutoValue_NodeTypeSpec(
        Kind.SUM_BASE,
        name,
        Optional.empty(),
        ImmutableList.copyOf(attributes),
        ImmutableList.of());
  }

  public static NodeTypeSpec constructor(
      String name, String parent, List<Field> inheritedAttributes, List<Field> fields) {
    return new AutoValue_NodeTypeSpec(
        Kind.CONSTRUCTOR,
        name,
        Optional.of(parent),
        ImmutableList.copyOf(inheritedAttributes),
        ImmutableList.copyOf(fields));
  }
}
