package asdl.generator;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** The in-memory form of a parsed schema. All types are immutable values. */
public final class Schema {

  public enum Primitive {
    IDENT("ident"),
    INT("int", "char"),
    STRING("string", "str"),
    BOOLEAN("boolean", "bool"),
    FLOAT("float");

    private final ImmutableSet<String> names;

    Primitive(String... names) {
      this.names = ImmutableSet.copyOf(names);
    }

    public ImmutableSet<String> names() {
      return names;
    }

    private static final ImmutableMap<String, Primitive> BY_NAME;

    static {
      ImmutableMap.Builder<String, Primitive> builder = ImmutableMap.builder();
      for (Primitive p : values()) {
        p.names.forEach(n -> builder.put(n, p));
      }
      BY_NAME = builder.build();
    }

    public static Optional<Primitive> named(String name) {
      return Optional.ofNullable(BY_NAME.get(name));
    }
  }

  // Schemas may not define a type with this name.
  public static final String BASE_NODE_NAME = "AST";

  @AutoValue
  public abstract static class Module {
    public abstract String name();

    public abstract ImmutableList<TypeDef> typeDefs();

    public static Module create(String name, List<TypeDef> typeDefs) {
      return new AutoValue_Schema_Module(name, ImmutableList.copyOf(typeDefs));
    }
  }

  @AutoValue
  public abstract static class TypeDef {
    public abstract String name();

    public abstract AbstractType type();

    public static TypeDef create(String name, AbstractType type) {
      return new AutoValue_Schema_TypeDef(name, type);
    }
  }

  public abstract static class AbstractType {
    public enum Kind {
      PRODUCT,
      SUM;
    }

    AbstractType() {}

    public abstract Kind kind();

    @SuppressWarnings("unchecked")
    public <T extends AbstractType> T cast() {
      return (T) this;
    }
  }

  @AutoValue
  public abstract static class ProductType extends AbstractType {
    public abstract ImmutableList<Field> fields();

    @Override
    public final Kind kind() {
      return Kind.PRODUCT;
    }

    public static ProductType create(List<Field> fields) {
      return new AutoValue_Schema_ProductType(ImmutableList.copyOf(fields));
    }
  }

  @AutoValue
  public abstract static class SumType extends AbstractType {
    public abstract ImmutableList<Constructor> constructors();

    public abstract ImmutableList<Field> attributes();

    @Override
    public final Kind kind() {
      return Kind.SUM;
    }

    @Memoized
    public ImmutableList<String> constructorNames() {
      return constructors()
          .stream()
          .map(Constructor::name)
          .collect(ImmutableList.toImmutableList());
    }

    public static SumType create(List<Constructor> constructors, List<Field> attributes) {
      return new AutoValue_Schema_SumType(
          ImmutableList.copyOf(constructors), ImmutableList.copyOf(attributes));
    }
  }

  @AutoValue
  public abstract static class Constructor {
    public abstract String name();

    public abstract ImmutableList<Field> fields();

    public static Constructor create(String name, List<Field> fields) {
      return new AutoValue_Schema_Constructor(name, ImmutableList.copyOf(fields));
    }
  }

  // `?` -> canNone; `*` -> canNone and canMany; `+` -> canMany.
  @AutoValue
  public abstract static class Field {
    public abstract String typeName();

    public abstract String name();

    public abstract boolean canNone();

    public abstract boolean canMany();

    public final Optional<Primitive> primitive() {
      return Primitive.named(typeName());
    }

    public static Field create(String typeName, String name, boolean canNone, boolean canMany) {
      return new AutoValue_Schema_Field(typeName, name, canNone, canMany);
    }

    public static Field required(String typeName, String name) {
      return create(typeName, name, false, false);
    }
  }

  private Schema() {}
}
