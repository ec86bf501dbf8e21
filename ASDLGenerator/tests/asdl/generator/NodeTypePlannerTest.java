package asdl.generator;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import asdl.generator.Schema.Field;

public class NodeTypePlannerTest {

  private static ImmutableList<NodeTypeSpec> plan(String schema) throws SchemaException {
    return NodeTypePlanner.plan(SchemaParser.parse(schema));
  }

  private static void assertRejected(String errorSubstr, String schema) {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> plan(schema));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  @Test
  public void sumTypeLayout() throws SchemaException {
    ImmutableList<NodeTypeSpec> plan =
        plan("module M { stmt = Expr(int value) | Pass attributes (int lineno) }");

    assertThat(plan.stream().map(NodeTypeSpec::name).collect(Collectors.toList()))
        .containsExactly("stmt", "Expr", "Pass")
        .inOrder();

    NodeTypeSpec base = plan.get(0);
    assertThat(base.kind()).isEqualTo(NodeTypeSpec.Kind.SUM_BASE);
    assertThat(base.isAbstract()).isTrue();
    assertThat(base.parent()).isEmpty();
    assertThat(base.attributes()).containsExactly(Field.required("int", "lineno"));
    assertThat(base.fields()).isEmpty();

    NodeTypeSpec expr = plan.get(1);
    assertThat(expr.kind()).isEqualTo(NodeTypeSpec.Kind.CONSTRUCTOR);
    assertThat(expr.isAbstract()).isFalse();
    assertThat(expr.parent()).hasValue("stmt");
    assertThat(expr.parameters())
        .containsExactly(Field.required("int", "lineno"), Field.required("int", "value"))
        .inOrder();

    NodeTypeSpec pass = plan.get(2);
    assertThat(pass.fields()).isEmpty();
    assertThat(pass.parameters()).containsExactly(Field.required("int", "lineno"));
  }

  @Test
  public void productTypeLayout() throws SchemaException {
    ImmutableList<NodeTypeSpec> plan =
        plan("module M { alias = (ident name, ident? asname) expr = Name(ident id) }");

    assertThat(plan).hasSize(3);
    NodeTypeSpec alias = plan.get(0);
    assertThat(alias.kind()).isEqualTo(NodeTypeSpec.Kind.PRODUCT);
    assertThat(alias.parent()).isEmpty();
    assertThat(alias.attributes()).isEmpty();
    assertThat(alias.parameters()).isEqualTo(alias.fields());
    assertThat(plan.get(2).parent()).hasValue("expr");
  }

  @Test
  public void typeNamedAfterModule() {
    assertRejected("same name as its module", "module M { M = (int x) }");
    assertRejected("same name as its module", "module M { stmt = M }");
  }

  @Test
  public void duplicateClassNames() {
    assertRejected("more than one node class named 'A'", "module M { a = A | A }");
    assertRejected("more than one node class named 'B'", "module M { B = (int x) a = B }");
  }

  @Test
  public void clashingFields() {
    assertRejected(
        "field 'x' clashes with another field of 'A'", "module M { A = (int x, int x) }");
    assertRejected(
        "field 'lineno' clashes with another field of 'C'",
        "module M { s = C(int lineno) attributes (int lineno) }");
  }

  @Test
  public void escapedNamesAreStillChecked() throws SchemaException {
    // `toString` is escaped to `toString_`, which no longer clashes with anything.
    assertThat(plan("module M { A = (ident toString, int class) }")).hasSize(1);
    assertRejected("field 'class_' clashes", "module M { A = (int class, int class_) }");
  }
}
