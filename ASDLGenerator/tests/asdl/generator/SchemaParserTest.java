package asdl.generator;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import asdl.generator.Schema.AbstractType;
import asdl.generator.Schema.Constructor;
import asdl.generator.Schema.Field;
import asdl.generator.Schema.ProductType;
import asdl.generator.Schema.SumType;
import asdl.generator.Schema.TypeDef;

public class SchemaParserTest {

  private static Schema.Module parse(String... lines) throws SchemaException {
    return SchemaParser.parse(Arrays.asList(lines).stream().collect(Collectors.joining("\n")));
  }

  private static SchemaException assertErrors(String errorSubstr, String... lines) {
    SchemaException ex = assertThrows(SchemaException.class, () -> parse(lines));
    assertThat(ex.fullMessage()).contains(errorSubstr);
    return ex;
  }

  @Test
  public void sumTypeWithAttributes() throws SchemaException {
    Schema.Module module =
        parse("module M { stmt = Expr(int value) | Pass attributes (int lineno) }");

    assertThat(module.name()).isEqualTo("M");
    assertThat(module.typeDefs()).hasSize(1);
    TypeDef stmt = module.typeDefs().get(0);
    assertThat(stmt.name()).isEqualTo("stmt");
    assertThat(stmt.type().kind()).isEqualTo(AbstractType.Kind.SUM);

    SumType sum = stmt.type().cast();
    assertThat(sum.constructors())
        .containsExactly(
            Constructor.create("Expr", Arrays.asList(Field.required("int", "value"))),
            Constructor.create("Pass", Arrays.asList()))
        .inOrder();
    assertThat(sum.attributes()).containsExactly(Field.required("int", "lineno"));
  }

  @Test
  public void productTypeWithMultiplicities() throws SchemaException {
    Schema.Module module =
        parse(
            "module M {",
            "  arguments = (arg* args, identifier? vararg, stmt+ body, int count)",
            "}");

    ProductType product = module.typeDefs().get(0).type().cast();
    assertThat(product.kind()).isEqualTo(AbstractType.Kind.PRODUCT);
    assertThat(product.fields())
        .containsExactly(
            Field.create("arg", "args", true, true),
            Field.create("identifier", "vararg", true, false),
            Field.create("stmt", "body", false, true),
            Field.create("int", "count", false, false))
        .inOrder();
  }

  @Test
  public void typeDefinitionsKeepDeclarationOrder() throws SchemaException {
    Schema.Module module =
        parse(
            "module Lang {",
            "  mod = Module(stmt* body)",
            "  stmt = Pass | Break",
            "  alias = (ident name, ident? asname)",
            "}");

    assertThat(module.typeDefs().stream().map(TypeDef::name).collect(Collectors.toList()))
        .containsExactly("mod", "stmt", "alias")
        .inOrder();
    SumType stmt = module.typeDefs().get(1).type().cast();
    assertThat(stmt.constructorNames()).containsExactly("Pass", "Break").inOrder();
    assertThat(stmt.attributes()).isEmpty();
  }

  @Test
  public void commentsAreIgnored() throws SchemaException {
    Schema.Module module =
        parse(
            "-- leading comment",
            "module M { -- the module",
            "  expr = Num(int n) -- a number",
            "       | Name(ident id)",
            "  -- (int broken,",
            "}");

    SumType expr = module.typeDefs().get(0).type().cast();
    assertThat(expr.constructorNames()).containsExactly("Num", "Name").inOrder();
  }

  @Test
  public void undefinedTypeReferencesAreAccepted() throws SchemaException {
    Schema.Module module = parse("module M { node = (nowhere child, node? self) }");

    ProductType node = module.typeDefs().get(0).type().cast();
    assertThat(node.fields().get(0).typeName()).isEqualTo("nowhere");
    assertThat(node.fields().get(0).primitive()).isEmpty();
    assertThat(node.fields().get(1).typeName()).isEqualTo("node");
  }

  @Test
  public void emptyModule() throws SchemaException {
    assertThat(parse("module Empty {", "}").typeDefs()).isEmpty();
  }

  @Test
  public void primitiveAliases() throws SchemaException {
    ProductType product =
        parse("module M { p = (char c, str s, bool b, float f, ident i) }")
            .typeDefs()
            .get(0)
            .type()
            .cast();

    assertThat(product.fields().get(0).primitive()).hasValue(Schema.Primitive.INT);
    assertThat(product.fields().get(1).primitive()).hasValue(Schema.Primitive.STRING);
    assertThat(product.fields().get(2).primitive()).hasValue(Schema.Primitive.BOOLEAN);
    assertThat(product.fields().get(3).primitive()).hasValue(Schema.Primitive.FLOAT);
    assertThat(product.fields().get(4).primitive()).hasValue(Schema.Primitive.IDENT);
  }

  @Test
  public void missingModuleHeader() {
    assertErrors("missing module statement", "stmt = Pass");
    assertErrors("missing module statement", "module { stmt = Pass }");
    assertErrors("missing module statement", "module M { stmt = Pass");
  }

  @Test
  public void duplicateTypeName() {
    assertErrors(
        "cannot define type 'A' twice", "module M { A = (int x) B = (int x) A = (int x) }");
  }

  @Test
  public void lowercaseConstructor() {
    SchemaException ex = assertErrors("uppercase", "module M { A = ctor(int x) }");
    assertThat(ex).hasMessageThat().isEqualTo("in type definition of 'A'");
  }

  @Test
  public void reservedTypeNames() {
    assertErrors("cannot redefine basic type 'int'", "module M { int = (int x) }");
    assertErrors("cannot redefine basic type 'str'", "module M { str = Str }");
    assertErrors("cannot redefine basic type 'AST'", "module M { AST = (int x) }");
  }

  @Test
  public void malformedFieldLists() {
    assertErrors("expected field", "module M { A = (int) }");
    assertErrors("expected field", "module M { A = () }");
    assertErrors("expected right parenthesis", "module M { A = (int x int y) }");
    assertErrors("expected left parenthesis", "module M { A = B attributes int x }");
  }

  @Test
  public void leftoverInputIsRejected() {
    assertErrors("expected type definition", "module M { A = (int x) ) }");
    assertErrors("expected type definition", "module M { = (int x) }");
  }

  @Test
  public void errorsCarryNestedContextAndPosition() {
    SchemaException ex =
        assertErrors(
            "in type definition of 'stmt': in constructor of 'Expr': expected field",
            "module M {",
            "  stmt = Expr(int value,)",
            "}");

    assertThat(ex.pos()).hasValue(SchemaCursor.Pos.create(2, 25));
    assertThat(ex.fullMessage()).startsWith("2:25: ");
    assertThat(ex.getCause()).hasMessageThat().isEqualTo("in constructor of 'Expr'");
  }

  @Test
  public void attributeErrorsAreNotConstructorErrors() {
    SchemaException ex =
        assertErrors("expected field", "module M { stmt = Pass attributes (int) }");
    assertThat(ex.fullMessage()).doesNotContain("in constructor");
  }
}
