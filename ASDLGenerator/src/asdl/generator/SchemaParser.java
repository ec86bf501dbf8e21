package asdl.generator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import asdl.generator.Schema.AbstractType;
import asdl.generator.Schema.Constructor;
import asdl.generator.Schema.Field;
import asdl.generator.Schema.ProductType;
import asdl.generator.Schema.SumType;
import asdl.generator.Schema.TypeDef;

/**
 * Recursive-descent parser for the schema language.
 *
 * <pre>
 * Module      = 'module' name '{' TypeDef* '}'
 * TypeDef     = type_name '=' (ProductType | SumType)
 * ProductType = Fields
 * SumType     = Constructor ('|' Constructor)* ('attributes' Fields)?
 * Constructor = CtorName Fields?
 * Fields      = '(' Field (',' Field)* ')'
 * Field       = type_name ('?' | '*' | '+')? field_name
 * </pre>
 *
 * Comments start with {@code --} and run to the end of the line.
 */
public final class SchemaParser {
  private static final Pattern COMMENT = Pattern.compile("--.*$", Pattern.MULTILINE);
  private static final Pattern MODULE =
      Pattern.compile("\\A\\s*module\\s+(\\w+)\\s*\\{(.*)\\}\\s*\\z", Pattern.DOTALL);

  private static final Pattern TYPE_DEF = Pattern.compile("\\s*(\\w+)\\s*=\\s*");
  private static final Pattern NAME = Pattern.compile("\\s*(\\w+)\\s*");
  private static final Pattern FIELD = Pattern.compile("\\s*(\\w+)([?*+])?\\s+(\\w+)\\s*");
  private static final Pattern OPEN_PAREN_AHEAD = Pattern.compile("\\s*\\(");
  private static final Pattern OPEN_PAREN = Pattern.compile("\\s*\\(\\s*");
  private static final Pattern CLOSE_PAREN = Pattern.compile("\\s*\\)\\s*");
  private static final Pattern COMMA = Pattern.compile("\\s*,\\s*");
  private static final Pattern BAR = Pattern.compile("\\s*\\|\\s*");
  private static final Pattern ATTRIBUTES = Pattern.compile("\\s*attributes\\b\\s*");

  private SchemaParser() {}

  public static Schema.Module parse(String text) throws SchemaException {
    // Comments never span lines, so stripping them keeps line numbers intact.
    String stripped = COMMENT.matcher(text).replaceAll("");

    Matcher header = MODULE.matcher(stripped);
    if (!header.matches()) {
      throw new SchemaException("missing module statement");
    }

    SchemaCursor cursor = new SchemaCursor(stripped, header.start(2), header.end(2));
    return Schema.Module.create(header.group(1), parseTypeDefs(cursor));
  }

  private static List<TypeDef> parseTypeDefs(SchemaCursor cursor) throws SchemaException {
    List<TypeDef> typeDefs = new ArrayList<>();
    Set<String> defined = new HashSet<>();

    while (!cursor.atEnd()) {
      SchemaCursor.Pos pos = cursor.pos();
      MatchResult m = expect(cursor, TYPE_DEF, "expected type definition");
      String typeName = m.group(1);
      if (!defined.add(typeName)) {
        throw new SchemaException(pos, String.format("cannot define type '%s' twice", typeName));
      }

      try {
        typeDefs.add(TypeDef.create(typeName, parseType(cursor, typeName, pos)));
      } catch (SchemaException ex) {
        throw new SchemaException(String.format("in type definition of '%s'", typeName), ex);
      }
    }

    return typeDefs;
  }

  private static AbstractType parseType(SchemaCursor cursor, String typeName, SchemaCursor.Pos pos)
      throws SchemaException {
    if (typeName.equals(Schema.BASE_NODE_NAME) || Schema.Primitive.named(typeName).isPresent()) {
      throw new SchemaException(pos, String.format("cannot redefine basic type '%s'", typeName));
    }

    if (cursor.lookingAt(OPEN_PAREN_AHEAD)) {
      return ProductType.create(parseFields(cursor));
    }
    return parseSumType(cursor);
  }

  private static SumType parseSumType(SchemaCursor cursor) throws SchemaException {
    List<Constructor> constructors = new ArrayList<>();
    do {
      constructors.add(parseConstructor(cursor));
    } while (cursor.consume(BAR).isPresent());

    List<Field> attributes = new ArrayList<>();
    if (cursor.consume(ATTRIBUTES).isPresent()) {
      attributes = parseFields(cursor);
    }
    return SumType.create(constructors, attributes);
  }

  private static Constructor parseConstructor(SchemaCursor cursor) throws SchemaException {
    SchemaCursor.Pos pos = cursor.pos();
    String name = expect(cursor, NAME, "expected name in constructor").group(1);
    if (!Character.isUpperCase(name.charAt(0))) {
      throw new SchemaException(
          pos, String.format("constructor name '%s' must start with an uppercase letter", name));
    }

    if (!cursor.lookingAt(OPEN_PAREN_AHEAD)) {
      return Constructor.create(name, new ArrayList<>());
    }
    try {
      return Constructor.create(name, parseFields(cursor));
    } catch (SchemaException ex) {
      throw new SchemaException(String.format("in constructor of '%s'", name), ex);
    }
  }

  private static List<Field> parseFields(SchemaCursor cursor) throws SchemaException {
    expect(cursor, OPEN_PAREN, "expected left parenthesis to begin field list");

    List<Field> fields = new ArrayList<>();
    do {
      fields.add(parseField(cursor));
    } while (cursor.consume(COMMA).isPresent());

    expect(cursor, CLOSE_PAREN, "expected right parenthesis to close field list");
    return fields;
  }

  private static Field parseField(SchemaCursor cursor) throws SchemaException {
    MatchResult m = expect(cursor, FIELD, "expected field");
    String marker = Optional.ofNullable(m.group(2)).orElse("");
    boolean canNone = marker.equals("?") || marker.equals("*");
    boolean canMany = marker.equals("*") || marker.equals("+");
    return Field.create(m.group(1), m.group(3), canNone, canMany);
  }

  private static MatchResult expect(SchemaCursor cursor, Pattern pattern, String errorMsg)
      throws SchemaException {
    SchemaCursor.Pos pos = cursor.pos();
    Optional<MatchResult> m = cursor.consume(pattern);
    if (!m.isPresent()) {
      throw new SchemaException(pos, errorMsg);
    }
    return m.get();
  }
}
