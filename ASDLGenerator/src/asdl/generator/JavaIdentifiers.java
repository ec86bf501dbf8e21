package asdl.generator;

import javax.lang.model.SourceVersion;

import com.google.common.collect.ImmutableSet;

// Values stay stored under the schema name; only Java members are renamed.
final class JavaIdentifiers {

  // Members of AST and Object that a generated accessor must not shadow.
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "fieldNames",
          "attributeNames",
          "symref",
          "setSymref",
          "startLine",
          "startColumn",
          "endLine",
          "endColumn",
          "setStartLine",
          "setStartColumn",
          "setEndLine",
          "setEndColumn",
          "clearStartLine",
          "clearStartColumn",
          "clearEndLine",
          "clearEndColumn",
          "hasLocation",
          "clone",
          "finalize",
          "getClass",
          "hashCode",
          "notify",
          "notifyAll",
          "toString",
          "wait");

  // Names the generated constructors use for their own constants and parameters.
  private static final ImmutableSet<String> RESERVED_PARAMETERS =
      ImmutableSet.of("fieldNames", "FIELDS", "ATTRIBUTES");

  static String typeName(String schemaName) {
    return SourceVersion.isKeyword(schemaName) ? schemaName + "_" : schemaName;
  }

  static String getter(String fieldName) {
    return escape(fieldName);
  }

  static String setter(String fieldName) {
    return escape("set" + Character.toUpperCase(fieldName.charAt(0)) + fieldName.substring(1));
  }

  static String parameter(String fieldName) {
    return SourceVersion.isKeyword(fieldName) || RESERVED_PARAMETERS.contains(fieldName)
        ? fieldName + "_"
        : fieldName;
  }

  private static String escape(String name) {
    return SourceVersion.isKeyword(name) || RESERVED.contains(name) ? name + "_" : name;
  }

  private JavaIdentifiers() {}
}
