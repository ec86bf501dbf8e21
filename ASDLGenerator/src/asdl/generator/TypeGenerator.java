package asdl.generator;

import com.squareup.javapoet.JavaFile;

/**
 * Turns a parsed schema into Java node classes built on {@link asdl.AST}.
 *
 * <p>Output depends only on the package name and the module. Field type names that are not
 * primitives refer to the node class of that name and are not checked.
 */
public final class TypeGenerator {

  public static JavaFile generateFile(String packageName, Schema.Module module) {
    return JavaNodeRenderer.render(packageName, module, NodeTypePlanner.plan(module));
  }

  public static String generate(String packageName, Schema.Module module) {
    return generateFile(packageName, module).toString();
  }

  public static String generate(String packageName, String schema) throws SchemaException {
    return generate(packageName, SchemaParser.parse(schema));
  }

  private TypeGenerator() {}
}
