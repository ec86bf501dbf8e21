package asdl.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.lang.model.element.Modifier;

import com.google.common.collect.ImmutableList;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;

import asdl.AST;
import asdl.generator.Schema.Field;

/**
 * Renders a planned module as one Java compilation unit: a final holder class named after the
 * module, with one nested class per {@link NodeTypeSpec}.
 */
public final class JavaNodeRenderer {
  private static final ClassName AST_NAME = ClassName.get(AST.class);
  private static final ClassName LIST_NAME = ClassName.get(List.class);
  private static final ClassName ARRAY_LIST_NAME = ClassName.get(ArrayList.class);
  private static final ClassName OPTIONAL_NAME = ClassName.get(Optional.class);
  private static final ClassName IMMUTABLE_LIST_NAME = ClassName.get(ImmutableList.class);
  private static final TypeName NAME_LIST =
      ParameterizedTypeName.get(IMMUTABLE_LIST_NAME, ClassName.get(String.class));

  private final ClassName holder;

  private JavaNodeRenderer(String packageName, String moduleName) {
    this.holder = ClassName.get(packageName, moduleName);
  }

  public static JavaFile render(String packageName, Schema.Module module, List<NodeTypeSpec> plan) {
    JavaNodeRenderer renderer = new JavaNodeRenderer(packageName, module.name());

    TypeSpec.Builder holderBuilder =
        TypeSpec.classBuilder(renderer.holder)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Node classes of the {@code $L} module.\n", module.name())
            .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());
    plan.forEach(spec -> holderBuilder.addType(renderer.renderNode(spec)));

    return JavaFile.builder(packageName, holderBuilder.build())
        .addFileComment("Generated from module $L. Do not edit.", module.name())
        .skipJavaLangImports(true)
        .build();
  }

  private TypeSpec renderNode(NodeTypeSpec spec) {
    TypeSpec.Builder builder =
        TypeSpec.classBuilder(JavaIdentifiers.typeName(spec.name()))
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addModifiers(spec.isAbstract() ? Modifier.ABSTRACT : Modifier.FINAL)
            .superclass(spec.parent().map(this::nodeClass).orElse(AST_NAME));

    switch (spec.kind()) {
      case SUM_BASE:
        builder.addField(nameList("ATTRIBUTES", spec.attributes()));
        builder.addMethod(sumBaseConstructor(spec));
        builder.addMethods(accessors(spec.attributes()));
        break;
      case PRODUCT:
      case CONSTRUCTOR:
        builder.addField(nameList("FIELDS", spec.fields()));
        builder.addMethod(nodeConstructor(spec));
        builder.addMethods(accessors(spec.fields()));
        break;
    }
    return builder.build();
  }

  private static FieldSpec nameList(String constant, List<Field> fields) {
    List<CodeBlock> names = new ArrayList<>();
    fields.forEach(f -> names.add(CodeBlock.of("$S", f.name())));
    return FieldSpec.builder(NAME_LIST, constant, Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
        .initializer("$T.of($L)", IMMUTABLE_LIST_NAME, CodeBlock.join(names, ", "))
        .build();
  }

  // Subclasses pass their own field names up; the base adds the shared attribute names.
  private MethodSpec sumBaseConstructor(NodeTypeSpec spec) {
    MethodSpec.Builder builder =
        MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PROTECTED)
            .addParameter(NAME_LIST, "fieldNames")
            .addStatement("super(fieldNames, ATTRIBUTES)");
    for (Field attribute : spec.attributes()) {
      builder.addParameter(javaType(attribute), JavaIdentifiers.parameter(attribute.name()));
      builder.addStatement("setValue($S, $L)", attribute.name(), storedValue(attribute));
    }
    return builder.build();
  }

  private MethodSpec nodeConstructor(NodeTypeSpec spec) {
    MethodSpec.Builder builder = MethodSpec.constructorBuilder().addModifiers(Modifier.PUBLIC);
    spec.parameters()
        .forEach(p -> builder.addParameter(javaType(p), JavaIdentifiers.parameter(p.name())));

    if (spec.kind() == NodeTypeSpec.Kind.CONSTRUCTOR) {
      List<CodeBlock> args = new ArrayList<>();
      args.add(CodeBlock.of("FIELDS"));
      for (Field attribute : spec.attributes()) {
        args.add(CodeBlock.of("$L", JavaIdentifiers.parameter(attribute.name())));
      }
      builder.addStatement("super($L)", CodeBlock.join(args, ", "));
    } else {
      builder.addStatement("super(FIELDS, $T.of())", IMMUTABLE_LIST_NAME);
    }

    for (Field field : spec.fields()) {
      builder.addStatement("setValue($S, $L)", field.name(), storedValue(field));
    }
    return builder.build();
  }

  private List<MethodSpec> accessors(List<Field> fields) {
    List<MethodSpec> methods = new ArrayList<>();
    for (Field field : fields) {
      String param = JavaIdentifiers.parameter(field.name());
      methods.add(
          MethodSpec.methodBuilder(JavaIdentifiers.getter(field.name()))
              .addModifiers(Modifier.PUBLIC)
              .returns(javaType(field))
              .addStatement(
                  "return this.<$T>$L($S)", elementType(field).box(), reader(field), field.name())
              .build());
      methods.add(
          MethodSpec.methodBuilder(JavaIdentifiers.setter(field.name()))
              .addModifiers(Modifier.PUBLIC)
              .addParameter(javaType(field), param)
              .addStatement("setValue($S, $L)", field.name(), storedValue(field))
              .build());
    }
    return methods;
  }

  private static String reader(Field field) {
    if (field.canMany()) return "listValue";
    if (field.canNone()) return "optionalValue";
    return "requireValue";
  }

  // Lists are copied so that the node owns a mutable list; an empty Optional stores nothing.
  private static CodeBlock storedValue(Field field) {
    String param = JavaIdentifiers.parameter(field.name());
    if (field.canMany()) return CodeBlock.of("new $T<>($L)", ARRAY_LIST_NAME, param);
    if (field.canNone()) return CodeBlock.of("$L.orElse(null)", param);
    return CodeBlock.of("$L", param);
  }

  private TypeName javaType(Field field) {
    TypeName element = elementType(field);
    if (field.canMany()) return ParameterizedTypeName.get(LIST_NAME, element.box());
    if (field.canNone()) return ParameterizedTypeName.get(OPTIONAL_NAME, element.box());
    return element;
  }

  private TypeName elementType(Field field) {
    return field
        .primitive()
        .map(JavaNodeRenderer::primitiveType)
        .orElseGet(() -> nodeClass(field.typeName()));
  }

  private static TypeName primitiveType(Schema.Primitive primitive) {
    switch (primitive) {
      case INT:
        return TypeName.INT;
      case BOOLEAN:
        return TypeName.BOOLEAN;
      case FLOAT:
        return TypeName.DOUBLE;
      case IDENT:
      case STRING:
        return ClassName.get(String.class);
    }
    throw new AssertionError(primitive);
  }

  // Unknown names become forward references; javac reports any that are never defined.
  private ClassName nodeClass(String typeName) {
    return holder.nestedClass(JavaIdentifiers.typeName(typeName));
  }
}
