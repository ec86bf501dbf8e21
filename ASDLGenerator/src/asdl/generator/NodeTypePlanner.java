package asdl.generator;

import java.util.HashSet;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import asdl.generator.Schema.Constructor;
import asdl.generator.Schema.Field;
import asdl.generator.Schema.ProductType;
import asdl.generator.Schema.SumType;
import asdl.generator.Schema.TypeDef;

public final class NodeTypePlanner {

  public static ImmutableList<NodeTypeSpec> plan(Schema.Module module) {
    ImmutableList.Builder<NodeTypeSpec> builder = ImmutableList.builder();
    for (TypeDef typeDef : module.typeDefs()) {
      switch (typeDef.type().kind()) {
        case PRODUCT:
          {
            ProductType product = typeDef.type().cast();
            builder.add(NodeTypeSpec.product(typeDef.name(), product.fields()));
            break;
          }
        case SUM:
          {
            SumType sum = typeDef.type().cast();
            builder.add(NodeTypeSpec.sumBase(typeDef.name(), sum.attributes()));
            for (Constructor ctor : sum.constructors()) {
              builder.add(
                  NodeTypeSpec.constructor(
                      ctor.name(), typeDef.name(), sum.attributes(), ctor.fields()));
            }
            break;
          }
      }
    }

    ImmutableList<NodeTypeSpec> plan = builder.build();
    checkNames(module, plan);
    return plan;
  }

  // Rejects layouts that would not compile as nested classes of the module holder.
  private static void checkNames(Schema.Module module, ImmutableList<NodeTypeSpec> plan) {
    Set<String> typeNames = new HashSet<>();
    for (NodeTypeSpec spec : plan) {
      String name = JavaIdentifiers.typeName(spec.name());
      Preconditions.checkArgument(
          !name.equals(module.name()),
          "type '%s' has the same name as its module",
          spec.name());
      Preconditions.checkArgument(
          typeNames.add(name), "more than one node class named '%s'", spec.name());

      Set<String> members = new HashSet<>();
      for (Field field : spec.parameters()) {
        Preconditions.checkArgument(
            members.add(JavaIdentifiers.getter(field.name()))
                && members.add(JavaIdentifiers.setter(field.name())),
            "field '%s' clashes with another field of '%s'",
            field.name(),
            spec.name());
      }
    }
  }

  private NodeTypePlanner() {}
}
