package asdl.generator;

import java.io.IOException;
import java.util.Set;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.JavaFile;

@AutoService(Processor.class)
public class AsdlSchemaProcessor extends AbstractProcessor {

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(AsdlSchema.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    for (Element element : roundEnv.getElementsAnnotatedWith(AsdlSchema.class)) {
      try {
        writeSchemaFile(element);
      } catch (IOException ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, element);
      }
    }
    return true;
  }

  private void writeSchemaFile(Element element) throws IOException {
    String schema = Joiner.on('\n').join(element.getAnnotation(AsdlSchema.class).value());
    String packageName =
        processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();

    JavaFile javaFile;
    try {
      javaFile = TypeGenerator.generateFile(packageName, SchemaParser.parse(schema));
    } catch (SchemaException ex) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Invalid schema: " + ex.fullMessage(), element);
      return;
    } catch (IllegalArgumentException ex) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Cannot generate node classes: " + ex.getMessage(), element);
      return;
    }

    javaFile.writeTo(processingEnv.getFiler());
  }
}
