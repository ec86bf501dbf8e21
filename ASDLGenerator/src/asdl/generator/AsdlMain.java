package asdl.generator;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Files;

public class AsdlMain {

  public static void main(String[] args) throws IOException {
    System.exit(run(args));
  }

  static int run(String[] args) throws IOException {
    if (args.length != 3) {
      System.err.println("Usage: $GENERATOR schema_file output_dir package");
      return 1;
    }

    File schemaFile = new File(args[0]);
    Schema.Module module;
    try {
      module = SchemaParser.parse(read(schemaFile));
    } catch (SchemaException ex) {
      ex.print(schemaFile.toString());
      System.out.println("Generation failed.  See errors above.");
      return 1;
    }

    String packageName = args[2];
    String source;
    try {
      source = TypeGenerator.generate(packageName, module);
    } catch (IllegalArgumentException ex) {
      System.out.println("ERROR: " + ex.getMessage());
      System.out.println("Generation failed.  See errors above.");
      return 1;
    }

    File packageDir = new File(args[1], packageName.replace('.', File.separatorChar));
    File out = new File(packageDir, module.name() + ".java");
    Files.createParentDirs(out);
    write(source, out);

    System.out.println(
        String.format("Generated %d type definitions into %s", module.typeDefs().size(), out));
    return 0;
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
