package dfrs;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class CompilerMain {
  private static final String SOURCE_EXTENSION = ".dfrs";
  private static final String TEMPLATES_EXTENSION = ".dft";

  private static final String USAGE =
      "Usage: $COMPILER [--strict-calls] [--debug-tokens] [--debug-nodes] [--debug-compile]"
          + " (compile <file|dir> | decompile <template> [out_file] | dump <file>)";

  public static void main(String[] args) throws IOException {
    CompilerOptions.Builder options = CompilerOptions.builder();
    List<String> positional = new ArrayList<>();
    for (String arg : args) {
      switch (arg) {
        case "--strict-calls":
          options.setStrictCalls(true);
          break;
        case "--debug-tokens":
          options.setDebugTokens(true);
          break;
        case "--debug-nodes":
          options.setDebugNodes(true);
          break;
        case "--debug-compile":
          options.setDebugCompile(true);
          break;
        default:
          positional.add(arg);
          break;
      }
    }

    if (positional.size() < 2) usage();
    if (Arrays.stream(args).anyMatch(a -> a.startsWith("--debug-"))) {
      // Must be set before the first logger is created.
      System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
    }
    ActionCatalog catalog = ActionCatalog.load();
    switch (positional.get(0)) {
      case "compile":
        if (positional.size() != 2) usage();
        if (!compileAll(new File(positional.get(1)), catalog, options.build())) {
          System.out.println("Compilation failed.  See errors above.");
          System.exit(1);
        }
        System.out.println("Compilation succeeded!");
        break;
      case "decompile":
        if (positional.size() > 3) usage();
        decompile(positional, catalog);
        break;
      case "dump":
        if (positional.size() != 2) usage();
        dump(new File(positional.get(1)), catalog, options.build());
        break;
      default:
        usage();
    }
  }

  private static void usage() {
    System.err.println(USAGE);
    System.exit(1);
  }

  private static boolean compileAll(File input, ActionCatalog catalog, CompilerOptions options)
      throws IOException {
    boolean success = true;
    for (File f : getFiles(input)) {
      ImmutableList<Compiler.Unit> units;
      try {
        units = new Pipeline(catalog, options).compile(f);
      } catch (Pipeline.SourceException ex) {
        ex.print();
        success = false;
        continue;
      }

      String templates =
          units.stream()
              .map(u -> u.name() + "\t" + CodeTemplates.compress(u.json()))
              .collect(Collectors.joining("\n", "", "\n"));
      File out = new File(f.getPath() + TEMPLATES_EXTENSION);
      write(templates, out);
      System.out.println(String.format("Compiled %d units of %s", units.size(), f.getName()));
    }
    return success;
  }

  private static void decompile(List<String> args, ActionCatalog catalog) throws IOException {
    String template = args.get(1);
    File file = new File(template);
    if (file.isFile()) template = read(file);

    String source;
    try {
      source = new Decompiler(catalog).decompile(template);
    } catch (IllegalArgumentException ex) {
      System.out.println("ERROR: " + ex.getMessage());
      System.exit(1);
      return;
    }

    if (args.size() == 3) {
      write(source, new File(args.get(2)));
      System.out.println("Decompiled to " + args.get(2));
    } else {
      System.out.print(source);
    }
  }

  private static void dump(File f, ActionCatalog catalog, CompilerOptions options)
      throws IOException {
    try {
      for (Compiler.Unit unit : new Pipeline(catalog, options).compile(f)) {
        System.out.println(unit.name());
        System.out.println(unit.json());
      }
    } catch (Pipeline.SourceException ex) {
      ex.print();
      System.exit(1);
    }
  }

  /** Lexes, parses, validates and compiles one file together with the files it uses. */
  static class Pipeline {
    /** A compiler error together with the source it refers to. */
    static class SourceException extends Exception {
      private static final long serialVersionUID = 1L;

      private final File file;
      private final String source;

      SourceException(File file, String source, CompilerException cause) {
        super(cause.errorMsg(), cause);
        this.file = file;
        this.source = source;
      }

      void print() {
        System.out.println(file.getPath() + ":");
        ((CompilerException) getCause()).print(source);
      }
    }

    private final Logger logger = LoggerFactory.getLogger(Pipeline.class);
    private final ActionCatalog catalog;
    private final CompilerOptions options;
    private final Set<String> included = new HashSet<>();

    Pipeline(ActionCatalog catalog, CompilerOptions options) {
      this.catalog = catalog;
      this.options = options;
    }

    ImmutableList<Compiler.Unit> compile(File f) throws IOException, SourceException {
      AST ast = parse(f);
      String source = read(f);
      try {
        new Validator(catalog, options).validate(ast);
      } catch (ValidateException ex) {
        throw new SourceException(f, source, ex);
      }
      return new Compiler(options).compile(ast);
    }

    // Used files contribute their functions and processes; each file is read once.
    private AST parse(File f) throws IOException, SourceException {
      included.add(f.getCanonicalPath());
      String source = read(f);
      AST ast;
      try {
        ImmutableList<Token> tokens = new Lexer(source).lex();
        if (options.debugTokens()) logger.debug("Tokens of {}: {}", f, tokens);
        ast = new Parser(tokens).parse();
      } catch (LexException | ParseException ex) {
        throw new SourceException(f, source, ex);
      }

      for (AST.Use use : ast.uses()) {
        File used = new File(f.getAbsoluteFile().getParentFile(), use.file());
        if (included.contains(used.getCanonicalPath())) continue;
        if (!used.isFile()) {
          throw new SourceException(
              f,
              source,
              new ParseException(
                  ParseException.Kind.INVALID_USE,
                  use.range(),
                  "Invalid use statement: no file " + use.file()));
        }
        ast = ast.include(parse(used));
      }
      if (options.debugNodes()) {
        logger.debug(
            "Parsed {}: {} events, {} functions, {} processes",
            f,
            ast.events().size(),
            ast.functions().size(),
            ast.processes().size());
      }
      return ast;
    }
  }

  private static List<File> getFiles(File input) {
    if (input.isFile()) return ImmutableList.of(input);
    File[] files = input.listFiles();
    if (files == null) return ImmutableList.of();
    return Arrays.stream(files)
        .filter(f -> f.isFile() && f.getName().endsWith(SOURCE_EXTENSION))
        .sorted()
        .collect(Collectors.toList());
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
