package bflc.cli;

import bflc.ast.AstPrinter;
import bflc.ast.Program;
import bflc.codegen.BrainfuckCompiler;
import bflc.codegen.CompiledModule;
import bflc.codegen.CompilerOptions;
import bflc.exec.ExecutionException;
import bflc.exec.ProgramRunner;
import bflc.io.IrWriter;
import bflc.llvm.LlvmException;
import bflc.lexer.SourceReadException;
import bflc.parser.ParseException;
import bflc.parser.ParseMode;
import bflc.parser.Parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public final class Main {
    static final String USAGE = """
            Usage: bflc <input.bf> [output.ll|-] [options]
              -O0               skip the simplification passes
              --strict          reject unmatched brackets
              --tape-size=N     number of tape cells (default 16384)
              --checked         stop on tape access outside 0..N-1
              --ast             print the parsed program
              --run             execute the program instead of writing IR""";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        String input = null;
        String output = null;
        CompilerOptions options = CompilerOptions.defaults();
        boolean execute = false;
        boolean printAst = false;

        try {
            for (String a : args) {
                if (a.equals("-O0")) options = options.withOptimize(false);
                else if (a.equals("--strict")) options = options.withParseMode(ParseMode.STRICT);
                else if (a.startsWith("--tape-size=")) options = options.withTapeSize(Integer.parseInt(a.substring(12)));
                else if (a.equals("--checked")) options = options.withBoundsChecked(true);
                else if (a.equals("--ast")) printAst = true;
                else if (a.equals("--run")) execute = true;
                else if (a.startsWith("-") && !a.equals("-")) throw new IllegalArgumentException("Unknown option: " + a);
                else if (input == null) input = a;
                else if (output == null) output = a;
                else throw new IllegalArgumentException("Unexpected argument: " + a);
            }
            if (input == null) throw new IllegalArgumentException("No input file");
        } catch (IllegalArgumentException e) {
            stderr.println(e.getMessage());
            stderr.println(USAGE);
            return 2;
        }

        Path in = Path.of(input);
        boolean toStdout = "-".equals(output);
        Path out = (output == null) ? IrWriter.defaultOutput(in) : (toStdout ? null : Path.of(output));

        // stdout занят программой или IR -> прогресс уходит в stderr
        PrintStream log = (execute || toStdout) ? stderr : stdout;

        try {
            // 1. Чтение + парсер (один проход по потоку)
            log.println("[1/4] Reading: " + in);
            Program program;
            try (Reader r = Files.newBufferedReader(in, StandardCharsets.ISO_8859_1)) {
                program = Parser.parse(r, options.parseMode());
            }
            log.println("[2/4] Parser: " + program.instructionCount() + " instructions, loop depth " + program.maxDepth());
            if (printAst) log.println(AstPrinter.print(program));

            // 2. Генерация + проверка + проходы
            try (CompiledModule result = new BrainfuckCompiler(options).generate(program, in.getFileName().toString())) {
                log.println("[3/4] Codegen: " + result.generatedInsns() + " IR instructions");
                log.println(options.optimize()
                        ? "[4/4] Passes: " + result.finalInsns() + " IR instructions after simplification"
                        : "[4/4] Passes: skipped (-O0)");

                // 3. Выполнение или запись
                if (execute) {
                    new ProgramRunner().run(result, stdin, stdout);
                    return 0;
                }
                if (toStdout) {
                    IrWriter.write(stdout, result.module());
                    return 0;
                }
                IrWriter.write(out, result.module());

                log.println("\n✓ Success: " + out);
                log.println("  Blocks:       " + result.blockCount());
                log.println("  Instructions: " + result.finalInsns());
                log.println("  File size:    " + Files.size(out) + " bytes");
                return 0;
            }
        } catch (NoSuchFileException e) {
            stderr.println("error: cannot open " + e.getFile());
        } catch (IOException | SourceReadException e) {
            stderr.println("error: failed to read or write: " + e.getMessage());
        } catch (ParseException | LlvmException | ExecutionException e) {
            stderr.println("error: " + e.getMessage());
        }
        return 1;
    }
}
