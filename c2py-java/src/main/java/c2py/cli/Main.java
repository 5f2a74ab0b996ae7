package c2py.cli;

import c2py.Translator;
import c2py.error.TranslationException;
import c2py.io.PythonWriter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 2) {
            err.println("Usage: c2py <input.cpp> <output.py>");
            return EXIT_USAGE;
        }

        Path input = Path.of(args[0]);
        Path output = Path.of(args[1]);
        Translator translator = new Translator();

        try {
            // 1. Reading
            String source = Files.readString(input, StandardCharsets.UTF_8);
            out.println("[1/5] Reading: " + input);

            // 2. Lexer
            var tokens = translator.lex(source);
            out.println("[2/5] Lexer: " + tokens.size() + " tokens");

            // 3. Parser
            var program = translator.parse(tokens);
            out.println("[3/5] Parser: " + program.statements().size() + " top-level statements");

            // 4. Generator
            String python = translator.generate(program);
            out.println("[4/5] Generator: " + python.lines().count() + " lines");

            // 5. Writing
            PythonWriter.write(output, python);
            out.println("[5/5] Writing: " + output);

            out.println("\n✓ Translation complete: " + output);
            return EXIT_OK;
        } catch (TranslationException e) {
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (NoSuchFileException e) {
            String reason = e.getReason() != null ? e.getReason() : "no such file";
            err.println("error: " + reason + ": " + e.getFile());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("error: " + e);
            return EXIT_FAILURE;
        }
    }
}
