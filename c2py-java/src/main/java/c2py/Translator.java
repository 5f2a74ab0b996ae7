package c2py;

import c2py.ast.Program;
import c2py.codegen.PythonGenerator;
import c2py.io.PythonWriter;
import c2py.lexer.Lexer;
import c2py.lexer.Token;
import c2py.parser.Parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * C++ subset to Python, lexer → parser → generator. Each stage is also
 * callable on its own so a caller can report progress between them.
 * Any stage may throw a {@link c2py.error.TranslationException}.
 */
public final class Translator {
    private final PythonGenerator generator = new PythonGenerator();

    public List<Token> lex(String source) {
        return new Lexer(source).tokenize();
    }

    public Program parse(List<Token> tokens) {
        return new Parser(tokens).parseProgram();
    }

    public String generate(Program program) {
        return generator.generate(program);
    }

    public String translate(String source) {
        return generate(parse(lex(source)));
    }

    /** The output file is only written when the whole translation succeeded. */
    public void translateFile(Path input, Path output) throws IOException {
        String source = Files.readString(input, StandardCharsets.UTF_8);
        String python = translate(source);
        PythonWriter.write(output, python);
    }
}
