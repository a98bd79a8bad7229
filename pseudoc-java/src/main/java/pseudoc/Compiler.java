package pseudoc;

import pseudoc.ast.Program;
import pseudoc.codegen.PythonGenerator;
import pseudoc.lexer.Lexer;
import pseudoc.lexer.Token;
import pseudoc.parser.Parser;
import pseudoc.sema.AnalyzedProgram;
import pseudoc.sema.SemanticAnalyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs lexer, parser, semantic analyzer and Python generator in sequence.
 * The first phase that fails aborts the run with its {@link CompilationException}.
 */
public final class Compiler {

    private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    public String compile(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        logger.debug("Lexer: {} tokens", tokens.size());

        Program program = new Parser(tokens).parseProgram();
        logger.debug("Parser: algorithm '{}', {} declaration(s), {} function(s), {} statement(s)",
                program.name(), program.declarations().size(), program.functions().size(),
                program.statements().size());

        AnalyzedProgram analyzed = new SemanticAnalyzer().analyze(program);
        logger.debug("Semantic analysis: OK, {} global variable(s)", analyzed.globalCount());

        String python = new PythonGenerator().generate(analyzed);
        logger.debug("Generator: {} line(s) of Python", python.lines().count());
        return python;
    }
}
