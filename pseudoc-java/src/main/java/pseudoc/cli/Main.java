package pseudoc.cli;

import pseudoc.CompilationException;
import pseudoc.Compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public final class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final PythonRunner runner;

    Main(PrintStream out, PrintStream err, PythonRunner runner) {
        this.out = out;
        this.err = err;
        this.runner = runner;
    }

    public static void main(String[] args) {
        int code = new Main(System.out, System.err, PythonRunner.system()).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        // 1. Read
        String source;
        try {
            source = Files.readString(options.input(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot read '" + options.input() + "': " + e.getMessage());
            return EXIT_FAILURE;
        }
        logger.info("Compiling {} -> {}", options.input(), options.output());

        // 2. Compile; nothing is written on failure
        String python;
        try {
            python = new Compiler().compile(source);
        } catch (CompilationException e) {
            logger.debug("{} phase failed at line {}", e.stage().label(), e.line());
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }

        // 3. Write
        try {
            Files.writeString(options.output(), python, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot write '" + options.output() + "': " + e.getMessage());
            return EXIT_FAILURE;
        }
        out.println("Compiled " + options.input() + " -> " + options.output());

        if (!options.run()) return EXIT_OK;

        // 4. Optional run
        try {
            return runner.run(options.output());
        } catch (IOException e) {
            err.println("Error: cannot start Python ('" + PythonRunner.interpreter() + "'): " + e.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: interrupted while running " + options.output());
            return EXIT_FAILURE;
        }
    }
}
