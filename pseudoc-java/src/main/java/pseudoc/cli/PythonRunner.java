package pseudoc.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/** Runs a generated Python script and returns the interpreter's exit code. */
@FunctionalInterface
public interface PythonRunner {

    String PYTHON_PROPERTY = "pseudoc.python";
    String PYTHON_ENV = "PSEUDOC_PYTHON";
    String DEFAULT_PYTHON = "python3";

    int run(Path script) throws IOException, InterruptedException;

    /**
     * Interpreter taken from the {@code pseudoc.python} system property, then the
     * {@code PSEUDOC_PYTHON} environment variable, then {@code python3}. The child
     * shares this process's stdin/stdout/stderr so {@code LIRE} reads from the console.
     */
    static PythonRunner system() {
        return script -> {
            Logger logger = LoggerFactory.getLogger(PythonRunner.class);
            String python = interpreter();
            logger.info("Executing: {} {}", python, script);

            Process process = new ProcessBuilder(python, script.toString())
                    .inheritIO()
                    .start();
            int exit = process.waitFor();
            logger.debug("Python exited with code {}", exit);
            return exit;
        };
    }

    static String interpreter() {
        String fromProperty = System.getProperty(PYTHON_PROPERTY);
        if (fromProperty != null && !fromProperty.isBlank()) return fromProperty;
        String fromEnv = System.getenv(PYTHON_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv;
        return DEFAULT_PYTHON;
    }
}
