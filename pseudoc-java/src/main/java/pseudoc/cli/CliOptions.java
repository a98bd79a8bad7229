package pseudoc.cli;

import java.nio.file.Path;

/** Parsed command line of {@code pseudoc}. */
public record CliOptions(Path input, Path output, boolean run, boolean help) {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: pseudoc <input.algo> [-o <output.py>] [-r|--run]",
            "  -o <file>   output file (default: input with extension replaced by .py)",
            "  -r, --run   run the generated program with Python after compiling",
            "  -h, --help  show this help");

    public static CliOptions parse(String[] args) {
        if (args.length == 0) throw new IllegalArgumentException("Missing input file");

        Path input = null;
        Path output = null;
        boolean run = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h", "--help" -> {
                    return new CliOptions(null, null, false, true);
                }
                case "-r", "--run" -> run = true;
                case "-o" -> {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("Option -o needs a file name");
                    output = Path.of(args[++i]);
                }
                default -> {
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Unexpected argument: " + a);
                    input = Path.of(a);
                }
            }
        }

        if (input == null) throw new IllegalArgumentException("Missing input file");
        if (output == null) output = defaultOutput(input);
        return new CliOptions(input, output, run, false);
    }

    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path out = input.resolveSibling(base + ".py");
        // never overwrite the source itself
        return out.equals(input) ? input.resolveSibling(name + ".py") : out;
    }
}
