package org.cmmn.parser;

import org.cmmn.parser.exceptions.CmmnException;
import org.cmmn.parser.exceptions.CmmnFileException;
import org.cmmn.parser.format.CmmnFormat;
import org.cmmn.parser.models.Definitions;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Command line entry point: parses a CMMN file and prints it in the JSON dialect.
 * <pre>
 * Main &lt;file&gt; [xml|json|auto] [--validate]
 * </pre>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: Main <file> [xml|json|auto] [--validate]";

    private final CmmnParser parser;

    public Main() {
        this(new CmmnParser());
    }

    Main(CmmnParser parser) {
        this.parser = parser;
    }

    public static void main(String[] args) {
        int exitCode = new Main().run(args, System.out, System.err);
        System.exit(exitCode);
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        String file = null;
        String hint = null;
        boolean validate = false;

        for (String arg : args) {
            if ("--validate".equals(arg)) {
                validate = true;
            } else if (file == null) {
                file = arg;
            } else if (hint == null) {
                hint = arg;
            } else {
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }
        if (file == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            CmmnFormat format = CmmnFormat.fromHint(hint);
            Path path = toPath(file);
            if (validate) {
                parser.validateFile(path, format);
            }
            Definitions definitions = parser.parseFile(path, format);
            out.println(parser.toJsonString(definitions));
            return EXIT_OK;
        } catch (CmmnException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static Path toPath(String file) {
        try {
            return Path.of(file);
        } catch (InvalidPathException e) {
            throw new CmmnFileException("Invalid file path: " + e.getMessage(), e);
        }
    }
}
