package com.cern.driver;

import com.cern.GenerationException;
import com.cern.Lexer;
import com.cern.Logging;
import com.cern.ParseException;
import com.cern.Parser;
import com.cern.Token;
import com.cern.TokenizeException;
import com.cern.ast.ArenaExhaustedException;
import com.cern.ast.NodeArena;
import com.cern.ast.SyntaxTree;
import com.cern.ast.TreePrinter;
import com.cern.gen.Generator;
import com.cern.json.AstJsonProvider;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end: reads a {@code .ce} file, parses it, emits C++ (or a
 * tree dump) and optionally hands the C++ to an external compiler.
 *
 * Usage:
 *   cern [options] &lt;file.ce&gt;
 *
 * Options:
 *   --emit=cpp|json|tree  What to write (default: cpp)
 *   --out=PATH            Output file, "-" for stdout (default: main.cpp for cpp, stdout otherwise)
 *   --no-compile          Do not run the C++ compiler
 *   --compiler=CMD        C++ compiler executable (default: g++)
 *   --exe=PATH            Executable produced by the compiler (default: app)
 *   --arena-capacity=N    Maximum number of syntax tree nodes
 *   --verbose             Enable debug logging
 */
public class Driver {
    private static final Logger logger = Logging.getCernLogger();

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;

    public Driver(Config config) {
        this(config, System.out, System.err);
    }

    public Driver(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(ExitCode.ERROR_COMMAND.code());
        }

        Logging.setupLogging(config.verbose);
        System.exit(new Driver(config).run().code());
    }

    /**
     * Runs every stage and reports the first failure on the error stream.
     */
    public ExitCode run() {
        String source;
        try {
            source = Files.readString(config.sourceFile);
        } catch (IOException e) {
            err.println("[Error] cannot read " + config.sourceFile + ": " + e.getMessage());
            return ExitCode.ERROR_IO;
        }

        try {
            List<Token> tokens = new Lexer(source).tokenize();
            logger.debug("Tokenized " + config.sourceFile + " into " + tokens.size() + " tokens");

            SyntaxTree tree = new Parser(tokens, config.arenaCapacity).parseProgram();
            logger.debug("Emitting " + config.emit.name().toLowerCase());

            String output = switch (config.emit) {
                case CPP -> new Generator(tree).generateProgram();
                case JSON -> AstJsonProvider.getProvider().getSerializer().serializePretty(tree) + "\n";
                case TREE -> TreePrinter.print(tree) + "\n";
            };
            writeOutput(output);
        } catch (TokenizeException | ParseException e) {
            err.println(e.getMessage());
            return ExitCode.ERROR_PARSER;
        } catch (GenerationException e) {
            err.println(e.getMessage());
            return ExitCode.ERROR_USER;
        } catch (ArenaExhaustedException e) {
            err.println("[Internal Error] " + e.getMessage());
            return ExitCode.ERROR_INTERNAL;
        } catch (IOException e) {
            err.println("[Error] cannot write " + config.output + ": " + e.getMessage());
            return ExitCode.ERROR_IO;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while compiling " + config.sourceFile, e);
            err.println("[Internal Error] " + e.getMessage());
            return ExitCode.ERROR_INTERNAL;
        }

        if (config.emit == Emit.CPP && config.compile && config.output != null) {
            return compile();
        }
        return ExitCode.SUCCESS;
    }

    private void writeOutput(String output) throws IOException {
        if (config.output == null) {
            out.print(output);
            out.flush();
            return;
        }
        Files.writeString(config.output, output);
        logger.info("Wrote " + config.output);
    }

    private ExitCode compile() {
        List<String> command = List.of(
            config.compiler, "-std=c++23", "-Wall", "-Wextra",
            config.output.toString(), "-o", config.executable.toString());
        logger.info("Running " + String.join(" ", command));

        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            // Compiler diagnostics go to our error stream
            try (InputStream diagnostics = process.getInputStream()) {
                diagnostics.transferTo(err);
            }
            err.flush();
            int status = process.waitFor();
            if (status != 0) {
                err.println("[Error] " + config.compiler + " exited with status " + status);
                return ExitCode.ERROR_USER;
            }
            return ExitCode.SUCCESS;
        } catch (IOException e) {
            err.println("[Error] cannot run " + config.compiler + ": " + e.getMessage());
            return ExitCode.ERROR_IO;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("[Internal Error] interrupted while waiting for " + config.compiler);
            return ExitCode.ERROR_INTERNAL;
        }
    }

    private static void printUsage() {
        System.err.println("usage: cern [options] <file.ce>");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --emit=cpp|json|tree  What to write (default: cpp)");
        System.err.println("  --out=PATH            Output file, '-' for stdout (default: main.cpp for cpp, stdout otherwise)");
        System.err.println("  --no-compile          Do not run the C++ compiler");
        System.err.println("  --compiler=CMD        C++ compiler executable (default: g++)");
        System.err.println("  --exe=PATH            Executable produced by the compiler (default: app)");
        System.err.println("  --arena-capacity=N    Maximum number of syntax tree nodes");
        System.err.println("  --verbose, -v         Enable debug logging");
    }

    public enum Emit {
        CPP,
        JSON,
        TREE
    }

    public static class Config {
        Emit emit = Emit.CPP;
        Path output; // null means stdout
        boolean compile = true;
        String compiler = "g++";
        Path executable = Path.of("app");
        int arenaCapacity = NodeArena.DEFAULT_CAPACITY;
        boolean verbose = false;
        Path sourceFile;

        /**
         * @return the configuration, or null if the arguments are invalid or help was requested
         */
        public static Config parse(String[] args) {
            Config config = new Config();
            List<Path> sources = new ArrayList<>();
            String out = null;

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--emit=")) {
                    String emit = arg.substring(7).toUpperCase();
                    try {
                        config.emit = Emit.valueOf(emit);
                    } catch (IllegalArgumentException e) {
                        System.err.println("Invalid emit mode: " + arg.substring(7));
                        return null;
                    }
                } else if (arg.startsWith("--out=")) {
                    out = arg.substring(6);
                } else if (arg.equals("--no-compile")) {
                    config.compile = false;
                } else if (arg.startsWith("--compiler=")) {
                    config.compiler = arg.substring(11);
                } else if (arg.startsWith("--exe=")) {
                    config.executable = Path.of(arg.substring(6));
                } else if (arg.startsWith("--arena-capacity=")) {
                    try {
                        config.arenaCapacity = Integer.parseInt(arg.substring(17));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid arena capacity: " + arg.substring(17));
                        return null;
                    }
                    if (config.arenaCapacity <= 0) {
                        System.err.println("Arena capacity must be positive");
                        return null;
                    }
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    sources.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (sources.size() != 1) {
                System.err.println("Error: expected exactly one source file");
                return null;
            }
            config.sourceFile = sources.get(0);

            if (out == null) {
                config.output = config.emit == Emit.CPP ? Path.of("main.cpp") : null;
            } else {
                config.output = out.equals("-") ? null : Path.of(out);
            }
            return config;
        }

        public Emit getEmit() {
            return emit;
        }

        public Path getOutput() {
            return output;
        }

        public boolean isCompile() {
            return compile;
        }

        public String getCompiler() {
            return compiler;
        }

        public Path getExecutable() {
            return executable;
        }

        public int getArenaCapacity() {
            return arenaCapacity;
        }

        public boolean isVerbose() {
            return verbose;
        }

        public Path getSourceFile() {
            return sourceFile;
        }
    }
}
