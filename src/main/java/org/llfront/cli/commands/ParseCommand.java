package org.llfront.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.llfront.IrParser;
import org.llfront.api.IIrParser;
import org.llfront.api.IrException;
import org.llfront.cli.CommandLineInterface;
import org.llfront.config.ConfigLoader;
import org.llfront.config.ParserOptions;
import org.llfront.ir.function.BasicBlock;
import org.llfront.ir.function.Function;
import org.llfront.ir.print.IrPrinter;
import org.llfront.ir.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses a type, basic block or function and prints it in canonical form.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);
    private static final String STDIN = "-";

    @Parameters(index = "0", description = "The file to read, or '-' for standard input.")
    private String input;

    @Option(names = {"-k", "--kind"}, defaultValue = "function",
            description = "What the input contains: type, block or function (default: ${DEFAULT-VALUE}).")
    private String kind;

    @Option(names = "--debug", description = "Print the model records instead of canonical text.")
    private boolean debug;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final java.util.function.Function<ParserOptions, IIrParser> parserFactory;
    private final InputStream stdin;

    public ParseCommand() {
        this(IrParser::new, System.in);
    }

    /**
     * @param parserFactory Creates the parser for the effective options.
     * @param stdin The stream read when the input is {@code -}.
     */
    public ParseCommand(java.util.function.Function<ParserOptions, IIrParser> parserFactory, InputStream stdin) {
        this.parserFactory = Objects.requireNonNull(parserFactory, "parserFactory");
        this.stdin = Objects.requireNonNull(stdin, "stdin");
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String sourceName = STDIN.equals(input) ? "<stdin>" : input;
        String source;
        try {
            source = STDIN.equals(input)
                    ? new String(stdin.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(Path.of(input), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Cannot read {}: {}", sourceName, e.getMessage());
            err.println("Cannot read " + sourceName + ": " + e.getMessage());
            return 1;
        }

        ParserOptions options;
        try {
            options = ParserOptions.fromConfig(loadConfig()).withSourceName(sourceName);
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }
        IIrParser parser = parserFactory.apply(options);
        try {
            switch (kind.toLowerCase(Locale.ROOT)) {
                case "type": {
                    Type type = parser.parseType(source);
                    out.println(debug ? type.toString() : IrPrinter.print(type));
                    break;
                }
                case "block": {
                    BasicBlock block = parser.parseBasicBlock(source);
                    out.print(debug ? block + System.lineSeparator() : IrPrinter.print(block));
                    break;
                }
                case "function": {
                    Function function = parser.parseFunction(source);
                    out.print(debug ? function + System.lineSeparator() : IrPrinter.print(function));
                    break;
                }
                default:
                    err.println("Unknown kind '" + kind + "', expected type, block or function");
                    return 2;
            }
        } catch (IrException e) {
            LOG.warn("Parsing {} failed [{}]: {}", sourceName, e.code(), e.getMessage());
            err.println(e.getMessage());
            return 1;
        }
        out.flush();
        return 0;
    }

    private Config loadConfig() {
        return parent != null ? parent.getConfig() : ConfigLoader.load(null);
    }
}
