package org.llfront;

import org.llfront.api.IIrParser;
import org.llfront.api.IrException;
import org.llfront.config.ParserOptions;
import org.llfront.diagnostics.Diagnostic;
import org.llfront.diagnostics.DiagnosticsEngine;
import org.llfront.frontend.lexer.Lexer;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.parser.Parser;
import org.llfront.ir.function.BasicBlock;
import org.llfront.ir.function.Function;
import org.llfront.ir.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The main parser implementation. This class runs the lexer and the parser for one
 * entry point per call and keeps no state between calls, so one instance may be shared.
 */
public class IrParser implements IIrParser {

    private static final Logger LOG = LoggerFactory.getLogger(IrParser.class);

    private final ParserOptions options;

    /**
     * Creates a parser with the default options.
     */
    public IrParser() {
        this(ParserOptions.DEFAULT);
    }

    /**
     * @param options The options controlling nesting limits and the file name used in positions.
     */
    public IrParser(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public Type parseType(String source) throws IrException {
        LOG.debug("Parsing type from {}", options.sourceName());
        return createParser(source).parseTypeEntry();
    }

    @Override
    public BasicBlock parseBasicBlock(String source) throws IrException {
        LOG.debug("Parsing basic block from {}", options.sourceName());
        return createParser(source).parseBasicBlockEntry();
    }

    @Override
    public Function parseFunction(String source) throws IrException {
        LOG.debug("Parsing function from {}", options.sourceName());
        Function function = createParser(source).parseFunctionEntry();
        LOG.debug("Parsed function {} with {} basic blocks", function.name(), function.basicBlocks().size());
        return function;
    }

    public ParserOptions getOptions() {
        return options;
    }

    private Parser createParser(String source) {
        Objects.requireNonNull(source, "source");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics, options.sourceName()).scanTokens();
        for (Diagnostic warning : diagnostics.getWarnings()) {
            LOG.warn("{}: {}", warning.sourceInfo(), warning.message());
        }
        return new Parser(tokens, diagnostics, options.maxNestingDepth());
    }
}
