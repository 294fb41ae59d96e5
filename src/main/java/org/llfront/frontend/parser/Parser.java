package org.llfront.frontend.parser;

import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.SourceInfo;
import org.llfront.api.SyntaxErrorException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.diagnostics.Diagnostic;
import org.llfront.diagnostics.DiagnosticsEngine;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.opcode.ITerminatorHandler;
import org.llfront.frontend.opcode.OpcodeHandlerRegistry;
import org.llfront.frontend.semantics.LocalReference;
import org.llfront.frontend.semantics.ParsedBlock;
import org.llfront.ir.function.BasicBlock;
import org.llfront.ir.function.Function;
import org.llfront.ir.function.Operation;
import org.llfront.ir.instructions.AtomicOrdering;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The main parser for textual IR. It consumes the token list produced by the
 * {@link org.llfront.frontend.lexer.Lexer} and builds types, basic blocks and functions.
 * <p>
 * Instructions and terminators are parsed by the handlers of the {@link OpcodeHandlerRegistry};
 * the parser itself owns the block structure and the grammar shared between handlers.
 * A parser instance reads exactly one entry (a type, a block or a function) and is not reusable.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final OpcodeHandlerRegistry opcodeRegistry;
    private final TypeParser typeParser;
    private final ValueParser valueParser;
    private final AttributeParser attributeParser;
    private final List<LocalReference> references = new ArrayList<>();
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, ending with {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine the lexer reported to; lexical errors found there abort parsing.
     * @param maxNestingDepth The deepest nesting of type and constant syntax that is accepted.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, int maxNestingDepth) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.opcodeRegistry = OpcodeHandlerRegistry.initialize();
        NestingGuard nesting = new NestingGuard(maxNestingDepth);
        this.typeParser = new TypeParser(this, nesting);
        this.valueParser = new ValueParser(this, nesting, references::add);
        this.attributeParser = new AttributeParser(this);
    }

    // region Entry points

    /**
     * Parses the whole token stream as a single type.
     * @return The type.
     * @throws IrException if the input is not exactly one valid type.
     */
    public Type parseTypeEntry() throws IrException {
        failOnLexicalErrors();
        Type type = parseType();
        consume(TokenType.END_OF_FILE, "end of input after the type");
        return type;
    }

    /**
     * Parses the whole token stream as a single basic block. Local names are kept as written;
     * they can only be checked against a complete function.
     * @return The block.
     * @throws IrException if the input is not exactly one valid block.
     */
    public BasicBlock parseBasicBlockEntry() throws IrException {
        failOnLexicalErrors();
        BasicBlock block = parseBasicBlock().block();
        consume(TokenType.END_OF_FILE, "end of input after the terminator");
        return block;
    }

    /**
     * Parses the whole token stream as a single function definition and resolves its local names.
     * @return The function.
     * @throws IrException if the input is not exactly one valid function definition.
     */
    public Function parseFunctionEntry() throws IrException {
        failOnLexicalErrors();
        Function function = new FunctionParser(this).parseFunction();
        consume(TokenType.END_OF_FILE, "end of input after the function body");
        return function;
    }

    private void failOnLexicalErrors() throws SyntaxErrorException {
        Optional<Diagnostic> error = diagnostics.firstError();
        if (error.isPresent()) {
            Diagnostic diagnostic = error.get();
            throw new SyntaxErrorException(diagnostic.code(), diagnostic.message(), "", diagnostic.sourceInfo(), null);
        }
    }

    // endregion

    // region Blocks

    /**
     * Parses an optional label, any number of operations and the closing terminator.
     * @return The block together with the positions needed for name resolution.
     * @throws IrException if the block is malformed.
     */
    ParsedBlock parseBasicBlock() throws IrException {
        Token start = peek();
        Optional<String> name = Optional.empty();
        if (match(TokenType.LABEL)) {
            name = Optional.of(previous().text());
        }

        List<Operation> operations = new ArrayList<>();
        List<SourceInfo> positions = new ArrayList<>();
        while (true) {
            Token first = peek();
            if (check(TokenType.LOCAL_ID) && checkNext(TokenType.EQUALS)) {
                advance(); // consume name
                advance(); // consume '='
                Token opcode = peek();
                if (opcode.type() == TokenType.WORD && opcodeRegistry.isTerminator(opcode.text())) {
                    parseTerminator();
                    throw new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN,
                            "an instruction that produces a value", opcode.text(), opcode.sourceInfo());
                }
                Instruction instruction = parseInstruction();
                if (instruction.resultType() instanceof Type.Void) {
                    throw new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN,
                            "Cannot assign the result of '" + opcode.text() + "', it produces no value",
                            first.text(), first.sourceInfo(), null);
                }
                operations.add(new Operation.Assignment(first.text(), instruction));
                positions.add(first.sourceInfo());
            } else if (first.type() == TokenType.WORD && opcodeRegistry.isTerminator(first.text())) {
                Terminator terminator = parseTerminator();
                LOG.debug("Parsed block {} with {} operations", name.orElse("<unnamed>"), operations.size());
                return new ParsedBlock(new BasicBlock(name, operations, terminator), start.sourceInfo(), positions);
            } else if (first.type() == TokenType.WORD) {
                operations.add(new Operation.Standalone(parseInstruction()));
                positions.add(first.sourceInfo());
            } else {
                throw unexpected("an instruction or a terminator");
            }
        }
    }

    private Instruction parseInstruction() throws IrException {
        Token opcode = peek();
        Optional<IInstructionHandler> handler = opcodeRegistry.getInstruction(opcode.text());
        if (handler.isEmpty()) {
            throw new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN, "an opcode", opcode.text(), opcode.sourceInfo());
        }
        Instruction instruction = handler.get().parse(this);
        rejectMetadataAttachment();
        return instruction;
    }

    private Terminator parseTerminator() throws IrException {
        Token opcode = peek();
        ITerminatorHandler handler = opcodeRegistry.getTerminator(opcode.text())
                .orElseThrow(() -> new IllegalStateException("Not a terminator: " + opcode.text()));
        Terminator terminator = handler.parse(this);
        rejectMetadataAttachment();
        return terminator;
    }

    private void rejectMetadataAttachment() throws UnsupportedConstructException {
        if (check(TokenType.COMMA) && checkNext(TokenType.METADATA)) {
            Token attachment = tokens.get(current + 1);
            throw new UnsupportedConstructException("metadata attachment " + attachment.text(), attachment.sourceInfo());
        }
    }

    /**
     * @return Every use of a local name read so far, in textual order.
     */
    List<LocalReference> references() {
        return references;
    }

    // endregion

    // region Token stream

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean matchWord(String... keywords) {
        for (String keyword : keywords) {
            if (checkWord(keyword)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    @Override
    public boolean checkWord(String keyword) {
        return peek().isWord(keyword);
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public boolean checkNextWord(String keyword) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).isWord(keyword);
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String expected) throws SyntaxErrorException {
        if (check(type)) return advance();
        throw unexpected(expected);
    }

    @Override
    public Token consumeWord(String keyword) throws SyntaxErrorException {
        if (checkWord(keyword)) return advance();
        throw unexpected("'" + keyword + "'");
    }

    @Override
    public SyntaxErrorException unexpected(String expected) {
        Token token = peek();
        String found = token.type() == TokenType.END_OF_FILE ? "end of input" : token.text();
        return new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN, expected, found, token.sourceInfo());
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    // endregion

    // region Shared grammar

    @Override
    public Type parseType() throws IrException {
        return typeParser.parseType();
    }

    @Override
    public Value parseValue(Type type) throws IrException {
        return valueParser.parseValue(type);
    }

    @Override
    public Value parseTypedValue() throws IrException {
        return valueParser.parseTypedValue();
    }

    @Override
    public Value.FromLabel parseLabel() throws IrException {
        consumeWord("label");
        if (!check(TokenType.LOCAL_ID)) {
            throw unexpected("a label name");
        }
        return (Value.FromLabel) valueParser.parseValue(new Type.Label());
    }

    @Override
    public long parseAlignmentValue() throws SyntaxErrorException {
        Token token = consume(TokenType.INTEGER, "an alignment");
        BigInteger value = (BigInteger) token.value();
        // LLVM caps alignments at 2^32.
        if (value.signum() <= 0 || value.bitCount() != 1 || value.bitLength() > 33) {
            throw new SyntaxErrorException(IrErrorCode.INVALID_ALIGNMENT, "a power of two alignment",
                    token.text(), token.sourceInfo());
        }
        return value.longValue();
    }

    @Override
    public OptionalLong parseTrailingAlignment() throws SyntaxErrorException {
        if (check(TokenType.COMMA) && checkNextWord("align")) {
            advance(); // consume ','
            advance(); // consume 'align'
            return OptionalLong.of(parseAlignmentValue());
        }
        return OptionalLong.empty();
    }

    @Override
    public AddressSpace parseAddressSpace() throws SyntaxErrorException {
        consumeWord("addrspace");
        consume(TokenType.LEFT_PAREN, "'(' after 'addrspace'");
        AddressSpace addressSpace;
        if (check(TokenType.STRING)) {
            addressSpace = new AddressSpace.Named((String) advance().value());
        } else {
            Token token = consume(TokenType.INTEGER, "an address space number or name");
            BigInteger number = (BigInteger) token.value();
            if (number.signum() < 0 || number.bitLength() > 24) {
                throw new SyntaxErrorException(IrErrorCode.INVALID_NUMBER, "an address space number below 2^24",
                        token.text(), token.sourceInfo());
            }
            addressSpace = new AddressSpace.Numbered(number.longValue());
        }
        consume(TokenType.RIGHT_PAREN, "')'");
        return addressSpace;
    }

    @Override
    public Optional<String> parseSyncScope() throws SyntaxErrorException {
        if (!matchWord("syncscope")) {
            return Optional.empty();
        }
        consume(TokenType.LEFT_PAREN, "'(' after 'syncscope'");
        String scope = (String) consume(TokenType.STRING, "a synchronisation scope name").value();
        consume(TokenType.RIGHT_PAREN, "')'");
        return Optional.of(scope);
    }

    @Override
    public AtomicOrdering parseOrdering() throws SyntaxErrorException {
        Optional<AtomicOrdering> ordering = check(TokenType.WORD)
                ? AtomicOrdering.fromKeyword(peek().text())
                : Optional.empty();
        if (ordering.isEmpty()) {
            throw unexpected("an atomic ordering");
        }
        advance();
        return ordering.get();
    }

    @Override
    public List<ParameterAttribute> parseParameterAttributes() throws IrException {
        return attributeParser.parseParameterAttributes();
    }

    @Override
    public List<String> parseFunctionAttributes() throws IrException {
        return attributeParser.parseFunctionAttributes();
    }

    @Override
    public Optional<String> parseCallingConvention() throws SyntaxErrorException {
        return attributeParser.parseCallingConvention();
    }

    // endregion
}
