package org.llfront.frontend.parser;

import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.semantics.LocalNameResolver;
import org.llfront.frontend.semantics.ParsedBlock;
import org.llfront.frontend.semantics.ParsedParameter;
import org.llfront.ir.function.Function;
import org.llfront.ir.function.FunctionParameter;
import org.llfront.ir.function.LinkageType;
import org.llfront.ir.function.PreemptionSpecifier;
import org.llfront.ir.function.UnnamedAddress;
import org.llfront.ir.function.Visibility;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parses a function definition: the header up to the opening brace, then the basic blocks.
 * <pre>
 * define [linkage] [preemption] [visibility] [cconv] [ret attrs] &lt;type&gt; @name([params]) [unnamed_addr]
 *        [addrspace(n)] [fn attrs] [section "s"] [partition "p"] [align n] [gc "name"] { blocks }
 * </pre>
 * Once the body is complete its local names are checked by a {@link LocalNameResolver}.
 */
final class FunctionParser {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionParser.class);

    private static final Set<String> UNSUPPORTED_HEADER_CLAUSES = Set.of("comdat", "prefix", "prologue", "personality");

    private final Parser parser;

    FunctionParser(Parser parser) {
        this.parser = parser;
    }

    Function parseFunction() throws IrException {
        if (parser.checkWord("declare")) {
            throw new UnsupportedConstructException("function declaration", parser.peek().sourceInfo());
        }
        parser.consumeWord("define");
        Function.Builder builder = Function.builder();

        Optional<LinkageType> linkage = keyword(LinkageType::fromKeyword);
        linkage.ifPresent(builder::withLinkage);
        Optional<PreemptionSpecifier> preemption = keyword(PreemptionSpecifier::fromKeyword);
        preemption.ifPresent(builder::withPreemptionSpecifier);
        Optional<Visibility> visibility = keyword(Visibility::fromKeyword);
        visibility.ifPresent(builder::withVisibility);
        if (parser.checkWord("dllimport") || parser.checkWord("dllexport")) {
            throw new UnsupportedConstructException("DLL storage class", parser.peek().sourceInfo());
        }
        parser.parseCallingConvention().ifPresent(builder::withCallingConvention);
        builder.withReturnAttributes(parser.parseParameterAttributes());
        builder.withReturnType(parser.parseType());
        String name = parser.consume(TokenType.GLOBAL_ID, "a function name").text();
        builder.withName(name);

        List<ParsedParameter> parsedParameters = parseParameters(builder);
        parseTrailingHeader(builder);

        parser.consume(TokenType.LEFT_BRACE, "'{' opening the function body");
        List<ParsedBlock> blocks = new ArrayList<>();
        while (!parser.check(TokenType.RIGHT_BRACE)) {
            if (parser.isAtEnd()) {
                throw parser.unexpected("'}' closing the function body");
            }
            blocks.add(parser.parseBasicBlock());
        }
        if (blocks.isEmpty()) {
            throw parser.unexpected("a basic block");
        }
        parser.advance(); // consume '}'

        List<String> labels = new LocalNameResolver().resolve(parsedParameters, blocks, parser.references());
        for (int i = 0; i < blocks.size(); i++) {
            builder.withBasicBlock(blocks.get(i).block(), labels.get(i));
        }
        Function function = builder.build();
        LOG.debug("Parsed function {} with {} blocks", name, blocks.size());
        return function;
    }

    private List<ParsedParameter> parseParameters(Function.Builder builder) throws IrException {
        parser.consume(TokenType.LEFT_PAREN, "'(' opening the parameter list");
        List<ParsedParameter> parsed = new ArrayList<>();
        if (!parser.check(TokenType.RIGHT_PAREN)) {
            do {
                if (parser.match(TokenType.ELLIPSIS)) {
                    builder.withVarargs(true);
                    break;
                }
                Token start = parser.peek();
                Type type = parser.parseType();
                List<ParameterAttribute> attributes = parser.parseParameterAttributes();
                Optional<String> name = Optional.empty();
                if (parser.check(TokenType.LOCAL_ID)) {
                    Token nameToken = parser.advance();
                    name = Optional.of(nameToken.text());
                    start = nameToken;
                }
                builder.withParameter(new FunctionParameter(type, attributes, name));
                parsed.add(new ParsedParameter(name, start.sourceInfo()));
            } while (parser.match(TokenType.COMMA));
        }
        parser.consume(TokenType.RIGHT_PAREN, "')' closing the parameter list");
        return parsed;
    }

    private void parseTrailingHeader(Function.Builder builder) throws IrException {
        keyword(UnnamedAddress::fromKeyword).ifPresent(builder::withUnnamedAddress);
        if (parser.checkWord("addrspace")) {
            builder.withAddressSpace(parser.parseAddressSpace());
        }
        for (String attribute : parser.parseFunctionAttributes()) {
            builder.withFunctionAttribute(attribute);
        }
        while (!parser.check(TokenType.LEFT_BRACE)) {
            Token token = parser.peek();
            if (parser.matchWord("section")) {
                builder.withSection(quoted());
            } else if (parser.matchWord("partition")) {
                builder.withPartition(quoted());
            } else if (parser.matchWord("align")) {
                builder.withAlignment(parser.parseAlignmentValue());
            } else if (parser.matchWord("gc")) {
                builder.withGarbageCollector(quoted());
            } else if (token.type() == TokenType.WORD && UNSUPPORTED_HEADER_CLAUSES.contains(token.text())) {
                throw new UnsupportedConstructException("'" + token.text() + "' clause", token.sourceInfo());
            } else if (token.type() == TokenType.METADATA) {
                throw new UnsupportedConstructException("metadata attachment " + token.text(), token.sourceInfo());
            } else {
                throw parser.unexpected("'{' opening the function body");
            }
        }
    }

    private String quoted() throws SyntaxErrorException {
        return (String) parser.consume(TokenType.STRING, "a quoted name").value();
    }

    /**
     * Consumes the current token if it is a keyword of the given enumeration.
     */
    private <T> Optional<T> keyword(java.util.function.Function<String, Optional<T>> lookup) {
        if (!parser.check(TokenType.WORD)) {
            return Optional.empty();
        }
        Optional<T> value = lookup.apply(parser.peek().text());
        if (value.isPresent()) {
            parser.advance();
        }
        return value;
    }
}
