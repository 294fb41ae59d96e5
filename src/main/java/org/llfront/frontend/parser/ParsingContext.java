package org.llfront.frontend.parser;

import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.diagnostics.DiagnosticsEngine;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.ir.instructions.AtomicOrdering;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides instruction handlers with access to the token stream and the shared
 * pieces of grammar (types, values, attributes) without coupling them to the parser itself.
 */
public interface ParsingContext {

    // region Token stream

    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is one of the given bare keywords. If so, consumes it.
     * @param keywords The keywords to match.
     * @return true if a keyword was consumed.
     */
    boolean matchWord(String... keywords);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks if the current token is the given bare keyword without consuming it.
     * @param keyword The keyword.
     * @return true if the current token is the keyword.
     */
    boolean checkWord(String keyword);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type.
     */
    boolean checkNext(TokenType type);

    /**
     * Checks if the token after the current one is the given bare keyword.
     * @param keyword The keyword.
     * @return true if the next token is the keyword.
     */
    boolean checkNextWord(String keyword);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param expected A description of what was expected, for the error message.
     * @return The consumed token.
     * @throws SyntaxErrorException if the current token has another type.
     */
    Token consume(TokenType type, String expected) throws SyntaxErrorException;

    /**
     * Consumes the given bare keyword.
     * @param keyword The expected keyword.
     * @return The consumed token.
     * @throws SyntaxErrorException if the current token is not the keyword.
     */
    Token consumeWord(String keyword) throws SyntaxErrorException;

    /**
     * Creates an error saying that the current token is not what the grammar requires.
     * @param expected A description of what was expected.
     * @return The error, to be thrown by the caller.
     */
    SyntaxErrorException unexpected(String expected);

    /**
     * Gets the diagnostics engine for reporting warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    // endregion

    // region Shared grammar

    /**
     * Parses a type, including function types written as a suffix of their return type.
     * @return The type.
     * @throws IrException if the text is not a valid type.
     */
    Type parseType() throws IrException;

    /**
     * Parses a value written without its type, e.g. the second operand of {@code add i32 %a, %b}.
     * @param type The type the value is used with.
     * @return The value.
     * @throws IrException if the text is not a value, or a constant does not fit the type.
     */
    Value parseValue(Type type) throws IrException;

    /**
     * Parses a type followed by a value of that type, e.g. {@code i32 0}.
     * @return The value.
     * @throws IrException if the text is not a typed value.
     */
    Value parseTypedValue() throws IrException;

    /**
     * Parses {@code label %name}.
     * @return The label value.
     * @throws IrException if the text is not a label operand.
     */
    Value.FromLabel parseLabel() throws IrException;

    /**
     * Parses the integer following {@code align} and checks that it is a power of two.
     * The {@code align} keyword itself must already be consumed.
     * @return The alignment in bytes.
     * @throws SyntaxErrorException if the alignment is missing or invalid.
     */
    long parseAlignmentValue() throws SyntaxErrorException;

    /**
     * Parses an optional trailing {@code , align N} clause.
     * @return The alignment, or empty if the next tokens are not an alignment clause.
     * @throws SyntaxErrorException if the alignment is invalid.
     */
    OptionalLong parseTrailingAlignment() throws SyntaxErrorException;

    /**
     * Parses {@code addrspace(N)} or {@code addrspace("name")}; the keyword must be the current token.
     * @return The address space.
     * @throws SyntaxErrorException if the clause is malformed.
     */
    AddressSpace parseAddressSpace() throws SyntaxErrorException;

    /**
     * Parses an optional {@code syncscope("name")} clause.
     * @return The scope name, or empty if no clause is present.
     * @throws SyntaxErrorException if the clause is malformed.
     */
    Optional<String> parseSyncScope() throws SyntaxErrorException;

    /**
     * Parses an atomic ordering keyword.
     * @return The ordering.
     * @throws SyntaxErrorException if the current token is not an ordering.
     */
    AtomicOrdering parseOrdering() throws SyntaxErrorException;

    /**
     * Parses a possibly empty run of parameter attributes.
     * @return The attributes in textual order.
     * @throws IrException if an attribute is malformed.
     */
    List<ParameterAttribute> parseParameterAttributes() throws IrException;

    /**
     * Parses a possibly empty run of function attributes and attribute group references.
     * @return The attributes in canonical text form.
     * @throws IrException if an attribute is malformed.
     */
    List<String> parseFunctionAttributes() throws IrException;

    /**
     * Parses an optional calling convention, e.g. {@code fastcc} or {@code cc 10}.
     * @return The calling convention as written, or empty.
     * @throws SyntaxErrorException if {@code cc} is not followed by a number.
     */
    Optional<String> parseCallingConvention() throws SyntaxErrorException;

    // endregion
}
