package org.llfront.frontend.lexer;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SourceInfo;
import org.llfront.diagnostics.DiagnosticsEngine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * textual IR into a sequence of tokens.
 * <p>
 * Comments run from ';' to the end of the line. Whitespace, line breaks included,
 * only separates tokens. Problems are reported to the {@link DiagnosticsEngine} and
 * scanning continues, so one pass reports every lexical error.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source text as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source text as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the text being parsed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source text.
     * @return A list of the recognized tokens, always ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = current - lineStart + 1;
            scanToken();
        }
        tokenLine = line;
        tokenColumn = current - lineStart + 1;
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, tokenLine, tokenColumn, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ',': addToken(TokenType.COMMA); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '<': addToken(TokenType.LESS); break;
            case '>': addToken(TokenType.GREATER); break;
            case '=': addToken(TokenType.EQUALS); break;
            case '*': addToken(TokenType.STAR); break;
            case '"': string(); break;
            case ';':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '%': identifier(TokenType.LOCAL_ID); break;
            case '@': identifier(TokenType.GLOBAL_ID); break;
            case '$': identifier(TokenType.COMDAT); break;
            case '!':
                while (isNameChar(peek())) advance();
                addToken(TokenType.METADATA);
                break;
            case '#':
                if (!isDigit(peek())) {
                    error(IrErrorCode.UNEXPECTED_CHARACTER, "Expected attribute group number after '#'");
                    break;
                }
                while (isDigit(peek())) advance();
                Long group = slotNumber(source.substring(start + 1, current));
                if (group != null) addToken(TokenType.ATTRIBUTE_GROUP, group);
                break;
            case '-':
                // If a minus is followed by a digit, it's a negative number.
                if (isDigit(peek())) {
                    number();
                } else {
                    error(IrErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: " + c);
                }
                break;
            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    word();
                }
                break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                newLine();
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isNameStart(c)) {
                    word();
                } else {
                    error(IrErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: " + c);
                }
                break;
        }
    }

    private void identifier(TokenType type) {
        if (peek() == '"') {
            error(IrErrorCode.UNEXPECTED_CHARACTER, "Quoted names are not supported");
            advance();
            while (peek() != '"' && peek() != '\n' && !isAtEnd()) advance();
            if (peek() == '"') advance();
            return;
        }
        if (isDigit(peek())) {
            while (isDigit(peek())) advance();
            if (isNameChar(peek())) {
                while (isNameChar(peek())) advance();
                error(IrErrorCode.UNEXPECTED_CHARACTER, "Invalid name: " + source.substring(start, current));
                return;
            }
            Long slot = slotNumber(source.substring(start + 1, current));
            if (slot != null) addToken(type, slot);
            return;
        }
        if (!isNameStart(peek())) {
            error(IrErrorCode.UNEXPECTED_CHARACTER, "Expected a name after '" + source.charAt(start) + "'");
            return;
        }
        while (isNameChar(peek())) advance();
        addToken(type);
    }

    private void word() {
        while (isNameChar(peek())) advance();
        if (peek() == ':') {
            String name = source.substring(start, current);
            advance();
            addToken(TokenType.LABEL, null, name);
            return;
        }
        addToken(TokenType.WORD);
    }

    private void number() {
        // Hexadecimal floats: 0x, 0xK, 0xL, 0xM, 0xH and 0xR prefixes.
        if (previous() == '0' && peek() == 'x' && start == current - 1) {
            advance();
            if ("KLMHR".indexOf(peek()) >= 0) advance();
            if (!isHexDigit(peek())) {
                error(IrErrorCode.INVALID_NUMBER, "Invalid number format: " + source.substring(start, current));
                return;
            }
            while (isHexDigit(peek())) advance();
            addToken(TokenType.FLOAT);
            return;
        }
        while (isDigit(peek())) advance();
        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        } else if (peek() == '.' && !isNameStart(peekNext())) {
            // "1." is a valid float literal
            isFloat = true;
            advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }
        String numberString = source.substring(start, current);
        if (isFloat) {
            addToken(TokenType.FLOAT);
            return;
        }
        if (peek() == ':' && source.charAt(start) != '-') {
            advance();
            Long slot = slotNumber(numberString);
            if (slot != null) addToken(TokenType.LABEL, slot, numberString);
            return;
        }
        if (isNameChar(peek())) {
            while (isNameChar(peek())) advance();
            error(IrErrorCode.INVALID_NUMBER, "Invalid number format: " + source.substring(start, current));
            return;
        }
        addToken(TokenType.INTEGER, new BigInteger(numberString));
    }

    /**
     * Reads the digits of a numbered name, label or attribute group.
     * @return The number, or {@code null} after reporting an error if it does not fit a {@code long}.
     */
    private Long slotNumber(String digits) {
        BigInteger value = new BigInteger(digits);
        if (value.bitLength() > 63) {
            error(IrErrorCode.INVALID_NUMBER, "Number too large: " + source.substring(start, current));
            return null;
        }
        return value.longValue();
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') {
                advance();
                newLine();
                continue;
            }
            advance();
        }

        if (isAtEnd()) {
            error(IrErrorCode.UNTERMINATED_STRING, "Unterminated string.");
            return;
        }

        // The closing "
        advance();

        String content = source.substring(start + 1, current - 1);
        if (EscapeSequences.containsEscapes(content)) {
            diagnostics.reportWarning(IrErrorCode.VERBATIM_ESCAPE,
                    "Escape sequences are kept verbatim in \"" + content + "\"", sourceInfo());
        }
        // The text of the token is the string *with* quotes, the value is the content.
        addToken(TokenType.STRING, EscapeSequences.decode(content), source.substring(start, current));
    }

    private void error(IrErrorCode code, String message) {
        diagnostics.reportError(code, message, sourceInfo());
    }

    private SourceInfo sourceInfo() {
        return new SourceInfo(logicalFileName, tokenLine, tokenColumn);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        addToken(type, literal, text);
    }

    private void addToken(TokenType type, Object literal, String text) {
        tokens.add(new Token(type, text, literal, tokenLine, tokenColumn, logicalFileName));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' || c == '.' || c == '$' || c == '-';
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || isDigit(c);
    }
}
