package org.llfront.frontend.parser;

import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.ir.types.ParameterAttribute;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parses parameter attributes, function attributes and calling conventions.
 * <p>
 * Function attributes are kept as canonical text; only the keywords listed here are recognised,
 * which is what tells a trailing attribute apart from the next instruction.
 */
final class AttributeParser {

    static final Set<String> FUNCTION_ATTRIBUTES = Set.of(
            "alignstack", "allockind", "allocsize", "alwaysinline", "builtin", "cold", "convergent",
            "disable_sanitizer_instrumentation", "fn_ret_thunk_extern", "hot", "inlinehint", "jumptable",
            "memory", "minsize", "mustprogress", "naked", "nobuiltin", "nocallback", "nocf_check",
            "noduplicate", "nofree", "noimplicitfloat", "noinline", "nomerge", "nonlazybind", "noprofile",
            "norecurse", "noredzone", "noreturn", "nosanitize_bounds", "nosanitize_coverage", "nosync",
            "nounwind", "null_pointer_is_valid", "optdebug", "optforfuzzing", "optnone", "optsize",
            "presplitcoroutine", "readnone", "readonly", "returns_twice", "safestack", "sanitize_address",
            "sanitize_hwaddress", "sanitize_memory", "sanitize_memtag", "sanitize_thread", "shadowcallstack",
            "skipprofile", "speculatable", "speculative_load_hardening", "ssp", "sspreq", "sspstrong",
            "strictfp", "uwtable", "vscale_range", "willreturn", "writeonly");

    static final Set<String> CALLING_CONVENTIONS = Set.of(
            "ccc", "fastcc", "coldcc", "ghccc", "webkit_jscc", "anyregcc", "preserve_mostcc", "preserve_allcc",
            "preserve_nonecc", "cxx_fast_tlscc", "swiftcc", "swifttailcc", "tailcc", "cfguard_checkcc",
            "x86_stdcallcc", "x86_fastcallcc", "x86_thiscallcc", "x86_vectorcallcc", "x86_regcallcc",
            "x86_intrcc", "x86_64_sysvcc", "win64cc", "arm_apcscc", "arm_aapcscc", "arm_aapcs_vfpcc",
            "aarch64_vector_pcs", "aarch64_sve_vector_pcs", "msp430_intrcc", "avr_intrcc", "avr_signalcc",
            "ptx_kernel", "ptx_device", "spir_func", "spir_kernel", "intel_ocl_bicc", "amdgpu_kernel",
            "amdgpu_vs", "amdgpu_gs", "amdgpu_ps", "amdgpu_cs", "amdgpu_gfx", "riscv_vector_cc");

    private final ParsingContext context;

    AttributeParser(ParsingContext context) {
        this.context = context;
    }

    List<ParameterAttribute> parseParameterAttributes() throws IrException {
        List<ParameterAttribute> attributes = new ArrayList<>();
        while (context.check(TokenType.WORD)) {
            Optional<ParameterAttribute.Kind> kind = ParameterAttribute.Kind.fromKeyword(context.peek().text());
            if (kind.isEmpty()) {
                break;
            }
            context.advance();
            switch (kind.get().payload()) {
                case NONE:
                    attributes.add(new ParameterAttribute.Simple(kind.get()));
                    break;
                case TYPE:
                    context.consume(TokenType.LEFT_PAREN, "'(' after '" + kind.get().keyword() + "'");
                    attributes.add(new ParameterAttribute.WithType(kind.get(), context.parseType()));
                    context.consume(TokenType.RIGHT_PAREN, "')'");
                    break;
                case INTEGER:
                    attributes.add(new ParameterAttribute.WithInteger(kind.get(), parseIntegerPayload(kind.get())));
                    break;
                default:
                    throw new IllegalStateException("Unknown payload " + kind.get().payload());
            }
        }
        return attributes;
    }

    private long parseIntegerPayload(ParameterAttribute.Kind kind) throws SyntaxErrorException {
        if (kind == ParameterAttribute.Kind.ALIGN && !context.check(TokenType.LEFT_PAREN)) {
            return context.parseAlignmentValue();
        }
        context.consume(TokenType.LEFT_PAREN, "'(' after '" + kind.keyword() + "'");
        long value;
        if (kind == ParameterAttribute.Kind.ALIGN || kind == ParameterAttribute.Kind.ALIGNSTACK) {
            value = context.parseAlignmentValue();
        } else {
            Token token = context.consume(TokenType.INTEGER, "a byte count");
            BigInteger integer = (BigInteger) token.value();
            if (integer.signum() < 0 || integer.bitLength() > 63) {
                throw new SyntaxErrorException(IrErrorCode.INVALID_NUMBER, "a non-negative byte count",
                        token.text(), token.sourceInfo());
            }
            value = integer.longValue();
        }
        context.consume(TokenType.RIGHT_PAREN, "')'");
        return value;
    }

    List<String> parseFunctionAttributes() throws IrException {
        List<String> attributes = new ArrayList<>();
        while (true) {
            if (context.check(TokenType.ATTRIBUTE_GROUP)) {
                attributes.add(context.advance().text());
            } else if (context.check(TokenType.STRING)) {
                StringBuilder sb = new StringBuilder(context.advance().text());
                if (context.match(TokenType.EQUALS)) {
                    sb.append('=').append(context.consume(TokenType.STRING, "an attribute value").text());
                }
                attributes.add(sb.toString());
            } else if (context.check(TokenType.WORD) && FUNCTION_ATTRIBUTES.contains(context.peek().text())) {
                StringBuilder sb = new StringBuilder(context.advance().text());
                if (context.check(TokenType.LEFT_PAREN)) {
                    appendParenthesized(sb);
                }
                attributes.add(sb.toString());
            } else {
                return attributes;
            }
        }
    }

    /**
     * Copies a parenthesized attribute argument, e.g. {@code (argmem: readwrite, inaccessiblemem: none)}.
     */
    private void appendParenthesized(StringBuilder sb) throws SyntaxErrorException {
        Token open = context.consume(TokenType.LEFT_PAREN, "'('");
        sb.append('(');
        while (!context.check(TokenType.RIGHT_PAREN)) {
            if (context.isAtEnd()) {
                throw new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN,
                        "')' closing the attribute argument opened at " + open.sourceInfo(),
                        context.peek().text(), context.peek().sourceInfo(), null);
            }
            Token token = context.advance();
            if (token.type() == TokenType.COMMA) {
                sb.append(", ");
            } else if (token.type() == TokenType.LABEL) {
                sb.append(token.text()).append(": ");
            } else {
                sb.append(token.text());
            }
        }
        context.advance();
        sb.append(')');
    }

    Optional<String> parseCallingConvention() throws SyntaxErrorException {
        if (context.matchWord("cc")) {
            Token number = context.consume(TokenType.INTEGER, "a calling convention number");
            return Optional.of("cc " + number.text());
        }
        if (context.check(TokenType.WORD) && CALLING_CONVENTIONS.contains(context.peek().text())) {
            return Optional.of(context.advance().text());
        }
        return Optional.empty();
    }
}
