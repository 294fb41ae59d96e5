package org.llfront.frontend.parser.features.memory;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.AtomicOrdering;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Handles the plain and the atomic form of {@code load}.
 * <pre>
 * load [volatile] &lt;ty&gt;, ptr &lt;pointer&gt; [, align &lt;n&gt;]
 * load atomic [volatile] &lt;ty&gt;, ptr &lt;pointer&gt; [syncscope("&lt;scope&gt;")] &lt;ordering&gt;, align &lt;n&gt;
 * </pre>
 * An atomic load may not have release semantics.
 */
public final class LoadHandler implements IInstructionHandler {

    private static final Set<AtomicOrdering> ATOMIC_ORDERINGS = EnumSet.of(
            AtomicOrdering.UNORDERED, AtomicOrdering.MONOTONIC, AtomicOrdering.ACQUIRE,
            AtomicOrdering.SEQUENTIALLY_CONSISTENT);

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'load'
        boolean isAtomic = context.matchWord("atomic");
        boolean isVolatile = context.matchWord("volatile");
        Type resultType = context.parseType();
        context.consume(TokenType.COMMA, "',' after the loaded type");
        Value pointer = context.parseTypedValue();

        if (!isAtomic) {
            return new Instruction.Load(isVolatile, resultType, pointer, context.parseTrailingAlignment());
        }
        Optional<String> syncScope = context.parseSyncScope();
        AtomicOrdering ordering = AtomicOrderings.parseAllowed(context, ATOMIC_ORDERINGS, "an atomic load");
        context.consume(TokenType.COMMA, "', align' after the ordering of an atomic load");
        context.consumeWord("align");
        long alignment = context.parseAlignmentValue();
        return new Instruction.AtomicLoad(isVolatile, resultType, pointer, ordering, syncScope, alignment);
    }
}
