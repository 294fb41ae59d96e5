package org.llfront.frontend.parser.features.memory;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.AtomicOrdering;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.values.Value;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Handles the plain and the atomic form of {@code store}.
 * <pre>
 * store [volatile] &lt;ty&gt; &lt;value&gt;, ptr &lt;pointer&gt; [, align &lt;n&gt;]
 * store atomic [volatile] &lt;ty&gt; &lt;value&gt;, ptr &lt;pointer&gt; [syncscope("&lt;scope&gt;")] &lt;ordering&gt;, align &lt;n&gt;
 * </pre>
 * An atomic store may not have acquire semantics.
 */
public final class StoreHandler implements IInstructionHandler {

    private static final Set<AtomicOrdering> ATOMIC_ORDERINGS = EnumSet.of(
            AtomicOrdering.UNORDERED, AtomicOrdering.MONOTONIC, AtomicOrdering.RELEASE,
            AtomicOrdering.SEQUENTIALLY_CONSISTENT);

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'store'
        boolean isAtomic = context.matchWord("atomic");
        boolean isVolatile = context.matchWord("volatile");
        Value value = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' after the stored value");
        Value pointer = context.parseTypedValue();

        if (!isAtomic) {
            return new Instruction.Store(isVolatile, value, pointer, context.parseTrailingAlignment());
        }
        Optional<String> syncScope = context.parseSyncScope();
        AtomicOrdering ordering = AtomicOrderings.parseAllowed(context, ATOMIC_ORDERINGS, "an atomic store");
        context.consume(TokenType.COMMA, "', align' after the ordering of an atomic store");
        context.consumeWord("align");
        long alignment = context.parseAlignmentValue();
        return new Instruction.AtomicStore(isVolatile, value, pointer, ordering, syncScope, alignment);
    }
}
