package org.llfront.frontend.parser.features.memory;

import org.llfront.api.IrException;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.AtomicOrdering;
import org.llfront.ir.instructions.Instruction;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Handles {@code fence [syncscope("<scope>")] <ordering>}. Only orderings that
 * synchronise (acquire, release, acq_rel, seq_cst) are valid for a fence.
 */
public final class FenceHandler implements IInstructionHandler {

    private static final Set<AtomicOrdering> ORDERINGS = EnumSet.of(
            AtomicOrdering.ACQUIRE, AtomicOrdering.RELEASE, AtomicOrdering.ACQUIRE_RELEASE,
            AtomicOrdering.SEQUENTIALLY_CONSISTENT);

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'fence'
        Optional<String> syncScope = context.parseSyncScope();
        AtomicOrdering ordering = AtomicOrderings.parseAllowed(context, ORDERINGS, "a fence");
        return new Instruction.Fence(ordering, syncScope);
    }
}
