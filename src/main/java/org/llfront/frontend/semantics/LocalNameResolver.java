package org.llfront.frontend.semantics;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SourceInfo;
import org.llfront.api.SyntaxErrorException;
import org.llfront.ir.function.Operation;
import org.llfront.ir.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks the local names of one function body once it has been parsed completely.
 * <p>
 * The first pass walks parameters, blocks and instructions in textual order, assigns slot
 * numbers to everything unnamed and defines every name in a {@link SymbolTable}. Numbered
 * names must follow the slot sequence exactly: unnamed and numbered parameters first, then
 * per block the block itself followed by its value-producing instructions.
 * <p>
 * The second pass resolves every recorded use: a {@code label %x} operand must name a block,
 * any other local operand a parameter or instruction result. Uses may precede definitions.
 */
public class LocalNameResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LocalNameResolver.class);

    private final SymbolTable symbolTable = new SymbolTable();
    private long nextSlot = 0;

    /**
     * Resolves the local names of a function body.
     *
     * @param parameters The formal parameters in order.
     * @param blocks The blocks in order.
     * @param references Every use of a local name in the body.
     * @return The label of each block without sigil, parallel to {@code blocks}; unlabeled blocks
     *         receive their slot number.
     * @throws SyntaxErrorException on a duplicate definition, an out-of-sequence number or an undefined name.
     */
    public List<String> resolve(List<ParsedParameter> parameters, List<ParsedBlock> blocks,
                                List<LocalReference> references) throws SyntaxErrorException {
        List<String> labels = collectDefinitions(parameters, blocks);
        resolveReferences(references);
        LOG.debug("Resolved {} local names and {} uses", symbolTable.size(), references.size());
        return labels;
    }

    private List<String> collectDefinitions(List<ParsedParameter> parameters, List<ParsedBlock> blocks)
            throws SyntaxErrorException {
        for (ParsedParameter parameter : parameters) {
            define(parameter.name(), Symbol.Type.PARAMETER, parameter.sourceInfo());
        }
        List<String> labels = new ArrayList<>(blocks.size());
        for (ParsedBlock parsed : blocks) {
            Optional<String> label = parsed.block().name().map(name -> "%" + name);
            String defined = define(label, Symbol.Type.BLOCK, parsed.sourceInfo());
            labels.add(defined.substring(1));

            List<Operation> operations = parsed.block().operations();
            for (int i = 0; i < operations.size(); i++) {
                Operation operation = operations.get(i);
                SourceInfo position = parsed.operationPositions().get(i);
                if (operation instanceof Operation.Assignment assignment) {
                    define(Optional.of(assignment.identifier()), Symbol.Type.VALUE, position);
                } else if (!(operation.instruction().resultType() instanceof Type.Void)) {
                    // An unnamed result still takes a slot.
                    define(Optional.empty(), Symbol.Type.VALUE, position);
                }
            }
        }
        return labels;
    }

    /**
     * Defines a local name, or the next slot number if the name is absent.
     * @return The name that was defined, with sigil.
     */
    private String define(Optional<String> name, Symbol.Type type, SourceInfo sourceInfo) throws SyntaxErrorException {
        String effective;
        if (name.isEmpty()) {
            effective = "%" + nextSlot++;
        } else {
            effective = name.get();
            OptionalSlot slot = OptionalSlot.of(effective);
            if (slot.isNumbered()) {
                if (slot.number() != nextSlot) {
                    throw new SyntaxErrorException(IrErrorCode.NUMBERING_MISMATCH,
                            "%" + nextSlot, effective, sourceInfo);
                }
                nextSlot++;
            }
        }
        symbolTable.define(new Symbol(effective, type, sourceInfo));
        return effective;
    }

    private void resolveReferences(List<LocalReference> references) throws SyntaxErrorException {
        for (LocalReference reference : references) {
            Optional<Symbol> symbol = symbolTable.resolve(reference.name());
            if (reference.isLabel()) {
                if (symbol.isEmpty() || symbol.get().type() != Symbol.Type.BLOCK) {
                    throw new SyntaxErrorException(IrErrorCode.UNDEFINED_LABEL,
                            "Use of undefined label '" + reference.name() + "'",
                            reference.name(), reference.sourceInfo(), null);
                }
            } else if (symbol.isEmpty() || symbol.get().type() == Symbol.Type.BLOCK) {
                throw new SyntaxErrorException(IrErrorCode.UNDEFINED_VALUE,
                        "Use of undefined value '" + reference.name() + "'",
                        reference.name(), reference.sourceInfo(), null);
            }
        }
    }

    /**
     * The slot number a local name stands for, if it is a numbered name like {@code %3}.
     */
    private record OptionalSlot(long number) {
        private static final OptionalSlot NONE = new OptionalSlot(-1);

        static OptionalSlot of(String name) {
            String body = name.substring(1);
            for (int i = 0; i < body.length(); i++) {
                if (!Character.isDigit(body.charAt(i))) {
                    return NONE;
                }
            }
            try {
                return new OptionalSlot(Long.parseLong(body));
            } catch (NumberFormatException e) {
                return NONE;
            }
        }

        boolean isNumbered() {
            return number >= 0;
        }
    }
}
