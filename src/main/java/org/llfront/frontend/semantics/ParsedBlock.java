package org.llfront.frontend.semantics;

import org.llfront.api.SourceInfo;
import org.llfront.ir.function.BasicBlock;

import java.util.List;

/**
 * A basic block together with the source positions the name resolution reports against.
 *
 * @param block The block.
 * @param sourceInfo The position of the block's label, or of its first token if it has none.
 * @param operationPositions The position of each operation, parallel to {@code block.operations()}.
 */
public record ParsedBlock(BasicBlock block, SourceInfo sourceInfo, List<SourceInfo> operationPositions) {
    public ParsedBlock {
        operationPositions = List.copyOf(operationPositions);
        if (operationPositions.size() != block.operations().size()) {
            throw new IllegalArgumentException("One position per operation required");
        }
    }
}
