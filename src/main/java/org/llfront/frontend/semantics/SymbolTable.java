package org.llfront.frontend.semantics;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SyntaxErrorException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The local namespace of one function. Parameters, instruction results and blocks
 * share it, so a name can be defined only once.
 */
public class SymbolTable {

    private final Map<String, Symbol> symbols = new HashMap<>();

    /**
     * Defines a new symbol.
     * @param symbol The symbol to define.
     * @throws SyntaxErrorException if the name is already defined.
     */
    public void define(Symbol symbol) throws SyntaxErrorException {
        Symbol existing = symbols.putIfAbsent(symbol.name(), symbol);
        if (existing != null) {
            throw new SyntaxErrorException(IrErrorCode.DUPLICATE_DEFINITION,
                    "Redefinition of '" + symbol.name() + "', first defined at " + existing.sourceInfo(),
                    symbol.name(), symbol.sourceInfo(), null);
        }
    }

    /**
     * Resolves a name.
     * @param name The sigil-qualified name.
     * @return The symbol, or empty if the name is not defined.
     */
    public Optional<Symbol> resolve(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * @return The number of defined symbols.
     */
    public int size() {
        return symbols.size();
    }
}
