package org.llfront.frontend.semantics;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SourceInfo;
import org.llfront.api.SyntaxErrorException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SymbolTable}.
 */
public class SymbolTableTest {

    /**
     * Verifies that a defined symbol can be resolved and an unknown one cannot.
     */
    @Test
    @Tag("unit")
    void testDefineAndResolve() throws SyntaxErrorException {
        // Arrange
        SymbolTable table = new SymbolTable();
        Symbol symbol = new Symbol("%x", Symbol.Type.VALUE, new SourceInfo("f.ll", 2, 3));

        // Act
        table.define(symbol);

        // Assert
        assertThat(table.resolve("%x")).contains(symbol);
        assertThat(table.resolve("%y")).isEmpty();
        assertThat(table.size()).isEqualTo(1);
    }

    /**
     * Verifies that a second definition of the same name fails and points at both definitions.
     */
    @Test
    @Tag("unit")
    void testRedefinitionIsRejected() throws SyntaxErrorException {
        // Arrange
        SymbolTable table = new SymbolTable();
        table.define(new Symbol("%entry", Symbol.Type.BLOCK, new SourceInfo("f.ll", 2, 1)));

        // Act & Assert
        assertThatThrownBy(() -> table.define(new Symbol("%entry", Symbol.Type.VALUE, new SourceInfo("f.ll", 5, 3))))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.DUPLICATE_DEFINITION);
                    assertThat(e.sourceInfo()).contains(new SourceInfo("f.ll", 5, 3));
                })
                .hasMessage("Redefinition of '%entry', first defined at f.ll:2:1 at f.ll:5:3");
        assertThat(table.resolve("%entry").get().type()).isEqualTo(Symbol.Type.BLOCK);
    }
}
