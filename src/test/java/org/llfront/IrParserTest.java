package org.llfront;

import org.llfront.api.IrException;
import org.llfront.config.ParserOptions;
import org.llfront.ir.function.Function;
import org.llfront.junit.extensions.logging.ExpectLog;
import org.llfront.junit.extensions.logging.LogLevel;
import org.llfront.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the parser facade: options, reported file names and forwarded lexer warnings.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class IrParserTest {

    @Test
    void testDefaultOptions() {
        assertThat(new IrParser().getOptions()).isEqualTo(ParserOptions.DEFAULT);
    }

    @Test
    void testErrorsNameTheConfiguredSource() {
        // Arrange
        IrParser parser = new IrParser(ParserOptions.DEFAULT.withSourceName("x.ll"));

        // Act & Assert
        assertThatThrownBy(() -> parser.parseType("i0"))
                .isInstanceOf(IrException.class)
                .hasMessageEndingWith("at x.ll:1:1");
    }

    @Test
    void testNullSourceIsRejected() {
        assertThatThrownBy(() -> new IrParser().parseType(null))
                .isInstanceOf(NullPointerException.class);
    }

    /**
     * A literal with a backslash is accepted, and the lexer warning is logged with its position.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*IrParser",
            messagePattern = "<memory>:1:\\d+: Escape sequences are kept verbatim.*")
    void testEscapeWarningIsLogged() throws IrException {
        // Act
        Function function = new IrParser().parseFunction("define void @f() section \"a\\01\" {\n  ret void\n}");

        // Assert
        assertThat(function.section()).contains("a\\01");
    }
}
