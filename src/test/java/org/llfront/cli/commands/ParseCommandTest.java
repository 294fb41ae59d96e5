package org.llfront.cli.commands;

import org.llfront.IrParser;
import org.llfront.api.IIrParser;
import org.llfront.api.IrException;
import org.llfront.api.SourceInfo;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.config.ParserOptions;
import org.llfront.ir.types.Type;
import org.llfront.junit.extensions.logging.ExpectLog;
import org.llfront.junit.extensions.logging.LogLevel;
import org.llfront.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class ParseCommandTest {

    @Mock
    private IIrParser parser;

    @TempDir
    Path tempDir;

    private final AtomicReference<ParserOptions> usedOptions = new AtomicReference<>();
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private CommandLine command(InputStream stdin) {
        ParseCommand parseCommand = new ParseCommand(options -> {
            usedOptions.set(options);
            return parser;
        }, stdin);
        return newCommandLine(parseCommand);
    }

    private CommandLine newCommandLine(ParseCommand parseCommand) {
        CommandLine commandLine = new CommandLine(parseCommand);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine;
    }

    private static InputStream stdin(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testTypeFromStandardInput() throws IrException {
        // Arrange
        when(parser.parseType("i32")).thenReturn(new Type.Integer(32));

        // Act
        int exitCode = command(stdin("i32")).execute("--kind", "type", "-");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("i32");
        assertThat(usedOptions.get().sourceName()).isEqualTo("<stdin>");
    }

    @Test
    void testDebugPrintsTheModel() throws IrException {
        // Arrange
        when(parser.parseType(anyString())).thenReturn(new Type.Integer(8));

        // Act
        int exitCode = command(stdin("i8")).execute("-k", "TYPE", "--debug", "-");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo(new Type.Integer(8).toString());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ParseCommand", messagePattern = "Parsing <stdin> failed \\[UNSUPPORTED_CONSTRUCT\\].*")
    void testParseErrorIsReported() throws IrException {
        // Arrange
        when(parser.parseBasicBlock(anyString()))
                .thenThrow(new UnsupportedConstructException("instruction 'phi'", new SourceInfo("<stdin>", 1, 6)));

        // Act
        int exitCode = command(stdin("%x = phi i32 [0, %a]")).execute("-k", "block", "-");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unsupported construct 'instruction 'phi'' at <stdin>:1:6");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*ParseCommand", messagePattern = "Cannot read .*")
    void testMissingInputFile() {
        // Act
        int exitCode = command(stdin("")).execute(tempDir.resolve("absent.ll").toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Cannot read ");
        verifyNoInteractions(parser);
    }

    @Test
    void testUnknownKind() {
        // Act
        int exitCode = command(stdin("i32")).execute("--kind", "module", "-");

        // Assert
        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown kind 'module'");
    }

    @Test
    void testFileIsParsedWithItsPathAsSourceName() throws IOException, IrException {
        // Arrange
        Path file = tempDir.resolve("f.ll");
        Files.writeString(file, "define void @f() {\n  ret void\n}\n", StandardCharsets.UTF_8);
        ParseCommand parseCommand = new ParseCommand(IrParser::new, InputStream.nullInputStream());

        // Act
        int exitCode = newCommandLine(parseCommand).execute(file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("@f()").contains("ret void");
    }

    @Test
    void testFactoryReceivesConfiguredOptions() throws IrException {
        // Arrange
        when(parser.parseType("")).thenReturn(new Type.Void());

        // Act
        command(stdin("")).execute("-k", "type", "-");

        // Assert
        assertThat(usedOptions.get().maxNestingDepth()).isEqualTo(ParserOptions.DEFAULT.maxNestingDepth());
        verify(parser).parseType("");
    }
}
