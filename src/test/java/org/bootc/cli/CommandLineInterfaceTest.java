package org.bootc.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code bootc} command line in-process and checks output streams and exit codes.
 */
@Tag("integration")
public class CommandLineInterfaceTest {

    private static final String PROGRAM = "int main() { int x; x = 5; return x; }\n";
    private static final String EXPECTED_C =
            "int main(void) {\n"
            + "    int x;\n"
            + "    x = 5;\n"
            + "    return x;\n"
            + "}\n";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path source(String name, String text) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text);
        return file;
    }

    @Test
    void testCommandName() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());

        assertThat(commandLine.getCommandName()).isEqualTo("bootc");
        assertThat(commandLine.getSubcommands()).containsKeys("translate", "build", "lex", "ast", "help");
    }

    @Test
    void testTranslatePrintsC() throws IOException {
        int exitCode = run("translate", source("main.bc", PROGRAM).toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo(EXPECTED_C);
    }

    @Test
    void testTranslateWritesOutputFile() throws IOException {
        Path target = tempDir.resolve("main.c");

        int exitCode = run("translate", "-o", target.toString(), source("main.bc", PROGRAM).toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(target)).isEqualTo(EXPECTED_C);
    }

    @Test
    void testStrictAssignmentFromConfigFile() throws IOException {
        Path config = source("strict.conf", "bootc.compiler.strict-assignment = true\n");
        Path program = source("main.bc", "int main() { x + 5; }");

        int exitCode = run("-c", config.toString(), "translate", program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_COMPILATION_ERROR);
        assertThat(err.toString()).startsWith("ParseError: Expected '=' but found OP '+'");
    }

    @Test
    void testLexPrintsTokens() throws IOException {
        int exitCode = run("lex", source("main.bc", "int x;").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("1:1 INT 'int'\n1:5 ID 'x'\n1:6 SEMI ';'\n");
    }

    @Test
    void testAstPrintsTree() throws IOException {
        int exitCode = run("ast", source("main.bc", "int main() { return 1+2; }").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo(
                "Function main\n"
                + "  Return\n"
                + "    BinaryOp +\n"
                + "      IntegerLiteral 1\n"
                + "      IntegerLiteral 2\n");
    }

    @Test
    void testParseErrorExitsWithOneAndNoOutput() throws IOException {
        Path program = source("main.bc", "int main() { int x = 1 return x; }");

        int exitCode = run("translate", program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_COMPILATION_ERROR);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).startsWith("ParseError: Expected SEMI but found RETURN 'return'");
    }

    @Test
    void testLexErrorExitsWithOne() throws IOException {
        int exitCode = run("lex", source("main.bc", "int main() { return 1 # 2; }").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_COMPILATION_ERROR);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).startsWith("LexError: Unexpected character '#'");
    }

    @Test
    void testMissingSourceFileExitsWithTwo() {
        int exitCode = run("translate", tempDir.resolve("absent.bc").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(err.toString()).contains("Cannot read");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testBuildRunsConfiguredToolchain() throws IOException {
        Path config = source("fake-cc.conf",
                "bootc.toolchain { command = sh, arguments = [\"-c\", \"cp \\\"$0\\\" \\\"$2\\\"\"] }\n");
        Path executable = tempDir.resolve("main");

        int exitCode = run("-c", config.toString(), "build", "-o", executable.toString(),
                source("main.bc", PROGRAM).toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(Files.readString(executable)).isEqualTo(EXPECTED_C);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testBuildFailureExitsWithTwo() throws IOException {
        Path config = source("broken-cc.conf",
                "bootc.toolchain { command = sh, arguments = [\"-c\", \"echo 'cc: fatal'; exit 1\"] }\n");

        int exitCode = run("-c", config.toString(), "build", "-o", tempDir.resolve("main").toString(),
                source("main.bc", PROGRAM).toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(err.toString()).contains("exited with code 1").contains("cc: fatal");
    }
}
