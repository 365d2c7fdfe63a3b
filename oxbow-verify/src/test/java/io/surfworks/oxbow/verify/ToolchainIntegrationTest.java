package io.surfworks.oxbow.verify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import io.surfworks.oxbow.audit.AuditReport;
import io.surfworks.oxbow.audit.UnsafeAuditor;
import io.surfworks.oxbow.codegen.RustCodeGenerator;
import io.surfworks.oxbow.detect.PatternDetector;
import io.surfworks.oxbow.detect.RewriteCandidate;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.DerefAssign;
import io.surfworks.oxbow.ir.IrAst.ExprStmt;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.Literal;
import io.surfworks.oxbow.ir.IrAst.PointerType;
import io.surfworks.oxbow.ir.IrAst.Program;
import io.surfworks.oxbow.ir.IrAst.Return;
import io.surfworks.oxbow.ir.IrAst.ScalarType;
import io.surfworks.oxbow.ir.IrAst.SizeOf;
import io.surfworks.oxbow.ir.IrAst.Unary;
import io.surfworks.oxbow.ir.IrAst.UnaryOp;
import io.surfworks.oxbow.ir.IrAst.VarDecl;
import io.surfworks.oxbow.ir.IrAst.VarRef;

/**
 * Runs the differential tester against the real gcc and rustc.
 *
 * <p>Skipped unless both compilers are on the PATH.
 */
@Tag("toolchain")
@DisplayName("Toolchain Integration")
class ToolchainIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private static boolean toolchainAvailable;

    private DifferentialTester tester;

    @BeforeAll
    static void detectToolchain() {
        toolchainAvailable = responds("gcc") && responds("rustc");
    }

    private static boolean responds(String compiler) {
        try {
            return ProcessRunner.run(List.of(compiler, "--version"), null, Duration.ofSeconds(10)).exitCode() == 0;
        } catch (IOException | TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private DifferentialTester tester() {
        assumeTrue(toolchainAvailable, "gcc and rustc are not both on the PATH");
        if (tester == null) {
            tester = new DifferentialTester(DiffTestConfig.defaults().withTimeout(TIMEOUT));
        }
        return tester;
    }

    // ==================== Hand-written Programs ====================

    @Nested
    @DisplayName("Hand-written programs")
    class HandWritten {

        @Test
        @DisplayName("hello world matches")
        void helloWorld() throws DiffTestException {
            DiffResult result = tester().diffTest(
                    "#include <stdio.h>\nint main(void) { printf(\"hello\\n\"); return 0; }\n",
                    "fn main() { println!(\"hello\"); }\n");

            assertTrue(result.passed(), () -> String.join("\n", result.divergences()));
            assertEquals("hello\n", result.originalOutput().stdout());
        }

        @Test
        @DisplayName("exit code 42 matches")
        void exitCode() throws DiffTestException {
            DiffResult result = tester().diffTest(
                    "int main(void) { return 42; }\n",
                    "fn main() { std::process::exit(42); }\n");

            assertTrue(result.passed());
            assertEquals(42, result.translatedOutput().exitCode());
        }

        @Test
        @DisplayName("different output is a divergence")
        void differentOutput() throws DiffTestException {
            DiffResult result = tester().diffTest(
                    "#include <stdio.h>\nint main(void) { printf(\"from C\\n\"); return 0; }\n",
                    "fn main() { println!(\"from Rust\"); }\n");

            assertFalse(result.passed());
            assertFalse(result.stdoutMatches());
            assertTrue(result.exitCodeMatches());
        }

        @Test
        @DisplayName("rustc errors surface as compilation failures")
        void rustCompileError() {
            CompilationException e = assertThrows(CompilationException.class,
                    () -> tester().diffTest("int main(void) { return 0; }\n", "fn main() { let x: i32 = \"no\"; }\n"));

            assertEquals(Side.TRANSLATED, e.side());
            assertTrue(e.diagnostics().contains("mismatched types"), e.diagnostics());
        }
    }

    // ==================== Generated Programs ====================

    @Nested
    @DisplayName("Generated programs")
    class Generated {

        private static final String C_SOURCE = """
                #include <stdio.h>
                #include <stdlib.h>
                int main(void) {
                    int *p = malloc(sizeof(int));
                    *p = 42;
                    printf("%d\\n", *p);
                    free(p);
                    return 0;
                }
                """;

        private Function heapProgram() {
            return new Function("main", ScalarType.INT, List.of(), List.of(
                    VarDecl.of("p", new PointerType(ScalarType.INT), Call.of("malloc", new SizeOf(ScalarType.INT))),
                    new DerefAssign(new VarRef("p"), Literal.ofInt(42)),
                    new ExprStmt(Call.of("printf", Literal.ofString("%d\n"),
                            new Unary(UnaryOp.DEREFERENCE, new VarRef("p")))),
                    new ExprStmt(Call.of("free", new VarRef("p"))),
                    Return.of(Literal.ofInt(0))));
        }

        @Test
        @DisplayName("literal and upgraded translations both behave like the C original")
        void literalAndUpgraded() throws Exception {
            DifferentialTester tester = tester();
            RustCodeGenerator generator = new RustCodeGenerator();
            Function func = heapProgram();
            Program program = new Program(List.of(func));
            List<RewriteCandidate> candidates = new PatternDetector().detect(func);

            String literal = generator.generateProgram(program);
            String upgraded = generator.generateProgramUpgraded(program, Map.of("main", candidates));

            AuditReport literalAudit = new UnsafeAuditor().audit(literal);
            AuditReport upgradedAudit = new UnsafeAuditor().audit(upgraded);
            assertFalse(literalAudit.isSafe());
            assertTrue(upgradedAudit.isSafe(), upgraded);

            DiffResult literalResult = tester.diffTest(C_SOURCE, literal);
            DiffResult upgradedResult = tester.diffTest(C_SOURCE, upgraded);

            assertTrue(literalResult.passed(), () -> literal + String.join("\n", literalResult.divergences()));
            assertTrue(upgradedResult.passed(), () -> upgraded + String.join("\n", upgradedResult.divergences()));
            assertEquals("42\n", upgradedResult.translatedOutput().stdout());
        }
    }
}
