package io.surfworks.oxbow.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.oxbow.detect.AliasPolicy;
import io.surfworks.oxbow.detect.IdiomFamily;
import io.surfworks.oxbow.detect.PatternDetector;
import io.surfworks.oxbow.detect.RewriteCandidate;
import io.surfworks.oxbow.ir.IrAst.ArrayType;
import io.surfworks.oxbow.ir.IrAst.Assign;
import io.surfworks.oxbow.ir.IrAst.Binary;
import io.surfworks.oxbow.ir.IrAst.BinaryOp;
import io.surfworks.oxbow.ir.IrAst.Break;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.Continue;
import io.surfworks.oxbow.ir.IrAst.DerefAssign;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.ExprStmt;
import io.surfworks.oxbow.ir.IrAst.For;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.If;
import io.surfworks.oxbow.ir.IrAst.Index;
import io.surfworks.oxbow.ir.IrAst.IndexAssign;
import io.surfworks.oxbow.ir.IrAst.Literal;
import io.surfworks.oxbow.ir.IrAst.Param;
import io.surfworks.oxbow.ir.IrAst.PointerType;
import io.surfworks.oxbow.ir.IrAst.Program;
import io.surfworks.oxbow.ir.IrAst.Return;
import io.surfworks.oxbow.ir.IrAst.ScalarType;
import io.surfworks.oxbow.ir.IrAst.SizeOf;
import io.surfworks.oxbow.ir.IrAst.Stmt;
import io.surfworks.oxbow.ir.IrAst.Unary;
import io.surfworks.oxbow.ir.IrAst.UnaryOp;
import io.surfworks.oxbow.ir.IrAst.VarDecl;
import io.surfworks.oxbow.ir.IrAst.VarRef;
import io.surfworks.oxbow.ir.IrAst.While;

/**
 * Tests for literal and upgraded Rust generation.
 */
@DisplayName("Rust Code Generator")
class RustCodeGeneratorTest {

    private static final PointerType INT_PTR = new PointerType(ScalarType.INT);

    private final RustCodeGenerator generator = new RustCodeGenerator();

    private static Function main(Stmt... body) {
        return new Function("main", ScalarType.INT, List.of(), List.of(body));
    }

    private static VarRef var(String name) {
        return new VarRef(name);
    }

    private static Expr mallocInt() {
        return Call.of("malloc", new SizeOf(ScalarType.INT));
    }

    private static Stmt printInt(Expr value) {
        return new ExprStmt(Call.of("printf", Literal.ofString("%d\n"), value));
    }

    private static Stmt free(String name) {
        return new ExprStmt(Call.of("free", var(name)));
    }

    private static Stmt strcpy(String target, String text) {
        return new ExprStmt(Call.of("strcpy", var(target), Literal.ofString(text)));
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    /** malloc one int, store through it, print it, free it. */
    private static Function heapProgram() {
        return main(
                VarDecl.of("p", INT_PTR, mallocInt()),
                new DerefAssign(var("p"), Literal.ofInt(42)),
                printInt(new Unary(UnaryOp.DEREFERENCE, var("p"))),
                free("p"),
                Return.of(Literal.ofInt(0)));
    }

    // ==================== Literal Translation ====================

    @Nested
    @DisplayName("Literal translation")
    class LiteralTests {

        @Test
        @DisplayName("translates scalars and statement increments")
        void scalarsAndIncrements() throws CodegenException {
            Function func = main(
                    VarDecl.of("x", ScalarType.INT, Literal.ofInt(5)),
                    new ExprStmt(new Unary(UnaryOp.POST_INCREMENT, var("x"))),
                    Return.of(Literal.ofInt(0)));

            assertEquals(lines(
                    "fn main() {",
                    "    let mut x: i32 = 5;",
                    "    x += 1;",
                    "    std::process::exit(0);",
                    "}"), generator.generate(func));
        }

        @Test
        @DisplayName("keeps raw pointers and wraps every access in unsafe")
        void rawPointers() throws CodegenException {
            assertEquals(lines(
                    "fn main() {",
                    "    let mut p: *mut i32 = unsafe { malloc(std::mem::size_of::<i32>()) as *mut i32 };",
                    "    unsafe { *p = 42; }",
                    "    print!(\"{}\\n\", unsafe { *p });",
                    "    unsafe { free(p as *mut std::ffi::c_void) };",
                    "    std::process::exit(0);",
                    "}"), generator.generate(heapProgram()));
        }

        @Test
        @DisplayName("renders value-context increments as blocks")
        void valueIncrements() throws CodegenException {
            Function func = main(
                    VarDecl.of("i", ScalarType.INT, Literal.ofInt(0)),
                    VarDecl.of("a", ScalarType.INT, new Unary(UnaryOp.PRE_INCREMENT, var("i"))),
                    VarDecl.of("b", ScalarType.INT, new Unary(UnaryOp.POST_DECREMENT, var("i"))));

            String rust = generator.generate(func);

            assertTrue(rust.contains("let mut a: i32 = { i += 1; i };"), rust);
            assertTrue(rust.contains("let mut b: i32 = { let __tmp = i; i -= 1; __tmp };"), rust);
        }

        @Test
        @DisplayName("increments through a raw pointer offset inside unsafe")
        void pointerOffsetIncrement() throws CodegenException {
            Function bump = new Function("bump", ScalarType.VOID, List.of(new Param("p", INT_PTR)), List.of(
                    new ExprStmt(new Unary(UnaryOp.POST_INCREMENT, new Index(var("p"), Literal.ofInt(2))))));

            assertEquals(lines(
                    "fn bump(mut p: *mut i32) {",
                    "    unsafe { *p.offset(2 as isize) += 1; }",
                    "}"), generator.generate(bump));
        }

        @Test
        @DisplayName("takes addresses of locals as raw pointers")
        void addressOf() throws CodegenException {
            Function func = main(
                    VarDecl.of("x", ScalarType.INT, Literal.ofInt(1)),
                    VarDecl.of("q", INT_PTR, new Unary(UnaryOp.ADDRESS_OF, var("x"))));

            assertTrue(generator.generate(func).contains("let mut q: *mut i32 = (&mut x as *mut i32);"));
        }

        @Test
        @DisplayName("lowers for loops with continue to labelled blocks")
        void forWithContinue() throws CodegenException {
            Stmt loop = new For(
                    Optional.of(VarDecl.of("i", ScalarType.INT, Literal.ofInt(0))),
                    new Binary(BinaryOp.LT, var("i"), Literal.ofInt(3)),
                    Optional.of(new ExprStmt(new Unary(UnaryOp.POST_INCREMENT, var("i")))),
                    List.of(
                            If.of(new Binary(BinaryOp.EQ, var("i"), Literal.ofInt(1)), List.of(new Continue())),
                            printInt(var("i"))));

            assertEquals(lines(
                    "fn main() {",
                    "    {",
                    "        let mut i: i32 = 0;",
                    "        'l0: while i < 3 {",
                    "            'b0: {",
                    "                if i == 1 {",
                    "                    break 'b0;",
                    "                }",
                    "                print!(\"{}\\n\", i);",
                    "            }",
                    "            i += 1;",
                    "        }",
                    "    }",
                    "}"), generator.generate(main(loop)));
        }

        @Test
        @DisplayName("tests integers and pointers for truthiness")
        void truthiness() throws CodegenException {
            Function func = main(
                    VarDecl.of("n", ScalarType.INT, Literal.ofInt(3)),
                    VarDecl.of("p", INT_PTR, Literal.nul()),
                    new While(var("n"), List.of(new ExprStmt(new Unary(UnaryOp.PRE_DECREMENT, var("n"))))),
                    If.of(new Unary(UnaryOp.LOGICAL_NOT, var("p")), List.of(Return.of(Literal.ofInt(1)))));

            String rust = generator.generate(func);

            assertTrue(rust.contains("while n != 0 {"), rust);
            assertTrue(rust.contains("if p.is_null() {"), rust);
            assertTrue(rust.contains("let mut p: *mut i32 = std::ptr::null_mut();"), rust);
        }

        @Test
        @DisplayName("parenthesizes by C precedence")
        void precedence() throws CodegenException {
            Expr sum = new Binary(BinaryOp.ADD, var("a"), var("b"));
            Function func = main(
                    VarDecl.of("a", ScalarType.INT, Literal.ofInt(1)),
                    VarDecl.of("b", ScalarType.INT, Literal.ofInt(2)),
                    VarDecl.of("c", ScalarType.INT, new Binary(BinaryOp.MUL, sum, Literal.ofInt(3))),
                    VarDecl.of("d", ScalarType.INT, new Binary(BinaryOp.SUB, var("a"), sum)));

            String rust = generator.generate(func);

            assertTrue(rust.contains("let mut c: i32 = (a + b) * 3;"), rust);
            assertTrue(rust.contains("let mut d: i32 = a - (a + b);"), rust);
        }

        @Test
        @DisplayName("formats characters and floats for printf")
        void printfConversions() throws CodegenException {
            Function func = main(
                    VarDecl.of("c", ScalarType.CHAR, Literal.ofChar('A')),
                    VarDecl.of("f", ScalarType.FLOAT, Literal.ofInt(2)),
                    new ExprStmt(Call.of("printf", Literal.ofString("%c %f\n"), var("c"), var("f"))));

            String rust = generator.generate(func);

            assertTrue(rust.contains("let mut c: u8 = b'A';"), rust);
            assertTrue(rust.contains("let mut f: f32 = 2.0;"), rust);
            assertTrue(rust.contains("print!(\"{} {:.6}\\n\", char::from(c), f);"), rust);
        }

        @Test
        @DisplayName("reinterprets %u arguments as unsigned")
        void printfUnsigned() throws CodegenException {
            Function func = main(
                    VarDecl.of("x", ScalarType.INT, Literal.ofInt(-1)),
                    new ExprStmt(Call.of("printf", Literal.ofString("%u %d\n"), var("x"), var("x"))));

            String rust = generator.generate(func);

            assertTrue(rust.contains("print!(\"{} {}\\n\", (x as u32), x);"), rust);
        }

        @Test
        @DisplayName("renders float literals with a fractional part")
        void floatLiterals() throws CodegenException {
            Function func = main(
                    VarDecl.of("f", ScalarType.FLOAT, Literal.ofFloat("1.5f")),
                    VarDecl.of("g", ScalarType.FLOAT, Literal.ofFloat("2")));

            String rust = generator.generate(func);

            assertTrue(rust.contains("let mut f: f32 = 1.5;"), rust);
            assertTrue(rust.contains("let mut g: f32 = 2.0;"), rust);
        }

        @Test
        @DisplayName("passes string functions through to the C library")
        void libcPassThrough() throws CodegenException {
            Function func = main(
                    VarDecl.uninitialized("buf", ArrayType.sized(ScalarType.CHAR, 8)),
                    strcpy("buf", "hi"),
                    printInt(Call.of("strlen", var("buf"))));

            String rust = generator.generate(func);

            assertTrue(rust.contains("unsafe { strcpy(buf.as_mut_ptr(), (b\"hi\\0\".as_ptr() as *mut u8)) };"), rust);
            assertTrue(rust.contains("print!(\"{}\\n\", (unsafe { strlen(buf.as_mut_ptr()) } as i32));"), rust);
        }

        @Test
        @DisplayName("equals upgraded generation with no candidates")
        void literalEqualsEmptyUpgrade() throws CodegenException {
            Function func = heapProgram();

            assertEquals(generator.generate(func), generator.generateUpgraded(func, List.of()));
        }
    }

    // ==================== Upgraded Translation ====================

    @Nested
    @DisplayName("Upgraded translation")
    class UpgradedTests {

        @Test
        @DisplayName("replaces a single allocation with Box and drops its free")
        void boxUpgrade() throws CodegenException {
            Function func = heapProgram();
            List<RewriteCandidate> candidates = new PatternDetector().detect(func);

            assertEquals(lines(
                    "fn main() {",
                    "    let mut p: Box<i32> = Box::new(0i32);",
                    "    *p = 42;",
                    "    print!(\"{}\\n\", *p);",
                    "    std::process::exit(0);",
                    "}"), generator.generateUpgraded(func, candidates));
        }

        @Test
        @DisplayName("replaces an array allocation with Vec")
        void vecUpgrade() throws CodegenException {
            Function func = main(
                    VarDecl.of("n", ScalarType.INT, Literal.ofInt(4)),
                    VarDecl.of("a", INT_PTR, Call.of("calloc", var("n"), new SizeOf(ScalarType.INT))),
                    new IndexAssign(var("a"), Literal.ofInt(0), Literal.ofInt(7)),
                    printInt(new Index(var("a"), Literal.ofInt(0))),
                    free("a"));

            assertEquals(lines(
                    "fn main() {",
                    "    let mut n: i32 = 4;",
                    "    let mut a: Vec<i32> = vec![0i32; n as usize];",
                    "    a[0] = 7;",
                    "    print!(\"{}\\n\", a[0]);",
                    "}"), generator.generateUpgraded(func, new PatternDetector().detect(func)));
        }

        @Test
        @DisplayName("replaces a nullable pointer with Option<Box>")
        void optionUpgrade() throws CodegenException {
            Function func = main(
                    VarDecl.of("head", INT_PTR, Literal.nul()),
                    If.of(new Binary(BinaryOp.EQ, var("head"), Literal.nul()),
                            List.of(new ExprStmt(Call.of("puts", Literal.ofString("empty"))))),
                    new Assign("head", mallocInt()),
                    free("head"),
                    Return.of(Literal.ofInt(0)));

            assertEquals(lines(
                    "fn main() {",
                    "    let mut head: Option<Box<i32>> = None;",
                    "    if head.is_none() {",
                    "        println!(\"empty\");",
                    "    }",
                    "    head = Some(Box::new(0i32));",
                    "    head = None;",
                    "    std::process::exit(0);",
                    "}"), generator.generateUpgraded(func, new PatternDetector().detect(func)));
        }

        @Test
        @DisplayName("replaces a strcpy-filled buffer with String")
        void stringUpgrade() throws CodegenException {
            Function func = main(
                    VarDecl.uninitialized("buf", ArrayType.sized(ScalarType.CHAR, 16)),
                    strcpy("buf", "hello"),
                    new ExprStmt(Call.of("printf", Literal.ofString("%s %d\n"),
                            var("buf"), Call.of("strlen", var("buf")))),
                    new ExprStmt(Call.of("puts", var("buf"))),
                    Return.of(Literal.ofInt(0)));
            List<RewriteCandidate> candidates = new PatternDetector().detect(func);

            assertEquals(List.of(RewriteCandidate.of("buf", 0, IdiomFamily.STRING_COPY)), candidates);
            assertEquals(lines(
                    "fn main() {",
                    "    let mut buf: String = String::new();",
                    "    buf = String::from(\"hello\");",
                    "    print!(\"{} {}\\n\", buf, (buf.len() as i32));",
                    "    println!(\"{}\", buf);",
                    "    std::process::exit(0);",
                    "}"), generator.generateUpgraded(func, candidates));
        }

        @Test
        @DisplayName("keeps a nullable pointer retargeted at a local raw under every policy")
        void retargetedNullableStaysRaw() throws CodegenException {
            Function func = main(
                    VarDecl.of("x", ScalarType.INT, Literal.ofInt(5)),
                    VarDecl.of("p", INT_PTR, Literal.nul()),
                    new Assign("p", new Unary(UnaryOp.ADDRESS_OF, var("x"))),
                    Return.of(new Unary(UnaryOp.DEREFERENCE, var("p"))));

            for (AliasPolicy policy : AliasPolicy.values()) {
                List<RewriteCandidate> candidates = new PatternDetector().withAliasPolicy(policy).detect(func);

                assertEquals(generator.generate(func), generator.generateUpgraded(func, candidates), policy.name());
            }
        }

        @Test
        @DisplayName("keeps a stepped heap pointer raw under every policy")
        void steppedPointerStaysRaw() throws CodegenException {
            Function func = main(
                    VarDecl.of("p", INT_PTR, mallocInt()),
                    new ExprStmt(new Unary(UnaryOp.POST_INCREMENT, var("p"))),
                    Return.of(Literal.ofInt(0)));

            for (AliasPolicy policy : AliasPolicy.values()) {
                List<RewriteCandidate> candidates = new PatternDetector().withAliasPolicy(policy).detect(func);

                String rust = generator.generateUpgraded(func, candidates);
                assertTrue(rust.contains("p = p.wrapping_add(1);"), rust);
            }
        }

        @Test
        @DisplayName("leaves declarations without candidates raw")
        void partialUpgrade() throws CodegenException {
            Function func = main(
                    VarDecl.of("p", INT_PTR, mallocInt()),
                    VarDecl.of("q", INT_PTR, mallocInt()),
                    free("q"),
                    free("p"));
            RewriteCandidate onlyP = new RewriteCandidate("p", 0, IdiomFamily.HEAP_ALLOCATION, OptionalInt.of(3));

            String rust = generator.generateUpgraded(func, List.of(onlyP));

            assertTrue(rust.contains("let mut p: Box<i32> = Box::new(0i32);"), rust);
            assertTrue(rust.contains("let mut q: *mut i32 = unsafe {"), rust);
            assertTrue(rust.contains("unsafe { free(q as *mut std::ffi::c_void) };"), rust);
            assertFalse(rust.contains("free(p"), rust);
        }

        @Test
        @DisplayName("is deterministic")
        void deterministic() throws CodegenException {
            Function func = heapProgram();
            List<RewriteCandidate> candidates = new PatternDetector().detect(func);

            assertEquals(generator.generateUpgraded(func, candidates), generator.generateUpgraded(func, candidates));
        }
    }

    // ==================== Program Mode ====================

    @Nested
    @DisplayName("Program mode")
    class ProgramTests {

        @Test
        @DisplayName("declares only the C primitives in use")
        void externBlock() throws CodegenException {
            String rust = generator.generateProgram(new Program(List.of(heapProgram())));

            assertTrue(rust.startsWith(RustCodeGenerator.LINT_HEADER), rust);
            assertTrue(rust.contains(lines(
                    "extern \"C\" {",
                    "    fn free(ptr: *mut std::ffi::c_void);",
                    "    fn malloc(size: usize) -> *mut std::ffi::c_void;",
                    "}")), rust);
            assertFalse(rust.contains("calloc"), rust);
        }

        @Test
        @DisplayName("omits the extern block once allocations are upgraded")
        void noExternsAfterUpgrade() throws CodegenException {
            Function func = heapProgram();
            Map<String, List<RewriteCandidate>> candidates = Map.of("main", new PatternDetector().detect(func));

            String rust = generator.generateProgramUpgraded(new Program(List.of(func)), candidates);

            assertFalse(rust.contains("extern"), rust);
        }

        @Test
        @DisplayName("coerces arguments to callee parameter types")
        void userCalls() throws CodegenException {
            Function square = new Function("square", ScalarType.FLOAT,
                    List.of(new Param("x", ScalarType.FLOAT)),
                    List.of(Return.of(new Binary(BinaryOp.MUL, var("x"), var("x")))));
            Function entry = main(
                    VarDecl.of("n", ScalarType.INT, Literal.ofInt(3)),
                    VarDecl.of("r", ScalarType.FLOAT, Call.of("square", var("n"))));

            String rust = generator.generateProgram(new Program(List.of(square, entry)));

            assertTrue(rust.contains("fn square(mut x: f32) -> f32 {"), rust);
            assertTrue(rust.contains("let mut r: f32 = square((n as f32));"), rust);
        }

        @Test
        @DisplayName("declares the string functions it passes through")
        void libcExterns() throws CodegenException {
            Function func = main(
                    VarDecl.uninitialized("buf", ArrayType.sized(ScalarType.CHAR, 8)),
                    strcpy("buf", "hi"),
                    printInt(Call.of("strlen", var("buf"))),
                    Return.of(Literal.ofInt(0)));

            String literal = generator.generateProgram(new Program(List.of(func)));
            String upgraded = generator.generateProgramUpgraded(new Program(List.of(func)),
                    Map.of("main", new PatternDetector().detect(func)));

            assertTrue(literal.contains(lines(
                    "extern \"C\" {",
                    "    fn strcpy(dest: *mut u8, src: *const u8) -> *mut u8;",
                    "    fn strlen(s: *const u8) -> usize;",
                    "}")), literal);
            assertFalse(upgraded.contains("extern"), upgraded);
            assertFalse(upgraded.contains("unsafe {"), upgraded);
        }

        @Test
        @DisplayName("rejects candidates for unknown functions")
        void unknownFunctionCandidates() {
            Program program = new Program(List.of(heapProgram()));

            assertThrows(CodegenException.class,
                    () -> generator.generateProgramUpgraded(program, Map.of("other", List.of())));
        }
    }

    // ==================== Malformed Input ====================

    @Nested
    @DisplayName("Malformed input")
    class MalformedTests {

        @Test
        @DisplayName("rejects candidates pointing past the body")
        void candidateOutOfRange() {
            RewriteCandidate candidate = RewriteCandidate.of("p", 9, IdiomFamily.HEAP_ALLOCATION);

            assertThrows(CodegenException.class, () -> generator.generateUpgraded(heapProgram(), List.of(candidate)));
        }

        @Test
        @DisplayName("rejects candidates whose family does not match the declaration")
        void candidateFamilyMismatch() {
            RewriteCandidate candidate = RewriteCandidate.of("p", 0, IdiomFamily.NULLABLE_POINTER);

            CodegenException e = assertThrows(CodegenException.class,
                    () -> generator.generateUpgraded(heapProgram(), List.of(candidate)));
            assertTrue(e.getMessage().contains("does not point at a matching declaration"));
        }

        @Test
        @DisplayName("rejects unknown variables")
        void unknownVariable() {
            Function func = main(new Assign("ghost", Literal.ofInt(1)));

            CodegenException e = assertThrows(CodegenException.class, () -> generator.generate(func));
            assertEquals("Unknown variable 'ghost' in function main", e.getMessage());
        }

        @Test
        @DisplayName("rejects incrementing a non-lvalue")
        void incrementNonLvalue() {
            Function func = main(VarDecl.of("x", ScalarType.INT,
                    new Unary(UnaryOp.POST_INCREMENT, Literal.ofInt(1))));

            CodegenException e = assertThrows(CodegenException.class, () -> generator.generate(func));
            assertTrue(e.getMessage().startsWith("Cannot increment non-lvalue"));
        }

        @Test
        @DisplayName("rejects printf without a literal format")
        void printfNeedsLiteralFormat() {
            Function func = main(
                    VarDecl.of("fmt", new PointerType(ScalarType.CHAR), Literal.ofString("%d")),
                    new ExprStmt(Call.of("printf", var("fmt"), Literal.ofInt(1))));

            assertThrows(CodegenException.class, () -> generator.generate(func));
        }

        @Test
        @DisplayName("rejects printf argument count mismatches")
        void printfArgumentCount() {
            Function func = main(new ExprStmt(Call.of("printf", Literal.ofString("%d %d\n"), Literal.ofInt(1))));

            assertThrows(CodegenException.class, () -> generator.generate(func));
        }

        @Test
        @DisplayName("rejects break outside a loop")
        void breakOutsideLoop() {
            Function func = main(new Break());

            assertThrows(CodegenException.class, () -> generator.generate(func));
        }

        @Test
        @DisplayName("rejects raw access to an upgraded string")
        void rawAccessToString() {
            Function func = main(
                    VarDecl.uninitialized("buf", ArrayType.sized(ScalarType.CHAR, 8)),
                    new IndexAssign(var("buf"), Literal.ofInt(0), Literal.ofChar('x')));
            RewriteCandidate candidate = RewriteCandidate.of("buf", 0, IdiomFamily.STRING_COPY);

            CodegenException e = assertThrows(CodegenException.class,
                    () -> generator.generateUpgraded(func, List.of(candidate)));
            assertEquals("String variable 'buf' cannot be used as a raw pointer", e.getMessage());
        }

        @Test
        @DisplayName("rejects C library calls with the wrong argument count")
        void libcArgumentCount() {
            Function func = main(new ExprStmt(Call.of("strlen", Literal.ofString("a"), Literal.ofString("b"))));

            assertThrows(CodegenException.class, () -> generator.generate(func));
        }

        @Test
        @DisplayName("rejects pointer arithmetic on an upgraded variable")
        void arithmeticOnOwned() {
            Function func = main(
                    VarDecl.of("p", INT_PTR, mallocInt()),
                    new ExprStmt(new Unary(UnaryOp.POST_INCREMENT, var("p"))));
            RewriteCandidate candidate = RewriteCandidate.of("p", 0, IdiomFamily.HEAP_ALLOCATION);

            assertThrows(CodegenException.class, () -> generator.generateUpgraded(func, List.of(candidate)));
        }
    }
}
