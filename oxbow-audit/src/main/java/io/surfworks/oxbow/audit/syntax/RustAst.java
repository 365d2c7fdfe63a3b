package io.surfworks.oxbow.audit.syntax;

import java.util.List;
import java.util.Objects;

import io.surfworks.oxbow.audit.syntax.RustTokenizer.Token;

/**
 * Syntax tree for the parts of a Rust source file that matter to an unsafe audit.
 *
 * Items are modelled individually. Function bodies are blocks of statements, and a
 * statement is a sequence of expression parts: nested blocks, unsafe blocks, control
 * flow, macro calls, delimited groups and plain tokens. Operator precedence is not
 * modelled.
 */
public final class RustAst {

    private RustAst() {}

    // ==================== File ====================

    public record SourceFile(List<Item> items) {
        public SourceFile {
            items = List.copyOf(items);
        }
    }

    // ==================== Items ====================

    public sealed interface Item permits FnItem, ExternBlock, StaticItem, UnionItem, ModItem, ImplItem, OtherItem {
        int line();
    }

    /**
     * A function. The body is absent for declarations ending in {@code ;}.
     */
    public record FnItem(String name, boolean isUnsafe, Block body, int line, int column) implements Item {
        public FnItem {
            Objects.requireNonNull(name, "name cannot be null");
        }

        public boolean hasBody() {
            return body != null;
        }
    }

    /**
     * An {@code extern "ABI" { ... }} block and the foreign functions it declares.
     */
    public record ExternBlock(List<String> functions, List<StaticItem> statics, int line) implements Item {
        public ExternBlock {
            functions = List.copyOf(functions);
            statics = List.copyOf(statics);
        }
    }

    public record StaticItem(String name, boolean mutable, int line) implements Item {}

    public record UnionItem(String name, int line) implements Item {}

    public record ModItem(String name, List<Item> items, int line) implements Item {
        public ModItem {
            items = List.copyOf(items);
        }
    }

    /**
     * An {@code impl} or {@code trait} block.
     */
    public record ImplItem(String keyword, boolean isUnsafe, List<Item> items, int line) implements Item {
        public ImplItem {
            items = List.copyOf(items);
        }
    }

    /**
     * Any other item: struct, enum, const, use, type, macro definitions and invocations.
     */
    public record OtherItem(String keyword, int line) implements Item {}

    // ==================== Blocks and statements ====================

    /**
     * A braced block.
     *
     * @param statements the block's statements, including its tail expression
     * @param tokens     every token from the opening brace to the closing brace inclusive
     */
    public record Block(List<Stmt> statements, List<Token> tokens, int line) {
        public Block {
            statements = List.copyOf(statements);
            tokens = List.copyOf(tokens);
        }
    }

    public sealed interface Stmt permits ItemStmt, ExprStmt {}

    public record ItemStmt(Item item) implements Stmt {}

    /**
     * An expression or {@code let} statement as a sequence of parts.
     */
    public record ExprStmt(List<Expr> parts, int line) implements Stmt {
        public ExprStmt {
            parts = List.copyOf(parts);
        }
    }

    // ==================== Expression parts ====================

    public sealed interface Expr permits Leaf, Group, BlockExpr, UnsafeBlock, ControlFlow, MacroCall {}

    /**
     * A single token that is not a delimiter.
     */
    public record Leaf(Token token) implements Expr {}

    /**
     * A parenthesized or bracketed group; commas are kept as leaves.
     */
    public record Group(Token open, List<Expr> parts) implements Expr {
        public Group {
            parts = List.copyOf(parts);
        }
    }

    public record BlockExpr(Block block) implements Expr {}

    /**
     * An {@code unsafe { ... }} block.
     */
    public record UnsafeBlock(Token keyword, Block block) implements Expr {}

    /**
     * {@code if}, {@code while}, {@code for}, {@code loop} or {@code match} with its header
     * parts and its blocks. Else branches of an {@code if} are nested control flow or a
     * trailing block.
     */
    public record ControlFlow(Token keyword, List<Expr> header, List<Block> blocks, ControlFlow elseIf)
            implements Expr {
        public ControlFlow {
            header = List.copyOf(header);
            blocks = List.copyOf(blocks);
        }
    }

    /**
     * A macro invocation such as {@code println!(...)}. Arguments are parsed as expression parts.
     */
    public record MacroCall(Token name, Group arguments) implements Expr {}
}
