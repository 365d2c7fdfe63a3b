package io.surfworks.oxbow.audit.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import io.surfworks.oxbow.audit.syntax.RustAst.Block;
import io.surfworks.oxbow.audit.syntax.RustAst.BlockExpr;
import io.surfworks.oxbow.audit.syntax.RustAst.ControlFlow;
import io.surfworks.oxbow.audit.syntax.RustAst.Expr;
import io.surfworks.oxbow.audit.syntax.RustAst.ExprStmt;
import io.surfworks.oxbow.audit.syntax.RustAst.ExternBlock;
import io.surfworks.oxbow.audit.syntax.RustAst.FnItem;
import io.surfworks.oxbow.audit.syntax.RustAst.Group;
import io.surfworks.oxbow.audit.syntax.RustAst.ImplItem;
import io.surfworks.oxbow.audit.syntax.RustAst.Item;
import io.surfworks.oxbow.audit.syntax.RustAst.ItemStmt;
import io.surfworks.oxbow.audit.syntax.RustAst.Leaf;
import io.surfworks.oxbow.audit.syntax.RustAst.MacroCall;
import io.surfworks.oxbow.audit.syntax.RustAst.ModItem;
import io.surfworks.oxbow.audit.syntax.RustAst.OtherItem;
import io.surfworks.oxbow.audit.syntax.RustAst.SourceFile;
import io.surfworks.oxbow.audit.syntax.RustAst.StaticItem;
import io.surfworks.oxbow.audit.syntax.RustAst.Stmt;
import io.surfworks.oxbow.audit.syntax.RustAst.UnionItem;
import io.surfworks.oxbow.audit.syntax.RustAst.UnsafeBlock;
import io.surfworks.oxbow.audit.syntax.RustTokenizer.Token;
import io.surfworks.oxbow.audit.syntax.RustTokenizer.TokenType;

/**
 * Recursive descent parser for Rust source text.
 *
 * Delimiters are checked for balance before parsing starts. Items are parsed
 * individually; item signatures, types and struct bodies are skipped as balanced
 * token runs. Function bodies are split into statements whose expression parts are
 * kept as a shallow tree (see {@link RustAst}).
 */
public final class RustParser {

    private static final Set<String> KEYWORDS = Set.of(
            "as", "async", "await", "break", "const", "continue", "crate", "dyn", "else", "enum",
            "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move",
            "mut", "pub", "ref", "return", "self", "Self", "static", "struct", "super", "trait", "true",
            "type", "unsafe", "use", "where", "while");

    private static final Set<String> VALUE_KEYWORDS = Set.of("self", "Self", "true", "false", "crate", "super");

    private static final Set<String> CONTROL_FLOW = Set.of("if", "while", "for", "loop", "match");

    /** Punctuation that may end an expression: {@code x?} and {@code a..}. */
    private static final Set<String> POSTFIX = Set.of("?", "..");

    private final List<Token> tokens;
    private int pos;

    public RustParser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Tokenizes and parses Rust source text.
     *
     * @throws RustParseException if the text is not valid Rust
     */
    public static SourceFile parse(String input) {
        RustTokenizer tokenizer = new RustTokenizer(input);
        RustParser parser = new RustParser(tokenizer.tokenize());
        return parser.parseFile();
    }

    /**
     * True for reserved words, excluding those that can stand as a value or path ({@code self}, {@code true}...).
     */
    public static boolean isReserved(String word) {
        return KEYWORDS.contains(word) && !VALUE_KEYWORDS.contains(word);
    }

    public SourceFile parseFile() {
        checkDelimiters();
        List<Item> items = parseItems(TokenType.EOF);
        return new SourceFile(items);
    }

    // ==================== Delimiters ====================

    private void checkDelimiters() {
        Deque<Token> open = new ArrayDeque<>();
        for (Token t : tokens) {
            switch (t.type()) {
                case LPAREN, LBRACE, LBRACKET -> open.push(t);
                case RPAREN, RBRACE, RBRACKET -> {
                    if (open.isEmpty()) {
                        throw new RustParseException("Unexpected '" + t.value() + "'", t.line(), t.column());
                    }
                    Token opener = open.pop();
                    if (closerOf(opener.type()) != t.type()) {
                        throw new RustParseException(String.format("Mismatched '%s': '%s' opened at line %d",
                                t.value(), opener.value(), opener.line()), t.line(), t.column());
                    }
                }
                default -> {
                }
            }
        }
        if (!open.isEmpty()) {
            Token unclosed = open.peek();
            throw new RustParseException("Unclosed '" + unclosed.value() + "'", unclosed.line(), unclosed.column());
        }
    }

    private static TokenType closerOf(TokenType opener) {
        return switch (opener) {
            case LPAREN -> TokenType.RPAREN;
            case LBRACE -> TokenType.RBRACE;
            case LBRACKET -> TokenType.RBRACKET;
            default -> throw new IllegalArgumentException("Not an opening delimiter: " + opener);
        };
    }

    private static boolean isOpener(Token t) {
        return t.type() == TokenType.LPAREN || t.type() == TokenType.LBRACE || t.type() == TokenType.LBRACKET;
    }

    // ==================== Items ====================

    private List<Item> parseItems(TokenType end) {
        List<Item> items = new ArrayList<>();
        while (true) {
            skipAttributes();
            if (check(end)) {
                return items;
            }
            items.add(parseItem());
        }
    }

    private Item parseItem() {
        skipAttributes();
        skipVisibility();
        Token start = peek();

        boolean isUnsafe = false;
        while (true) {
            if (checkIdentifier("unsafe") && nextIsIdentifier("fn", "impl", "trait", "extern")) {
                isUnsafe = true;
                advance();
            } else if (checkIdentifier("const") && nextIsIdentifier("fn", "unsafe", "async", "extern")) {
                advance();
            } else if (checkIdentifier("async") && nextIsIdentifier("fn", "unsafe")) {
                advance();
            } else if (checkIdentifier("default") && nextIsIdentifier("fn", "unsafe", "const", "type")) {
                advance();
            } else if (checkIdentifier("extern") && peekAt(1).type() == TokenType.STRING
                    && peekAt(2).isIdentifier("fn")) {
                advance();
                advance();
            } else if (checkIdentifier("extern") && nextIsIdentifier("fn")) {
                advance();
            } else {
                break;
            }
        }

        Token t = peek();
        if (t.type() == TokenType.IDENTIFIER) {
            switch (t.value()) {
                case "fn":
                    return parseFn(start, isUnsafe);
                case "extern":
                    if (nextIsIdentifier("crate")) {
                        skipToSemicolon();
                        return new OtherItem("extern crate", t.line());
                    }
                    return parseExternBlock();
                case "static":
                    return parseStatic();
                case "const", "use", "type":
                    skipToSemicolon();
                    return new OtherItem(t.value(), t.line());
                case "struct", "enum":
                    skipTypeDefinition();
                    return new OtherItem(t.value(), t.line());
                case "mod":
                    return parseMod();
                case "impl", "trait":
                    return parseImpl(isUnsafe);
                default:
                    break;
            }
            if (t.value().equals("union") && peekAt(1).type() == TokenType.IDENTIFIER) {
                String name = peekAt(1).value();
                skipTypeDefinition();
                return new UnionItem(name, t.line());
            }
            if (peekAt(1).isPunct("!") && t.value().equals("macro_rules")) {
                advance();
                advance();
                expect(TokenType.IDENTIFIER);
                skipMacroBody();
                return new OtherItem("macro_rules", t.line());
            }
            if (peekAt(1).isPunct("!") && isOpener(peekAt(2))) {
                advance();
                advance();
                skipMacroBody();
                return new OtherItem("macro", t.line());
            }
        }
        throw error("Expected item, found '" + t.value() + "'");
    }

    private FnItem parseFn(Token start, boolean isUnsafe) {
        expectIdentifier("fn");
        String name = expect(TokenType.IDENTIFIER).value();
        // generics, parameters, return type, where clause
        while (!check(TokenType.LBRACE) && !check(TokenType.SEMICOLON)) {
            if (check(TokenType.EOF) || check(TokenType.RBRACE)) {
                throw error("Expected body of function '" + name + "'");
            }
            skipTokenOrGroup();
        }
        if (check(TokenType.SEMICOLON)) {
            advance();
            return new FnItem(name, isUnsafe, null, start.line(), start.column());
        }
        Block body = parseBlock(false);
        return new FnItem(name, isUnsafe, body, start.line(), start.column());
    }

    private ExternBlock parseExternBlock() {
        Token keyword = expectIdentifier("extern");
        if (check(TokenType.STRING)) {
            advance();
        }
        expect(TokenType.LBRACE);
        List<String> functions = new ArrayList<>();
        List<StaticItem> statics = new ArrayList<>();
        for (Item item : parseItems(TokenType.RBRACE)) {
            if (item instanceof FnItem fn) {
                functions.add(fn.name());
            } else if (item instanceof StaticItem s) {
                statics.add(s);
            }
        }
        expect(TokenType.RBRACE);
        return new ExternBlock(functions, statics, keyword.line());
    }

    private StaticItem parseStatic() {
        Token keyword = expectIdentifier("static");
        boolean mutable = false;
        if (checkIdentifier("mut")) {
            mutable = true;
            advance();
        }
        String name = expect(TokenType.IDENTIFIER).value();
        skipToSemicolon();
        return new StaticItem(name, mutable, keyword.line());
    }

    private ModItem parseMod() {
        Token keyword = expectIdentifier("mod");
        String name = expect(TokenType.IDENTIFIER).value();
        if (check(TokenType.SEMICOLON)) {
            advance();
            return new ModItem(name, List.of(), keyword.line());
        }
        expect(TokenType.LBRACE);
        List<Item> items = parseItems(TokenType.RBRACE);
        expect(TokenType.RBRACE);
        return new ModItem(name, items, keyword.line());
    }

    private ImplItem parseImpl(boolean isUnsafe) {
        Token keyword = advance();
        while (!check(TokenType.LBRACE)) {
            if (check(TokenType.EOF) || check(TokenType.SEMICOLON) || check(TokenType.RBRACE)) {
                throw error("Expected '{' after " + keyword.value());
            }
            skipTokenOrGroup();
        }
        expect(TokenType.LBRACE);
        List<Item> items = parseItems(TokenType.RBRACE);
        expect(TokenType.RBRACE);
        return new ImplItem(keyword.value(), isUnsafe, items, keyword.line());
    }

    /**
     * Skips a struct, enum or union: either a braced body or a tuple body followed by {@code ;}.
     */
    private void skipTypeDefinition() {
        advance();
        while (true) {
            if (check(TokenType.SEMICOLON)) {
                advance();
                return;
            }
            if (check(TokenType.LBRACE)) {
                skipGroup();
                return;
            }
            if (check(TokenType.EOF) || check(TokenType.RBRACE)) {
                throw error("Expected type body");
            }
            skipTokenOrGroup();
        }
    }

    private void skipMacroBody() {
        if (!isOpener(peek())) {
            throw error("Expected macro body");
        }
        boolean braced = check(TokenType.LBRACE);
        skipGroup();
        if (!braced) {
            expect(TokenType.SEMICOLON);
        } else if (check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private void skipAttributes() {
        while (peek().isPunct("#")) {
            advance();
            if (peek().isPunct("!")) {
                advance();
            }
            if (!check(TokenType.LBRACKET)) {
                throw error("Expected '[' after '#'");
            }
            skipGroup();
        }
    }

    private void skipVisibility() {
        if (checkIdentifier("pub")) {
            advance();
            if (check(TokenType.LPAREN)) {
                skipGroup();
            }
        }
    }

    private void skipToSemicolon() {
        while (!check(TokenType.SEMICOLON)) {
            if (check(TokenType.EOF) || check(TokenType.RBRACE)) {
                throw error("Expected ';'");
            }
            skipTokenOrGroup();
        }
        advance();
    }

    private void skipTokenOrGroup() {
        if (isOpener(peek())) {
            skipGroup();
        } else {
            advance();
        }
    }

    /**
     * Skips a balanced group starting at the current opening delimiter.
     */
    private void skipGroup() {
        int depth = 0;
        do {
            Token t = advance();
            if (isOpener(t)) {
                depth++;
            } else if (t.type() == TokenType.RPAREN || t.type() == TokenType.RBRACE
                    || t.type() == TokenType.RBRACKET) {
                depth--;
            }
        } while (depth > 0);
    }

    // ==================== Blocks and statements ====================

    private Block parseBlock(boolean matchArms) {
        int start = pos;
        Token open = expect(TokenType.LBRACE);
        List<Stmt> statements = new ArrayList<>();
        while (true) {
            skipAttributes();
            if (check(TokenType.RBRACE)) {
                break;
            }
            if (check(TokenType.SEMICOLON)) {
                advance();
                continue;
            }
            statements.add(parseStatement(matchArms));
        }
        advance();
        return new Block(statements, tokens.subList(start, pos), open.line());
    }

    private boolean startsItem() {
        Token t = peek();
        if (t.type() != TokenType.IDENTIFIER) {
            return false;
        }
        return switch (t.value()) {
            case "fn", "struct", "enum", "use", "mod", "impl", "trait", "static", "type", "extern", "pub" -> true;
            case "const" -> peekAt(1).type() == TokenType.IDENTIFIER;
            case "unsafe" -> nextIsIdentifier("fn", "impl", "trait", "extern");
            case "async" -> nextIsIdentifier("fn");
            case "union" -> peekAt(1).type() == TokenType.IDENTIFIER && !KEYWORDS.contains(peekAt(1).value());
            case "macro_rules" -> peekAt(1).isPunct("!");
            default -> false;
        };
    }

    /**
     * Parses one statement. A statement ends at {@code ;}, at the end of the block, or
     * right after a leading block-like expression ({@code if}, {@code while},
     * {@code unsafe { }}, ...), which needs no semicolon.
     */
    private Stmt parseStatement(boolean matchArms) {
        if (startsItem()) {
            return new ItemStmt(parseItem());
        }
        Token first = peek();
        List<Expr> parts = new ArrayList<>();
        boolean guardPosition = matchArms;
        while (!check(TokenType.SEMICOLON) && !check(TokenType.RBRACE)) {
            Expr part = parsePart(guardPosition);
            requireSeparated(parts, part);
            parts.add(part);
            if (matchArms) {
                guardPosition = nextArmStarts(part, guardPosition);
            }
            if (!matchArms && isBlockLike(part) && onlyLabelBefore(parts)
                    && !peek().isPunct(".") && !peek().isPunct("?")) {
                break;
            }
        }
        if (!matchArms) {
            requireComplete(parts);
        }
        if (check(TokenType.SEMICOLON)) {
            advance();
        }
        return new ExprStmt(parts, first.line());
    }

    /**
     * Rejects a statement cut short: {@code let} without a pattern, or an operator with
     * no right-hand side ({@code let x = ;}, {@code x + ;}).
     */
    private void requireComplete(List<Expr> parts) {
        if (parts.isEmpty()) {
            return;
        }
        if (parts.get(0) instanceof Leaf let && let.token().isIdentifier("let")) {
            if (parts.size() == 1 || parts.get(1) instanceof Leaf next
                    && (next.token().isPunct("=") || next.token().isPunct(":"))) {
                throw new RustParseException("Expected pattern after 'let'", let.token().line(), let.token().column());
            }
        }
        if (parts.get(parts.size() - 1) instanceof Leaf last && last.token().type() == TokenType.PUNCT
                && !POSTFIX.contains(last.token().value()) && !closesGenerics(parts, last.token())) {
            throw error("Expected expression after '" + last.token().value() + "'");
        }
    }

    /**
     * A trailing {@code >} ends a type such as {@code Vec<i32>} when a {@code <} came before it.
     */
    private static boolean closesGenerics(List<Expr> parts, Token last) {
        if (!last.isPunct(">") && !last.isPunct(">>")) {
            return false;
        }
        return parts.stream().anyMatch(p -> p instanceof Leaf leaf && leaf.token().isPunct("<"));
    }

    /**
     * Tracks whether the parser is before an arm's {@code =>}, where {@code if} starts a guard.
     * An arm ends at a comma or after a block body.
     */
    private static boolean nextArmStarts(Expr part, boolean inPattern) {
        if (part instanceof Leaf leaf) {
            if (leaf.token().isPunct("=>")) {
                return false;
            }
            if (leaf.token().type() == TokenType.COMMA) {
                return true;
            }
        }
        if (!inPattern && isBlockLike(part)) {
            return true;
        }
        return inPattern;
    }

    private static boolean isBlockLike(Expr part) {
        return part instanceof BlockExpr || part instanceof UnsafeBlock || part instanceof ControlFlow;
    }

    private static boolean onlyLabelBefore(List<Expr> parts) {
        if (parts.size() == 1) {
            return true;
        }
        return parts.size() == 3
                && parts.get(0) instanceof Leaf label && label.token().type() == TokenType.LIFETIME
                && parts.get(1) instanceof Leaf colon && colon.token().isPunct(":");
    }

    /**
     * Two operands in a row mean a statement separator is missing: {@code let a = 1 let b = 2}.
     */
    private static void requireSeparated(List<Expr> parts, Expr next) {
        if (parts.isEmpty()) {
            return;
        }
        Expr previous = parts.get(parts.size() - 1);
        if (endsOperand(previous) && startsOperand(next)) {
            Token at = firstToken(next);
            throw new RustParseException("Expected ';' before '" + at.value() + "'", at.line(), at.column());
        }
    }

    private static boolean endsOperand(Expr part) {
        if (part instanceof Group || part instanceof MacroCall) {
            return true;
        }
        return part instanceof Leaf leaf && isOperandToken(leaf.token());
    }

    private static boolean startsOperand(Expr part) {
        if (part instanceof MacroCall) {
            return true;
        }
        return part instanceof Leaf leaf
                && (isOperandToken(leaf.token()) || leaf.token().isIdentifier("let"));
    }

    private static boolean isOperandToken(Token t) {
        return switch (t.type()) {
            case INTEGER, FLOAT, STRING, CHAR -> true;
            case IDENTIFIER -> !isReserved(t.value());
            default -> false;
        };
    }

    private static Token firstToken(Expr part) {
        if (part instanceof Leaf leaf) {
            return leaf.token();
        }
        if (part instanceof MacroCall call) {
            return call.name();
        }
        if (part instanceof Group group) {
            return group.open();
        }
        if (part instanceof UnsafeBlock block) {
            return block.keyword();
        }
        if (part instanceof ControlFlow flow) {
            return flow.keyword();
        }
        if (part instanceof BlockExpr block) {
            return block.block().tokens().get(0);
        }
        throw new IllegalStateException("Unhandled expression part: " + part);
    }

    // ==================== Expression parts ====================

    private Expr parsePart(boolean guardPosition) {
        Token t = peek();
        switch (t.type()) {
            case LPAREN, LBRACKET:
                return parseGroup();
            case LBRACE:
                return new BlockExpr(parseBlock(false));
            case RPAREN, RBRACE, RBRACKET:
                throw error("Unexpected '" + t.value() + "'");
            case EOF:
                throw error("Unexpected end of input");
            case IDENTIFIER:
                if (t.value().equals("unsafe")) {
                    if (peekAt(1).type() == TokenType.LBRACE) {
                        advance();
                        return new UnsafeBlock(t, parseBlock(false));
                    }
                    // unsafe fn pointer types: let f: unsafe extern "C" fn(i32)
                    if (!nextIsIdentifier("fn", "extern")) {
                        advance();
                        throw error("Expected block after 'unsafe'");
                    }
                }
                if (CONTROL_FLOW.contains(t.value()) && !(guardPosition && t.value().equals("if"))) {
                    return parseControlFlow();
                }
                if (peekAt(1).isPunct("!") && isOpener(peekAt(2))) {
                    advance();
                    advance();
                    return new MacroCall(t, parseGroup());
                }
                advance();
                return new Leaf(t);
            default:
                advance();
                return new Leaf(t);
        }
    }

    /**
     * Parses a delimited group. Braced groups only occur as macro arguments.
     */
    private Group parseGroup() {
        Token open = advance();
        TokenType close = closerOf(open.type());
        List<Expr> parts = new ArrayList<>();
        while (!check(close)) {
            parts.add(parsePart(false));
        }
        advance();
        return new Group(open, parts);
    }

    private ControlFlow parseControlFlow() {
        Token keyword = advance();
        List<Expr> header = new ArrayList<>();
        List<Block> blocks = new ArrayList<>();

        if (keyword.value().equals("loop")) {
            blocks.add(parseBlock(false));
            return new ControlFlow(keyword, header, blocks, null);
        }

        // the header ends at the first top-level '{'; Rust forbids struct literals there
        while (!check(TokenType.LBRACE)) {
            if (check(TokenType.SEMICOLON) || check(TokenType.RBRACE) || check(TokenType.RPAREN)
                    || check(TokenType.RBRACKET) || check(TokenType.EOF)) {
                throw error("Expected block after '" + keyword.value() + "'");
            }
            header.add(parsePart(false));
        }
        if (header.isEmpty()) {
            throw error("Expected expression after '" + keyword.value() + "'");
        }
        blocks.add(parseBlock(keyword.value().equals("match")));

        ControlFlow elseIf = null;
        if (keyword.value().equals("if") && checkIdentifier("else")) {
            advance();
            if (checkIdentifier("if")) {
                elseIf = parseControlFlow();
            } else {
                blocks.add(parseBlock(false));
            }
        }
        return new ControlFlow(keyword, header, blocks, elseIf);
    }

    // ==================== Helpers ====================

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int at = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(at);
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF) {
            pos++;
        }
        return t;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkIdentifier(String value) {
        return peek().isIdentifier(value);
    }

    private boolean nextIsIdentifier(String... values) {
        Token next = peekAt(1);
        for (String value : values) {
            if (next.isIdentifier(value)) {
                return true;
            }
        }
        return false;
    }

    private Token expect(TokenType type) {
        Token t = peek();
        if (t.type() != type) {
            throw error("Expected " + type + ", got " + t.type() + " (" + t.value() + ")");
        }
        return advance();
    }

    private Token expectIdentifier(String value) {
        Token t = peek();
        if (!t.isIdentifier(value)) {
            throw error("Expected '" + value + "', got '" + t.value() + "'");
        }
        return advance();
    }

    private RustParseException error(String message) {
        Token t = peek();
        return new RustParseException(message, t.line(), t.column());
    }
}
