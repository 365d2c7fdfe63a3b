package io.surfworks.oxbow.audit.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for Rust source text.
 *
 * Recognizes:
 * - Identifiers and keywords, including raw identifiers (r#type)
 * - Lifetimes and loop labels: 'a, 'static, 'outer
 * - Numeric literals with suffixes: 42, 0x1F, 1_000u64, 2.5f32, 1e-3
 * - String literals: "...", b"...", r"...", r#"..."#, br"..."
 * - Character literals: 'a', b'\n', '\\u{1F600}'
 * - Punctuation, longest match first: :: -> => == != <= >= && || .. ..= += ...
 * - Comments: // line, nested block comments
 */
public final class RustTokenizer {

    public enum TokenType {
        IDENTIFIER,      // fn, unsafe, main, r#type
        LIFETIME,        // 'a, 'l0

        // Literals
        INTEGER,         // 0, 42i32, 0xff
        FLOAT,           // 1.0, 2.5f32, 1e9
        STRING,          // "...", b"...", r#"..."#
        CHAR,            // 'a', b'x'

        PUNCT,           // operators and other punctuation

        // Delimiters
        LPAREN,          // (
        RPAREN,          // )
        LBRACE,          // {
        RBRACE,          // }
        LBRACKET,        // [
        RBRACKET,        // ]
        SEMICOLON,       // ;
        COMMA,           // ,

        EOF
    }

    public record Token(TokenType type, String value, int line, int column) {
        @Override
        public String toString() {
            return String.format("%s(%s)@%d:%d", type, value, line, column);
        }

        public boolean is(TokenType type, String value) {
            return this.type == type && this.value.equals(value);
        }

        public boolean isIdentifier(String value) {
            return is(TokenType.IDENTIFIER, value);
        }

        public boolean isPunct(String value) {
            return is(TokenType.PUNCT, value);
        }
    }

    private static final String[] PUNCTUATION = {
            "<<=", ">>=", "...", "..=",
            "::", "->", "=>", "==", "!=", "<=", ">=", "&&", "||", "+=", "-=", "*=", "/=", "%=",
            "^=", "&=", "|=", "<<", ">>", "..",
            "+", "-", "*", "/", "%", "^", "!", "&", "|", "=", "<", ">", "@", ".", "#", "$", "?", "~", ":"
    };

    private final String input;
    private int pos;
    private int line;
    private int lineStart;

    public RustTokenizer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.lineStart = 0;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new Token(TokenType.EOF, "", line, column()));
        return tokens;
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private char peekChar(int offset) {
        int at = pos + offset;
        return at < input.length() ? input.charAt(at) : '\0';
    }

    private void advanceChar() {
        if (input.charAt(pos) == '\n') {
            line++;
            lineStart = pos + 1;
        }
        pos++;
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                advanceChar();
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startCol = column();
        int depth = 0;
        do {
            if (pos >= input.length()) {
                throw new RustParseException("Unterminated block comment", startLine, startCol);
            }
            if (input.charAt(pos) == '/' && peekChar(1) == '*') {
                depth++;
                pos += 2;
            } else if (input.charAt(pos) == '*' && peekChar(1) == '/') {
                depth--;
                pos += 2;
            } else {
                advanceChar();
            }
        } while (depth > 0);
    }

    private Token nextToken() {
        int startLine = line;
        int startCol = column();
        char c = input.charAt(pos);

        // Raw and byte strings, byte chars
        if (c == 'r' && (peekChar(1) == '"' || (peekChar(1) == '#' && isRawStringStart(pos + 1)))) {
            pos++;
            return rawString(startLine, startCol, "r");
        }
        if (c == 'b' && peekChar(1) == 'r' && (peekChar(2) == '"' || peekChar(2) == '#')) {
            pos += 2;
            return rawString(startLine, startCol, "br");
        }
        if (c == 'b' && peekChar(1) == '"') {
            pos++;
            return quoted(startLine, startCol, "b");
        }
        if (c == 'b' && peekChar(1) == '\'') {
            pos++;
            return charLiteral(startLine, startCol, "b");
        }

        if (c == 'r' && peekChar(1) == '#' && isIdentifierStart(peekChar(2))) {
            pos += 2;
            return identifier(startLine, startCol, "r#");
        }
        if (isIdentifierStart(c)) {
            return identifier(startLine, startCol, "");
        }
        if (Character.isDigit(c)) {
            return number(startLine, startCol);
        }
        if (c == '"') {
            return quoted(startLine, startCol, "");
        }
        if (c == '\'') {
            return quoteOrLifetime(startLine, startCol);
        }

        TokenType delimiter = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ';' -> TokenType.SEMICOLON;
            case ',' -> TokenType.COMMA;
            default -> null;
        };
        if (delimiter != null) {
            pos++;
            return new Token(delimiter, String.valueOf(c), startLine, startCol);
        }

        for (String punct : PUNCTUATION) {
            if (input.startsWith(punct, pos)) {
                pos += punct.length();
                return new Token(TokenType.PUNCT, punct, startLine, startCol);
            }
        }

        throw new RustParseException("Unexpected character '" + c + "'", startLine, startCol);
    }

    private boolean isRawStringStart(int from) {
        int i = from;
        while (i < input.length() && input.charAt(i) == '#') {
            i++;
        }
        return i < input.length() && input.charAt(i) == '"';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Raw identifiers keep their {@code r#} prefix so they never read as keywords.
     */
    private Token identifier(int startLine, int startCol, String prefix) {
        int start = pos;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }
        return new Token(TokenType.IDENTIFIER, prefix + input.substring(start, pos), startLine, startCol);
    }

    private Token number(int startLine, int startCol) {
        int start = pos;
        boolean isFloat = false;

        if (input.charAt(pos) == '0' && (peekChar(1) == 'x' || peekChar(1) == 'o' || peekChar(1) == 'b')) {
            pos += 2;
            while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
                pos++;
            }
            return new Token(TokenType.INTEGER, input.substring(start, pos), startLine, startCol);
        }

        consumeDigits();
        // 1.5 is a float; 1..2 is a range and x.0.method() a tuple access
        if (peekChar(0) == '.' && Character.isDigit(peekChar(1))) {
            isFloat = true;
            pos++;
            consumeDigits();
        } else if (peekChar(0) == '.' && peekChar(1) != '.' && !isIdentifierStart(peekChar(1))) {
            isFloat = true;
            pos++;
        }
        if (peekChar(0) == 'e' || peekChar(0) == 'E') {
            int signOffset = (peekChar(1) == '+' || peekChar(1) == '-') ? 2 : 1;
            if (Character.isDigit(peekChar(signOffset))) {
                isFloat = true;
                pos += signOffset;
                consumeDigits();
            }
        }
        // Type suffix: u8, i32, f64, usize
        int suffixStart = pos;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }
        String suffix = input.substring(suffixStart, pos);
        if (suffix.startsWith("f")) {
            isFloat = true;
        }
        return new Token(isFloat ? TokenType.FLOAT : TokenType.INTEGER,
                input.substring(start, pos), startLine, startCol);
    }

    private void consumeDigits() {
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
            pos++;
        }
    }

    private Token quoted(int startLine, int startCol, String prefix) {
        int start = pos;
        pos++;
        while (true) {
            if (pos >= input.length()) {
                throw new RustParseException("Unterminated string literal", startLine, startCol);
            }
            char c = input.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < input.length()) {
                    advanceChar();
                }
            } else if (c == '"') {
                pos++;
                break;
            } else {
                advanceChar();
            }
        }
        return new Token(TokenType.STRING, prefix + input.substring(start, pos), startLine, startCol);
    }

    private Token rawString(int startLine, int startCol, String prefix) {
        int hashes = 0;
        while (peekChar(0) == '#') {
            hashes++;
            pos++;
        }
        if (peekChar(0) != '"') {
            throw new RustParseException("Malformed raw string literal", startLine, startCol);
        }
        String terminator = "\"" + "#".repeat(hashes);
        int bodyStart = pos;
        pos++;
        while (!input.startsWith(terminator, pos)) {
            if (pos >= input.length()) {
                throw new RustParseException("Unterminated raw string literal", startLine, startCol);
            }
            advanceChar();
        }
        pos += terminator.length();
        String text = prefix + "#".repeat(hashes) + input.substring(bodyStart, pos);
        return new Token(TokenType.STRING, text, startLine, startCol);
    }

    private Token quoteOrLifetime(int startLine, int startCol) {
        char next = peekChar(1);
        boolean isChar = next == '\\'
                || (next != '\0' && next != '\'' && peekChar(2) == '\'')
                || (Character.isHighSurrogate(next) && peekChar(3) == '\'');
        if (isChar) {
            return charLiteral(startLine, startCol, "");
        }
        if (isIdentifierStart(next)) {
            pos++;
            int start = pos;
            while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
                pos++;
            }
            return new Token(TokenType.LIFETIME, "'" + input.substring(start, pos), startLine, startCol);
        }
        throw new RustParseException("Malformed character literal", startLine, startCol);
    }

    private Token charLiteral(int startLine, int startCol, String prefix) {
        int start = pos;
        pos++;
        while (true) {
            if (pos >= input.length() || input.charAt(pos) == '\n') {
                throw new RustParseException("Unterminated character literal", startLine, startCol);
            }
            char c = input.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == '\'') {
                pos++;
                break;
            } else {
                pos++;
            }
        }
        return new Token(TokenType.CHAR, prefix + input.substring(start, pos), startLine, startCol);
    }
}
