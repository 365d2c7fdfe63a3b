package io.surfworks.oxbow.audit.syntax;

import io.surfworks.oxbow.audit.syntax.RustTokenizer.Token;
import io.surfworks.oxbow.audit.syntax.RustTokenizer.TokenType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RustTokenizerTest {

    private static List<Token> tokenize(String input) {
        return new RustTokenizer(input).tokenize();
    }

    private static List<String> values(String input) {
        return tokenize(input).stream()
                .filter(t -> t.type() != TokenType.EOF)
                .map(Token::value)
                .toList();
    }

    @Nested
    class BasicTokens {

        @Test
        void emptyInputYieldsOnlyEof() {
            List<Token> tokens = tokenize("");
            assertEquals(1, tokens.size());
            assertEquals(TokenType.EOF, tokens.get(0).type());
        }

        @Test
        void functionHeader() {
            List<Token> tokens = tokenize("fn main() {}");

            assertEquals(7, tokens.size());
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals("fn", tokens.get(0).value());
            assertEquals("main", tokens.get(1).value());
            assertEquals(TokenType.LPAREN, tokens.get(2).type());
            assertEquals(TokenType.RPAREN, tokens.get(3).type());
            assertEquals(TokenType.LBRACE, tokens.get(4).type());
            assertEquals(TokenType.RBRACE, tokens.get(5).type());
            assertEquals(TokenType.EOF, tokens.get(6).type());
        }

        @Test
        void tracksLinesAndColumns() {
            List<Token> tokens = tokenize("a\n  b");

            assertEquals(1, tokens.get(0).line());
            assertEquals(1, tokens.get(0).column());
            assertEquals(2, tokens.get(1).line());
            assertEquals(3, tokens.get(1).column());
        }

        @Test
        void tokenToStringShowsPosition() {
            assertEquals("IDENTIFIER(fn)@1:1", tokenize("fn").get(0).toString());
        }

        @Test
        void rawIdentifierKeepsPrefix() {
            Token t = tokenize("r#match").get(0);
            assertEquals(TokenType.IDENTIFIER, t.type());
            assertEquals("r#match", t.value());
        }
    }

    @Nested
    class Literals {

        @ParameterizedTest
        @ValueSource(strings = {"42", "42i32", "0x1F", "1_000u64", "0b1010"})
        void integers(String text) {
            Token t = tokenize(text).get(0);
            assertEquals(TokenType.INTEGER, t.type());
            assertEquals(text, t.value());
        }

        @ParameterizedTest
        @ValueSource(strings = {"1.5", "2.5f32", "1e-3", "3f64", "6.02E23"})
        void floats(String text) {
            Token t = tokenize(text).get(0);
            assertEquals(TokenType.FLOAT, t.type());
            assertEquals(text, t.value());
        }

        @Test
        void rangeIsNotFloat() {
            assertEquals(List.of("1", "..", "2"), values("1..2"));
            assertEquals(TokenType.INTEGER, tokenize("1..2").get(0).type());
        }

        @Test
        void tupleFieldAccess() {
            assertEquals(List.of("pair", ".", "0"), values("pair.0"));
        }

        @Test
        void stringWithEscapes() {
            Token t = tokenize("\"a \\\"b\\\" c\"").get(0);
            assertEquals(TokenType.STRING, t.type());
            assertEquals("\"a \\\"b\\\" c\"", t.value());
        }

        @Test
        void rawStringWithHashes() {
            Token t = tokenize("r#\"say \"hi\"\"#").get(0);
            assertEquals(TokenType.STRING, t.type());
            assertEquals("r#\"say \"hi\"\"#", t.value());
        }

        @Test
        void byteStringAndByteChar() {
            List<Token> tokens = tokenize("b\"abc\" b'x'");
            assertEquals(TokenType.STRING, tokens.get(0).type());
            assertEquals("b\"abc\"", tokens.get(0).value());
            assertEquals(TokenType.CHAR, tokens.get(1).type());
            assertEquals("b'x'", tokens.get(1).value());
        }

        @Test
        void charVersusLifetime() {
            List<Token> tokens = tokenize("'a' '\\n' 'outer");
            assertEquals(TokenType.CHAR, tokens.get(0).type());
            assertEquals(TokenType.CHAR, tokens.get(1).type());
            assertEquals("'\\n'", tokens.get(1).value());
            assertEquals(TokenType.LIFETIME, tokens.get(2).type());
            assertEquals("'outer", tokens.get(2).value());
        }

        @Test
        void unicodeEscapeChar() {
            List<Token> tokens = tokenize("let c = '\\u{1F600}';");
            Token literal = tokens.get(3);
            assertEquals(TokenType.CHAR, literal.type());
            assertEquals("'\\u{1F600}'", literal.value());
            assertEquals(TokenType.SEMICOLON, tokens.get(4).type());
        }
    }

    @Nested
    class Punctuation {

        @Test
        void longestMatchFirst() {
            assertEquals(List.of("a", "::", "b", "->", "c", "=>", "d", "..=", "e", "<<=", "f"),
                    values("a::b -> c => d ..= e <<= f"));
        }

        @Test
        void derefAndMultiplyAreSamePunct() {
            List<Token> tokens = tokenize("*p * 2");
            assertTrue(tokens.get(0).isPunct("*"));
            assertTrue(tokens.get(2).isPunct("*"));
        }

        @Test
        void delimitersHaveTheirOwnTypes() {
            List<Token> tokens = tokenize("[a, b];");
            assertEquals(TokenType.LBRACKET, tokens.get(0).type());
            assertEquals(TokenType.COMMA, tokens.get(2).type());
            assertEquals(TokenType.RBRACKET, tokens.get(4).type());
            assertEquals(TokenType.SEMICOLON, tokens.get(5).type());
        }
    }

    @Nested
    class Comments {

        @Test
        void lineComment() {
            assertEquals(List.of("x", "y"), values("x // ignored\ny"));
        }

        @Test
        void nestedBlockComment() {
            assertEquals(List.of("x"), values("/* outer /* inner */ still outer */ x"));
        }

        @Test
        void blockCommentAdvancesLines() {
            Token t = tokenize("/* one\ntwo */\nz").get(0);
            assertEquals(3, t.line());
        }
    }

    @Nested
    class Errors {

        @Test
        void unterminatedString() {
            RustParseException e = assertThrows(RustParseException.class, () -> tokenize("let s = \"abc"));
            assertEquals("Unterminated string literal at line 1, column 9", e.getMessage());
            assertEquals(1, e.getLine());
            assertEquals(9, e.getColumn());
        }

        @Test
        void unterminatedBlockComment() {
            RustParseException e = assertThrows(RustParseException.class, () -> tokenize("x /* never closed"));
            assertTrue(e.getMessage().startsWith("Unterminated block comment"));
        }

        @Test
        void unterminatedRawString() {
            assertThrows(RustParseException.class, () -> tokenize("r#\"open\""));
        }

        @Test
        void unexpectedCharacter() {
            RustParseException e = assertThrows(RustParseException.class, () -> tokenize("a ` b"));
            assertEquals("Unexpected character '`' at line 1, column 3", e.getMessage());
        }
    }
}
