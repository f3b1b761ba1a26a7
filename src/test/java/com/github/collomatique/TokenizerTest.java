package com.github.collomatique;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.collomatique.Tokenizer.Token;
import com.github.collomatique.Tokenizer.TokenType;
import com.github.collomatique.parser.ParsingException;

public class TokenizerTest {

    @ParameterizedTest
    @MethodSource("tokenTypes")
    public void testTokenTypes(String code, List<TokenType> expected) {
        assertEquals(expected, types(code));
    }

    private static Object[][] tokenTypes() {
        return new Object[][] {
            { "let", List.of(TokenType.LET) },
            { "letter", List.of(TokenType.IDENTIFIER) },
            { "pub let f", List.of(TokenType.PUB, TokenType.LET, TokenType.IDENTIFIER) },
            { "a === b", List.of(TokenType.IDENTIFIER, TokenType.CONSTRAINT_EQ, TokenType.IDENTIFIER) },
            { "a == b", List.of(TokenType.IDENTIFIER, TokenType.EQUALS_EQUALS, TokenType.IDENTIFIER) },
            { "x <== 3", List.of(TokenType.IDENTIFIER, TokenType.CONSTRAINT_LE, TokenType.NUMBER) },
            { "x <= 3", List.of(TokenType.IDENTIFIER, TokenType.LE, TokenType.NUMBER) },
            { "7 // 2", List.of(TokenType.NUMBER, TokenType.SLASH_SLASH, TokenType.NUMBER) },
            { "[1..4]", List.of(TokenType.LBRACKET, TokenType.NUMBER, TokenType.DOT_DOT, TokenType.NUMBER, TokenType.RBRACKET) },
            { "E::V", List.of(TokenType.IDENTIFIER, TokenType.DOUBLE_COLON, TokenType.IDENTIFIER) },
            { "$[X](s)", List.of(TokenType.DOLLAR, TokenType.LBRACKET, TokenType.IDENTIFIER, TokenType.RBRACKET,
                    TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.RPAREN) },
            { "@[Student]", List.of(TokenType.AT, TokenType.LBRACKET, TokenType.IDENTIFIER, TokenType.RBRACKET) },
            { "-> _x1", List.of(TokenType.ARROW, TokenType.IDENTIFIER) },
        };
    }

    @Test
    public void testCommentsAreSkipped() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER),
                types("1 # one\n+ ## two\n2"));
    }

    @Test
    public void testDocstringsAreCollected() {
        var tokens = new Tokenizer().tokenize("## first\n# plain\n## second\nlet");
        var docs = tokens.docstrings();
        assertEquals(List.of(" first", " second"), docs.stream().map(Token::image).toList());
        assertEquals(TokenType.LET, tokens.next().type());
    }

    @Test
    public void testPeekKeepsDocstrings() {
        var tokens = new Tokenizer().tokenize("## doc\nlet # trailing\nf");
        assertEquals(TokenType.LET, tokens.peek().type());
        assertEquals(TokenType.LET, tokens.peek().type());
        assertEquals(List.of(" doc"), tokens.docstrings().stream().map(Token::image).toList());
        assertEquals(TokenType.LET, tokens.next(TokenType.LET).type());
        assertEquals("f", tokens.next(TokenType.IDENTIFIER).image());
        assertEquals(TokenType.EOF, tokens.peek().type());
    }

    @Test
    public void testStringEscapes() {
        var token = new Tokenizer().tokenize("\"a\\\"b\\n\"").next();
        assertEquals(TokenType.STRING, token.type());
        assertEquals("a\"b\n", token.image());
    }

    @Test
    public void testPeekAtSkipsComments() {
        var tokens = new Tokenizer().tokenize("a # c\n b c");
        assertEquals("b", tokens.peekAt(1).image());
        assertEquals(TokenType.EOF, tokens.peekAt(5).type());
        assertEquals("a", tokens.next().image());
    }

    @Test
    public void testSpans() {
        var tokens = new Tokenizer().tokenize("  foo  ");
        var token = tokens.next();
        assertEquals(2, token.start());
        assertEquals(5, token.end());
        assertEquals(7, tokens.next().start());
    }

    @Test
    public void testUnexpectedCharacter() {
        var e = assertThrows(ParsingException.class, () -> new Tokenizer().tokenize("a ? b"));
        assertEquals(ParsingException.Kind.UNEXPECTED_CHARACTER, e.kind());
        assertEquals(2, e.span().start());
    }

    @Test
    public void testUnterminatedString() {
        var e = assertThrows(ParsingException.class, () -> new Tokenizer().tokenize("\"abc"));
        assertEquals(ParsingException.Kind.UNTERMINATED_STRING, e.kind());
    }

    private static List<TokenType> types(String code) {
        var tokens = new Tokenizer().tokenize(code);
        List<TokenType> result = new ArrayList<>();
        for (var token = tokens.next(); token.type() != TokenType.EOF; token = tokens.next()) {
            result.add(token.type());
        }
        return result;
    }
}
