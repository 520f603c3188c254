package io.authscript.spl;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class LexerTest {

    static List<TokenKind> kinds(String src) {
        return Lexer.tokenize(src).tokens().stream().map(Token::kind).toList();
    }

    @Test void emptySourceIsJustEof() {
        assertEquals(List.of(TokenKind.EOF), kinds(""));
    }

    @Test void structuralKeywordsAreCaseSensitive() {
        assertEquals(List.of(TokenKind.ROLE, TokenKind.IDENTIFIER, TokenKind.EOF), kinds("ROLE role"));
    }

    @Test void actionsAreCaseInsensitive() {
        assertEquals(List.of(TokenKind.READ, TokenKind.DELETE, TokenKind.LIST, TokenKind.EOF),
            kinds("read DELETE List"));
    }

    @Test void operators() {
        assertEquals(List.of(TokenKind.EQUALS, TokenKind.NOT_EQUALS, TokenKind.LESS_EQUAL,
            TokenKind.GREATER_EQUAL, TokenKind.LESS_THAN, TokenKind.GREATER_THAN, TokenKind.EOF),
            kinds("== != <= >= < >"));
    }

    @Test void stringEscapesAreDecoded() {
        Token tok = Lexer.tokenize("\"a\\\"b\\nc\"").tokens().get(0);
        assertEquals(TokenKind.STRING, tok.kind());
        assertEquals("a\"b\nc", tok.value());
    }

    @Test void singleQuotedStrings() {
        assertEquals("Admin", Lexer.tokenize("'Admin'").tokens().get(0).value());
    }

    @Test void numbers() {
        List<Token> tokens = Lexer.tokenize("9 17.5").tokens();
        assertEquals("9", tokens.get(0).value());
        assertEquals("17.5", tokens.get(1).value());
        assertEquals(TokenKind.NUMBER, tokens.get(1).kind());
    }

    @Test void lineNumbersFollowNewlinesAndComments() {
        String src = "ROLE A\n// note\n/* two\nlines */ USER B";
        List<Token> tokens = Lexer.tokenize(src).tokens();
        assertEquals(1, tokens.get(0).line());
        assertEquals(4, tokens.get(2).line());
    }

    @Test void tokenizingTwiceGivesSameLines() {
        String src = "ROLE A {\n can: read\n}\n";
        assertEquals(Lexer.tokenize(src).tokens(), Lexer.tokenize(src).tokens());
    }

    @Test void singleEqualsWarnsWithHint() {
        Lexer.Result r = Lexer.tokenize("a = b");
        assertEquals(1, r.diagnostics().size());
        Diagnostic d = r.diagnostics().get(0);
        assertEquals(Diagnostic.Severity.WARNING, d.severity());
        assertEquals("use '==' for comparison", d.hint());
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.EOF), kinds("a = b"));
    }

    @Test void unknownCharacterIsSkipped() {
        Lexer.Result r = Lexer.tokenize("ROLE @ A");
        assertEquals(1, r.diagnostics().size());
        assertEquals(3, r.tokens().size());
    }

    @Test void unterminatedStringDropsRestOfLine() {
        Lexer.Result r = Lexer.tokenize("\"abc def\nUSER");
        assertEquals("Unterminated string literal", r.diagnostics().get(0).message());
        assertEquals(List.of(TokenKind.USER, TokenKind.EOF), r.tokens().stream().map(Token::kind).toList());
        assertEquals(2, r.tokens().get(0).line());
    }

    @Test void unterminatedBlockComment() {
        Lexer.Result r = Lexer.tokenize("ROLE /* open\n");
        assertEquals("Unterminated block comment", r.diagnostics().get(0).message());
        assertEquals(2, r.tokens().get(1).line());
    }

    @Test void nullSourceRejected() {
        assertThrows(NullPointerException.class, () -> Lexer.tokenize(null));
    }
}
