package io.rerun.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.rerun.Span;
import java.util.List;
import org.junit.jupiter.api.Test;

public class LexerTest {

  @Test
  void testTokenizesAllParts() {
    List<Token> tokens = Lexer.tokenize("-15m+5s@d+1h");
    assertEquals(
        List.of(
            Token.number("-15", new Span(0, 3)),
            Token.unit("m", new Span(3, 4)),
            Token.number("+5", new Span(4, 6)),
            Token.unit("s", new Span(6, 7)),
            Token.at(new Span(7, 8)),
            Token.unit("d", new Span(8, 9)),
            Token.number("+1", new Span(9, 11)),
            Token.unit("h", new Span(11, 12))),
        tokens);
  }

  @Test
  void testStopsAtUnknownCharacter() {
    List<Token> tokens = Lexer.tokenize("-1d@d junk");
    Token last = tokens.get(tokens.size() - 1);
    assertEquals(TokenKind.REST, last.kind());
    assertEquals(" junk", last.text());
    assertEquals(new Span(5, 10), last.span());
  }

  @Test
  void testSignWithoutDigitsIsRest() {
    List<Token> tokens = Lexer.tokenize("@d+h");
    assertEquals(3, tokens.size());
    assertEquals(Token.rest("+h", new Span(2, 4)), tokens.get(2));
  }

  @Test
  void testSignedness() {
    assertTrue(Token.number("-1", new Span(0, 2)).isSigned());
    assertTrue(Token.number("+1", new Span(0, 2)).isSigned());
    assertFalse(Token.number("1", new Span(0, 1)).isSigned());
    assertFalse(Token.unit("d", new Span(0, 1)).isSigned());
  }

  @Test
  void testEmptyInput() {
    assertTrue(Lexer.tokenize("").isEmpty());
  }
}
