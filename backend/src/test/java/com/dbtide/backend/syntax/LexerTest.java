package com.dbtide.backend.syntax;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class LexerTest {

  @Test
  void tokenizesVariableWithTrivia() {
    List<Token> tokens = Lexer.tokenize("{{ x }}");

    assertThat(tokens)
        .containsExactly(
            new Token(TokenKind.VARIABLE_BEGIN, 0, 2),
            new Token(TokenKind.WHITESPACE, 2, 3),
            new Token(TokenKind.NAME, 3, 4),
            new Token(TokenKind.WHITESPACE, 4, 5),
            new Token(TokenKind.VARIABLE_END, 5, 7));
  }

  @Test
  void tokensCoverTheInputWithoutGaps() {
    List<String> inputs =
        List.of(
            "",
            "select 1",
            "{{ a }} and {% if b %}c{% endif %}",
            "{# note #}{{ 'unterminated }}",
            "{{ $ ?? }}",
            "{% raw %}{{ x }}",
            "{{ a",
            "{%- set x = [1, 2] -%}\r\n{{ x | join(',') }}",
            "\u00e9 {{ na\u00efve }} {{ \uD83D\uDE00 }}",
            "{{ '\uD83D\uDE00\u00e9' }}\uD83D\uDE00");

    for (String input : inputs) {
      int expectedStart = 0;
      for (Token token : Lexer.tokenize(input)) {
        assertThat(token.range().start()).as("start in %s", input).isEqualTo(expectedStart);
        assertThat(token.range().isEmpty()).as("empty token in %s", input).isFalse();
        expectedStart = token.range().end();
      }
      assertThat(expectedStart).as("end of %s", input).isEqualTo(input.length());
    }
  }

  @Test
  void keepsRawBodyAsSingleDataToken() {
    List<Token> tokens = Lexer.tokenize("{% raw %}{{ x }}{% if %}{% endraw %}");

    assertThat(tokens).extracting(Token::kind)
        .containsExactly(TokenKind.RAW_BEGIN, TokenKind.DATA, TokenKind.RAW_END);
    assertThat(tokens.get(1).text("{% raw %}{{ x }}{% if %}{% endraw %}")).isEqualTo("{{ x }}{% if %}");
  }

  @Test
  void splitsCommentIntoMarkersAndBody() {
    assertThat(Lexer.tokenize("{# hi #}")).extracting(Token::kind)
        .containsExactly(TokenKind.COMMENT_BEGIN, TokenKind.COMMENT_DATA, TokenKind.COMMENT_END);
  }

  @Test
  void unterminatedStringBecomesErrorQuote() {
    String source = "{{ 'abc }}";
    List<Token> tokens = Lexer.tokenize(source);

    assertThat(tokens).extracting(Token::kind)
        .containsExactly(
            TokenKind.VARIABLE_BEGIN,
            TokenKind.WHITESPACE,
            TokenKind.ERROR,
            TokenKind.NAME,
            TokenKind.WHITESPACE,
            TokenKind.VARIABLE_END);
    assertThat(tokens.get(2).text(source)).isEqualTo("'");
  }

  @Test
  void unknownCharacterBecomesErrorToken() {
    List<Token> tokens = Lexer.tokenize("{{ $ }}");

    assertThat(tokens.get(2)).isEqualTo(new Token(TokenKind.ERROR, 3, 4));
  }

  @Test
  void classifiesNumbersAndOperators() {
    String source = "{{ 1_000 1.5 1e3 a // b ** c }}";

    assertThat(Lexer.tokenize(source)).extracting(Token::kind)
        .filteredOn(kind -> kind != TokenKind.WHITESPACE)
        .containsExactly(
            TokenKind.VARIABLE_BEGIN,
            TokenKind.INTEGER_LITERAL,
            TokenKind.FLOAT_LITERAL,
            TokenKind.FLOAT_LITERAL,
            TokenKind.NAME,
            TokenKind.FLOOR_DIV,
            TokenKind.NAME,
            TokenKind.POWER,
            TokenKind.NAME,
            TokenKind.VARIABLE_END);
  }

  @Test
  void dictBracesDoNotEndVariable() {
    assertThat(Lexer.tokenize("{{ {'a': 1} }}")).extracting(Token::kind)
        .filteredOn(kind -> kind != TokenKind.WHITESPACE)
        .containsExactly(
            TokenKind.VARIABLE_BEGIN,
            TokenKind.LEFT_BRACE,
            TokenKind.STRING_LITERAL,
            TokenKind.COLON,
            TokenKind.INTEGER_LITERAL,
            TokenKind.RIGHT_BRACE,
            TokenKind.VARIABLE_END);
  }

  @Test
  void whitespaceControlMarkersBelongToDelimiters() {
    String source = "{%- if x -%}";
    List<Token> tokens = Lexer.tokenize(source);

    assertThat(tokens.get(0).text(source)).isEqualTo("{%-");
    assertThat(tokens.get(tokens.size() - 1).text(source)).isEqualTo("-%}");
  }

  @Test
  void supplementaryCharacterBecomesOneErrorToken() {
    List<Token> tokens = Lexer.tokenize("{{\uD83D\uDE00}}");

    assertThat(tokens)
        .containsExactly(
            new Token(TokenKind.VARIABLE_BEGIN, 0, 2),
            new Token(TokenKind.ERROR, 2, 4),
            new Token(TokenKind.VARIABLE_END, 4, 6));
  }

  @Test
  void namesMayContainNonAsciiLetters() {
    String source = "{{ na\u00efve }}";

    List<Token> tokens = Lexer.tokenize(source);

    assertThat(tokens.get(2)).isEqualTo(new Token(TokenKind.NAME, 3, 8));
    assertThat(tokens.get(2).text(source)).isEqualTo("na\u00efve");
  }
}
