package com.dbtide.backend.syntax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class ParserTest {

  private static final List<String> SAMPLES =
      List.of(
          "",
          "select * from {{ ref('orders') }}",
          "{% if x %}a{% endif %}{% for %}",
          "{% macro m(a, b=1) %}{{ a ~ b }}{% endmacro %}",
          "{{ 'unterminated }}",
          "{% endfor %}{% else %}",
          "{{ f(a=1, b) | upper is defined }}",
          "{% raw %}{{ x }}",
          "{# open comment",
          "{% set x %}body{% endset %}{{ x[1:2, ::3] }}",
          "{{ ((((a)))) if b else c }}\r\n{%- for k, v in d.items() if v recursive -%}{% endfor %}",
          "{{ {'a': [1, 2.5], 'b': none} }} {{ $ }}",
          "\u00e9 {{ na\u00efve }} {{ \uD83D\uDE00 }} {% if '\u00fc' %}\uD83D\uDE00{% endif %}",
          "{{ x ~ '\uD83D\uDE00' }}\uD83D");

  private static SyntaxElement expression(ParseResult result) {
    return result.root().firstChild(SyntaxKind.VARIABLE).orElseThrow().childNodes().get(0);
  }

  private static List<SyntaxKind> kinds(List<SyntaxElement> elements) {
    return elements.stream().map(SyntaxElement::kind).toList();
  }

  @Test
  void treeTextEqualsSource() {
    for (String sample : SAMPLES) {
      ParseResult result = Parser.parse(sample);
      assertThat(result.root().text()).as(sample).isEqualTo(sample);
      assertThat(result.root().range()).as(sample).isEqualTo(new TextRange(0, sample.length()));
      assertThat(result.root().kind()).isEqualTo(SyntaxKind.TEMPLATE);
    }
  }

  @Test
  void tokensTileTheSource() {
    for (String sample : SAMPLES) {
      int expected = 0;
      for (SyntaxElement token : Parser.parse(sample).root().tokens()) {
        assertThat(token.range().start()).as(sample).isEqualTo(expected);
        expected = token.range().end();
      }
      assertThat(expected).as(sample).isEqualTo(sample.length());
    }
  }

  @Test
  void parsingIsDeterministic() {
    for (String sample : SAMPLES) {
      ParseResult first = Parser.parse(sample);
      ParseResult second = Parser.parse(sample);
      assertThat(TreeRenderer.render(second)).isEqualTo(TreeRenderer.render(first));
      assertThat(second.errors()).isEqualTo(first.errors());
    }
  }

  @Test
  void emptySourceGivesEmptyTemplate() {
    ParseResult result = Parser.parse("");

    assertThat(result.root().children()).isEmpty();
    assertThat(result.hasErrors()).isFalse();
  }

  @Test
  void multiplicationBindsTighterThanAddition() {
    ParseResult result = Parser.parse("{{ 1 + 2 * 3 }}");

    SyntaxElement add = expression(result);
    assertThat(add.kind()).isEqualTo(SyntaxKind.EXPR_ADD);
    assertThat(kinds(add.childNodes()))
        .containsExactly(SyntaxKind.EXPR_CONSTANT_INTEGER, SyntaxKind.EXPR_MULTIPLY);
    assertThat(add.childNodes().get(1).text()).isEqualTo("2 * 3");
    assertThat(result.hasErrors()).isFalse();
  }

  @Test
  void powerIsRightAssociativeAndBindsTighterThanNegation() {
    SyntaxElement power = expression(Parser.parse("{{ 2 ** 3 ** 2 }}"));
    assertThat(power.kind()).isEqualTo(SyntaxKind.EXPR_POWER);
    assertThat(kinds(power.childNodes()))
        .containsExactly(SyntaxKind.EXPR_CONSTANT_INTEGER, SyntaxKind.EXPR_POWER);

    SyntaxElement negative = expression(Parser.parse("{{ -2 ** 2 }}"));
    assertThat(negative.kind()).isEqualTo(SyntaxKind.EXPR_NEGATIVE);
    assertThat(kinds(negative.childNodes())).containsExactly(SyntaxKind.EXPR_POWER);
  }

  @Test
  void comparisonChainsAndNotIn() {
    SyntaxElement compare = expression(Parser.parse("{{ a not in b }}"));

    assertThat(compare.kind()).isEqualTo(SyntaxKind.EXPR_COMPARE);
    assertThat(compare.descendants()).extracting(SyntaxElement::kind).contains(SyntaxKind.NAME_OPERATOR_NOT_IN);
  }

  @Test
  void conditionalFilterAndTestExpressions() {
    assertThat(expression(Parser.parse("{{ a if b else c }}")).kind()).isEqualTo(SyntaxKind.EXPR_TERNARY);
    assertThat(expression(Parser.parse("{{ x | upper }}")).kind()).isEqualTo(SyntaxKind.EXPR_FILTER);
    assertThat(expression(Parser.parse("{{ x is defined }}")).kind()).isEqualTo(SyntaxKind.EXPR_TEST);

    SyntaxElement test = expression(Parser.parse("{{ x is divisibleby 3 }}"));
    assertThat(test.firstChild(SyntaxKind.TEST_ARGUMENTS)).isPresent();
  }

  @Test
  void tupleOnlyWithComma() {
    assertThat(expression(Parser.parse("{{ a, b }}")).kind()).isEqualTo(SyntaxKind.EXPR_TUPLE);
    assertThat(expression(Parser.parse("{{ (a) }}")).kind()).isEqualTo(SyntaxKind.EXPR_WRAPPED);
  }

  @Test
  void ifErrorDoesNotLeakIntoClosedBlock() {
    ParseResult result = Parser.parse("{% if x %}a{% endif %}{% for %}");

    SyntaxElement ifStatement = result.root().firstChild(SyntaxKind.STMT_IF).orElseThrow();
    assertThat(ifStatement.descendants()).noneMatch(SyntaxElement::isError);
    assertThat(result.errors(ParseError.Category.STRUCTURAL)).hasSize(1);
    assertThat(result.errors(ParseError.Category.STRUCTURAL).get(0).message()).contains("'for'");
    assertThat(result.errors()).noneMatch(error -> error.range().intersects(ifStatement.range()));
    assertThat(kinds(result.root().childNodes())).containsExactly(SyntaxKind.STMT_IF, SyntaxKind.ERROR);
  }

  @Test
  void callRoundTrips() {
    String source = "{{ config(materialized='table') }}";
    ParseResult result = Parser.parse(source);

    SyntaxElement call = expression(result);
    assertThat(result.hasErrors()).isFalse();
    assertThat(call.kind()).isEqualTo(SyntaxKind.EXPR_CALL);
    assertThat(call.childNodes().get(0).text()).isEqualTo("config");
    SyntaxElement argument =
        call.firstChild(SyntaxKind.CALL_ARGUMENTS).orElseThrow()
            .firstChild(SyntaxKind.CALL_STATIC_KWARG).orElseThrow();
    assertThat(argument.text()).isEqualTo("materialized='table'");
    assertThat(result.root().text()).isEqualTo(source);
  }

  @Test
  void rawBodyIsOpaque() {
    ParseResult result = Parser.parse("{% raw %}{{ x }}{% if %}{% endraw %}");

    assertThat(result.hasErrors()).isFalse();
    assertThat(kinds(result.root().childNodes())).containsExactly(SyntaxKind.STMT_RAW);
    assertThat(result.root().descendants())
        .extracting(SyntaxElement::kind)
        .doesNotContain(SyntaxKind.VARIABLE, SyntaxKind.STMT_IF);
  }

  @Test
  void unclosedRawIsStructuralError() {
    ParseResult result = Parser.parse("{% raw %}abc");

    assertThat(result.root().childNodes().get(0).kind()).isEqualTo(SyntaxKind.ERROR);
    assertThat(result.errors(ParseError.Category.STRUCTURAL)).hasSize(1);
  }

  @Test
  void closerWithoutOpener() {
    ParseResult result = Parser.parse("{% endif %}");

    assertThat(result.root().childNodes().get(0).kind()).isEqualTo(SyntaxKind.STMT_UNKNOWN);
    assertThat(result.errors()).singleElement()
        .satisfies(error -> {
          assertThat(error.category()).isEqualTo(ParseError.Category.STRUCTURAL);
          assertThat(error.message()).isEqualTo("'endif' has no matching 'if'");
          assertThat(error.range()).isEqualTo(new TextRange(0, 11));
        });
  }

  @Test
  void unknownTagIsSyntaxError() {
    ParseResult result = Parser.parse("{% frobnicate x %}");

    assertThat(result.errors()).singleElement()
        .satisfies(error -> {
          assertThat(error.category()).isEqualTo(ParseError.Category.SYNTAX);
          assertThat(error.message()).isEqualTo("unknown tag 'frobnicate'");
        });
  }

  @Test
  void innerBlockIsAbandonedByOuterCloser() {
    ParseResult result = Parser.parse("{% for x in y %}{% if a %}{% endfor %}");

    SyntaxElement loop = result.root().firstChild(SyntaxKind.STMT_FOR).orElseThrow();
    assertThat(kinds(loop.childNodes()))
        .containsExactly(SyntaxKind.FOR_START, SyntaxKind.ERROR, SyntaxKind.FOR_END);
    assertThat(loop.childNodes().get(1).firstChild(SyntaxKind.IF_START)).isPresent();
    assertThat(result.errors()).singleElement()
        .satisfies(error -> assertThat(error.message()).isEqualTo("'if' block is never closed with 'endif'"));
  }

  @Test
  void elifAndElseBranches() {
    ParseResult result = Parser.parse("{% if a %}1{% elif b %}2{% else %}3{% endif %}");

    assertThat(result.hasErrors()).isFalse();
    assertThat(kinds(result.root().firstChild(SyntaxKind.STMT_IF).orElseThrow().childNodes()))
        .containsExactly(
            SyntaxKind.IF_START,
            SyntaxKind.EXPR_DATA,
            SyntaxKind.IF_ELIF,
            SyntaxKind.EXPR_DATA,
            SyntaxKind.IF_ELSE,
            SyntaxKind.EXPR_DATA,
            SyntaxKind.IF_END);
  }

  @Test
  void forElseBranch() {
    ParseResult result = Parser.parse("{% for x in xs %}{{ x }}{% else %}none{% endfor %}");

    assertThat(result.hasErrors()).isFalse();
    assertThat(result.root().firstChild(SyntaxKind.STMT_FOR).orElseThrow().firstChild(SyntaxKind.FOR_ELSE))
        .isPresent();
  }

  @Test
  void elseOutsideOfBlock() {
    ParseResult result = Parser.parse("{% else %}");

    assertThat(result.errors(ParseError.Category.STRUCTURAL)).singleElement()
        .satisfies(error -> assertThat(error.message()).isEqualTo("'else' outside of an 'if' or 'for' block"));
  }

  @Test
  void setStatementAndSetBlock() {
    ParseResult inline = Parser.parse("{% set x = 1 %}");
    assertThat(inline.hasErrors()).isFalse();
    assertThat(kinds(inline.root().childNodes())).containsExactly(SyntaxKind.STMT_ASSIGN);

    ParseResult block = Parser.parse("{% set x | trim %}abc{% endset %}");
    assertThat(block.hasErrors()).isFalse();
    assertThat(kinds(block.root().firstChild(SyntaxKind.STMT_ASSIGN_BLOCK).orElseThrow().childNodes()))
        .containsExactly(SyntaxKind.ASSIGN_BLOCK_START, SyntaxKind.EXPR_DATA, SyntaxKind.ASSIGN_BLOCK_END);
  }

  @Test
  void macroSignature() {
    ParseResult result = Parser.parse("{% macro m(a, b=1) %}x{% endmacro %}");

    assertThat(result.hasErrors()).isFalse();
    SyntaxElement signature =
        result.root().firstChild(SyntaxKind.STMT_MACRO).orElseThrow()
            .firstChild(SyntaxKind.MACRO_BLOCK_START).orElseThrow()
            .firstChild(SyntaxKind.SIGNATURE).orElseThrow();
    assertThat(kinds(signature.childNodes()))
        .containsExactly(SyntaxKind.SIGNATURE_ARG, SyntaxKind.SIGNATURE_DEFAULT_ARG);
  }

  @Test
  void requiredArgumentAfterDefaultIsReported() {
    ParseResult result = Parser.parse("{% macro m(a=1, b) %}{% endmacro %}");

    assertThat(result.errors()).singleElement()
        .satisfies(error -> assertThat(error.message()).isEqualTo("non-default argument follows a default argument"));
  }

  @Test
  void macroClosesOpenBlocks() {
    ParseResult result = Parser.parse("{% if a %}{% macro m() %}{% endmacro %}");

    assertThat(kinds(result.root().childNodes())).containsExactly(SyntaxKind.ERROR, SyntaxKind.STMT_MACRO);
    assertThat(result.errors(ParseError.Category.STRUCTURAL)).hasSize(1);
  }

  @Test
  void materializationHeaders() {
    ParseResult adapter =
        Parser.parse("{% materialization table, adapter='postgres' %}{% endmaterialization %}");
    assertThat(adapter.hasErrors()).isFalse();
    assertThat(adapter.root().descendants()).extracting(SyntaxElement::kind)
        .contains(SyntaxKind.MATERIALIZATION_ADAPTER);

    ParseResult fallback = Parser.parse("{% materialization view, default %}{% endmaterialization %}");
    assertThat(fallback.hasErrors()).isFalse();
    assertThat(fallback.root().descendants()).extracting(SyntaxElement::kind)
        .contains(SyntaxKind.MATERIALIZATION_DEFAULT);
  }

  @Test
  void importStatements() {
    ParseResult result =
        Parser.parse("{% import 'macros.sql' as m %}{% from 'x.sql' import a, b as c with context %}"
            + "{% include 'p.sql' ignore missing without context %}");

    assertThat(result.hasErrors()).isFalse();
    assertThat(kinds(result.root().childNodes()))
        .containsExactly(SyntaxKind.STMT_IMPORT, SyntaxKind.STMT_FROM_IMPORT, SyntaxKind.STMT_INCLUDE);
    assertThat(result.root().firstChild(SyntaxKind.STMT_FROM_IMPORT).orElseThrow()
        .childrenOfKind(SyntaxKind.IMPORT_NAME)).hasSize(2);
  }

  @Test
  void argumentsOutOfOrderAreReported() {
    ParseResult result = Parser.parse("{{ f(a=1, b) }}");

    assertThat(result.errors()).singleElement()
        .satisfies(error -> assertThat(error.message()).startsWith("argument out of order"));
  }

  @Test
  void subscriptSlices() {
    ParseResult result = Parser.parse("{{ x[1:2] }}");

    assertThat(result.hasErrors()).isFalse();
    assertThat(result.root().descendants()).extracting(SyntaxElement::kind)
        .contains(SyntaxKind.EXPR_GET_ITEM, SyntaxKind.SUBSCRIPT, SyntaxKind.EXPR_SLICE);
  }

  @Test
  void unterminatedStringIsLexicalError() {
    ParseResult result = Parser.parse("{{ 'abc }}");

    assertThat(result.errors(ParseError.Category.LEXICAL)).singleElement()
        .satisfies(error -> {
          assertThat(error.message()).isEqualTo("unterminated string literal");
          assertThat(error.range()).isEqualTo(new TextRange(3, 4));
        });
    assertThat(result.root().text()).isEqualTo("{{ 'abc }}");
  }

  @Test
  void unterminatedCommentIsReported() {
    ParseResult result = Parser.parse("{# open");

    assertThat(result.errors()).singleElement()
        .satisfies(error -> assertThat(error.message()).isEqualTo("unterminated comment"));
  }

  @Test
  void deeplyNestedExpressionIsBounded() {
    String source = "{{ " + "(".repeat(5_000) + "a" + ")".repeat(5_000) + " }}";

    ParseResult result = Parser.parse(source);

    assertThat(result.root().text()).isEqualTo(source);
    assertThat(result.errors()).anyMatch(error -> error.message().equals("expression is nested too deeply"));
  }

  @Test
  void cancellationAbortsParse() {
    assertThatThrownBy(() -> Parser.parse("{{ a }}{{ b }}", () -> true))
        .isInstanceOf(CancellationException.class);
  }

  @Test
  void acceptsPrelexedTokens() {
    String source = "{{ a }}";

    ParseResult result = Parser.parse(source, Lexer.tokenize(source));

    assertThat(TreeRenderer.render(result)).isEqualTo(TreeRenderer.render(Parser.parse(source)));
  }
}
