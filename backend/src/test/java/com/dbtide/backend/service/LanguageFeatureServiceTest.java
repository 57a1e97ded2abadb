package com.dbtide.backend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dbtide.backend.config.DbtIdeProperties;
import com.dbtide.backend.dto.CompletionItem;
import com.dbtide.backend.dto.CompletionItem.CompletionKind;
import com.dbtide.backend.dto.CompletionResponse;
import com.dbtide.backend.dto.ContentType;
import com.dbtide.backend.dto.DefinitionResponse;
import com.dbtide.backend.dto.HoverResponse;
import com.dbtide.backend.dto.TextDocumentPositionRequest;
import com.dbtide.backend.exception.DocumentNotFoundException;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LanguageFeatureServiceTest {

  private static final String URI = "file:///shop/models/report.sql";

  @TempDir Path root;

  private DocumentService documents;
  private LanguageFeatureService features;

  @BeforeEach
  void setUp() throws Exception {
    ProjectFixture.write(root);
    DbtIdeProperties properties = new DbtIdeProperties(root.toString(), null, null, null, null);
    ProjectService project = new ProjectService(properties);
    project.reload();
    documents = new DocumentService(properties);
    features = new LanguageFeatureService(documents, project);
  }

  @AfterEach
  void tearDown() throws Exception {
    documents.destroy();
  }

  private void open(String text) {
    documents.update(URI, 1, text, ContentType.TEMPLATED_SQL).join();
  }

  private static TextDocumentPositionRequest at(int line, int character) {
    return new TextDocumentPositionRequest(URI, line, character);
  }

  @Test
  void completesModelNamesInsideRefString() {
    open("select * from {{ ref('or') }}");

    CompletionResponse response = features.completion(at(0, 24));

    assertThat(response.items()).extracting(CompletionItem::label).containsExactly("orders");
    assertThat(response.items().get(0).insertText()).isEqualTo("orders");
    assertThat(response.items().get(0).kind()).isEqualTo(CompletionKind.MODEL);
  }

  @Test
  void completesQuotedModelNamesAfterRefParenthesis() {
    open("{{ ref() }}");

    CompletionResponse response = features.completion(at(0, 7));

    assertThat(response.items()).extracting(CompletionItem::label)
        .containsExactly("legacy", "orders", "stg_customers");
    assertThat(response.items()).extracting(CompletionItem::insertText).contains("'orders'");
  }

  @Test
  void completesEveryKeywordAfterBlockOpener() {
    open("{% ");

    CompletionResponse response = features.completion(at(0, 3));

    assertThat(response.items()).extracting(CompletionItem::label)
        .containsExactlyElementsOf(LanguageFeatureService.BLOCK_KEYWORDS);
  }

  @Test
  void filtersKeywordsByTypedPrefix() {
    open("{% en");

    CompletionResponse response = features.completion(at(0, 5));

    assertThat(response.items()).isNotEmpty();
    assertThat(response.items()).extracting(CompletionItem::label)
        .allMatch(label -> label.startsWith("end"))
        .contains("endif", "endmacro", "endsnapshot");
  }

  @Test
  void completesProjectMacrosInExpressions() {
    open("select 1\n{{ gr }}");

    CompletionResponse response = features.completion(at(1, 5));

    assertThat(response.items()).hasSize(1);
    CompletionItem item = response.items().get(0);
    assertThat(item.label()).isEqualTo("grant_select");
    assertThat(item.kind()).isEqualTo(CompletionKind.MACRO);
    assertThat(item.insertText()).isEqualTo("grant_select(${1:role})");
    assertThat(item.detail()).endsWith("grants.sql");
  }

  @Test
  void offersBuiltinsAndDocumentMacros() {
    open("{% macro helper(x, y=2) %}{% endmacro %}\n{{  }}");

    CompletionResponse response = features.completion(at(1, 3));

    assertThat(response.items()).extracting(CompletionItem::label)
        .startsWith("helper")
        .contains("grant_select", "dbt_utils.star", "ref", "source", "env_var");
    assertThat(response.items().get(0).detail()).isEqualTo("helper(x, y=2)");
    assertThat(response.items()).filteredOn(item -> item.label().equals("source"))
        .extracting(CompletionItem::insertText)
        .containsExactly("source(${1:source_name}, ${2:table_name})");
  }

  @Test
  void completesMacrosOfQualifyingPackage() {
    open("{{ dbt_utils. }}");

    CompletionResponse response = features.completion(at(0, 13));

    assertThat(response.items()).hasSize(1);
    assertThat(response.items().get(0).label()).isEqualTo("star");
    assertThat(response.items().get(0).detail()).isEqualTo("dbt_utils.star");
    assertThat(response.items().get(0).insertText()).isEqualTo("star(${1:from})");
  }

  @Test
  void offersNothingInPlainSql() {
    open("select * from x");

    assertThat(features.completion(at(0, 7)).items()).isEmpty();
    assertThat(features.completion(at(0, 0)).items()).isEmpty();
  }

  @Test
  void hoversProjectMacro() {
    open("{{ grant_select('admin') }}");

    HoverResponse hover = features.hover(at(0, 5));

    assertThat(hover.found()).isTrue();
    assertThat(hover.contents())
        .startsWith("```jinja\n{% macro grant_select(role) %}\n```")
        .contains("Defined in")
        .endsWith("grants.sql");
  }

  @Test
  void hoversBuiltin() {
    open("{{ source('raw', 'orders') }}");

    HoverResponse hover = features.hover(at(0, 4));

    assertThat(hover.contents())
        .contains("source(source_name, table_name)")
        .contains("https://docs.getdbt.com/reference/dbt-jinja-functions/source");
  }

  @Test
  void hoversModelReference() {
    open("{{ ref('orders') }}");

    HoverResponse hover = features.hover(at(0, 9));

    assertThat(hover.contents()).startsWith("Model `orders`").endsWith("orders.sql");
  }

  @Test
  void hoversPackageQualifiedMacro() {
    open("{{ dbt_utils.star('t') }}");

    HoverResponse hover = features.hover(at(0, 14));

    assertThat(hover.contents()).contains("{% macro star(from, except=[]) %}").endsWith("star.sql");
  }

  @Test
  void hoverOnUnknownNameFindsNothing() {
    open("{{ nothing_here }}");

    assertThat(features.hover(at(0, 5)).found()).isFalse();
  }

  @Test
  void jumpsToProjectMacroDefinition() {
    open("{{ grant_select('admin') }}");

    DefinitionResponse definition = features.definition(at(0, 5));

    assertThat(definition.found()).isTrue();
    assertThat(definition.uri()).startsWith("file:").endsWith("macros/grants.sql");
    assertThat(definition.startLine()).isZero();
    assertThat(definition.startColumn()).isEqualTo(9);
    assertThat(definition.endColumn()).isEqualTo(21);
  }

  @Test
  void jumpsToMacroDefinedInSameDocument() {
    open("{% macro local_one() %}{% endmacro %}\n{{ local_one() }}");

    DefinitionResponse definition = features.definition(at(1, 4));

    assertThat(definition.uri()).isEqualTo(URI);
    assertThat(definition.startLine()).isZero();
    assertThat(definition.startColumn()).isEqualTo(9);
  }

  @Test
  void jumpsToReferencedModelFile() {
    open("{{ ref('orders') }}");

    DefinitionResponse definition = features.definition(at(0, 9));

    assertThat(definition.uri()).endsWith("models/orders.sql");
    assertThat(definition.startLine()).isZero();
  }

  @Test
  void unknownDocumentIsRejected() {
    assertThatThrownBy(() -> features.hover(new TextDocumentPositionRequest("file:///missing.sql", 0, 0)))
        .isInstanceOf(DocumentNotFoundException.class);
  }
}
