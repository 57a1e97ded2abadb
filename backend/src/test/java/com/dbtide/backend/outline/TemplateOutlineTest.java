package com.dbtide.backend.outline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.dbtide.backend.syntax.Parser;
import com.dbtide.backend.syntax.SyntaxKind;
import com.dbtide.backend.syntax.TextRange;
import org.junit.jupiter.api.Test;

class TemplateOutlineTest {

  private static final String SOURCE =
      "{% macro grant(role, schema='public') %}grant{% endmacro %}\n"
          + "{% test not_null(model, column_name) %}select 1{% endtest %}\n"
          + "{% docs orders %}Orders{% enddocs %}\n"
          + "{{ ref('orders') }} {{ ref('pkg', 'customers') }} {{ source('raw', 'events') }} {{ ref(name) }}";

  private final TemplateOutline outline = TemplateOutline.of(Parser.parse(SOURCE).tree());

  @Test
  void extractsMacrosAndTests() {
    assertThat(outline.macros()).extracting(MacroDefinition::name).containsExactly("grant", "not_null");

    MacroDefinition grant = outline.macro("grant").orElseThrow();
    assertThat(grant.arguments())
        .containsExactly(new MacroArgument("role", null), new MacroArgument("schema", "'public'"));
    assertThat(grant.requiredArguments()).extracting(MacroArgument::name).containsExactly("role");
    assertThat(grant.signature()).isEqualTo("grant(role, schema='public')");
    assertThat(grant.nameRange()).isEqualTo(new TextRange(9, 14));
    assertThat(SOURCE.substring(grant.range().start(), grant.range().end())).endsWith("{% endmacro %}");
  }

  @Test
  void extractsNamedBlocks() {
    assertThat(outline.blocks())
        .extracting(BlockDefinition::kind, BlockDefinition::name)
        .containsExactly(
            tuple(SyntaxKind.STMT_TEST, "not_null"),
            tuple(SyntaxKind.STMT_DOCS, "orders"));
  }

  @Test
  void extractsConstantReferencesOnly() {
    assertThat(outline.references()).hasSize(3);
    assertThat(outline.references().get(0).target()).isEqualTo("orders");
    assertThat(outline.references().get(1).arguments()).containsExactly("pkg", "customers");
    assertThat(outline.references().get(1).target()).isEqualTo("customers");
    assertThat(outline.references().get(2).function()).isEqualTo("source");
    assertThat(outline.references().get(2).arguments()).containsExactly("raw", "events");
  }

  @Test
  void outlinesUnclosedMacro() {
    TemplateOutline partial = TemplateOutline.of(Parser.parse("{% macro half(x) %}{{ x }}").tree());

    assertThat(partial.macro("half")).isPresent();
  }

  @Test
  void emptyOutlineHasNothing() {
    assertThat(TemplateOutline.empty().macros()).isEmpty();
    assertThat(TemplateOutline.empty().macro("grant")).isEmpty();
  }
}
