package com.dbtide.backend.outline;

import com.dbtide.backend.syntax.SyntaxKind;
import com.dbtide.backend.syntax.TextRange;

/** A named dbt block: a materialization, a docs block or a snapshot. */
public record BlockDefinition(SyntaxKind kind, String name, TextRange nameRange, TextRange range) {
}
