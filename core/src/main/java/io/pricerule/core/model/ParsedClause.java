package io.pricerule.core.model;

import java.util.Objects;

/**
 * One {@code IF...THEN...[ELSE...]} clause of a multi-clause rule text.
 *
 * @param connector  the keyword that joined this clause to the previous one, {@code null} for
 *                   the first clause
 * @param definition the clause's conditions and formula, sharing the caller's variables
 */
public record ParsedClause(Connector connector, Definition definition) {

    public ParsedClause {
        Objects.requireNonNull(definition, "definition must not be null");
    }
}
