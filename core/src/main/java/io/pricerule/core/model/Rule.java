package io.pricerule.core.model;

import java.util.Objects;

/**
 * A named pricing rule as saved by a partner.
 *
 * @param name        display name, required
 * @param description optional free text, may be {@code null}
 * @param definition  the structured rule
 */
public record Rule(String name, String description, Definition definition) {

    public Rule {
        Objects.requireNonNull(definition, "definition must not be null");
    }
}
