package io.pricerule.core.parser;

import io.pricerule.core.model.Connector;
import java.util.Objects;

/**
 * One raw condition cut out of a condition list by {@link ConditionSplitter}.
 *
 * @param text      trimmed condition text, never empty
 * @param connector keyword that preceded it, {@code null} for the first condition
 */
public record ConditionText(String text, Connector connector) {

    public ConditionText {
        Objects.requireNonNull(text, "text must not be null");
    }
}
