package io.pricerule.core.parser;

import io.pricerule.core.model.Connector;
import java.util.Objects;

/**
 * One {@code IF...THEN...[ELSE...]} segment of a multi-clause rule text.
 *
 * @param connector keyword that joined it to the previous segment, {@code null} for the first
 * @param text      trimmed segment text
 */
public record ClauseText(Connector connector, String text) {

    public ClauseText {
        Objects.requireNonNull(text, "text must not be null");
    }
}
