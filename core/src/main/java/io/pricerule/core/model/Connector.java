package io.pricerule.core.model;

import java.util.Locale;

/**
 * Joins a condition to the previous one in a flat condition list.
 *
 * <ul>
 *   <li>{@link #AND} extends the current AND-group.
 *   <li>{@link #OR} starts a new AND-group.
 * </ul>
 */
public enum Connector {
    AND,
    OR;

    /** Lowercase name used in JSON. */
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a connector keyword case-insensitively.
     *
     * @throws IllegalArgumentException if the keyword is neither {@code and} nor {@code or}
     */
    public static Connector fromKeyword(String keyword) {
        for (Connector connector : values()) {
            if (connector.name().equalsIgnoreCase(keyword)) {
                return connector;
            }
        }
        throw new IllegalArgumentException("Unknown connector: '" + keyword + "'");
    }
}
