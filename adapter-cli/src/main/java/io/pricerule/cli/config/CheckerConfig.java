package io.pricerule.cli.config;

import io.pricerule.core.engine.EngineLimits;
import java.util.Locale;

/**
 * Configuration of the command-line rule checker.
 *
 * <p>
 * Use {@link #builder()}; every field has a default.
 *
 * @param limits        engine limits ({@code limits.*})
 * @param loggingFormat {@code text} or {@code json} ({@code logging.format})
 * @param loggingLevel  root log level ({@code logging.level})
 */
public record CheckerConfig(EngineLimits limits, String loggingFormat, String loggingLevel) {

    public CheckerConfig {
        if (limits == null) {
            throw new IllegalArgumentException("limits must not be null");
        }
        if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
            throw new IllegalArgumentException("logging.format must be 'text' or 'json', got: " + loggingFormat);
        }
        loggingFormat = loggingFormat.toLowerCase(Locale.ROOT);
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CheckerConfig}. */
    public static final class Builder {
        private int maxFormulaLength = EngineLimits.DEFAULT.maxFormulaLength();
        private int maxRuleLength = EngineLimits.DEFAULT.maxRuleLength();
        private int maxNestingDepth = EngineLimits.DEFAULT.maxNestingDepth();
        private int maxConditions = EngineLimits.DEFAULT.maxConditions();
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder maxFormulaLength(int maxFormulaLength) {
            this.maxFormulaLength = maxFormulaLength;
            return this;
        }

        public Builder maxRuleLength(int maxRuleLength) {
            this.maxRuleLength = maxRuleLength;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder maxConditions(int maxConditions) {
            this.maxConditions = maxConditions;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a limit is not positive or the format is unknown
         */
        public CheckerConfig build() {
            return new CheckerConfig(
                    new EngineLimits(maxFormulaLength, maxRuleLength, maxNestingDepth, maxConditions),
                    loggingFormat,
                    loggingLevel);
        }
    }
}
