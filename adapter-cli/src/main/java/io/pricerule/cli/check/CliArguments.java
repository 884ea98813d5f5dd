package io.pricerule.cli.check;

import java.nio.file.Path;

/**
 * Parsed command line.
 *
 * @param configPath     {@code --config}, or {@code null}
 * @param definitionPath {@code --definition}, or {@code null} for a fresh definition
 * @param ruleText       {@code --rule}, or {@code null}
 * @param ruleFile       {@code --rule-file}, or {@code null}
 */
record CliArguments(Path configPath, Path definitionPath, String ruleText, Path ruleFile) {

    static final String USAGE = "Usage: price-rule-check [--config <yaml>] [--definition <json>]"
            + " (--rule <text> | --rule-file <path>)";

    /**
     * @throws IllegalArgumentException on unknown options, missing values, or when not exactly
     *                                  one of {@code --rule} and {@code --rule-file} is given
     */
    static CliArguments parse(String[] args) {
        Path config = null;
        Path definition = null;
        String rule = null;
        Path ruleFile = null;
        for (int i = 0; i < args.length; i++) {
            String option = args[i];
            switch (option) {
                case "--config" -> config = Path.of(valueOf(args, i++));
                case "--definition" -> definition = Path.of(valueOf(args, i++));
                case "--rule" -> rule = valueOf(args, i++);
                case "--rule-file" -> ruleFile = Path.of(valueOf(args, i++));
                default -> throw new IllegalArgumentException("Unknown option: " + option);
            }
        }
        if ((rule == null) == (ruleFile == null)) {
            throw new IllegalArgumentException("Give exactly one of --rule or --rule-file");
        }
        return new CliArguments(config, definition, rule, ruleFile);
    }

    private static String valueOf(String[] args, int optionIndex) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(args[optionIndex] + " requires a value");
        }
        return args[optionIndex + 1];
    }
}
