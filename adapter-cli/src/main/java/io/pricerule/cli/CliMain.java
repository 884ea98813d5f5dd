package io.pricerule.cli;

import io.pricerule.cli.check.RuleCheckApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the command-line rule checker.
 *
 * <p>
 * Delegates to {@link RuleCheckApp#run(String[], java.io.PrintStream, java.io.PrintStream)} and
 * exits with its code. An unexpected failure is logged and exits with
 * {@link RuleCheckApp#EXIT_USAGE}.
 */
public final class CliMain {

    private static final Logger LOG = LoggerFactory.getLogger(CliMain.class);

    private CliMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --rule "IF booking_hours > 4 THEN 100"})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code;
        try {
            code = RuleCheckApp.run(args, System.out, System.err);
        } catch (Exception e) {
            LOG.error("Rule check failed: {}", e.getMessage(), e);
            code = RuleCheckApp.EXIT_USAGE;
        }
        System.exit(code);
    }
}
