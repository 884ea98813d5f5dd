package io.pricerule.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.pricerule.core.error.MissingThenException;
import io.pricerule.core.error.RuleException;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Rule;
import io.pricerule.core.testkit.TestDefinitions;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for the DEBUG entries {@link RuleEngine} writes on every accepted or rejected rule.
 * Rejections carry the error URN and category so they can be grouped.
 */
@DisplayName("RuleEngine logging")
class RuleEngineLoggingTest {

    private final RuleEngine engine = new RuleEngine(EngineLimits.DEFAULT, TestDefinitions.sequentialIds());
    private final Definition sample = TestDefinitions.sample();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger engineLogger;
    private Level previousLevel;

    @BeforeEach
    void setUp() {
        engineLogger = (Logger) LoggerFactory.getLogger(RuleEngine.class);
        previousLevel = engineLogger.getLevel();
        engineLogger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        engineLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(logAppender);
        logAppender.stop();
        engineLogger.setLevel(previousLevel);
    }

    // --- Helpers ---

    private List<String> messages() {
        return logAppender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    }

    @Test
    @DisplayName("accepted rule → clause and condition counts")
    void accepted() {
        engine.parseClauses("IF nights > 1 AND city = 'Cebu' THEN 5 OR IF nights > 3 THEN 4", sample);

        assertThat(messages()).containsExactly("Rule accepted: clauses=2, conditions=3");
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @DisplayName("rejected rule → URN, category and detail")
    void rejected() {
        assertThatThrownBy(() -> engine.parse("IF nights > 1", sample)).isInstanceOf(MissingThenException.class);

        assertThat(messages())
                .containsExactly("Rule rejected: type=" + MissingThenException.URN
                        + ", category=SYNTAX, detail=A rule that starts with IF needs a THEN followed by a formula.");
    }

    @Test
    @DisplayName("rejected stored rule → logged the same way")
    void rejectedValidation() {
        Rule unnamed = new Rule(" ", null, sample.withFormula("5"));

        assertThatThrownBy(() -> engine.validate(unnamed)).isInstanceOf(RuleException.class);

        assertThat(messages()).singleElement().asString().startsWith("Rule rejected: type=urn:price-rule:error:");
    }

    @Test
    @DisplayName("nothing above DEBUG is written for rejections")
    void debugOnly() {
        assertThatThrownBy(() -> engine.parse("IF nights > 1", sample)).isInstanceOf(RuleException.class);

        assertThat(logAppender.list).allSatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.DEBUG));
    }
}
