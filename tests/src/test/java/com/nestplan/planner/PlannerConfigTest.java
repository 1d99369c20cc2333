package com.nestplan.planner;

import com.nestplan.test.TestBase;
import com.nestplan.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PlannerConfig}.
 */
@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("PlannerConfig Tests")
public class PlannerConfigTest extends TestBase {

    @Test
    @DisplayName("Defaults")
    void testDefaults() {
        PlannerConfig config = PlannerConfig.defaults();

        assertThat(config.maxSubqueryDepth()).isEqualTo(PlannerConfig.DEFAULT_MAX_SUBQUERY_DEPTH);
        assertThat(config.checkLiteralCasts()).isTrue();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"0, 16", "-3, 16", "1, 1", "64, 64", "256, 256", "1000, 256"})
    @DisplayName("Depth limits are normalized into the accepted range")
    void testNormalizeDepth(int requested, int expected) {
        assertThat(PlannerConfig.normalizeDepth(requested)).isEqualTo(expected);
        assertThat(PlannerConfig.defaults().withMaxSubqueryDepth(requested).maxSubqueryDepth()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Properties override the defaults")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(PlannerConfig.MAX_SUBQUERY_DEPTH, " 4 ");
        properties.setProperty(PlannerConfig.CHECK_LITERAL_CASTS, "false");

        PlannerConfig config = PlannerConfig.fromProperties(properties);

        assertThat(config.maxSubqueryDepth()).isEqualTo(4);
        assertThat(config.checkLiteralCasts()).isFalse();
        assertThat(config).isEqualTo(PlannerConfig.defaults().withMaxSubqueryDepth(4).withCheckLiteralCasts(false));
    }

    @Test
    @DisplayName("Malformed values fall back to the defaults")
    void testMalformedProperties() {
        Properties properties = new Properties();
        properties.setProperty(PlannerConfig.MAX_SUBQUERY_DEPTH, "deep");

        assertThat(PlannerConfig.fromProperties(properties)).isEqualTo(PlannerConfig.defaults());
        assertThat(PlannerConfig.fromProperties(new Properties())).isEqualTo(PlannerConfig.defaults());
    }
}
