package io.schemarules.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemarules.core.model.ConstraintSet;
import io.schemarules.core.model.Rule;
import io.schemarules.core.model.RuleChain;
import io.schemarules.core.spi.SchemaNode;
import io.schemarules.core.testkit.TestSchemaNode;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the rule-to-constraint table in {@link ConstraintMapper}. */
class ConstraintMapperTest {

    private final ConstraintMapper mapper = new ConstraintMapper();

    private ConstraintSet map(SchemaNode node, Rule... rules) {
        return mapper.map(RuleChain.of("p", rules), node);
    }

    @Nested
    @DisplayName("Presence rules")
    class Presence {

        @Test
        void notNullMarksRequiredAndNotNullableOnly() {
            ConstraintSet set = map(TestSchemaNode.string(), Rule.notNull());

            assertThat(set.isRequired()).isTrue();
            assertThat(set.isNotNullable()).isTrue();
            assertThat(set.minLength()).isNull();
        }

        @Test
        void notEmptyOnStringAddsMinLengthOne() {
            ConstraintSet set = map(TestSchemaNode.string(), Rule.notEmpty());

            assertThat(set.isRequired()).isTrue();
            assertThat(set.isNotNullable()).isTrue();
            assertThat(set.minLength()).isEqualTo(1);
        }

        @Test
        void notEmptyOnArrayAddsMinItemsOne() {
            ConstraintSet set = map(new TestSchemaNode("array"), Rule.notEmpty());

            assertThat(set.minItems()).isEqualTo(1);
            assertThat(set.minLength()).isNull();
        }

        @Test
        void notEmptyOnIntegerAddsNoLength() {
            ConstraintSet set = map(TestSchemaNode.integer(), Rule.notEmpty());

            assertThat(set.isRequired()).isTrue();
            assertThat(set.minLength()).isNull();
            assertThat(set.minItems()).isNull();
        }

        @Test
        void notEmptyOnEmptyNodeStillRequires() {
            ConstraintSet set = map(SchemaNode.empty(), Rule.notEmpty());

            assertThat(set.isRequired()).isTrue();
            assertThat(set.minLength()).isNull();
        }
    }

    @Nested
    @DisplayName("Length rules")
    class Lengths {

        @Test
        void notEmptyThenMaximumLength() {
            ConstraintSet set = map(TestSchemaNode.string(), Rule.notEmpty(), Rule.maximumLength(100));

            assertThat(set.minLength()).isEqualTo(1);
            assertThat(set.maxLength()).isEqualTo(100);
        }

        @Test
        void maximumLengthThenNotEmpty() {
            ConstraintSet set = map(TestSchemaNode.string(), Rule.maximumLength(100), Rule.notEmpty());

            assertThat(set.minLength()).isEqualTo(1);
            assertThat(set.maxLength()).isEqualTo(100);
        }

        @Test
        void lengthSetsBothBounds() {
            ConstraintSet set = map(TestSchemaNode.string(), Rule.length(2, 8));

            assertThat(set.minLength()).isEqualTo(2);
            assertThat(set.maxLength()).isEqualTo(8);
        }

        @Test
        void repeatedLengthRulesKeepTightestBounds() {
            ConstraintSet set = map(
                    TestSchemaNode.string(),
                    Rule.minimumLength(1),
                    Rule.minimumLength(2),
                    Rule.maximumLength(1),
                    Rule.maximumLength(2));

            assertThat(set.minLength()).isEqualTo(2);
            assertThat(set.maxLength()).isEqualTo(1);
        }

        @Test
        void lengthOnArrayTargetsItems() {
            ConstraintSet set = map(new TestSchemaNode("array"), Rule.length(1, 5));

            assertThat(set.minItems()).isEqualTo(1);
            assertThat(set.maxItems()).isEqualTo(5);
            assertThat(set.minLength()).isNull();
            assertThat(set.maxLength()).isNull();
        }
    }

    @Nested
    @DisplayName("Comparison rules")
    class Comparisons {

        @Test
        void greaterThanZeroIsExclusiveMinimum() {
            ConstraintSet set = map(TestSchemaNode.integer(), Rule.greaterThan(0));

            assertThat(set.minimum()).isEqualByComparingTo("0");
            assertThat(set.exclusiveMinimum()).isTrue();
            assertThat(set.maximum()).isNull();
        }

        @Test
        void greaterThanOrEqualIsInclusive() {
            ConstraintSet set = map(TestSchemaNode.integer(), Rule.greaterThanOrEqual(3));

            assertThat(set.minimum()).isEqualByComparingTo("3");
            assertThat(set.exclusiveMinimum()).isFalse();
        }

        @Test
        void lessThanIsExclusiveMaximum() {
            ConstraintSet set = map(TestSchemaNode.integer(), Rule.lessThan(10));

            assertThat(set.maximum()).isEqualByComparingTo("10");
            assertThat(set.exclusiveMaximum()).isTrue();
        }

        @Test
        void lessThanOrEqualIsInclusive() {
            ConstraintSet set = map(TestSchemaNode.integer(), Rule.lessThanOrEqual(10));

            assertThat(set.maximum()).isEqualByComparingTo("10");
            assertThat(set.exclusiveMaximum()).isFalse();
        }

        @Test
        void inclusiveBetweenHasNoExclusiveFlags() {
            ConstraintSet set = map(TestSchemaNode.integer(), Rule.inclusiveBetween(5, 10));

            assertThat(set.minimum()).isEqualByComparingTo("5");
            assertThat(set.maximum()).isEqualByComparingTo("10");
            assertThat(set.exclusiveMinimum()).isFalse();
            assertThat(set.exclusiveMaximum()).isFalse();
        }

        @Test
        void exclusiveBetweenSetsBothFlags() {
            ConstraintSet set = map(TestSchemaNode.integer(), Rule.exclusiveBetween(5.1f, 10.2));

            assertThat(set.minimum()).isEqualByComparingTo("5.1");
            assertThat(set.maximum()).isEqualByComparingTo("10.2");
            assertThat(set.exclusiveMinimum()).isTrue();
            assertThat(set.exclusiveMaximum()).isTrue();
        }
    }

    @Test
    void matchesSetsPattern() {
        assertThat(map(TestSchemaNode.string(), Rule.matches("^\\d+$")).pattern()).isEqualTo("^\\d+$");
    }

    @Test
    void emailAddressSetsEmailPattern() {
        assertThat(map(TestSchemaNode.string(), Rule.emailAddress()).pattern())
                .isEqualTo(ConstraintMapper.EMAIL_PATTERN);
    }

    @Test
    void isInEnumSetsAllowedValues() {
        assertThat(map(TestSchemaNode.string(), Rule.isInEnum(List.of("A", "B"))).enumValues())
                .containsExactly("A", "B");
    }

    @Test
    void nullableEnumIsMappedOnAnyNode() {
        Rule rule = Rule.isInEnum(Arrays.asList("A", null));

        assertThat(map(SchemaNode.empty(), rule).enumValues()).containsExactly("A", null);
    }

    @Test
    void mapIntoAccumulatesAcrossChains() {
        ConstraintSet set = new ConstraintSet();
        mapper.mapInto(set, RuleChain.of("p", Rule.maximumLength(50)), TestSchemaNode.string());
        mapper.mapInto(set, RuleChain.of("p", Rule.maximumLength(20), Rule.notNull()), TestSchemaNode.string());

        assertThat(set.maxLength()).isEqualTo(20);
        assertThat(set.isRequired()).isTrue();
    }
}
