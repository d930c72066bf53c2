package io.schemarules.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Base class for validators declared in code:
 *
 * <pre>{@code
 * class SearchRequestValidator extends RuleSetValidator<SearchRequest> {
 *     SearchRequestValidator() {
 *         super(SearchRequest.class);
 *         ruleFor("query").notEmpty().maximumLength(200);
 *         ruleFor("page").greaterThan(0);
 *     }
 * }
 * }</pre>
 *
 * @param <T> the validated type
 */
public abstract class RuleSetValidator<T> implements Validator {

    private final Class<T> validatedType;
    private final List<RuleBuilder> builders = new ArrayList<>();

    protected RuleSetValidator(Class<T> validatedType) {
        this.validatedType = Objects.requireNonNull(validatedType, "validatedType must not be null");
    }

    /** Starts a new rule chain for {@code propertyName}. */
    protected final RuleBuilder ruleFor(String propertyName) {
        RuleBuilder builder = new RuleBuilder(propertyName);
        builders.add(builder);
        return builder;
    }

    @Override
    public final Class<T> validatedType() {
        return validatedType;
    }

    @Override
    public final List<RuleChain> ruleChains() {
        return builders.stream().map(RuleBuilder::toChain).toList();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + validatedType.getSimpleName() + "]";
    }

    /** Fluent builder for one property's rule chain. */
    public static final class RuleBuilder {

        private final String propertyName;
        private final List<Rule> rules = new ArrayList<>();

        RuleBuilder(String propertyName) {
            this.propertyName = Objects.requireNonNull(propertyName, "propertyName must not be null");
        }

        public RuleBuilder notNull() {
            return add(Rule.notNull());
        }

        public RuleBuilder notEmpty() {
            return add(Rule.notEmpty());
        }

        public RuleBuilder maximumLength(int max) {
            return add(Rule.maximumLength(max));
        }

        public RuleBuilder minimumLength(int min) {
            return add(Rule.minimumLength(min));
        }

        public RuleBuilder length(int min, int max) {
            return add(Rule.length(min, max));
        }

        public RuleBuilder greaterThan(Number value) {
            return add(Rule.greaterThan(value));
        }

        public RuleBuilder greaterThanOrEqualTo(Number value) {
            return add(Rule.greaterThanOrEqual(value));
        }

        public RuleBuilder lessThan(Number value) {
            return add(Rule.lessThan(value));
        }

        public RuleBuilder lessThanOrEqualTo(Number value) {
            return add(Rule.lessThanOrEqual(value));
        }

        public RuleBuilder inclusiveBetween(Number from, Number to) {
            return add(Rule.inclusiveBetween(from, to));
        }

        public RuleBuilder exclusiveBetween(Number from, Number to) {
            return add(Rule.exclusiveBetween(from, to));
        }

        public RuleBuilder matches(String regex) {
            return add(Rule.matches(regex));
        }

        public RuleBuilder emailAddress() {
            return add(Rule.emailAddress());
        }

        public RuleBuilder isInEnum(Collection<?> values) {
            return add(Rule.isInEnum(values));
        }

        public RuleBuilder isInEnum(Class<? extends Enum<?>> enumType) {
            return add(Rule.isInEnum(enumType));
        }

        public RuleBuilder rule(Rule rule) {
            return add(Objects.requireNonNull(rule, "rule must not be null"));
        }

        private RuleBuilder add(Rule rule) {
            rules.add(rule);
            return this;
        }

        RuleChain toChain() {
            return new RuleChain(propertyName, rules);
        }
    }
}
