package io.schemarules.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the fluent {@link RuleSetValidator} builder. */
class RuleSetValidatorTest {

    record Customer(String name, String email, int age) {}

    static final class CustomerValidator extends RuleSetValidator<Customer> {
        CustomerValidator() {
            super(Customer.class);
            ruleFor("name").notEmpty().maximumLength(64);
            ruleFor("email").emailAddress();
            ruleFor("age").inclusiveBetween(18, 120);
            ruleFor("name").matches("^[A-Z].*");
        }
    }

    @Test
    void collectsChainsInDeclarationOrder() {
        var validator = new CustomerValidator();

        assertThat(validator.validatedType()).isEqualTo(Customer.class);
        assertThat(validator.ruleChains())
                .extracting(RuleChain::propertyName)
                .containsExactly("name", "email", "age", "name");
        assertThat(validator.ruleChains().get(0).rules())
                .extracting(Rule::kind)
                .containsExactly(RuleKind.NOT_EMPTY, RuleKind.MAXIMUM_LENGTH);
    }

    @Test
    void toStringNamesValidatedType() {
        assertThat(new CustomerValidator()).hasToString("CustomerValidator[Customer]");
    }
}
