package io.schemarules.reference;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemarules.core.model.ConstraintSet;
import io.schemarules.core.model.Rule;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReferenceSchemaNodeTest {

    private final ObjectNode json = JsonNodeFactory.instance.objectNode().put("type", "integer");
    private final ReferenceSchemaNode node = new ReferenceSchemaNode(json);

    @Test
    void integralBoundsAreWrittenWithoutFraction() {
        node.setMinimum(new BigDecimal("10.00"));
        node.setMaximum(new BigDecimal("10.50"));

        assertThat(json.toString()).contains("\"minimum\":10,").contains("\"maximum\":10.5");
        assertThat(node.getMinimum()).isEqualByComparingTo("10");
    }

    @Test
    void nullWriteRemovesKeyword() {
        node.setExclusiveMinimum(true);
        node.setExclusiveMinimum(null);

        assertThat(json.has("exclusiveMinimum")).isFalse();
        assertThat(node.getExclusiveMinimum()).isNull();
    }

    @Test
    void requiredIsDeduplicated() {
        node.addRequired("a");
        node.addRequired("b");
        node.addRequired("a");

        assertThat(node.getRequired()).containsExactly("a", "b");
        assertThat(json.path("required")).hasSize(2);
    }

    @Test
    void enumValuesKeepTheirJsonTypes() {
        node.setEnumValues(List.<Object>of("A", new BigDecimal("2"), true));

        assertThat(json.path("enum").get(0).isTextual()).isTrue();
        assertThat(json.path("enum").get(1).isNumber()).isTrue();
        assertThat(json.path("enum").get(2).isBoolean()).isTrue();
        assertThat(node.getEnumValues()).hasSize(3);
    }

    @Test
    void nullEnumMemberSurvivesReadAndWrite() {
        json.putArray("enum").add("A").addNull();

        assertThat(node.getEnumValues()).containsExactly("A", null);

        ConstraintSet.readFrom(node).writeTo(node);

        assertThat(json.path("enum").toString()).isEqualTo("[\"A\",null]");
    }

    @Test
    void floatEnumMembersAreWrittenExactly() {
        node.setEnumValues(Rule.isInEnum(List.of(5.1f, 7)).values());

        assertThat(json.path("enum").toString()).isEqualTo("[5.1,7]");
    }

    @Test
    void typeIsReadFromJson() {
        assertThat(node.type()).hasValue("integer");
        assertThat(node.isEmpty()).isFalse();
        assertThat(node.propertyNames()).isEmpty();
    }
}
