package io.schemarules.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemarules.core.config.SchemaGenerationOptions;
import io.schemarules.core.model.RuleSetValidator;
import io.schemarules.core.registry.DefaultValidatorRegistry;
import io.schemarules.core.spi.SchemaNode;
import io.schemarules.core.testkit.TestSchemaNode;
import io.schemarules.core.testkit.TestSchemaStore;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for the per-operation hook {@link OperationAugmenter}. */
class OperationAugmenterTest {

    static final class SearchQuery {}

    static final class Unvalidated {}

    static final class SearchQueryValidator extends RuleSetValidator<SearchQuery> {
        SearchQueryValidator() {
            super(SearchQuery.class);
            ruleFor("text").notEmpty().maximumLength(200);
            ruleFor("page").greaterThan(0);
            ruleFor("sort").notNull().matches("^(asc|desc)$");
        }
    }

    /** Parameter expanded from a container property. */
    static final class Param implements OperationParameter {
        private final String name;
        private final Class<?> container;
        private final TestSchemaNode schema;
        private boolean required;

        Param(String name, Class<?> container, TestSchemaNode schema) {
            this.name = name;
            this.container = container;
            this.schema = schema;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<Class<?>> containerType() {
            return Optional.ofNullable(container);
        }

        @Override
        public String propertyName() {
            return name;
        }

        @Override
        public SchemaNode schema() {
            return schema;
        }

        @Override
        public boolean isRequired() {
            return required;
        }

        @Override
        public void markRequired() {
            required = true;
        }
    }

    private final SchemaGenerationOptions options = SchemaGenerationOptions.defaults();
    private final DefaultValidatorRegistry registry = DefaultValidatorRegistry.of(options, new SearchQueryValidator());
    private TestSchemaStore store;
    private OperationAugmenter augmenter;

    @BeforeEach
    void setUp() {
        SchemaAugmenter schemaAugmenter = new SchemaAugmenter(registry, options);
        store = new TestSchemaStore(type -> {
            TestSchemaNode node = TestSchemaNode.object()
                    .property("text", TestSchemaNode.string())
                    .property("page", TestSchemaNode.integer())
                    .property("sort", TestSchemaNode.string().references("SortOrder"));
            schemaAugmenter.augment(new TestSchemaStore.TestSchemaContext(type, node, store));
            return node;
        });
        store.put("Existing", TestSchemaNode.object());
        augmenter = new OperationAugmenter(registry, options);
    }

    @Test
    void copiesContainerConstraintsOntoParameters() {
        Param text = new Param("text", SearchQuery.class, TestSchemaNode.string());
        Param page = new Param("page", SearchQuery.class, TestSchemaNode.integer());

        augmenter.augment(List.of(text, page), store, store, Set::of);

        assertThat(text.schema.getMinLength()).isEqualTo(1);
        assertThat(text.schema.getMaxLength()).isEqualTo(200);
        assertThat(text.isRequired()).isTrue();
        assertThat(page.schema.getMinimum()).isEqualByComparingTo("0");
        assertThat(page.schema.getExclusiveMinimum()).isTrue();
        assertThat(page.isRequired()).isFalse();
    }

    @Test
    void containerSchemaCreatedForLookupIsRemoved() {
        Param text = new Param("text", SearchQuery.class, TestSchemaNode.string());

        Set<String> removed = augmenter.augment(List.of(text), store, store, Set::of);

        assertThat(store.materialized()).isEqualTo(1);
        assertThat(removed).containsExactly("SearchQuery");
        assertThat(store.schemaIds()).containsExactly("Existing");
    }

    @Test
    void containerSchemaReferencedByOutputSurvives() {
        Param text = new Param("text", SearchQuery.class, TestSchemaNode.string());

        Set<String> removed = augmenter.augment(List.of(text), store, store, () -> Set.of("SearchQuery"));

        assertThat(removed).isEmpty();
        assertThat(store.schemaIds()).contains("SearchQuery");
    }

    @Test
    void preExistingContainerSchemaIsKept() {
        store.getSchemaForType(SearchQuery.class);
        Param text = new Param("text", SearchQuery.class, TestSchemaNode.string());

        Set<String> removed = augmenter.augment(List.of(text), store, store, Set::of);

        assertThat(removed).isEmpty();
        assertThat(store.schemaIds()).containsExactly("Existing", "SearchQuery");
        assertThat(text.schema.getMaxLength()).isEqualTo(200);
    }

    @Test
    void unreachableContainerPropertyFallsBackToRules() {
        Param sort = new Param("sort", SearchQuery.class, TestSchemaNode.string());

        augmenter.augment(List.of(sort), store, store, Set::of);

        assertThat(sort.schema.getPattern()).isEqualTo("^(asc|desc)$");
        assertThat(sort.schema.getNullable()).isFalse();
        assertThat(sort.isRequired()).isTrue();
    }

    @Test
    void rulesReachParametersWhenContainerSchemaHasNoConstraints() {
        TestSchemaStore plain = new TestSchemaStore(type -> TestSchemaNode.object()
                .property("text", TestSchemaNode.string())
                .property("page", TestSchemaNode.integer()));
        Param text = new Param("text", SearchQuery.class, TestSchemaNode.string());
        Param page = new Param("page", SearchQuery.class, TestSchemaNode.integer());

        augmenter.augment(List.of(text, page), plain, plain, Set::of);

        assertThat(text.schema.getMinLength()).isEqualTo(1);
        assertThat(text.schema.getMaxLength()).isEqualTo(200);
        assertThat(text.isRequired()).isTrue();
        assertThat(page.schema.getMinimum()).isEqualByComparingTo("0");
        assertThat(page.schema.getExclusiveMinimum()).isTrue();
        assertThat(page.isRequired()).isFalse();
    }

    @Test
    void parametersWithoutValidatedContainerAreIgnored() {
        Param direct = new Param("id", null, TestSchemaNode.string());
        Param other = new Param("text", Unvalidated.class, TestSchemaNode.string());

        Set<String> removed = augmenter.augment(List.of(direct, other), store, store, Set::of);

        assertThat(removed).isEmpty();
        assertThat(store.materialized()).isZero();
        assertThat(other.schema.getMaxLength()).isNull();
        assertThat(direct.isRequired()).isFalse();
    }
}
