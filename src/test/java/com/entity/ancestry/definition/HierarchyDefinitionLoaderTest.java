package com.entity.ancestry.definition;

import com.entity.ancestry.api.HierarchyInspector;
import com.entity.ancestry.catalog.SequenceGenerator;
import com.entity.ancestry.relation.EdgeSetSubtypeRelation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static com.entity.ancestry.SampleHierarchy.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HierarchyDefinitionLoader Tests")
class HierarchyDefinitionLoaderTest {

    private final HierarchyDefinitionLoader loader = new HierarchyDefinitionLoader();

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Should load entities and catalogs in document order")
        void loadsResource() {
            HierarchyDefinition definition = loader.loadResource("hierarchy/sample-hierarchy.json");

            assertEquals(15, definition.entities().size());
            assertEquals(List.of("CAT", "ROOTS"), List.copyOf(definition.catalogs().keySet()));
            assertEquals(17, definition.catalogs().get("CAT").size());
            assertEquals(List.of(), definition.entities().get(0).parents());
        }

        @Test
        @DisplayName("Should build the described relation")
        void buildsRelation() {
            EdgeSetSubtypeRelation relation = loader.loadResource("hierarchy/sample-hierarchy.json").toRelation();

            assertTrue(relation.isAncestorOf(F, W));
            assertTrue(relation.isAncestorOf(A, T));
            assertFalse(relation.isAncestorOf(I, J));
        }

        @Test
        @DisplayName("Missing sections default to empty")
        void missingSections() {
            HierarchyDefinition definition = loader.load(new StringReader("{}"));
            assertTrue(definition.entities().isEmpty());
            assertTrue(definition.catalogs().isEmpty());
        }
    }

    @Nested
    @DisplayName("Applying")
    class ApplyingTests {

        @Test
        @DisplayName("Applied definition reproduces the sample scenario")
        void appliesToInspector() {
            HierarchyDefinition definition = loader.loadResource("hierarchy/sample-hierarchy.json");
            HierarchyInspector inspector = HierarchyInspector.builder()
                    .subtypeRelation(definition.toRelation())
                    .sequenceGenerator(new SequenceGenerator())
                    .build();

            definition.applyTo(inspector);

            assertEquals(List.of(A, C), inspector.resolveAncestors(D, "CAT").asList());
            assertEquals(List.of(F, H, J, I), inspector.resolveAncestors(K, "CAT").asList());
            assertEquals(List.of(F, H, J, I, K), inspector.resolveAncestors(W, "CAT").asList());
            assertTrue(inspector.containsLatest(Z, "CAT"));
            assertFalse(inspector.containsLatest(ZZ, "CAT"));
            assertEquals(List.of(F), inspector.resolveAncestors(W, "ROOTS").asList());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Malformed JSON should throw HierarchyDefinitionException")
        void malformed() {
            HierarchyDefinitionException e = assertThrows(HierarchyDefinitionException.class,
                    () -> loader.loadResource("hierarchy/malformed-hierarchy.json"));
            assertNotNull(e.getCause());
        }

        @Test
        @DisplayName("Entity without a name should throw HierarchyDefinitionException")
        void missingName() {
            assertThrows(HierarchyDefinitionException.class,
                    () -> loader.load(new StringReader("{\"entities\": [{\"parents\": [\"A\"]}]}")));
        }

        @Test
        @DisplayName("Missing resource should throw HierarchyDefinitionException")
        void missingResource() {
            assertThrows(HierarchyDefinitionException.class,
                    () -> loader.loadResource("hierarchy/does-not-exist.json"));
        }
    }
}
