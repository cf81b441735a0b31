package com.entity.ancestry.resolve;

import com.entity.ancestry.SampleHierarchy;
import com.entity.ancestry.core.model.AncestorChain;
import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.core.model.InvalidTypeSetException;
import com.entity.ancestry.core.model.TypeSet;
import com.entity.ancestry.relation.SubtypeRelation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.entity.ancestry.SampleHierarchy.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AncestorResolver Tests")
class AncestorResolverTest {

    private static final TypeSet SNAPSHOT = TypeSet.copyOf(REGISTRATION_ORDER);

    @Nested
    @DisplayName("Fold order")
    class FoldOrderTests {

        private final AncestorResolver resolver = new AncestorResolver(SampleHierarchy.relation());

        @Test
        @DisplayName("Single-inheritance branch resolves most ancient first")
        void singleInheritance() {
            assertEquals(List.of(A, C), resolver.resolve(D, SNAPSHOT).asList());
            assertEquals(List.of(A, B), resolver.resolve(T, SNAPSHOT).asList());
        }

        @Test
        @DisplayName("Diamond siblings follow the fold")
        void diamond() {
            assertEquals(List.of(F, H, J, I), resolver.resolve(K, SNAPSHOT).asList());
            assertEquals(List.of(F, H, J, I, K), resolver.resolve(W, SNAPSHOT).asList());
        }

        @Test
        @DisplayName("Roots have no ancestors")
        void roots() {
            assertTrue(resolver.resolve(A, SNAPSHOT).isEmpty());
            assertTrue(resolver.resolve(F, SNAPSHOT).isEmpty());
        }

        @Test
        @DisplayName("Queried entity is never part of its chain")
        void excludesQueried() {
            for (EntityDescriptor entity : REGISTRATION_ORDER) {
                AncestorChain chain = resolver.resolve(entity, SNAPSHOT);
                assertFalse(chain.contains(entity), "chain of " + entity);
                assertEquals(entity, chain.getQueried());
            }
        }

        @Test
        @DisplayName("Repeated registrations appear once in the chain")
        void duplicatesCollapse() {
            TypeSet repeated = TypeSet.of(A, A, C, A, C, D);
            assertEquals(List.of(A, C), resolver.resolve(D, repeated).asList());
        }

        @Test
        @DisplayName("Entity absent from the snapshot still resolves its registered ancestors")
        void absentQueried() {
            TypeSet withoutW = SNAPSHOT.removeAll(W);
            assertEquals(List.of(F, H, J, I, K), resolver.resolve(W, withoutW).asList());
        }

        @Test
        @DisplayName("Ancestors missing from the snapshot are skipped")
        void partialSnapshot() {
            assertEquals(List.of(H, K), resolver.resolve(W, TypeSet.of(K, H, C)).asList());
        }

        @Test
        @DisplayName("Empty snapshot yields an empty chain")
        void emptySnapshot() {
            assertTrue(resolver.resolve(W, TypeSet.empty()).isEmpty());
        }

        @Test
        @DisplayName("Null snapshot should throw InvalidTypeSetException")
        void nullSnapshot() {
            assertThrows(InvalidTypeSetException.class, () -> resolver.resolve(W, null));
        }

        @Test
        @DisplayName("Incomparable siblings come out last-registered first")
        void siblingFoldOrder() {
            assertEquals(List.of(H, J, I), resolver.resolve(K, TypeSet.of(I, H, J)).asList());
            assertEquals(List.of(H, I, J), resolver.resolve(K, TypeSet.of(J, H, I)).asList());
        }
    }

    @Nested
    @DisplayName("Declaration-stable order")
    class StableOrderTests {

        private final AncestorResolver resolver =
                new AncestorResolver(SampleHierarchy.relation(), ResolutionOrder.DECLARATION_STABLE);

        @Test
        @DisplayName("Siblings come out in snapshot order")
        void siblingsInSnapshotOrder() {
            assertEquals(List.of(F, H, I, J), resolver.resolve(K, SNAPSHOT).asList());
            assertEquals(List.of(F, H, I, J, K), resolver.resolve(W, SNAPSHOT).asList());
            assertEquals(List.of(H, J, I), resolver.resolve(K, TypeSet.of(J, H, I)).asList());
        }

        @Test
        @DisplayName("Non-sibling order matches the fold")
        void matchesFoldForChains() {
            assertEquals(List.of(A, C), resolver.resolve(D, SNAPSHOT).asList());
            assertEquals(ResolutionOrder.DECLARATION_STABLE, resolver.getOrder());
        }
    }

    @Test
    @DisplayName("Any supplied relation is honored")
    void customRelation() {
        // Single chain by name length: "a" above "ab" above "abc"
        SubtypeRelation prefix = (ancestor, descendant) -> descendant.getName().startsWith(ancestor.getName());
        AncestorResolver resolver = new AncestorResolver(prefix);
        EntityDescriptor a = EntityDescriptor.of("a");
        EntityDescriptor ab = EntityDescriptor.of("ab");
        EntityDescriptor abc = EntityDescriptor.of("abc");
        EntityDescriptor x = EntityDescriptor.of("x");

        assertEquals(List.of(a, ab), resolver.resolve(abc, TypeSet.of(x, ab, abc, a)).asList());
    }
}
