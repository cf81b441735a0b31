package com.entity.ancestry.catalog;

import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.core.model.TypeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.entity.ancestry.SampleHierarchy.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CatalogRegistry Tests")
class CatalogRegistryTest {

    private CatalogRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CatalogRegistry(new SequenceGenerator());
    }

    @Nested
    @DisplayName("Declaration")
    class DeclarationTests {

        @Test
        @DisplayName("Declared catalog starts empty")
        void startsEmpty() {
            long point = registry.declare("CAT");
            assertTrue(registry.isDeclared("CAT"));
            assertEquals(TypeSet.empty(), registry.snapshotLatest("CAT"));
            assertEquals(point, registry.require("CAT").getDeclarationPoint());
        }

        @Test
        @DisplayName("Declaring twice should throw DuplicateDeclarationException")
        void duplicateDeclaration() {
            registry.declare("CAT");
            DuplicateDeclarationException e =
                    assertThrows(DuplicateDeclarationException.class, () -> registry.declare("CAT"));
            assertEquals("CAT", e.getCatalogName());
        }

        @Test
        @DisplayName("Undeclared names should throw UnknownCatalogException")
        void unknownCatalog() {
            assertThrows(UnknownCatalogException.class, () -> registry.register("NOPE", A));
            assertThrows(UnknownCatalogException.class, () -> registry.snapshot("NOPE", 1));
            assertThrows(UnknownCatalogException.class, () -> registry.snapshotLatest("NOPE"));
            assertThrows(UnknownCatalogException.class, () -> registry.containsLatest(A, "NOPE"));
            assertFalse(registry.isDeclared("NOPE"));
            assertTrue(registry.find("NOPE").isEmpty());
        }

        @Test
        @DisplayName("Blank names are rejected")
        void blankName() {
            assertThrows(IllegalArgumentException.class, () -> registry.declare(" "));
            assertThrows(NullPointerException.class, () -> registry.declare(null));
        }
    }

    @Nested
    @DisplayName("Registration and snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("Sequence numbers increase across all catalogs")
        void globalNumbering() {
            registry.declare("ONE");
            registry.declare("TWO");
            long first = registry.register("ONE", A);
            long second = registry.register("TWO", B);
            long third = registry.register("ONE", C);

            assertTrue(first < second && second < third);
            assertEquals(third, registry.currentVersion());
        }

        @Test
        @DisplayName("Versions before declaration give the empty set")
        void beforeDeclaration() {
            registry.declare("OTHER");
            registry.register("OTHER", A);
            long before = registry.currentVersion();
            registry.declare("CAT");
            registry.register("CAT", B);

            assertEquals(TypeSet.empty(), registry.snapshot("CAT", before));
            assertEquals(TypeSet.empty(), registry.snapshot("CAT", 0));
        }

        @Test
        @DisplayName("Snapshot at the k-th registration holds exactly k entities in order")
        void pointInTime() {
            registry.declare("CAT");
            List<Long> versions = new ArrayList<>();
            for (EntityDescriptor entity : REGISTRATION_ORDER) {
                versions.add(registry.register("CAT", entity));
            }

            for (int k = 1; k <= REGISTRATION_ORDER.size(); k++) {
                TypeSet snapshot = registry.snapshot("CAT", versions.get(k - 1));
                assertEquals(REGISTRATION_ORDER.subList(0, k), snapshot.asList(), "after " + k);
            }
            // No implicit deduplication: A was registered three times
            assertEquals(REGISTRATION_ORDER.size(), registry.snapshotLatest("CAT").size());
        }

        @Test
        @DisplayName("Gaps left by other catalogs resolve to the previous entry")
        void interleavedGaps() {
            registry.declare("CAT");
            registry.declare("OTHER");
            long v1 = registry.register("CAT", A);
            long gapStart = registry.register("OTHER", F);
            long gapEnd = registry.register("OTHER", G);
            long v2 = registry.register("CAT", B);

            assertEquals(TypeSet.of(A), registry.snapshot("CAT", v1));
            assertEquals(TypeSet.of(A), registry.snapshot("CAT", gapStart));
            assertEquals(TypeSet.of(A), registry.snapshot("CAT", gapEnd));
            assertEquals(TypeSet.of(A, B), registry.snapshot("CAT", v2));
            assertEquals(TypeSet.of(F, G), registry.snapshotLatest("OTHER"));
        }

        @Test
        @DisplayName("containsLatest reflects registrations")
        void containsLatest() {
            registry.declare("CAT");
            REGISTRATION_ORDER.forEach(e -> registry.register("CAT", e));

            assertTrue(registry.containsLatest(Z, "CAT"));
            assertFalse(registry.containsLatest(ZZ, "CAT"));
        }

        @Test
        @DisplayName("Catalog keeps its registration entries")
        void entries() {
            registry.declare("CAT");
            long v1 = registry.register("CAT", A);
            long v2 = registry.register("CAT", A);

            Catalog catalog = registry.require("CAT");
            assertEquals(List.of(new CatalogEntry(v1, A), new CatalogEntry(v2, A)), catalog.entries());
            assertEquals(2, catalog.size());
            assertEquals(v2, catalog.getVersion());
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("Listeners are notified after each registration")
        void notified() {
            CatalogListener listener = mock(CatalogListener.class);
            registry.addListener(listener);
            registry.declare("CAT");

            long seq = registry.register("CAT", K);

            verify(listener).onRegistered("CAT", K, seq);
            verifyNoMoreInteractions(listener);
        }

        @Test
        @DisplayName("Removed listeners are not notified")
        void removed() {
            CatalogListener listener = mock(CatalogListener.class);
            registry.addListener(listener);
            registry.removeListener(listener);
            registry.declare("CAT");
            registry.register("CAT", K);

            verifyNoInteractions(listener);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Concurrent registrations produce one total order")
        void concurrentRegistrations() throws Exception {
            registry.declare("ONE");
            registry.declare("TWO");
            int threads = 8;
            int perThread = 200;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    String catalog = t % 2 == 0 ? "ONE" : "TWO";
                    EntityDescriptor entity = EntityDescriptor.of("E" + t);
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            registry.register(catalog, entity);
                            registry.snapshotLatest(catalog);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            int expectedPerCatalog = threads / 2 * perThread;
            assertEquals(expectedPerCatalog, registry.snapshotLatest("ONE").size());
            assertEquals(expectedPerCatalog, registry.snapshotLatest("TWO").size());
            assertEquals(threads * perThread + 2, registry.currentVersion());

            // Every history entry extends the previous one by exactly one element
            Catalog one = registry.require("ONE");
            List<CatalogEntry> entries = one.entries();
            for (int i = 0; i < entries.size(); i++) {
                TypeSet snapshot = one.snapshot(entries.get(i).sequenceNumber());
                assertEquals(i + 1, snapshot.size());
                assertEquals(entries.get(i).entity(), snapshot.back());
            }
        }

        @Test
        @DisplayName("Listed entries are always visible to snapshots")
        void entriesNeverAheadOfHistory() throws Exception {
            registry.declare("CAT");
            Catalog catalog = registry.require("CAT");
            int registrations = 2000;
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<?> writer = executor.submit(() -> {
                    for (int i = 0; i < registrations; i++) {
                        registry.register("CAT", i % 2 == 0 ? A : B);
                    }
                });
                while (!writer.isDone()) {
                    List<CatalogEntry> entries = catalog.entries();
                    if (!entries.isEmpty()) {
                        CatalogEntry last = entries.get(entries.size() - 1);
                        TypeSet snapshot = catalog.snapshot(last.sequenceNumber());
                        assertEquals(entries.size(), snapshot.size());
                        assertEquals(last.entity(), snapshot.back());
                    }
                }
                writer.get(30, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }
            assertEquals(registrations, catalog.size());
        }
    }
}
