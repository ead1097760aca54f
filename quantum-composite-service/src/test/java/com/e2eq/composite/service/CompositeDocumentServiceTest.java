package com.e2eq.composite.service;

import com.e2eq.composite.core.Document;
import com.e2eq.composite.exceptions.CyclicReferenceException;
import com.e2eq.composite.rest.dto.DocumentRequest;
import com.e2eq.composite.store.DocumentCatalog;
import com.e2eq.composite.store.InMemoryDocumentStore;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
public class CompositeDocumentServiceTest {

    private static final String P = "svc";
    private static final int ROUNDS = 40;

    @Inject
    CompositeDocumentService service;

    @Inject
    DocumentCatalog catalog;

    @BeforeEach
    void reset() {
        ((InMemoryDocumentStore) catalog).clear();
    }

    private void seedPair() {
        Instant t0 = Instant.parse("2024-07-01T00:00:00Z");
        catalog.save(new Document("A", P, "A", "a", null, null, null, t0));
        catalog.save(new Document("B", P, "B", "b", null, null, null, t0.plusSeconds(1)));
    }

    private static DocumentRequest pointAt(String target) {
        return DocumentRequest.builder().content("{{t}}").components(Map.of("t", target)).build();
    }

    @Test
    public void testConcurrentOpposingUpdatesNeverBothCommit() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < ROUNDS; round++) {
                reset();
                seedPair();
                CountDownLatch start = new CountDownLatch(1);
                List<Future<Boolean>> results = new ArrayList<>();
                results.add(pool.submit(update(start, "A", "B")));
                results.add(pool.submit(update(start, "B", "A")));
                start.countDown();

                int committed = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(10, TimeUnit.SECONDS)) committed++;
                }
                assertEquals(1, committed, "round " + round);
                boolean aToB = catalog.getDocument("A").orElseThrow().isComposite();
                boolean bToA = catalog.getDocument("B").orElseThrow().isComposite();
                assertFalse(aToB && bToA, "both directions stored in round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private Callable<Boolean> update(CountDownLatch start, String documentId, String target) {
        return () -> {
            start.await();
            try {
                service.update(P, documentId, pointAt(target));
                return true;
            } catch (CyclicReferenceException e) {
                return false;
            }
        };
    }

    @Test
    public void testImportValidatesWholeBatchBeforeSaving() {
        Instant t0 = Instant.parse("2024-07-01T00:00:00Z");
        Document ok = new Document("ok", P, "ok", "plain", null, "G", null, t0);
        Document x = new Document("X", P, "X", "{{y}}", Map.of("y", "Y"), null, null, t0.plusSeconds(1));
        Document y = new Document("Y", P, "Y", "{{g}}", Map.of("g", "group:G"), null, null, t0.plusSeconds(2));
        Document member = new Document("M", P, "M", "{{x}}", Map.of("x", "X"), "G", null, t0.plusSeconds(3));

        CyclicReferenceException ex = assertThrows(CyclicReferenceException.class,
                () -> service.importDocuments(List.of(ok, x, y, member)));
        assertEquals("X", ex.getEditedDocumentId());
        assertEquals(0, ((InMemoryDocumentStore) catalog).size());

        assertEquals(3, service.importDocuments(List.of(ok, x, y)).size());
        assertEquals("plain", service.resolve("X", Map.of()).text());
    }

    @Test
    public void testImportedGraphResolves() {
        Instant t0 = Instant.parse("2024-07-01T00:00:00Z");
        service.importDocuments(List.of(
                new Document("outer", P, "outer", "[{{in}}]", Map.of("in", "inner"), null, null, t0),
                new Document("inner", P, "inner", "inside", null, null, null, t0.plusSeconds(1))));
        assertEquals("[inside]", service.resolve("outer", Map.of()).text());
    }
}
