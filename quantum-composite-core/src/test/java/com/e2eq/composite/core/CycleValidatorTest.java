package com.e2eq.composite.core;

import com.e2eq.composite.exceptions.CyclicReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CycleValidatorTest {

    private static final String P = InMemoryDocumentStoreTestDouble.PROJECT;

    private InMemoryDocumentStoreTestDouble store;
    private CycleValidator validator;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStoreTestDouble();
        validator = new CycleValidator(store);
    }

    @Test
    void testAcyclicMapAccepted() {
        store.doc("B", "b{{c}}", "c", "C").doc("C", "c");
        assertDoesNotThrow(() -> validator.validate("A", Map.of("x", "B"), P));
    }

    @Test
    void testEmptyOrNullMapAccepted() {
        assertTrue(validator.findCycle("A", Map.of(), P).isEmpty());
        assertTrue(validator.findCycle("A", null, P).isEmpty());
    }

    @Test
    void testSelfReferenceRejected() {
        CyclicReferenceException ex = assertThrows(CyclicReferenceException.class,
                () -> validator.validate("A", Map.of("me", "A"), P));
        assertEquals("Cyclic dependency detected: Document A would create a circular reference", ex.getMessage());
        assertEquals("A", ex.getEditedDocumentId());
        assertEquals("A", ex.getOffendingDocumentId());
        assertNull(ex.getGroupId());
    }

    @Test
    void testIndirectCycleRejected() {
        store.doc("B", "{{c}}", "c", "C").doc("C", "{{a}}", "a", "A");
        CyclicReferenceException ex = assertThrows(CyclicReferenceException.class,
                () -> validator.validate("A", Map.of("x", "B"), P));
        assertTrue(ex.getMessage().contains("Document B would create a circular reference"));
        assertEquals("B", ex.getOffendingDocumentId());
        assertEquals("B", ex.getViolation().reference());
    }

    @Test
    void testExistingReferencesOfEditedDocumentAreIgnored() {
        // the edited document's stored map is never consulted, only the proposed one
        store.doc("A", "{{b}}", "b", "B").doc("B", "plain");
        assertTrue(validator.findCycle("B", Map.of("a", "Z"), P).isEmpty());
        assertTrue(validator.findCycle("B", Map.of("a", "A"), P).isPresent());
        assertTrue(validator.findCycle("A", Map.of("other", "B"), P).isEmpty());
    }

    @Test
    void testGroupMemberClosingCycleRejected() {
        store.groupDoc("G", "G", null, "safe")
             .groupDoc("M2", "G", "lore", "{{back}}", "back", "A");
        CyclicReferenceException ex = assertThrows(CyclicReferenceException.class,
                () -> validator.validate("A", Map.of("g", "group:G"), P));
        assertEquals("Cyclic dependency detected: Group G contains document M2 that would create a circular reference",
                ex.getMessage());
        assertEquals("G", ex.getGroupId());
        assertEquals("M2", ex.getOffendingDocumentId());
    }

    @Test
    void testGroupCheckIgnoresPreferredType() {
        // a read would pick the lore member, but every member is checked
        store.groupDoc("L", "G", "lore", "safe")
             .groupDoc("S", "G", "scene", "{{back}}", "back", "A");
        assertTrue(validator.findCycle("A", Map.of("g", "group:G:lore"), P).isPresent());
    }

    @Test
    void testEditedDocumentInsideReferencedGroupRejected() {
        store.groupDoc("A", "G", null, "a");
        Optional<CycleViolation> v = validator.findCycle("A", Map.of("g", "group:G"), P);
        assertTrue(v.isPresent());
        assertEquals("A", v.get().offendingDocumentId());
    }

    @Test
    void testGroupsExpandedAtDeeperLevels() {
        store.doc("B", "{{g}}", "g", "group:H")
             .groupDoc("H1", "H", null, "{{a}}", "a", "A");
        assertTrue(validator.findCycle("A", Map.of("x", "B"), P).isPresent());
    }

    @Test
    void testDanglingReferencesAreNoPath() {
        store.doc("B", "{{gone}}", "gone", "nowhere");
        assertTrue(validator.findCycle("A", Map.of("x", "B", "y", "missing", "z", "group:empty"), P).isEmpty());
    }

    @Test
    void testOtherProjectDocumentsAreNoPath() {
        store.put(new Document("F", "other", "F", "{{a}}", Map.of("a", "A"), null, null, Instant.now()));
        assertTrue(validator.findCycle("A", Map.of("x", "F"), P).isEmpty());
        assertTrue(validator.findCycle("A", Map.of("x", "F"), "other").isPresent());
    }

    @Test
    void testPreexistingCycleReachableFromTargetRejected() {
        // B <-> C was written without validation; pointing A at it is refused
        store.doc("B", "{{c}}", "c", "C").doc("C", "{{b}}", "b", "B");
        Optional<CycleViolation> v = validator.findCycle("A", Map.of("x", "B"), P);
        assertTrue(v.isPresent());
        assertEquals("B", v.get().offendingDocumentId());
        assertEquals(Optional.of("B"), v.get().existingCycleAt());
        assertEquals("Cyclic dependency detected: Document B would create a circular reference", v.get().message());
    }

    @Test
    void testCycleThroughEditedDocumentHasNoExistingCycleMarker() {
        store.doc("B", "{{c}}", "c", "C").doc("C", "{{a}}", "a", "A");
        Optional<CycleViolation> v = validator.findCycle("A", Map.of("x", "B"), P);
        assertTrue(v.isPresent());
        assertTrue(v.get().existingCycleAt().isEmpty());
    }

    @Test
    void testDiamondIsNotACycle() {
        store.doc("B", "{{d}}", "d", "D").doc("C", "{{d}}", "d", "D").doc("D", "d");
        Map<String, String> proposed = new LinkedHashMap<>();
        proposed.put("b", "B");
        proposed.put("c", "C");
        assertTrue(validator.findCycle("A", proposed, P).isEmpty());
        // D fully explored through B is not fetched again through C
        assertEquals(1, store.getFetchCount("D"));
    }

    @Test
    void testMalformedReferencesIgnored() {
        assertTrue(validator.findCycle("A", Map.of("x", "group:", "y", " "), P).isEmpty());
    }
}
