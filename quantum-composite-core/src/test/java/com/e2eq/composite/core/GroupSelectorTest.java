package com.e2eq.composite.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GroupSelectorTest {

    private static Document member(String id, String type, long created) {
        return new Document(id, "p1", id, "", Map.of(), "G", type, Instant.ofEpochSecond(created));
    }

    @Test
    void testRepresentativeChosenWithoutPreferredType() {
        Document m1 = member("M1", "lore", 1);
        Document m2 = member("G", null, 2);
        assertEquals("G", GroupSelector.select("G", Optional.empty(), List.of(m1, m2)).orElseThrow().id());
    }

    @Test
    void testPreferredTypeBeatsRepresentative() {
        Document m1 = member("M1", "lore", 2);
        Document m2 = member("G", null, 1);
        assertEquals("M1", GroupSelector.select("G", Optional.of("lore"), List.of(m2, m1)).orElseThrow().id());
    }

    @Test
    void testUnmatchedPreferredTypeFallsBackToRepresentative() {
        Document m1 = member("M1", "lore", 1);
        Document m2 = member("G", "scene", 2);
        assertEquals("G", GroupSelector.select("G", Optional.of("outline"), List.of(m1, m2)).orElseThrow().id());
    }

    @Test
    void testOldestMemberWhenNoRepresentative() {
        Document newer = member("M2", null, 20);
        Document older = member("M1", null, 10);
        assertEquals("M1", GroupSelector.select("G", Optional.empty(), List.of(newer, older)).orElseThrow().id());
        assertEquals("M1", GroupSelector.select("G", Optional.empty(), List.of(older, newer)).orElseThrow().id());
    }

    @Test
    void testSameCreationTimeBrokenById() {
        Document b = member("B", null, 5);
        Document a = member("A", null, 5);
        assertEquals("A", GroupSelector.select("G", Optional.empty(), List.of(b, a)).orElseThrow().id());
    }

    @Test
    void testOldestOfSeveralPreferredTypeMatches() {
        Document late = member("L", "lore", 9);
        Document early = member("E", "lore", 3);
        assertEquals("E", GroupSelector.select("G", Optional.of("lore"), List.of(late, early)).orElseThrow().id());
    }

    @Test
    void testEmptyGroupSelectsNothing() {
        assertTrue(GroupSelector.select("G", Optional.of("lore"), List.of()).isEmpty());
        assertTrue(GroupSelector.select("G", Optional.empty(), null).isEmpty());
    }

    @Test
    void testAvailableTypes() {
        List<Document> members = List.of(member("a", "scene", 1), member("b", "lore", 2),
                member("c", null, 3), member("d", "lore", 4));
        assertEquals(List.of("lore", "scene"), GroupSelector.availableTypes(members));
    }
}
