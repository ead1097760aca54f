package com.e2eq.composite.rest;

import com.e2eq.composite.core.Document;
import com.e2eq.composite.store.DocumentCatalog;
import com.e2eq.composite.store.InMemoryDocumentStore;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;

@QuarkusTest
public class ContextResourceTest {

    private static final String P = "ctx";
    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private static final String PRIMARY_SECTION = "=== Primary Document: Primary ===\nType: scene\nContent:\nMara arrives";
    private static final String SIBLING_SECTION = "=== Related Context: Sibling ===\nContent:\nsibling";
    private static final String LORE_SECTION = "=== Related Context: Lore ===\nType: lore\nContent:\nold tales";

    @Inject
    DocumentCatalog catalog;

    @BeforeEach
    void reset() {
        ((InMemoryDocumentStore) catalog).clear();
        catalog.save(new Document("primary", P, "Primary", "{{hero}} arrives", Map.of("hero", "hero"), "G", "scene", T0));
        catalog.save(new Document("hero", P, "Hero", "Mara", null, null, "character", T0.plusSeconds(1)));
        catalog.save(new Document("sibling", P, "Sibling", "sibling", null, "G", null, T0.plusSeconds(2)));
        catalog.save(new Document("lore", P, "Lore", "old tales", null, null, "lore", T0.plusSeconds(3)));
        catalog.save(new Document("notes", P, "Notes", "some notes", null, null, null, T0.plusSeconds(4)));
        catalog.save(new Document("foreign", "elsewhere", "Foreign", "not ours", null, null, null, T0.plusSeconds(5)));
    }

    private static int tokens(String section) {
        return (int) Math.ceil(section.length() / 4.0);
    }

    @Test
    public void testRelatedDocumentsOrderedAndCapped() {
        // related-limit is 2 in the test profile: the referenced hero document is cut
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("primaryDocumentId", "primary", "preferredTypes", List.of("lore")))
                .when().post("/composite/projects/" + P + "/context")
                .then()
                .statusCode(200)
                .body("documentsUsed", contains("primary", "sibling", "lore"))
                .body("context", is(PRIMARY_SECTION + "\n\n" + SIBLING_SECTION + "\n\n" + LORE_SECTION))
                .body("tokenCount", is(tokens(PRIMARY_SECTION) + tokens(SIBLING_SECTION) + tokens(LORE_SECTION)));
    }

    @Test
    public void testAdditionalDocumentsAndProjectScope() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("primaryDocumentId", "primary",
                        "additionalDocumentIds", List.of("foreign", "notes"),
                        "includeRelated", false))
                .when().post("/composite/projects/" + P + "/context")
                .then()
                .statusCode(200)
                .body("documentsUsed", contains("primary", "notes"))
                .body("context", is(PRIMARY_SECTION + "\n\n=== Additional Context: Notes ===\nContent:\nsome notes"));
    }

    @Test
    public void testSectionsBeyondBudgetAreSkipped() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("primaryDocumentId", "primary",
                        "additionalDocumentIds", List.of("notes"),
                        "maxTokens", tokens(PRIMARY_SECTION) + 1))
                .when().post("/composite/projects/" + P + "/context")
                .then()
                .statusCode(200)
                .body("documentsUsed", contains("primary"))
                .body("context", is(PRIMARY_SECTION))
                .body("tokenCount", is(tokens(PRIMARY_SECTION)));
    }

    @Test
    public void testMissingPrimaryIs404() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("primaryDocumentId", "foreign"))
                .when().post("/composite/projects/" + P + "/context")
                .then()
                .statusCode(404);
    }

    @Test
    public void testPrimaryRequired() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("additionalDocumentIds", List.of("notes")))
                .when().post("/composite/projects/" + P + "/context")
                .then()
                .statusCode(400);
    }
}
