package com.e2eq.composite.service;

import com.e2eq.composite.core.Document;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@ApplicationScoped
public class PresetService {

    private final Map<String, Preset> presets = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Inject
    CompositeDocumentService documents;

    /**
     * @throws BadRequestException when the name or document is missing, or the name is taken in the project
     * @throws NotFoundException   when the document is not in the project
     */
    public synchronized Preset create(String projectId, String name, String documentId, Map<String, String> overrides) {
        if (name == null || name.isBlank() || documentId == null || documentId.isBlank()) {
            throw new BadRequestException("Name and documentId are required");
        }
        documents.getDocument(projectId, documentId);
        boolean taken = presets.values().stream()
                .anyMatch(p -> p.getProjectId().equals(projectId) && p.getName().equals(name));
        if (taken) {
            throw new BadRequestException("A preset with this name already exists in this project");
        }
        Preset preset = Preset.builder()
                .id(UUID.randomUUID().toString())
                .projectId(projectId)
                .name(name)
                .documentId(documentId)
                .overrides(overrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(overrides)))
                .createdAt(Instant.now())
                .sequence(sequence.incrementAndGet())
                .build();
        presets.put(preset.getId(), preset);
        Log.debugf("Created preset %s (%s) for document %s", preset.getId(), name, documentId);
        return preset;
    }

    /**
     * Presets of a project, newest first.
     */
    public List<Preset> list(String projectId) {
        return presets.values().stream()
                .filter(p -> p.getProjectId().equals(projectId))
                .sorted(Comparator.comparingLong(Preset::getSequence).reversed())
                .toList();
    }

    public Optional<Preset> find(String presetId) {
        return Optional.ofNullable(presets.get(presetId));
    }

    public boolean delete(String presetId) {
        return presets.remove(presetId) != null;
    }

    /**
     * Resolves the preset's document with the preset's overrides.
     */
    public String render(String presetId) {
        Preset preset = find(presetId).orElseThrow(() -> new NotFoundException("Preset not found: " + presetId));
        Document document = documents.getDocument(preset.getProjectId(), preset.getDocumentId());
        return documents.resolve(document, preset.getOverrides()).text();
    }

    public Optional<String> documentTitle(Preset preset) {
        return documents.findDocument(preset.getDocumentId()).map(Document::title);
    }

    public void clear() {
        presets.clear();
    }
}
