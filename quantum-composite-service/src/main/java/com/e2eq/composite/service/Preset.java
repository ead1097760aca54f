package com.e2eq.composite.service;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A named, project-scoped pointer to a document plus the overrides it is rendered with.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class Preset {
    protected String id;
    protected String projectId;
    protected String name;
    protected String documentId;
    protected Map<String, String> overrides;
    protected Instant createdAt;
    // creation order within this process, newest sorts first
    protected long sequence;
}
