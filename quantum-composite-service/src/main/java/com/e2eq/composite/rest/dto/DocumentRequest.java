package com.e2eq.composite.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of document create and update calls. A non-empty {@code components} map makes the
 * document composite and is checked for cycles before the write.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class DocumentRequest {
    protected String title;
    protected String content;
    protected String groupId;
    protected String documentType;
    protected Map<String, String> components;
}
