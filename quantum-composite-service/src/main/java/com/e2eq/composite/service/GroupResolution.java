package com.e2eq.composite.service;

import com.e2eq.composite.core.Document;

import java.util.List;

/**
 * The member picked for a group together with its resolved content.
 *
 * @param selectedFromGroup true when a group lookup, rather than a direct id, produced {@code document}
 * @param availableTypes    distinct document types present in the group, sorted
 */
public record GroupResolution(Document document,
                              String resolvedContent,
                              String groupId,
                              boolean selectedFromGroup,
                              List<String> availableTypes) {

    public GroupResolution {
        availableTypes = availableTypes == null ? List.of() : List.copyOf(availableTypes);
    }
}
