package com.e2eq.composite.core;

import com.e2eq.composite.core.ExpansionIssue.Kind;
import com.e2eq.composite.spi.DocumentStore;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Read-time expansion of composite documents.
 *
 * <p>Each {@code {{key}}} token in a body is resolved to a document (directly, or through a
 * group), that document's body is expanded in turn, and the result replaces the token. The walk
 * is depth-first over an explicit stack of frames, one frame per document being expanded.</p>
 *
 * <p>Expansion is best effort. A token is left exactly as written, and an {@link ExpansionIssue}
 * recorded, when it has no reference, its group is empty, its target is missing or belongs to
 * another project, its target is already on the active path (cycle), or a limit is reached.
 * Nothing here throws for bad data; acyclicity is enforced at write time by {@link CycleValidator},
 * and the active-path check keeps this walk finite even if that was bypassed.</p>
 *
 * <p>All occurrences of the same token in one body receive the same expansion, since overrides
 * are fixed for the whole call. Substituted text is not rescanned at the same level.</p>
 */
public final class RecursiveExpander {

    private static final Logger LOG = Logger.getLogger(RecursiveExpander.class);

    private final DocumentStore store;
    private final ExpansionLimits limits;

    public RecursiveExpander(DocumentStore store) {
        this(store, ExpansionLimits.defaults());
    }

    public RecursiveExpander(DocumentStore store, ExpansionLimits limits) {
        this.store = Objects.requireNonNull(store, "store");
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public ExpansionLimits limits() {
        return limits;
    }

    /**
     * Expands a document fetched by the caller, starting with only that document on the path.
     */
    public Expansion resolve(Document document, Map<String, String> overrides) {
        Objects.requireNonNull(document, "document");
        return expand(document.id(), document.projectId(), document.content(), document.components(),
                overrides, Set.of(document.id()));
    }

    /**
     * Expands {@code body} as the content of {@code documentId}.
     *
     * @param documentId      document the body belongs to; enables namespaced overrides, may be null
     * @param projectId       when non-null, referenced documents from other projects are treated as missing
     * @param body            template text
     * @param localComponents the document's own token map
     * @param overrides       caller overrides, applied unchanged at every depth
     * @param visited         ids already on the active path
     */
    public Expansion expand(String documentId,
                            String projectId,
                            String body,
                            Map<String, String> localComponents,
                            Map<String, String> overrides,
                            Set<String> visited) {
        Map<String, String> ov = overrides == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(overrides));
        Set<String> rootPath = new HashSet<>(visited == null ? Set.of() : visited);
        if (documentId != null) rootPath.add(documentId);

        Walk walk = new Walk(projectId, ov, rootPath);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(documentId, body, localComponents, 0));
        String text = null;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.pendingKeys.hasNext()) {
                stack.pop();
                String rendered = frame.render();
                Frame parent = stack.peek();
                if (parent == null) {
                    text = rendered;
                } else {
                    walk.activePath.remove(frame.documentId);
                    parent.expansions.put(parent.awaitingKey, rendered);
                    parent.awaitingKey = null;
                }
                continue;
            }

            String key = frame.pendingKeys.next();
            Optional<Document> target = walk.locate(frame, key);
            if (target.isEmpty()) continue;

            Document next = target.get();
            walk.expanded++;
            walk.activePath.add(next.id());
            frame.awaitingKey = key;
            stack.push(new Frame(next.id(), next.content(), next.components(), frame.depth + 1));
        }

        return new Expansion(text, walk.groupCacheSnapshot(), walk.issues, walk.expanded);
    }

    /**
     * Per-call traversal state; never shared between calls. {@code activePath} holds the ids of the
     * documents whose frames are on the stack, plus the caller's visited set.
     */
    private final class Walk {
        final String projectId;
        final Map<String, String> overrides;
        final Set<String> activePath;
        final List<ExpansionIssue> issues = new ArrayList<>();
        final Map<String, Map<String, String>> groupCache = new LinkedHashMap<>();
        int expanded;

        Walk(String projectId, Map<String, String> overrides, Set<String> activePath) {
            this.projectId = projectId;
            this.overrides = overrides;
            this.activePath = activePath;
        }

        Optional<Document> locate(Frame frame, String key) {
            Optional<String> raw = ReferenceResolver.lookup(key, frame.documentId, frame.components, overrides);
            if (raw.isEmpty()) {
                return skip(Kind.UNRESOLVED_TOKEN, frame, key, null, "no reference for token");
            }
            Optional<Reference> parsed = Reference.parse(raw.get());
            if (parsed.isEmpty()) {
                return skip(Kind.INVALID_REFERENCE, frame, key, raw.get(), "reference cannot be parsed");
            }

            Reference ref = parsed.get();
            String targetId;
            Document prefetched = null;
            if (ref instanceof Reference.Group group) {
                List<Document> members = store.getGroupMembers(group.groupId()).stream()
                        .filter(d -> d.belongsTo(projectId))
                        .toList();
                Optional<Document> pick = GroupSelector.select(group, members);
                if (pick.isEmpty()) {
                    return skip(Kind.EMPTY_GROUP, frame, key, ref.wireFormat(), "group has no members");
                }
                prefetched = pick.get();
                targetId = prefetched.id();
                if (frame.documentId != null) {
                    groupCache.computeIfAbsent(frame.documentId, k -> new LinkedHashMap<>()).put(key, targetId);
                }
            } else {
                targetId = ((Reference.Direct) ref).documentId();
            }

            if (activePath.contains(targetId)) {
                return skip(Kind.CYCLE_SUPPRESSED, frame, key, ref.wireFormat(),
                        "circular reference to " + targetId);
            }
            if (frame.depth + 1 > limits.maxDepth()) {
                return skip(Kind.DEPTH_LIMIT, frame, key, ref.wireFormat(),
                        "maximum depth " + limits.maxDepth() + " reached");
            }
            if (expanded >= limits.maxExpansions()) {
                return skip(Kind.EXPANSION_LIMIT, frame, key, ref.wireFormat(),
                        "maximum of " + limits.maxExpansions() + " expanded documents reached");
            }

            // group members are already full documents; fetch again only for direct references
            Optional<Document> target = prefetched != null
                    ? Optional.of(prefetched)
                    : store.getDocument(targetId).filter(d -> d.belongsTo(projectId));
            if (target.isEmpty()) {
                return skip(Kind.MISSING_DOCUMENT, frame, key, ref.wireFormat(), "document " + targetId + " not found");
            }
            return target;
        }

        Optional<Document> skip(Kind kind, Frame frame, String key, String reference, String message) {
            LOG.warnf("Leaving token '%s' unresolved in document %s: %s", key, frame.documentId, message);
            issues.add(new ExpansionIssue(kind, frame.documentId, key, reference, message));
            return Optional.empty();
        }

        Map<String, Map<String, String>> groupCacheSnapshot() {
            Map<String, Map<String, String>> copy = new LinkedHashMap<>();
            groupCache.forEach((doc, picks) -> copy.put(doc, Map.copyOf(picks)));
            return copy;
        }
    }

    private static final class Frame {
        final String documentId;
        final String body;
        final Map<String, String> components;
        final int depth;
        final Iterator<String> pendingKeys;
        final Map<String, String> expansions = new HashMap<>();
        String awaitingKey;

        Frame(String documentId, String body, Map<String, String> components, int depth) {
            this.documentId = documentId;
            this.body = body == null ? "" : body;
            this.components = components == null ? Map.of() : components;
            this.depth = depth;
            this.pendingKeys = TokenScanner.distinctKeys(this.body).iterator();
        }

        String render() {
            if (expansions.isEmpty()) return body;
            StringBuilder sb = new StringBuilder(body.length());
            int pos = 0;
            for (TokenScanner.Token t : TokenScanner.scan(body)) {
                String replacement = expansions.get(t.key());
                if (replacement == null) continue;
                sb.append(body, pos, t.start()).append(replacement);
                pos = t.end();
            }
            sb.append(body, pos, body.length());
            return sb.toString();
        }
    }
}
