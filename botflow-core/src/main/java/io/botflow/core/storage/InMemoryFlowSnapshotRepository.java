package io.botflow.core.storage;

import io.botflow.core.flow.FlowDocument;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// In-memory workspace storage (default implementation).
///
/// Thread-safe, no external dependencies. Documents are immutable values, so they are
/// stored as given.
///
/// @see FlowSnapshotRepository for contract
public final class InMemoryFlowSnapshotRepository implements FlowSnapshotRepository {

    private static final Logger logger =
            Logger.getLogger(InMemoryFlowSnapshotRepository.class.getName());

    private final Map<String, FlowDocument> storage = new ConcurrentHashMap<>();

    @Override
    public void save(String workspaceId, FlowDocument snapshot) {
        Objects.requireNonNull(workspaceId, "workspaceId must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        storage.put(workspaceId, snapshot);
        logger.info(
                "Saved workspace "
                        + workspaceId
                        + " (flow "
                        + snapshot.flow().getId()
                        + ", "
                        + snapshot.flow().getNodes().size()
                        + " nodes)");
    }

    @Override
    public Optional<FlowDocument> load(String workspaceId) {
        Objects.requireNonNull(workspaceId, "workspaceId must not be null");
        return Optional.ofNullable(storage.get(workspaceId));
    }

    @Override
    public boolean delete(String workspaceId) {
        Objects.requireNonNull(workspaceId, "workspaceId must not be null");
        boolean removed = storage.remove(workspaceId) != null;
        if (removed) {
            logger.info("Deleted workspace " + workspaceId);
        }
        return removed;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }

    /// Returns the number of stored workspaces (useful for testing).
    public int size() {
        return storage.size();
    }
}
