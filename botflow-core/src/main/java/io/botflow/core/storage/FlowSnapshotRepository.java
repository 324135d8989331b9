package io.botflow.core.storage;

import io.botflow.core.flow.FlowDocument;
import java.util.Optional;

/// Persistence contract for editor workspaces.
///
/// A workspace holds exactly one {@link FlowDocument} snapshot (flow plus node
/// positions); saving replaces the previous snapshot. Implementations may be remote and
/// may fail; retrying and reporting failures is the caller's job.
///
/// ### Usage
/// {@snippet :
/// repository.save("acme-support", FlowDocument.of(flow));
///
/// Flow restored = repository.load("acme-support")
///         .map(FlowDocument::flow)
///         .orElseGet(() -> seedFlow());
/// }
///
/// @see InMemoryFlowSnapshotRepository for the in-memory implementation
public interface FlowSnapshotRepository {

    /// Stores the snapshot of a workspace, replacing any previous one.
    ///
    /// @param workspaceId workspace identifier, not null
    /// @param snapshot document to store, not null
    /// @throws NullPointerException if workspaceId or snapshot is null
    void save(String workspaceId, FlowDocument snapshot);

    /// Loads the snapshot of a workspace.
    ///
    /// @param workspaceId workspace identifier, not null
    /// @return the snapshot, or empty if none was saved
    /// @throws NullPointerException if workspaceId is null
    Optional<FlowDocument> load(String workspaceId);

    /// Deletes the snapshot of a workspace.
    ///
    /// @param workspaceId workspace identifier, not null
    /// @return true if a snapshot was deleted
    /// @throws NullPointerException if workspaceId is null
    boolean delete(String workspaceId);
}
