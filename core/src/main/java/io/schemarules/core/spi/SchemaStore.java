package io.schemarules.core.spi;

import java.util.Set;

/**
 * The host's repository of named schemas for one document-generation pass.
 *
 * <p>Owned by the host generator. The engine adds entries only through {@link
 * SchemaProvider#getSchemaForType(Class)} and removes them only through {@link
 * io.schemarules.core.materialization.MaterializationGuard}. Not thread-safe: one store per
 * document.
 */
public interface SchemaStore {

    /** Snapshot of the identifiers currently stored. */
    Set<String> schemaIds();

    /** Removes the schema stored under {@code schemaId}; returns {@code true} if it was present. */
    boolean remove(String schemaId);

    /**
     * Identifiers directly referenced from the schema stored under {@code schemaId}. Empty when the
     * id is unknown.
     */
    Set<String> referencedIds(String schemaId);
}
