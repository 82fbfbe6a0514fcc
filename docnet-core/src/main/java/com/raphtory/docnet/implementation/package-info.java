/**
 * DocNet storage implementation
 * <p>
 * A DocNet store holds a graph of documents fully in memory and persists it as a single JSON snapshot file.
 * <p>
 * <b>Snapshot</b><p>
 * The snapshot is one JSON object: {@code _next_place} holds the place counter, {@code edges} holds the
 * edge packs and every other key is a vertex place mapped to that vertex's pack.
 * See {@link com.raphtory.docnet.implementation.SnapshotCodec}.
 *<p>
 * <b>Main Classes</b><p>
 * {@link com.raphtory.docnet.implementation.DocNetStore} - The main entry point into DocNet.<p>
 * {@link com.raphtory.docnet.implementation.VertexManager} - Manages places and the vertex index.<p>
 * {@link com.raphtory.docnet.implementation.EdgeManager} - Manages the edge list.<p>
 * {@link com.raphtory.docnet.implementation.VertexIterator} - Iterates over vertices.<p>
 * {@link com.raphtory.docnet.implementation.EdgeIterator} - Iterates over the edges of a vertex.<p>
 */
package com.raphtory.docnet.implementation;
