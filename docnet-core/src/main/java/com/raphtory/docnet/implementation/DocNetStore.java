/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.implementation;

import com.fasterxml.jackson.databind.JsonNode;
import com.raphtory.docnet.CorruptSnapshotException;
import com.raphtory.docnet.EdgeInsertionException;
import com.raphtory.docnet.NotFoundException;
import com.raphtory.docnet.TypeMismatchException;
import com.raphtory.docnet.VertexAlreadyInsertedException;
import com.raphtory.docnet.VertexNotInsertedException;
import com.raphtory.docnet.VertexNotReadyException;
import com.raphtory.docnet.VertexStillConnectedException;
import com.raphtory.docnet.model.AnchoredEdge;
import com.raphtory.docnet.model.Direction;
import com.raphtory.docnet.model.Edge;
import com.raphtory.docnet.model.EdgeFactory;
import com.raphtory.docnet.model.Vertex;
import com.raphtory.docnet.model.VertexFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * This class holds all of the components that make up a DocNet store:
 * the vertex manager, the edge manager and the snapshot codec.
 *<p>
 * This is the main entry point into DocNet. The whole graph lives in memory;
 * {@link #save()} writes it to a single JSON file and {@link #load()} reads it back.
 *<p>
 * A store is not thread-safe. It assumes a single thread of control and does
 * no locking, and nothing protects the snapshot file from other processes.
 */
public class DocNetStore {
    private static final Logger LOG = LoggerFactory.getLogger(DocNetStore.class);

    /**
     * Configuration details for the DocNetStore.
     */
    public static class DocNetStoreConfig {
        /**
         * Location of the snapshot file
         */
        public Path _path;

        /**
         * Rebuilds vertices when a snapshot is loaded.
         * Replace it to store application-defined vertex subclasses.
         */
        public VertexFactory _vertexFactory = Vertex::fromPack;

        /**
         * Rebuilds edges when a snapshot is loaded.
         * Replace it to store application-defined edge subclasses.
         */
        public EdgeFactory _edgeFactory = Edge::fromPack;

        /**
         * The initial size of the place index
         */
        public int _initialVertexCapacity = 1024;

        /**
         * The initial size of the edge list
         */
        public int _initialEdgeCapacity = 1024;

        /**
         * If true, snapshots are written with indentation
         */
        public boolean _prettyPrint = false;
    }


    private final Path _path;
    private final VertexFactory _vertexFactory;
    private final EdgeFactory _edgeFactory;
    private final VertexManager _vmgr;
    private final EdgeManager _emgr;
    private final SnapshotCodec _codec;
    private final DocNetStatistics _stats;


    /**
     * Creates a new, empty DocNetStore configured accordingly.
     * The snapshot file is neither read nor created.
     *
     * @param config the configuration to use
     */
    public DocNetStore(DocNetStoreConfig config) {
        _path = Objects.requireNonNull(config._path, "A snapshot path is required");
        _vertexFactory = Objects.requireNonNull(config._vertexFactory, "A vertex factory is required");
        _edgeFactory = Objects.requireNonNull(config._edgeFactory, "An edge factory is required");

        _vmgr = new VertexManager(config._initialVertexCapacity);
        _emgr = new EdgeManager(config._initialEdgeCapacity);
        _codec = new SnapshotCodec(config._prettyPrint);
        _stats = new DocNetStatistics(this);
    }


    /**
     * Creates a new, empty DocNetStore with the default configuration.
     *
     * @param path location of the snapshot file
     */
    public DocNetStore(Path path) {
        this(configFor(path));
    }


    /**
     * Creates a DocNetStore and loads its snapshot, if there is one.
     *
     * @param config the configuration to use
     * @return the loaded store
     *
     * @throws IOException if the snapshot exists but can't be read
     */
    public static DocNetStore open(DocNetStoreConfig config) throws IOException {
        DocNetStore store = new DocNetStore(config);
        store.load();
        return store;
    }


    /**
     * @see #open(DocNetStoreConfig)
     */
    public static DocNetStore open(Path path) throws IOException {
        return open(configFor(path));
    }


    /**
     * @see #open(DocNetStoreConfig)
     */
    public static DocNetStore open(String path) throws IOException {
        return open(Paths.get(path));
    }


    private static DocNetStoreConfig configFor(Path path) {
        DocNetStoreConfig cfg = new DocNetStoreConfig();
        cfg._path = path;
        return cfg;
    }


    /**
     * Empties this store and then reads the snapshot file, if it exists.
     * A missing file leaves the store empty. Vertices and edges held before
     * the call are detached and may be inserted again.
     *<p>
     * If decoding fails part-way the store is left partially filled and should be discarded.
     *
     * @throws IOException if the file exists but can't be read
     * @throws CorruptSnapshotException if the file doesn't hold a valid snapshot
     */
    public void load() throws IOException {
        detachAll();

        JsonNode doc = _codec.read(_path);
        if (doc == null) {
            LOG.info("No snapshot at {}, starting empty", _path);
            return;
        }

        _codec.decode(doc, this, _vertexFactory, _edgeFactory);
        LOG.info("Loaded {} from {}", _stats, _path);
    }


    /**
     * Writes every vertex, every edge and the place counter to the
     * snapshot file, overwriting it.
     *
     * @throws IOException if the file can't be written
     */
    public void save() throws IOException {
        _codec.write(_path, _codec.encode(this));
        LOG.info("Saved {} to {}", _stats, _path);
    }


    /**
     * Inserts a vertex, giving it the next unused place.
     *<p>
     * The vertex's {@link Vertex#isReadyForInsertion()} is consulted first, then
     * the place is assigned and {@link Vertex#onInsert()} is called before the
     * vertex is indexed. If the hook throws, the vertex is left detached and
     * its place isn't reused.
     *
     * @param vertex the vertex to insert
     * @return the new place of the vertex
     *
     * @throws TypeMismatchException if vertex is null
     * @throws VertexAlreadyInsertedException if the vertex already has a place
     * @throws VertexNotReadyException if the vertex declines insertion
     */
    public int insert(Vertex vertex) {
        if (vertex == null) {
            throw new TypeMismatchException("Only a Vertex can be inserted");
        }
        if (vertex.isInserted()) {
            throw new VertexAlreadyInsertedException(vertex.getPlace());
        }
        if (!vertex.isReadyForInsertion()) {
            throw new VertexNotReadyException("The vertex is not ready for insertion: " + vertex);
        }

        int place = _vmgr.allocatePlace();
        vertex.setPlace(place);
        try {
            vertex.onInsert();
        }
        catch (RuntimeException e) {
            // The place stays used up
            vertex.setPlace(0);
            throw e;
        }
        _vmgr.addVertex(place, vertex);

        LOG.debug("Inserted vertex at place {}", place);
        return place;
    }


    /**
     * Removes a vertex with no edges. Its place is never reused.
     *
     * @param vertex the vertex to remove
     * @return the place the vertex had
     *
     * @throws TypeMismatchException if vertex is null
     * @throws VertexNotInsertedException if the vertex isn't held by this store
     * @throws VertexStillConnectedException if the vertex is the end of an edge
     */
    public int remove(Vertex vertex) {
        if (vertex == null) {
            throw new TypeMismatchException("Only a Vertex can be removed");
        }
        if (!vertex.isInserted()) {
            throw new VertexNotInsertedException("The vertex is not inserted");
        }
        if (!_vmgr.isMember(vertex)) {
            throw new VertexNotInsertedException("The vertex is inserted in another store");
        }

        int place = vertex.getPlace();
        if (_emgr.hasIncidentEdge(vertex)) {
            throw new VertexStillConnectedException(place);
        }

        _vmgr.removeVertex(place);
        vertex.setPlace(0);

        LOG.debug("Removed vertex from place {}", place);
        return place;
    }


    /**
     * @param place the place in question
     * @return the vertex at that place
     *
     * @throws NotFoundException if no vertex is at that place
     */
    public Vertex get(int place) {
        Vertex v = _vmgr.getVertex(place);
        if (v == null) {
            throw new NotFoundException("No vertex at place " + place);
        }

        return v;
    }


    /**
     * @param vertex the vertex in question
     * @return true if this exact instance is held by this store
     */
    public boolean contains(Vertex vertex) {
        return _vmgr.isMember(vertex);
    }


    /**
     * @return the number of vertices
     */
    public int size() {
        return _vmgr.nVertices();
    }


    /**
     * @return all vertices, in no particular order
     */
    public Iterable<Vertex> all() {
        return () -> new VertexIterator.AllVerticesIterator(_vmgr);
    }


    /**
     * Returns the vertices accepted by a predicate, lazily.
     *<p>
     * If the predicate throws a {@link com.raphtory.docnet.MissingFieldException}
     * (eg. by reading an element the vertex doesn't have) the vertex is skipped.
     * Any other exception is propagated.
     *
     * @param predicate the filter to apply
     * @return the matching vertices, in no particular order
     */
    public Iterable<Vertex> search(Predicate<? super Vertex> predicate) {
        if (predicate == null) {
            throw new TypeMismatchException("A search predicate is required");
        }

        return () -> new VertexIterator.MatchingVerticesIterator(_vmgr, predicate);
    }


    /**
     * Inserts an edge between two vertices of this store, then calls {@link Edge#onInsert()}.
     *
     * @param edge the edge to insert
     *
     * @throws TypeMismatchException if edge is null
     * @throws EdgeInsertionException if the edge is already inserted
     * @throws VertexNotInsertedException if an end of the edge isn't held by this store
     */
    public void insertEdge(Edge edge) {
        if (edge == null) {
            throw new TypeMismatchException("Only an Edge can be inserted");
        }
        if (edge.isInserted()) {
            throw new EdgeInsertionException("The edge is already inserted: " + edge);
        }
        checkEnds(edge);

        edge.setInserted(true);
        _emgr.addEdge(edge);
        edge.onInsert();

        LOG.debug("Inserted {}", edge);
    }


    /**
     * Creates and inserts an edge.
     *
     * @param start the start vertex
     * @param end the end vertex
     * @param label the label ("" for no label)
     * @param hasDirection whether the edge is directed
     * @return the inserted edge
     *
     * @see #insertEdge(Edge)
     */
    public Edge makeEdge(Vertex start, Vertex end, String label, boolean hasDirection) {
        Edge edge = new Edge(start, end, label, hasDirection);
        insertEdge(edge);
        return edge;
    }


    /**
     * Removes the first edge, in insertion order, equal to the supplied one.
     * Other duplicates are kept.
     *
     * @param edge the edge to match
     * @return the edge that was removed (which may be a different, equal instance)
     *
     * @throws NotFoundException if no edge matches
     */
    public Edge removeEdge(Edge edge) {
        if (edge == null) {
            throw new TypeMismatchException("Only an Edge can be removed");
        }

        Edge removed = _emgr.removeFirstMatching(edge);
        if (removed == null) {
            throw new NotFoundException("No such edge: " + edge);
        }

        removed.setInserted(false);

        LOG.debug("Removed {}", removed);
        return removed;
    }


    /**
     * Removes the first edge matching the supplied details.
     *
     * @see #removeEdge(Edge)
     */
    public Edge removeEdge(Vertex start, Vertex end, String label, boolean hasDirection) {
        return removeEdge(new Edge(start, end, label, hasDirection));
    }


    /**
     * @return all edges in insertion order (read-only)
     */
    public List<Edge> edges() {
        return _emgr.getEdges();
    }


    /**
     * @return the number of edges
     */
    public int edgeCount() {
        return _emgr.nEdges();
    }


    /**
     * @see #searchEdge(Vertex, Vertex, String, Direction)
     */
    public Iterable<AnchoredEdge> searchEdge(Vertex anchor) {
        return searchEdge(anchor, null, null, (Direction)null);
    }


    /**
     * @see #searchEdge(Vertex, Vertex, String, Direction)
     */
    public Iterable<AnchoredEdge> searchEdge(Vertex anchor, Vertex other) {
        return searchEdge(anchor, other, null, (Direction)null);
    }


    /**
     * Finds the edges of a vertex, each seen from that vertex.
     *<p>
     * Edges are filtered by other end (by identity), then direction, then label.
     * A null criterion is not applied; the empty label only matches unlabelled
     * edges. Each call to {@code iterator()} on the result starts a new lazy pass
     * over the edges, in insertion order.
     *
     * @param anchor the vertex whose edges are wanted
     * @param other the other end to match, or null
     * @param label the label to match, or null
     * @param direction the direction relative to the anchor, or null for all
     * @return the matching edges, viewed from the anchor
     */
    public Iterable<AnchoredEdge> searchEdge(Vertex anchor, Vertex other, String label, Direction direction) {
        if (anchor == null) {
            throw new TypeMismatchException("An anchor Vertex is required");
        }

        return () -> new EdgeIterator.MatchingEdgesIterator(_emgr, anchor, other, label, direction);
    }


    /**
     * @param direction "all", "out", "in" or "none"
     *
     * @throws com.raphtory.docnet.InvalidDirectionException for any other token
     *
     * @see #searchEdge(Vertex, Vertex, String, Direction)
     */
    public Iterable<AnchoredEdge> searchEdge(Vertex anchor, Vertex other, String label, String direction) {
        Direction d = direction == null || Direction.ALL_TOKEN.equals(direction) ? null : Direction.fromToken(direction);
        return searchEdge(anchor, other, label, d);
    }


    /**
     * @return the place the next inserted vertex will get
     */
    public int getNextPlace() {
        return _vmgr.getNextPlace();
    }


    public Path getPath() { return _path; }


    public VertexManager getVertexMgr() { return _vmgr; }


    public EdgeManager getEdgeMgr() { return _emgr; }


    public DocNetStatistics getStatistics() { return _stats; }


    /**
     * Indexes a vertex read from a snapshot.
     */
    void restoreVertex(int place, Vertex vertex) {
        if (vertex.isInserted()) {
            throw new VertexAlreadyInsertedException(vertex.getPlace());
        }
        if (_vmgr.getVertex(place) != null) {
            throw new CorruptSnapshotException("Duplicate place in snapshot: " + place);
        }

        vertex.setPlace(place);
        _vmgr.addVertex(place, vertex);
    }


    void restoreNextPlace(int nextPlace) {
        _vmgr.setNextPlace(nextPlace);
    }


    /**
     * Adds an edge read from a snapshot. No callback is invoked.
     */
    void restoreEdge(Edge edge) {
        checkEnds(edge);
        edge.setInserted(true);
        _emgr.addEdge(edge);
    }


    private void detachAll() {
        for (Edge e : _emgr.getEdges()) {
            e.setInserted(false);
        }
        for (Vertex v : _vmgr.getVertices()) {
            v.setPlace(0);
        }

        _vmgr.clear();
        _emgr.clear();
    }


    private void checkEnds(Edge edge) {
        if (!_vmgr.isMember(edge.getStart()) || !_vmgr.isMember(edge.getEnd())) {
            throw new VertexNotInsertedException("Both vertices of the edge must be inserted in this store");
        }
    }


    @Override
    public String toString() {
        return "DocNetStore " + _path.toAbsolutePath();
    }
}
