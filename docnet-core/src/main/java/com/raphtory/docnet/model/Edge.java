/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.model;

import com.raphtory.docnet.TypeMismatchException;
import com.raphtory.docnet.VertexNotInsertedException;
import com.raphtory.docnet.implementation.DocNetStore;

import java.util.ArrayList;
import java.util.List;

/**
 * An edge links two inserted vertices, with a label and an optional direction.
 *<p>
 * Undirected edges are stored in canonical form: the start vertex is the one
 * with the lowest place, whatever the order of the constructor parameters.
 *<p>
 * Two edges are equal if they have the same start and end vertices (by identity),
 * the same label and the same direction flag. The empty label is a label like any other.
 *<p>
 * The direction of an edge relative to one of its endpoints is given by an
 * {@link AnchoredEdge}, obtained with {@link #changeAnchor(Vertex)}. Views are
 * immutable values so the same edge can be looked at from both ends at once.
 *
 * @see DocNetStore#insertEdge(Edge)
 * @see DocNetStore#searchEdge(Vertex, Vertex, String, Direction)
 */
public class Edge extends Entity<List<Object>> {
    protected final Vertex _start;
    protected final Vertex _end;
    protected final String _label;
    protected final boolean _hasDirection;
    protected boolean _inserted = false;


    /**
     * Creates a directed, unlabelled edge.
     *
     * @param start the inserted start vertex
     * @param end the inserted end vertex
     */
    public Edge(Vertex start, Vertex end) {
        this(start, end, "", true);
    }


    /**
     * Creates a directed edge.
     *
     * @param start the inserted start vertex
     * @param end the inserted end vertex
     * @param label the label
     */
    public Edge(Vertex start, Vertex end, String label) {
        this(start, end, label, true);
    }


    /**
     * Creates an edge between two vertices.
     *
     * @param start the inserted start vertex
     * @param end the inserted end vertex
     * @param label the label ("" for an unlabelled edge)
     * @param hasDirection whether the edge is directed. If false, the order of start and
     *                     end doesn't matter and start is set to the vertex with the lowest place
     *
     * @throws VertexNotInsertedException if either vertex is not inserted
     */
    public Edge(Vertex start, Vertex end, String label, boolean hasDirection) {
        if (start == null || end == null) {
            throw new TypeMismatchException("Both ends of an Edge must be vertices");
        }
        if (label == null) {
            throw new TypeMismatchException("An Edge label can't be null, use \"\" for no label");
        }
        if (!start.isInserted() || !end.isInserted()) {
            throw new VertexNotInsertedException("Both vertices must be inserted to make an Edge");
        }

        if (hasDirection || start.getPlace() <= end.getPlace()) {
            _start = start;
            _end = end;
        }
        else {
            _start = end;
            _end = start;
        }

        _label = label;
        _hasDirection = hasDirection;
    }


    /**
     * Copies the structural details of another edge. Used by subclasses that
     * rebuild themselves from a pack on top of {@link #fromPack(List, DocNetStore)}.
     *
     * @param template the edge to copy
     */
    protected Edge(Edge template) {
        this(template._start, template._end, template._label, template._hasDirection);
    }


    /**
     * Creates an edge described from the point of view of one of its ends.
     *
     * @param anchor the vertex the direction is relative to
     * @param other the other end of the edge
     * @param label the label
     * @param direction OUT if anchor is the start, IN if it's the end, NONE for an undirected edge
     *
     * @return the new edge, viewed from the anchor
     */
    public static AnchoredEdge fromAnchor(Vertex anchor, Vertex other, String label, Direction direction) {
        if (direction == null) {
            throw new TypeMismatchException("A direction is required");
        }

        Edge edge;
        switch (direction) {
            case OUT:
                edge = new Edge(anchor, other, label, true);
                break;
            case IN:
                edge = new Edge(other, anchor, label, true);
                break;
            default:
                edge = new Edge(anchor, other, label, false);
                break;
        }

        return edge.changeAnchor(anchor);
    }


    /**
     * @param direction one of "out", "in" or "none"
     *
     * @throws com.raphtory.docnet.InvalidDirectionException for any other token
     *
     * @see #fromAnchor(Vertex, Vertex, String, Direction)
     */
    public static AnchoredEdge fromAnchor(Vertex anchor, Vertex other, String label, String direction) {
        return fromAnchor(anchor, other, label, Direction.fromToken(direction));
    }


    /**
     * Default edge factory - rebuilds an edge from its pack, resolving
     * the places through the store.
     *
     * @param pack [startPlace, endPlace, label, hasDirection], possibly followed by extra values
     * @param store the store used to map places to vertices
     *
     * @return the new edge (not yet marked as inserted)
     *
     * @throws com.raphtory.docnet.NotFoundException if a place doesn't resolve
     */
    public static Edge fromPack(List<Object> pack, DocNetStore store) {
        if (pack == null || pack.size() < 4) {
            throw new TypeMismatchException("An Edge pack needs at least 4 values: " + pack);
        }
        if (!(pack.get(2) instanceof String) || !(pack.get(3) instanceof Boolean)) {
            throw new TypeMismatchException("Malformed Edge pack: " + pack);
        }

        Vertex start = store.get(toPlace(pack.get(0)));
        Vertex end = store.get(toPlace(pack.get(1)));
        return new Edge(start, end, (String)pack.get(2), (Boolean)pack.get(3));
    }


    private static int toPlace(Object value) {
        if (!(value instanceof Integer) && !(value instanceof Long) && !(value instanceof Short)) {
            throw new TypeMismatchException("A place must be an integer, got: " + value);
        }

        long place = ((Number)value).longValue();
        if (place < Integer.MIN_VALUE || place > Integer.MAX_VALUE) {
            throw new TypeMismatchException("A place must fit in an int, got: " + value);
        }

        return (int)place;
    }


    /**
     * @param vertex the vertex in question
     * @return true if the vertex is one of the ends of this edge (by identity)
     */
    public boolean hasVertex(Vertex vertex) {
        return _start == vertex || _end == vertex;
    }


    /**
     * Computes the view of this edge from one of its ends.
     * This edge isn't modified.
     *
     * @param anchor the end to look from
     * @return the anchored view
     *
     * @throws IllegalArgumentException if the anchor doesn't belong to this edge
     */
    public AnchoredEdge changeAnchor(Vertex anchor) {
        if (!hasVertex(anchor)) {
            throw new IllegalArgumentException("The given anchor doesn't belong to the edge");
        }

        Vertex other = _start == anchor ? _end : _start;
        Direction direction;
        if (!_hasDirection) {
            direction = Direction.NONE;
        }
        else {
            direction = _start == anchor ? Direction.OUT : Direction.IN;
        }

        return new AnchoredEdge(this, anchor, other, direction);
    }


    public Vertex getStart() { return _start; }


    public Vertex getEnd() { return _end; }


    public String getLabel() { return _label; }


    public boolean hasDirection() { return _hasDirection; }


    @Override
    public boolean isInserted() { return _inserted; }


    /**
     * Flags this edge as held (or no longer held) by a store. Only the store should call this.
     *
     * @param inserted the new state
     */
    public void setInserted(boolean inserted) { _inserted = inserted; }


    /**
     * @return [startPlace, endPlace, label, hasDirection] - a new, mutable list
     */
    @Override
    public List<Object> pack() {
        List<Object> pack = new ArrayList<>(4);
        pack.add(_start.getPlace());
        pack.add(_end.getPlace());
        pack.add(_label);
        pack.add(_hasDirection);
        return pack;
    }


    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Edge)) {
            return false;
        }

        Edge other = (Edge)o;
        return _start == other._start
                && _end == other._end
                && _label.equals(other._label)
                && _hasDirection == other._hasDirection;
    }


    @Override
    public int hashCode() {
        int h = System.identityHashCode(_start);
        h = 31 * h + System.identityHashCode(_end);
        h = 31 * h + _label.hashCode();
        return 31 * h + (_hasDirection ? 1 : 0);
    }


    @Override
    public String toString() {
        if (_hasDirection) {
            return "Edge: from " + _start + " to " + _end + " with label '" + _label + "'";
        }

        return "Edge: between " + _start + " and " + _end + " with label '" + _label + "'";
    }
}
