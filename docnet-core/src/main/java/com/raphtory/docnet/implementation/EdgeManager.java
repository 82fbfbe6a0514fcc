/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.implementation;

import com.raphtory.docnet.model.Edge;
import com.raphtory.docnet.model.Vertex;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Collections;
import java.util.List;

/**
 * Manages the edges of a DocNetStore.
 *<p>
 * Edges are kept in insertion (or load) order. Duplicates are allowed;
 * removal always takes the first matching edge.
 */
public class EdgeManager {
    private final ObjectArrayList<Edge> _edges;
    private final List<Edge> _readOnlyEdges;


    /**
     * @param initialCapacity the initial size of the edge list
     */
    public EdgeManager(int initialCapacity) {
        _edges = new ObjectArrayList<>(initialCapacity);
        _readOnlyEdges = Collections.unmodifiableList(_edges);
    }


    public void addEdge(Edge edge) {
        _edges.add(edge);
    }


    /**
     * Removes the first edge equal to the supplied one.
     *
     * @param edge the edge to match
     * @return the edge that was removed, or null if none matched
     */
    public Edge removeFirstMatching(Edge edge) {
        int n = _edges.size();
        for (int i=0; i<n; ++i) {
            if (_edges.get(i).equals(edge)) {
                return _edges.remove(i);
            }
        }

        return null;
    }


    /**
     * @param vertex the vertex in question
     * @return true if at least one edge has this vertex as an end
     */
    public boolean hasIncidentEdge(Vertex vertex) {
        int n = _edges.size();
        for (int i=0; i<n; ++i) {
            if (_edges.get(i).hasVertex(vertex)) {
                return true;
            }
        }

        return false;
    }


    /**
     * @param vertex the vertex in question
     * @return the number of edges having this vertex as an end
     */
    public int countIncidentEdges(Vertex vertex) {
        int n = _edges.size();
        int count = 0;
        for (int i=0; i<n; ++i) {
            if (_edges.get(i).hasVertex(vertex)) {
                ++count;
            }
        }

        return count;
    }


    public Edge getEdge(int index) {
        return _edges.get(index);
    }


    public int nEdges() {
        return _edges.size();
    }


    /**
     * @return a read-only live view of the edges, in insertion order
     */
    public List<Edge> getEdges() {
        return _readOnlyEdges;
    }


    public void clear() {
        _edges.clear();
    }
}
