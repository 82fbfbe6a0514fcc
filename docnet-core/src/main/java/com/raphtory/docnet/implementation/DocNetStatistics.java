/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */
package com.raphtory.docnet.implementation;

import com.raphtory.docnet.model.Edge;
import com.raphtory.docnet.model.Vertex;

/**
 * Encapsulates basic stats for a DocNet store
 */
public class DocNetStatistics {
    private final VertexManager _vmgr;
    private final EdgeManager _emgr;


    public DocNetStatistics(DocNetStore store) {
        _vmgr = store.getVertexMgr();
        _emgr = store.getEdgeMgr();
    }


    @Override
    public String toString() {
        return "nVertices: " + getNVertices() + ", nEdges: " + getNEdges() + ", nextPlace: " + getNextPlace();
    }


    /**
     * @return the total number of vertices
     */
    public int getNVertices() {
        return _vmgr.nVertices();
    }


    /**
     * @return the total number of edges
     */
    public int getNEdges() {
        return _emgr.nEdges();
    }


    /**
     * @return the number of directed edges
     */
    public int getNDirectedEdges() {
        int n = _emgr.nEdges();
        int nDirected = 0;

        for (int i=0; i<n; ++i) {
            if (_emgr.getEdge(i).hasDirection()) {
                ++nDirected;
            }
        }

        return nDirected;
    }


    /**
     * @return the place the next inserted vertex will get
     */
    public int getNextPlace() {
        return _vmgr.getNextPlace();
    }


    /**
     * @param vertex the vertex in question
     * @return the number of edges the vertex is an end of (a self-edge counts once)
     */
    public int getDegree(Vertex vertex) {
        return _emgr.countIncidentEdges(vertex);
    }


    /**
     * @return the highest number of edges any one vertex is an end of
     */
    public int getMaxDegree() {
        int max = 0;
        for (Vertex v : _vmgr.getVertices()) {
            max = Math.max(max, _emgr.countIncidentEdges(v));
        }

        return max;
    }
}
