/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.implementation;

import com.raphtory.docnet.DocNetException;
import com.raphtory.docnet.model.Vertex;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.ObjectCollection;

/**
 * Manages the vertices of a DocNetStore: the place index and the place counter.
 *<p>
 * Places start at 1 and only ever increase. A place that has been handed out
 * is never handed out again, even once its vertex has been removed, so the
 * index may have holes.
 */
public class VertexManager {
    private final Int2ObjectOpenHashMap<Vertex> _vertices;
    private int _nextPlace = 1;


    /**
     * @param initialCapacity the initial size of the place index
     */
    public VertexManager(int initialCapacity) {
        _vertices = new Int2ObjectOpenHashMap<>(initialCapacity);
    }


    /**
     * Hands out the next unused place.
     *
     * @return the allocated place
     */
    public int allocatePlace() {
        if (_nextPlace == Integer.MAX_VALUE) {
            throw new DocNetException("No more places available");
        }

        return _nextPlace++;
    }


    /**
     * @return the place that will be handed out next
     */
    public int getNextPlace() { return _nextPlace; }


    /**
     * Restores the place counter, eg. from a snapshot.
     *
     * @param nextPlace the new value, must be at least 1
     */
    void setNextPlace(int nextPlace) {
        if (nextPlace < 1) {
            throw new IllegalArgumentException("The next place must be positive: " + nextPlace);
        }

        _nextPlace = nextPlace;
    }


    /**
     * Indexes a vertex under a place.
     *
     * @param place the place
     * @param vertex the vertex
     * @return the vertex previously held at that place, or null
     */
    public Vertex addVertex(int place, Vertex vertex) {
        return _vertices.put(place, vertex);
    }


    /**
     * @param place the place to un-index
     * @return the vertex that was held, or null
     */
    public Vertex removeVertex(int place) {
        return _vertices.remove(place);
    }


    /**
     * @param place the place in question
     * @return the vertex at that place, or null
     */
    public Vertex getVertex(int place) {
        return _vertices.get(place);
    }


    /**
     * @param vertex the vertex in question
     * @return true if this exact instance is indexed at its own place
     */
    public boolean isMember(Vertex vertex) {
        return vertex != null && vertex.isInserted() && _vertices.get(vertex.getPlace()) == vertex;
    }


    public int nVertices() {
        return _vertices.size();
    }


    public ObjectCollection<Vertex> getVertices() {
        return _vertices.values();
    }


    public IntSet getPlaces() {
        return _vertices.keySet();
    }


    /**
     * Drops every vertex and resets the place counter.
     * The dropped vertices keep their places.
     */
    public void clear() {
        _vertices.clear();
        _nextPlace = 1;
    }
}
