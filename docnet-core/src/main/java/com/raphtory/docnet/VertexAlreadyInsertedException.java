/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when inserting a vertex that already has a place.
 */
public class VertexAlreadyInsertedException extends VertexInsertionException {
    private final int _place;


    /**
     * @param place the place the vertex currently occupies
     */
    public VertexAlreadyInsertedException(int place) {
        super("Vertex is already inserted at place " + place);
        _place = place;
    }


    /**
     * @return the place the vertex occupies
     */
    public int getPlace() { return _place; }
}
