/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when removing a vertex that is still the endpoint of at least one edge.
 */
public class VertexStillConnectedException extends DocNetException {
    private final int _place;


    /**
     * @param place the place of the vertex that could not be removed
     */
    public VertexStillConnectedException(int place) {
        super("Vertex at place " + place + " still has edges and cannot be removed");
        _place = place;
    }


    public int getPlace() { return _place; }
}
