/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.model;

/**
 * An immutable view of an edge from one of its ends.
 *<p>
 * The anchor is the vertex the view is computed from, other is the opposite end
 * and direction is OUT, IN or NONE relative to the anchor. None of these take part
 * in the identity of the underlying edge.
 *<p>
 * Two views are equal if their edges are equal and they share the same anchor.
 *
 * @see Edge#changeAnchor(Vertex)
 */
public final class AnchoredEdge {
    private final Edge _edge;
    private final Vertex _anchor;
    private final Vertex _other;
    private final Direction _direction;


    AnchoredEdge(Edge edge, Vertex anchor, Vertex other, Direction direction) {
        _edge = edge;
        _anchor = anchor;
        _other = other;
        _direction = direction;
    }


    /**
     * @return the underlying edge
     */
    public Edge getEdge() { return _edge; }


    public Vertex getAnchor() { return _anchor; }


    public Vertex getOther() { return _other; }


    public Direction getDirection() { return _direction; }


    public String getLabel() { return _edge.getLabel(); }


    /**
     * @return the same edge viewed from its other end
     */
    public AnchoredEdge flip() {
        return new AnchoredEdge(_edge, _other, _anchor, _direction.reverse());
    }


    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnchoredEdge)) {
            return false;
        }

        AnchoredEdge other = (AnchoredEdge)o;
        return _anchor == other._anchor && _edge.equals(other._edge);
    }


    @Override
    public int hashCode() {
        return 31 * _edge.hashCode() + System.identityHashCode(_anchor);
    }


    @Override
    public String toString() {
        return "AnchoredEdge: " + _anchor + " -" + _direction + "-> " + _other + " with label '" + _edge.getLabel() + "'";
    }
}
