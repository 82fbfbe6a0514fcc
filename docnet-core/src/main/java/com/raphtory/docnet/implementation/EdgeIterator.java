/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.implementation;

import com.raphtory.docnet.model.AnchoredEdge;
import com.raphtory.docnet.model.Direction;
import com.raphtory.docnet.model.Edge;
import com.raphtory.docnet.model.Vertex;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * This class provides lazy iterators over the edges of a store, each edge
 * being returned as seen from an anchor vertex.
 *<p>
 * Edges are visited in the order of the store's edge list, one at a time, so
 * nothing is materialised up-front. Modifying the edges whilst iterating gives
 * undefined results.
 *
 * @see DocNetStore#searchEdge(Vertex, Vertex, String, Direction)
 */
public abstract class EdgeIterator implements Iterator<AnchoredEdge> {
    private boolean _hasNext = false;
    private boolean _getNext = true;

    protected EdgeManager _emgr;
    protected int _edgeIndex = -1;
    protected AnchoredEdge _current = null;


    /**
     * Initialise this iterator
     *
     * @param emgr the edge manager to iterate over
     */
    protected void init(EdgeManager emgr) {
        _emgr = emgr;
        _edgeIndex = -1;
        _current = null;
        _hasNext = false;
        _getNext = true;
    }


    @Override
    public boolean hasNext() {
        if (_getNext) {
            _hasNext = moveToNext();
            _getNext = false;
        }

        return _hasNext;
    }


    @Override
    public AnchoredEdge next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }

        _getNext = true;
        return _current;
    }


    /**
     * Advances to the next edge to return, setting _current.
     *
     * @return true if there is one, false otherwise
     */
    protected abstract boolean moveToNext();


    /**
     * Iterates over all edges that have the anchor as one of their ends.
     */
    public static class IncidentEdgesIterator extends EdgeIterator {
        protected final Vertex _anchor;


        public IncidentEdgesIterator(EdgeManager emgr, Vertex anchor) {
            _anchor = anchor;
            init(emgr);
        }


        @Override
        protected boolean moveToNext() {
            while (++_edgeIndex < _emgr.nEdges()) {
                Edge e = _emgr.getEdge(_edgeIndex);
                if (e.hasVertex(_anchor)) {
                    AnchoredEdge view = e.changeAnchor(_anchor);
                    if (accept(view)) {
                        _current = view;
                        return true;
                    }
                }
            }

            _current = null;
            return false;
        }


        /**
         * @param view an incident edge, seen from the anchor
         * @return true if the edge should be returned
         */
        protected boolean accept(AnchoredEdge view) {
            return true;
        }
    }


    /**
     * Iterates over the edges of the anchor, optionally restricted to a given
     * other end, direction and label. A null criterion is not applied.
     * The empty label only matches unlabelled edges.
     */
    public static class MatchingEdgesIterator extends IncidentEdgesIterator {
        private final Vertex _other;
        private final String _label;
        private final Direction _direction;


        /**
         * @param emgr the edge manager to iterate over
         * @param anchor the vertex the edges are seen from
         * @param other the other end to match (by identity), or null
         * @param label the label to match, or null
         * @param direction the direction to match, or null for all
         */
        public MatchingEdgesIterator(EdgeManager emgr, Vertex anchor, Vertex other, String label, Direction direction) {
            super(emgr, anchor);
            _other = other;
            _label = label;
            _direction = direction;
        }


        @Override
        protected boolean accept(AnchoredEdge view) {
            if (_other != null && view.getOther() != _other) {
                return false;
            }
            if (_direction != null && view.getDirection() != _direction) {
                return false;
            }

            return _label == null || _label.equals(view.getLabel());
        }
    }
}
