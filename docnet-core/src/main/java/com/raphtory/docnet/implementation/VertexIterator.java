/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.implementation;

import com.raphtory.docnet.MissingFieldException;
import com.raphtory.docnet.model.Vertex;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * This class provides lazy iterators over the vertices of a store.
 *<p>
 * The iteration order is the order of the place index and is not guaranteed
 * to follow the places. Modifying the store whilst iterating gives undefined results.
 */
public abstract class VertexIterator implements Iterator<Vertex> {
    private boolean _hasNext = false;
    private boolean _getNext = true;

    protected Iterator<Vertex> _source;
    protected Vertex _vertex = null;


    /**
     * Initialise this iterator
     *
     * @param vmgr the vertex manager to iterate over
     */
    protected void init(VertexManager vmgr) {
        _source = vmgr.getVertices().iterator();
        _vertex = null;
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
    public Vertex next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }

        _getNext = true;
        return _vertex;
    }


    /**
     * Advances to the next vertex to return, setting _vertex.
     *
     * @return true if there is one, false otherwise
     */
    protected abstract boolean moveToNext();


    /**
     * Iterates over all vertices.
     */
    public static class AllVerticesIterator extends VertexIterator {
        public AllVerticesIterator(VertexManager vmgr) {
            init(vmgr);
        }


        @Override
        protected boolean moveToNext() {
            if (_source.hasNext()) {
                _vertex = _source.next();
                return true;
            }

            _vertex = null;
            return false;
        }
    }


    /**
     * Iterates over the vertices accepted by a predicate.
     *<p>
     * A predicate that reads an element the vertex doesn't have (and so
     * throws a {@link MissingFieldException}) rejects that vertex. Any
     * other exception is propagated to the caller.
     */
    public static class MatchingVerticesIterator extends VertexIterator {
        private final Predicate<? super Vertex> _predicate;


        public MatchingVerticesIterator(VertexManager vmgr, Predicate<? super Vertex> predicate) {
            _predicate = predicate;
            init(vmgr);
        }


        @Override
        protected boolean moveToNext() {
            while (_source.hasNext()) {
                Vertex v = _source.next();
                if (matches(v)) {
                    _vertex = v;
                    return true;
                }
            }

            _vertex = null;
            return false;
        }


        private boolean matches(Vertex v) {
            try {
                return _predicate.test(v);
            }
            catch (MissingFieldException e) {
                // The vertex doesn't have the element the predicate looks at
                return false;
            }
        }
    }
}
