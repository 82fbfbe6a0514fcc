/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.model;

import com.raphtory.docnet.MissingFieldException;
import com.raphtory.docnet.implementation.DocNetStore;
import com.raphtory.docnet.implementation.ElementCopier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A vertex is a document: an insertion-ordered bag of named elements plus a place.
 *<p>
 * Element values may be strings, numbers, booleans, null, lists or nested maps.
 *<p>
 * A vertex is created detached (place 0). A DocNetStore assigns it a place
 * when it is inserted and resets the place to 0 when it is removed. Places
 * are never reused by a store.
 *<p>
 * Subclasses can validate values by overriding {@link #set(String, Object)},
 * refuse insertion via {@link #isReadyForInsertion()}, react to insertion via
 * {@link #onInsert()}, and extend {@link #pack()} as long as the matching
 * {@link VertexFactory} consumes the extra keys.
 *
 * @see DocNetStore#insert(Vertex)
 */
public class Vertex extends Entity<Map<String, Object>> {
    protected int _place = 0;
    protected final LinkedHashMap<String, Object> _elements = new LinkedHashMap<>();


    /**
     * Creates an empty, detached vertex.
     */
    public Vertex() {
    }


    /**
     * Creates a detached vertex seeded with a copy of the supplied elements.
     *
     * @param initElements the initial elements, may be null
     */
    public Vertex(Map<String, ?> initElements) {
        if (initElements != null) {
            _elements.putAll(ElementCopier.copyElements(initElements));
        }
    }


    /**
     * Default vertex factory, used by the store when loading a snapshot.
     *
     * @param pack the vertex pack
     * @return the new detached vertex
     */
    public static Vertex fromPack(Map<String, Object> pack) {
        return new Vertex(pack);
    }


    /**
     * @return this vertex's place, or 0 if it isn't inserted
     */
    public int getPlace() { return _place; }


    /**
     * Sets the place of this vertex. Only the store should call this.
     *
     * @param place the new place, 0 to detach
     */
    public void setPlace(int place) { _place = place; }


    @Override
    public boolean isInserted() {
        return _place != 0;
    }


    /**
     * Returns the value of an element.
     *
     * @param name the element name
     * @return the element's value (which may be null)
     *
     * @throws MissingFieldException if there is no such element
     */
    public Object get(String name) {
        if (!_elements.containsKey(name)) {
            throw new MissingFieldException(name);
        }

        return _elements.get(name);
    }


    /**
     * Sets the value of an element, adding it if required.
     *
     * @param name the element name
     * @param value the new value
     */
    public void set(String name, Object value) {
        _elements.put(name, value);
    }


    /**
     * Deletes an element.
     *
     * @param name the element name
     * @return the value the element held
     *
     * @throws MissingFieldException if there is no such element
     */
    public Object delete(String name) {
        if (!_elements.containsKey(name)) {
            throw new MissingFieldException(name);
        }

        return _elements.remove(name);
    }


    public boolean containsKey(String name) {
        return _elements.containsKey(name);
    }


    /**
     * @return the element names in insertion order (read-only)
     */
    public Set<String> keys() {
        return Collections.unmodifiableSet(_elements.keySet());
    }


    /**
     * @return the number of elements
     */
    public int size() {
        return _elements.size();
    }


    /**
     * Consulted by the store before insertion. If this returns false
     * the insertion is aborted and nothing is modified.
     *
     * @return true by default
     */
    public boolean isReadyForInsertion() {
        return true;
    }


    /**
     * @return a deep, storage-safe copy of the elements
     */
    @Override
    public Map<String, Object> pack() {
        return ElementCopier.copyElements(_elements);
    }


    @Override
    public String toString() {
        return "Vertex{place=" + _place + ", elements=" + _elements + "}";
    }
}
