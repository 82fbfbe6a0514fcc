/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.model;

/**
 * Base class for anything a DocNetStore holds.
 *<p>
 * An entity knows whether it is currently held by a store, can be
 * turned into a storage-safe pack, and is told when the store takes it in.
 * Each concrete entity type has a paired factory that rebuilds it from its pack.
 *
 * @param <P> the type of the pack produced for storage
 *
 * @see VertexFactory
 * @see EdgeFactory
 */
public abstract class Entity<P> {
    /**
     * @return true if this entity is currently held by a store, false otherwise
     */
    public abstract boolean isInserted();


    /**
     * Returns the storage form of this entity. The returned value is
     * independent of the entity: mutating one never affects the other.
     *
     * @return the pack for this entity
     */
    public abstract P pack();


    /**
     * Callback invoked by the store when this entity is inserted.
     *<p>
     * Does nothing by default, subclasses may override it to do additional processing.
     */
    public void onInsert() {
    }
}
