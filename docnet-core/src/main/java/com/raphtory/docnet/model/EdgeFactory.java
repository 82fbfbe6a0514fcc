/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.model;

import com.raphtory.docnet.implementation.DocNetStore;

import java.util.List;

/**
 * A client implements this interface and supplies it to the DocNetStore
 * in order to rebuild its own edge types when a snapshot is loaded.
 *
 * @see Edge#fromPack(List, DocNetStore)
 */
@FunctionalInterface
public interface EdgeFactory {
    /**
     * @param pack an edge pack read from a snapshot
     * @param store the store being loaded, used to map places to vertices
     * @return a new edge, not yet marked as inserted
     */
    Edge fromPack(List<Object> pack, DocNetStore store);
}
