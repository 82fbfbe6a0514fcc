/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.model;

import java.util.Map;

/**
 * A client implements this interface and supplies it to the DocNetStore
 * in order to rebuild its own vertex types when a snapshot is loaded.
 *<p>
 * The factory must consume any extra keys its vertex type adds to its pack.
 *
 * @see Vertex#fromPack(Map)
 */
@FunctionalInterface
public interface VertexFactory {
    /**
     * @param pack a vertex pack read from a snapshot
     * @return a new, detached vertex
     */
    Vertex fromPack(Map<String, Object> pack);
}
