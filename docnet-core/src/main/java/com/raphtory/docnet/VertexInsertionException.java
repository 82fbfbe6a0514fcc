/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Raised when the insertion state of a vertex is wrong for the current operation.
 *<p>
 * Depending on the situation the vertex may be inserted, not inserted,
 * or inserted in another store.
 *
 * @see VertexAlreadyInsertedException
 * @see VertexNotInsertedException
 */
public class VertexInsertionException extends DocNetException {
    public VertexInsertionException(String message) {
        super(message);
    }
}
