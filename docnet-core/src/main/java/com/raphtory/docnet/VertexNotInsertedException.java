/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when an operation needs a vertex attached to a store (or to this
 * particular store) and it is not.
 */
public class VertexNotInsertedException extends VertexInsertionException {
    public VertexNotInsertedException(String message) {
        super(message);
    }
}
