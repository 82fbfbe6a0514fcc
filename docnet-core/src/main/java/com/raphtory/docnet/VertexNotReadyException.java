/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when a vertex declines insertion through its readiness hook.
 * The store is left untouched.
 */
public class VertexNotReadyException extends DocNetException {
    public VertexNotReadyException(String message) {
        super(message);
    }
}
