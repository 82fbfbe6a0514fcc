/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Raised when the insertion state of an edge is wrong for the current operation.
 */
public class EdgeInsertionException extends DocNetException {
    public EdgeInsertionException(String message) {
        super(message);
    }
}
