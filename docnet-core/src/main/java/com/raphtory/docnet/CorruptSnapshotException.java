/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when a snapshot file exists but cannot be decoded into a graph.
 *<p>
 * The store that was loading is left in an undefined state and should be discarded.
 */
public class CorruptSnapshotException extends DocNetException {
    public CorruptSnapshotException(String message) {
        super(message);
    }


    public CorruptSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
