/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when a store operation receives an argument of the wrong kind,
 * eg. a null where a vertex or edge is expected.
 */
public class TypeMismatchException extends DocNetException {
    public TypeMismatchException(String message) {
        super(message);
    }
}
