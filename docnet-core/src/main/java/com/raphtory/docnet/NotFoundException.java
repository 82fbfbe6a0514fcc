/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when a lookup or removal does not find its target.
 */
public class NotFoundException extends DocNetException {
    public NotFoundException(String message) {
        super(message);
    }
}
