/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when a direction token is not one of the known values.
 */
public class InvalidDirectionException extends DocNetException {
    public InvalidDirectionException(String token) {
        super("Direction is either 'in', 'out' or 'none', got: " + token);
    }
}
