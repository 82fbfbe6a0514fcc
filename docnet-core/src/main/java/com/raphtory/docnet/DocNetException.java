/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Base exception for DocNet store operations.
 *<p>
 * All DocNet exceptions extend this class, so callers can catch
 * every store-related error in one place.
 */
public class DocNetException extends RuntimeException {
    /**
     * @param message error message
     */
    public DocNetException(String message) {
        super(message);
    }


    /**
     * @param message error message
     * @param cause underlying cause
     */
    public DocNetException(String message, Throwable cause) {
        super(message, cause);
    }
}
