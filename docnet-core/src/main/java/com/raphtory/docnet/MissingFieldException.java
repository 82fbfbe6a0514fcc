/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet;

/**
 * Thrown when a vertex field is read or deleted but does not exist.
 *<p>
 * Vertex searches treat this exception as a non-match.
 */
public class MissingFieldException extends NotFoundException {
    private final String _field;


    /**
     * @param field the name of the missing field
     */
    public MissingFieldException(String field) {
        super("No such field: " + field);
        _field = field;
    }


    /**
     * @return the name of the missing field
     */
    public String getField() { return _field; }
}
