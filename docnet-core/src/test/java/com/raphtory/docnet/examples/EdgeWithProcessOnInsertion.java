/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.examples;

import com.raphtory.docnet.model.Edge;
import com.raphtory.docnet.model.Vertex;

import java.time.Instant;

/**
 * An edge that records when it was inserted.
 */
public class EdgeWithProcessOnInsertion extends Edge {
    private String _insertionDate = null;


    public EdgeWithProcessOnInsertion(Vertex start, Vertex end) {
        super(start, end);
    }


    @Override
    public void onInsert() {
        _insertionDate = Instant.now().toString();
    }


    public String getInsertionDate() { return _insertionDate; }
}
