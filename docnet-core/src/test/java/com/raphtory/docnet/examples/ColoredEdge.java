/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.examples;

import com.raphtory.docnet.implementation.DocNetStore;
import com.raphtory.docnet.model.Edge;
import com.raphtory.docnet.model.Vertex;

import java.util.List;

/**
 * An edge with a color, stored as a fifth value in its pack.
 */
public class ColoredEdge extends Edge {
    private final String _color;


    public ColoredEdge(Vertex start, Vertex end, String label, boolean hasDirection, String color) {
        super(start, end, label, hasDirection);
        _color = color;
    }


    private ColoredEdge(Edge template, String color) {
        super(template);
        _color = color;
    }


    /**
     * Edge factory for colored edges.
     */
    public static ColoredEdge fromPack(List<Object> pack, DocNetStore store) {
        Edge base = Edge.fromPack(pack, store);
        String color = pack.size() > 4 ? (String)pack.get(4) : null;
        return new ColoredEdge(base, color);
    }


    public String getColor() { return _color; }


    @Override
    public List<Object> pack() {
        List<Object> pack = super.pack();
        pack.add(_color);
        return pack;
    }
}
