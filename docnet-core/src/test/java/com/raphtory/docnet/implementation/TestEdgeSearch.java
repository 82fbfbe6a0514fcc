/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */
package com.raphtory.docnet.implementation;

import com.raphtory.docnet.EdgeInsertionException;
import com.raphtory.docnet.InvalidDirectionException;
import com.raphtory.docnet.NotFoundException;
import com.raphtory.docnet.VertexNotInsertedException;
import com.raphtory.docnet.VertexStillConnectedException;
import com.raphtory.docnet.model.AnchoredEdge;
import com.raphtory.docnet.model.Direction;
import com.raphtory.docnet.model.Edge;
import com.raphtory.docnet.model.Vertex;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Checks edge insertion, removal and anchored searches.
 */
public class TestEdgeSearch {
    private DocNetStore _store;
    private Vertex _v1;
    private Vertex _v2;
    private Vertex _v3;


    @Before
    public void setup() {
        _store = new DocNetStore(Paths.get("unused-edge-search.json"));
        _v1 = new Vertex();
        _v2 = new Vertex();
        _v3 = new Vertex();
        _store.insert(_v1);
        _store.insert(_v2);
        _store.insert(_v3);
    }


    private static List<AnchoredEdge> collect(Iterable<AnchoredEdge> views) {
        List<AnchoredEdge> result = new ArrayList<>();
        for (AnchoredEdge view : views) {
            result.add(view);
        }
        return result;
    }


    @Test
    public void insertEdgeRequiresMembers() {
        DocNetStore other = new DocNetStore(Paths.get("unused-other.json"));
        Vertex foreign = new Vertex();
        other.insert(foreign);

        assertThrows(VertexNotInsertedException.class, () -> _store.insertEdge(new Edge(_v1, foreign)));
        assertEquals(0, _store.edgeCount());
    }


    @Test
    public void insertEdgeOnlyOnce() {
        Edge e = new Edge(_v1, _v2);
        _store.insertEdge(e);
        assertTrue(e.isInserted());

        assertThrows(EdgeInsertionException.class, () -> _store.insertEdge(e));
        assertEquals(1, _store.edgeCount());
    }


    @Test
    public void equalEdgesMayCoexist() {
        _store.makeEdge(_v1, _v2, "", true);
        _store.makeEdge(_v1, _v2, "", true);
        assertEquals(2, _store.edgeCount());
        assertEquals(2, collect(_store.searchEdge(_v1)).size());
    }


    @Test
    public void removeEdgeRemovesFirstDuplicate() {
        Edge first = _store.makeEdge(_v1, _v2, "", true);
        Edge middle = _store.makeEdge(_v2, _v3, "", true);
        Edge second = _store.makeEdge(_v1, _v2, "", true);

        Edge removed = _store.removeEdge(new Edge(_v1, _v2));
        assertSame(first, removed);
        assertFalse(first.isInserted());
        assertTrue(second.isInserted());

        assertEquals(2, _store.edgeCount());
        assertSame(middle, _store.edges().get(0));
        assertSame(second, _store.edges().get(1));
    }


    @Test
    public void removeEdgeByDetails() {
        Edge e = _store.makeEdge(_v3, _v1, "friend", false);
        assertSame(e, _store.removeEdge(_v1, _v3, "friend", false));
        assertEquals(0, _store.edgeCount());
    }


    @Test
    public void removeMissingEdgeIsNotFound() {
        _store.makeEdge(_v1, _v2, "x", true);
        assertThrows(NotFoundException.class, () -> _store.removeEdge(new Edge(_v1, _v2, "y")));
        assertThrows(NotFoundException.class, () -> _store.removeEdge(new Edge(_v2, _v1, "x")));
        assertEquals(1, _store.edgeCount());
    }


    @Test
    public void connectedVerticesCantBeRemoved() {
        _store.makeEdge(_v1, _v2, "", true);

        VertexStillConnectedException e = assertThrows(VertexStillConnectedException.class, () -> _store.remove(_v2));
        assertEquals(2, e.getPlace());
        assertTrue(_store.contains(_v2));
        assertEquals(3, _store.remove(_v3));
    }


    @Test
    public void removalAfterDisconnecting() {
        _store.makeEdge(_v1, _v2, "knows", false);
        _store.makeEdge(_v2, _v3, "", true);

        List<AnchoredEdge> views = collect(_store.searchEdge(_v2));
        assertEquals(2, views.size());

        AnchoredEdge knows = views.get(0);
        assertSame(_v2, knows.getAnchor());
        assertSame(_v1, knows.getOther());
        assertEquals(Direction.NONE, knows.getDirection());
        assertEquals("knows", knows.getLabel());

        AnchoredEdge toV3 = views.get(1);
        assertSame(_v2, toV3.getAnchor());
        assertSame(_v3, toV3.getOther());
        assertEquals(Direction.OUT, toV3.getDirection());
        assertEquals("", toV3.getLabel());

        assertThrows(VertexStillConnectedException.class, () -> _store.remove(_v2));

        for (AnchoredEdge view : collect(_store.searchEdge(_v2))) {
            _store.removeEdge(view.getEdge());
        }

        assertEquals(2, _store.remove(_v2));
        assertEquals(4, _store.insert(new Vertex()));
    }


    @Test
    public void searchByDirection() {
        _store.makeEdge(_v1, _v2, "", true);
        _store.makeEdge(_v3, _v1, "", true);
        _store.makeEdge(_v1, _v3, "", false);

        List<AnchoredEdge> out = collect(_store.searchEdge(_v1, null, null, "out"));
        assertEquals(1, out.size());
        assertSame(_v2, out.get(0).getOther());
        assertEquals(Direction.OUT, out.get(0).getDirection());

        List<AnchoredEdge> in = collect(_store.searchEdge(_v1, null, null, Direction.IN));
        assertEquals(1, in.size());
        assertSame(_v3, in.get(0).getOther());

        List<AnchoredEdge> none = collect(_store.searchEdge(_v1, null, null, "none"));
        assertEquals(1, none.size());
        assertFalse(none.get(0).getEdge().hasDirection());

        assertEquals(3, collect(_store.searchEdge(_v1, null, null, "all")).size());
        assertEquals(3, collect(_store.searchEdge(_v1, null, null, (String)null)).size());
    }


    @Test
    public void searchByLabel() {
        _store.makeEdge(_v1, _v2, "", true);
        _store.makeEdge(_v1, _v3, "name", true);

        List<AnchoredEdge> unlabelled = collect(_store.searchEdge(_v1, null, "", Direction.OUT));
        assertEquals(1, unlabelled.size());
        assertSame(_v2, unlabelled.get(0).getOther());

        List<AnchoredEdge> named = collect(_store.searchEdge(_v1, null, "name", Direction.OUT));
        assertEquals(1, named.size());
        assertSame(_v3, named.get(0).getOther());

        assertEquals(0, collect(_store.searchEdge(_v1, null, "missing", (Direction)null)).size());
    }


    @Test
    public void searchByOtherVertex() {
        _store.makeEdge(_v1, _v2, "", true);
        _store.makeEdge(_v1, _v3, "", true);
        _store.makeEdge(_v2, _v1, "", true);

        List<AnchoredEdge> views = collect(_store.searchEdge(_v1, _v2));
        assertEquals(2, views.size());
        assertEquals(Direction.OUT, views.get(0).getDirection());
        assertEquals(Direction.IN, views.get(1).getDirection());
        for (AnchoredEdge view : views) {
            assertSame(_v1, view.getAnchor());
            assertSame(_v2, view.getOther());
        }
    }


    @Test
    public void searchRejectsUnknownDirection() {
        assertThrows(InvalidDirectionException.class, () -> _store.searchEdge(_v1, null, null, "both"));
    }


    @Test
    public void searchIsRestartable() {
        _store.makeEdge(_v1, _v2, "", true);
        _store.makeEdge(_v1, _v3, "", true);

        Iterable<AnchoredEdge> views = _store.searchEdge(_v1);
        assertEquals(2, collect(views).size());
        assertEquals(2, collect(views).size());
    }


    @Test
    public void searchIsLazy() {
        Iterable<AnchoredEdge> views = _store.searchEdge(_v1);
        _store.makeEdge(_v1, _v2, "", true);

        assertEquals(1, collect(views).size());
    }


    @Test
    public void edgesKeepInsertionOrder() {
        Edge e1 = _store.makeEdge(_v2, _v3, "", true);
        Edge e2 = _store.makeEdge(_v1, _v2, "", false);

        List<Edge> edges = _store.edges();
        assertEquals(2, edges.size());
        assertSame(e1, edges.get(0));
        assertSame(e2, edges.get(1));
        assertThrows(UnsupportedOperationException.class, () -> edges.remove(0));
    }


    @Test
    public void selfEdges() {
        _store.makeEdge(_v1, _v1, "loop", true);

        List<AnchoredEdge> views = collect(_store.searchEdge(_v1));
        assertEquals(1, views.size());
        assertSame(_v1, views.get(0).getOther());
        assertEquals(Direction.OUT, views.get(0).getDirection());
        assertThrows(VertexStillConnectedException.class, () -> _store.remove(_v1));
    }


    @Test
    public void edgeOnInsertRunsOnce() {
        int[] calls = new int[1];
        Edge e = new Edge(_v1, _v2) {
            @Override
            public void onInsert() {
                ++calls[0];
            }
        };

        _store.insertEdge(e);
        assertEquals(1, calls[0]);
    }
}
