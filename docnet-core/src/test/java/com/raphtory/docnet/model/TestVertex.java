/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */
package com.raphtory.docnet.model;

import com.raphtory.docnet.MissingFieldException;
import com.raphtory.docnet.NotFoundException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Checks the element bag and the insertion state of a vertex.
 */
public class TestVertex {
    @Test
    public void newVertexIsNotInserted() {
        Vertex v = new Vertex();
        assertFalse(v.isInserted());
        assertEquals(0, v.getPlace());
        assertEquals(0, v.size());
    }


    @Test
    public void constructorUsesSuppliedElements() {
        Map<String, Object> init = new HashMap<>();
        init.put("name", "Reflexion");
        init.put("chapter", 6);

        Vertex v = new Vertex(init);
        assertEquals("Reflexion", v.get("name"));
        assertEquals(6, v.get("chapter"));
    }


    @Test
    public void constructorCopiesElements() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("level", 1);
        List<Object> tags = new ArrayList<>(Arrays.asList("a", "b"));

        Map<String, Object> init = new HashMap<>();
        init.put("name", "Reflexion");
        init.put("meta", nested);
        init.put("tags", tags);

        Vertex v = new Vertex(init);
        init.put("name", "NAME CHANGED");
        nested.put("level", 2);
        tags.add("c");

        assertEquals("Reflexion", v.get("name"));
        assertEquals(1, ((Map<?, ?>)v.get("meta")).get("level"));
        assertEquals(Arrays.asList("a", "b"), v.get("tags"));
    }


    @Test
    public void elementsBehaveLikeAMap() {
        Vertex v = new Vertex();
        v.set("name", "v");
        assertEquals("v", v.get("name"));

        v.set("version", 2);
        assertEquals("v", v.get("name"));
        assertEquals(2, v.get("version"));

        v.set("version", 3);
        assertEquals(3, v.get("version"));

        assertEquals("v", v.delete("name"));
        assertFalse(v.containsKey("name"));
        assertThrows(MissingFieldException.class, () -> v.get("name"));
        assertEquals(3, v.get("version"));
    }


    @Test
    public void missingFieldIsANotFound() {
        Vertex v = new Vertex();
        MissingFieldException e = assertThrows(MissingFieldException.class, () -> v.get("absent"));
        assertEquals("absent", e.getField());
        assertTrue(e instanceof NotFoundException);

        assertThrows(MissingFieldException.class, () -> v.delete("absent"));
    }


    @Test
    public void nullIsAValueNotAMissingField() {
        Vertex v = new Vertex();
        v.set("nothing", null);
        assertTrue(v.containsKey("nothing"));
        assertNull(v.get("nothing"));
    }


    @Test
    public void keysKeepInsertionOrder() {
        Vertex v = new Vertex();
        v.set("z", 1);
        v.set("a", 2);
        v.set("m", 3);

        assertEquals(Arrays.asList("z", "a", "m"), new ArrayList<>(v.keys()));
        assertThrows(UnsupportedOperationException.class, () -> v.keys().remove("z"));
    }


    @Test
    public void packIsIndependentOfTheVertex() {
        Vertex v = new Vertex();
        v.set("tags", new ArrayList<>(Arrays.asList("x")));
        v.set("name", "Ruby");

        Map<String, Object> pack = v.pack();
        assertEquals("Ruby", pack.get("name"));

        pack.put("name", "Weiss");
        ((List<Object>)pack.get("tags")).add("y");

        assertEquals("Ruby", v.get("name"));
        assertEquals(Arrays.asList("x"), v.get("tags"));
    }


    @Test
    public void fromPackBuildsADetachedVertex() {
        Map<String, Object> pack = new LinkedHashMap<>();
        pack.put("name", "Blake");

        Vertex v = Vertex.fromPack(pack);
        assertFalse(v.isInserted());
        assertEquals("Blake", v.get("name"));

        pack.put("name", "Yang");
        assertEquals("Blake", v.get("name"));
    }


    @Test
    public void readyForInsertionByDefault() {
        assertTrue(new Vertex().isReadyForInsertion());
    }
}
