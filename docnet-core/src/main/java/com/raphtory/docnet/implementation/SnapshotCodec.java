/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.implementation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raphtory.docnet.CorruptSnapshotException;
import com.raphtory.docnet.model.Edge;
import com.raphtory.docnet.model.EdgeFactory;
import com.raphtory.docnet.model.Vertex;
import com.raphtory.docnet.model.VertexFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts the contents of a DocNetStore to and from a single JSON document.
 *<p>
 * <b>Layout</b><p>
 * {@code _next_place} - the store's place counter.<p>
 * {@code edges} - an array of edge packs, {@code [startPlace, endPlace, label, hasDirection]},
 * possibly followed by extra values added by edge subclasses.<p>
 * Every other key is a place, as a string, mapped to that vertex's pack.
 *<p>
 * Snapshots are written in place: there is no atomic rename and the last save wins.
 */
public class SnapshotCodec {
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotCodec.class);

    public static final String NEXT_PLACE_KEY = "_next_place";
    public static final String EDGES_KEY = "edges";

    private final ObjectWriter _writer;


    /**
     * @param prettyPrint true to indent the written documents
     */
    public SnapshotCodec(boolean prettyPrint) {
        _writer = prettyPrint ? ElementCopier.MAPPER.writerWithDefaultPrettyPrinter() : ElementCopier.MAPPER.writer();
    }


    /**
     * Builds the snapshot document for a store.
     * Vertices are written in ascending place order.
     *
     * @param store the store to encode
     * @return the document
     */
    public ObjectNode encode(DocNetStore store) {
        ObjectNode doc = ElementCopier.MAPPER.createObjectNode();
        doc.put(NEXT_PLACE_KEY, store.getNextPlace());

        ArrayNode edges = doc.putArray(EDGES_KEY);
        for (Edge e : store.edges()) {
            edges.add(ElementCopier.toTree(e.pack()));
        }

        VertexManager vmgr = store.getVertexMgr();
        int[] places = vmgr.getPlaces().toIntArray();
        Arrays.sort(places);

        for (int place : places) {
            doc.set(Integer.toString(place), ElementCopier.toTree(vmgr.getVertex(place).pack()));
        }

        return doc;
    }


    /**
     * Writes a document, overwriting the file and creating any missing parent directories.
     *
     * @param path the file to write
     * @param doc the document
     *
     * @throws IOException if the file can't be written
     */
    public void write(Path path, ObjectNode doc) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }

        try (OutputStream out = Files.newOutputStream(path)) {
            _writer.writeValue(out, doc);
        }

        LOG.debug("Wrote snapshot {}", path);
    }


    /**
     * Reads a document.
     *
     * @param path the file to read
     * @return the document, or null if the file doesn't exist
     *
     * @throws CorruptSnapshotException if the file isn't valid JSON
     * @throws IOException if the file exists but can't be read
     */
    public JsonNode read(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.debug("No snapshot at {}", path);
            return null;
        }

        JsonNode doc;
        try (InputStream in = Files.newInputStream(path)) {
            doc = ElementCopier.MAPPER.readTree(in);
        }
        catch (JsonProcessingException e) {
            throw new CorruptSnapshotException("Snapshot " + path + " is not valid JSON", e);
        }

        if (doc == null || doc.isMissingNode()) {
            throw new CorruptSnapshotException("Snapshot " + path + " is empty");
        }

        return doc;
    }


    /**
     * Populates an empty store from a document. Vertices are rebuilt first,
     * then the edges are rebuilt and resolved against them.
     *
     * @param doc the document
     * @param store the store to fill
     * @param vertexFactory used to rebuild each vertex
     * @param edgeFactory used to rebuild each edge
     *
     * @throws CorruptSnapshotException if the document doesn't have the expected layout
     */
    public void decode(JsonNode doc, DocNetStore store, VertexFactory vertexFactory, EdgeFactory edgeFactory) {
        if (!doc.isObject()) {
            throw new CorruptSnapshotException("Snapshot root must be an object");
        }

        int maxPlace = 0;
        Iterator<Map.Entry<String, JsonNode>> it = doc.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            if (NEXT_PLACE_KEY.equals(key) || EDGES_KEY.equals(key)) {
                continue;
            }

            int place = parsePlace(key);
            if (!entry.getValue().isObject()) {
                throw new CorruptSnapshotException("Vertex " + key + " must be an object");
            }

            Map<String, Object> pack = ElementCopier.fromTree(entry.getValue(), ElementCopier.ELEMENTS_TYPE);
            Vertex v = vertexFactory.fromPack(pack);
            if (v == null) {
                throw new CorruptSnapshotException("The vertex factory returned null for place " + place);
            }

            store.restoreVertex(place, v);
            maxPlace = Math.max(maxPlace, place);
        }

        store.restoreNextPlace(readNextPlace(doc, maxPlace));

        JsonNode edges = doc.get(EDGES_KEY);
        if (edges == null) {
            return;
        }
        if (!edges.isArray()) {
            throw new CorruptSnapshotException("'" + EDGES_KEY + "' must be an array");
        }

        for (JsonNode node : edges) {
            if (!node.isArray()) {
                throw new CorruptSnapshotException("Edge pack must be an array: " + node);
            }

            List<Object> pack = ElementCopier.fromTree(node, ElementCopier.PACK_TYPE);
            Edge e = edgeFactory.fromPack(pack, store);
            if (e == null) {
                throw new CorruptSnapshotException("The edge factory returned null for " + node);
            }

            store.restoreEdge(e);
        }
    }


    private static int parsePlace(String key) {
        int place;
        try {
            place = Integer.parseInt(key);
        }
        catch (NumberFormatException e) {
            throw new CorruptSnapshotException("Unexpected key in snapshot: " + key, e);
        }

        if (place < 1) {
            throw new CorruptSnapshotException("Invalid place in snapshot: " + key);
        }

        return place;
    }


    private static int readNextPlace(JsonNode doc, int maxPlace) {
        if (maxPlace == Integer.MAX_VALUE) {
            throw new CorruptSnapshotException("No place is left after " + maxPlace);
        }

        JsonNode node = doc.get(NEXT_PLACE_KEY);
        if (node == null) {
            // Written before the counter was persisted
            return maxPlace + 1;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new CorruptSnapshotException("'" + NEXT_PLACE_KEY + "' must be an integer: " + node);
        }

        int nextPlace = node.intValue();
        if (nextPlace <= maxPlace) {
            LOG.warn("Snapshot {} of {} is behind its highest place {}, using {}", NEXT_PLACE_KEY, nextPlace, maxPlace, maxPlace + 1);
            return maxPlace + 1;
        }

        return nextPlace;
    }
}
