/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.implementation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raphtory.docnet.TypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces deep, storage-safe copies of vertex elements and edge packs.
 *<p>
 * Values are passed through a Jackson tree, so the copy only holds
 * strings, numbers, booleans, nulls, lists and maps - the same values
 * that a snapshot round-trip gives back.
 */
public final class ElementCopier {
    static final ObjectMapper MAPPER = new ObjectMapper();
    static final TypeReference<LinkedHashMap<String, Object>> ELEMENTS_TYPE = new TypeReference<LinkedHashMap<String, Object>>() {};
    static final TypeReference<List<Object>> PACK_TYPE = new TypeReference<List<Object>>() {};


    private ElementCopier() {
    }


    /**
     * @param elements the elements to copy
     * @return an independent, insertion-ordered copy of the elements
     *
     * @throws TypeMismatchException if a value can't be represented in a snapshot
     */
    public static LinkedHashMap<String, Object> copyElements(Map<String, ?> elements) {
        return fromTree(toTree(elements), ELEMENTS_TYPE);
    }


    /**
     * @param value any storable value
     * @return the Jackson tree for that value
     *
     * @throws TypeMismatchException if the value can't be represented in a snapshot
     */
    static JsonNode toTree(Object value) {
        try {
            return MAPPER.valueToTree(value);
        }
        catch (IllegalArgumentException e) {
            throw new TypeMismatchException("Value can't be stored: " + e.getMessage());
        }
    }


    static <T> T fromTree(JsonNode node, TypeReference<T> type) {
        try {
            return MAPPER.convertValue(node, type);
        }
        catch (IllegalArgumentException e) {
            throw new TypeMismatchException("Value can't be converted: " + e.getMessage());
        }
    }
}
