/* Copyright (C) Pometry Ltd - All Rights Reserved.
 *
 * This file is proprietary and confidential. Unauthorised
 * copying of this file, via any medium is strictly prohibited.
 *
 */

package com.raphtory.docnet.model;

import com.raphtory.docnet.InvalidDirectionException;

/**
 * The direction of an edge as seen from one of its endpoints (the anchor).
 */
public enum Direction {
    /** The anchor is the start of a directed edge */
    OUT("out"),

    /** The anchor is the end of a directed edge */
    IN("in"),

    /** The edge has no direction */
    NONE("none");

    /**
     * Token accepted by edge searches to mean "any direction".
     */
    public static final String ALL_TOKEN = "all";

    private final String _token;


    Direction(String token) {
        _token = token;
    }


    /**
     * @return the textual token for this direction
     */
    public String getToken() { return _token; }


    /**
     * @return the direction seen from the other endpoint of the same edge
     */
    public Direction reverse() {
        switch (this) {
            case OUT:
                return IN;
            case IN:
                return OUT;
            default:
                return NONE;
        }
    }


    /**
     * Maps a token ("out", "in" or "none") to a direction.
     *
     * @param token the token in question
     * @return the matching direction
     *
     * @throws InvalidDirectionException if the token is unknown
     */
    public static Direction fromToken(String token) {
        for (Direction d : values()) {
            if (d._token.equals(token)) {
                return d;
            }
        }

        throw new InvalidDirectionException(token);
    }


    @Override
    public String toString() {
        return _token;
    }
}
