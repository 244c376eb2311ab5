/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken.io;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.kencp.kenken.CageDescription;
import org.kencp.kenken.Cell;
import org.kencp.kenken.PuzzleDescription;
import org.kencp.util.exception.PuzzleFormatException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a puzzle description:
 * <pre>
 * {"size": 2,
 *  "cages": [{"members": [[1,1],[1,2]], "operator": "-", "target": 1},
 *            {"members": [[2,1],[2,2]], "operator": "/", "target": 2}]}
 * </pre>
 * Reading does not validate the board, see {@link org.kencp.kenken.PuzzleValidator}.
 */
public final class PuzzleJson {

    private PuzzleJson() {}

    public static JSONObject toJson(PuzzleDescription puzzle) {
        JSONArray cages = new JSONArray();
        for (CageDescription cage : puzzle.cages()) {
            JSONArray members = new JSONArray();
            for (Cell c : cage.members())
                members.put(new JSONArray().put(c.x()).put(c.y()));
            cages.put(new JSONObject()
                    .put("members", members)
                    .put("operator", cage.operator())
                    .put("target", cage.target()));
        }
        return new JSONObject().put("size", puzzle.size()).put("cages", cages);
    }

    public static String write(PuzzleDescription puzzle) {
        return toJson(puzzle).toString();
    }

    public static void write(PuzzleDescription puzzle, Path path) throws IOException {
        Files.writeString(path, toJson(puzzle).toString(2), StandardCharsets.UTF_8);
    }

    /**
     * @throws PuzzleFormatException if the text is not a JSON puzzle description
     */
    public static PuzzleDescription read(String json) {
        try {
            return fromJson(new JSONObject(json));
        } catch (JSONException e) {
            throw new PuzzleFormatException("Invalid puzzle description: " + e.getMessage(), e);
        }
    }

    /**
     * @throws PuzzleFormatException if the text is not a JSON puzzle description
     *                               or the reader fails
     */
    public static PuzzleDescription read(Reader reader) {
        try {
            return fromJson(new JSONObject(new JSONTokener(reader)));
        } catch (JSONException e) {
            throw new PuzzleFormatException("Invalid puzzle description: " + e.getMessage(), e);
        }
    }

    public static PuzzleDescription read(Path path) throws IOException {
        return read(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static PuzzleDescription fromJson(JSONObject json) {
        try {
            int size = integer(json.get("size"), "size");
            JSONArray cages = json.getJSONArray("cages");
            List<CageDescription> res = new ArrayList<>(cages.length());
            for (int i = 0; i < cages.length(); i++) {
                JSONObject cage = cages.getJSONObject(i);
                JSONArray members = cage.getJSONArray("members");
                List<Cell> cells = new ArrayList<>(members.length());
                for (int j = 0; j < members.length(); j++) {
                    JSONArray xy = members.getJSONArray(j);
                    if (xy.length() != 2)
                        throw new PuzzleFormatException("Cage " + i + ": member " + xy + " is not an (x,y) pair");
                    cells.add(new Cell(integer(xy.get(0), "cage " + i + " x"), integer(xy.get(1), "cage " + i + " y")));
                }
                res.add(new CageDescription(cells, cage.getString("operator"), integer(cage.get("target"), "cage " + i + " target")));
            }
            return new PuzzleDescription(size, res);
        } catch (JSONException e) {
            throw new PuzzleFormatException("Invalid puzzle description: " + e.getMessage(), e);
        }
    }

    // integral JSON numbers only, no strings and no fractions
    private static int integer(Object value, String what) {
        if (value instanceof Integer)
            return (Integer) value;
        if (value instanceof Long) {
            long v = (Long) value;
            if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
                return (int) v;
        }
        throw new PuzzleFormatException("Invalid puzzle description: " + what + " is not an int: " + value);
    }
}
