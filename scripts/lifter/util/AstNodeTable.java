/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// Content-addressed table of serialized nodes. Identities start at 1 and are
// handed out in first-insertion order; re-inserting a known key returns its
// identity and leaves the stored payload alone.
public class AstNodeTable {
    private final Map<AstNodeKey, Integer> keyTable = new HashMap<>();
    private final Map<Integer, JsonObject> indexTable = new TreeMap<>();
    private int next = 1;

    public synchronized int intern(AstNodeKey key, JsonObject payload) {
        Integer existing = keyTable.get(key);
        if (existing != null) {
            return existing;
        }
        int index = next++;
        keyTable.put(key, index);
        indexTable.put(index, payload.deepCopy());
        return index;
    }

    public synchronized boolean contains(AstNodeKey key) {
        return keyTable.containsKey(key);
    }

    public synchronized int size() {
        return indexTable.size();
    }

    // Copies of the payloads in identity order, each with its "id".
    public synchronized List<JsonObject> records() {
        List<JsonObject> result = new ArrayList<>();
        for (Map.Entry<Integer, JsonObject> entry : indexTable.entrySet()) {
            JsonObject record = entry.getValue().deepCopy();
            record.addProperty("id", entry.getKey());
            result.add(record);
        }
        return result;
    }
}
