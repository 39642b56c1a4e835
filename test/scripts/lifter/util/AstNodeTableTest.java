/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import com.google.gson.JsonObject;

import java.util.List;

public class AstNodeTableTest {
    private static JsonObject payload(String tag) {
        JsonObject node = new JsonObject();
        node.addProperty("tag", tag);
        return node;
    }

    @Test
    public void testIdentitiesStartAtOne() {
        AstNodeTable table = new AstNodeTable();

        assertEquals(1, table.intern(new AstNodeKey(List.of("var", "R0"), List.of()), payload("var")));
        assertEquals(2, table.intern(new AstNodeKey(List.of("var", "R1"), List.of()), payload("var")));
        assertEquals(3, table.intern(new AstNodeKey(List.of("lval"), List.of(1L, 2L)), payload("lval")));
        assertEquals(3, table.size());
    }

    @Test
    public void testReinsertKeepsFirstPayload() {
        AstNodeTable table = new AstNodeTable();
        AstNodeKey key = new AstNodeKey(List.of("integer-constant", "3"), List.of());

        JsonObject first = payload("integer-constant");
        first.addProperty("value", "3");
        int id = table.intern(key, first);
        int again = table.intern(new AstNodeKey(List.of("integer-constant", "3"), List.of()), payload("other"));

        assertEquals(id, again);
        assertEquals(1, table.size());
        assertTrue(table.contains(key));
        assertEquals("integer-constant", table.records().get(0).get("tag").getAsString());
    }

    @Test
    public void testTagsAndArgsAreDistinguished() {
        AstNodeTable table = new AstNodeTable();

        int a = table.intern(new AstNodeKey(List.of("binary-op", "plus"), List.of(1L, 2L)), payload("binary-op"));
        int b = table.intern(new AstNodeKey(List.of("binary-op", "plus"), List.of(2L, 1L)), payload("binary-op"));
        int c = table.intern(new AstNodeKey(List.of("binary-op", "minus"), List.of(1L, 2L)), payload("binary-op"));

        assertNotEquals(a, b);
        assertNotEquals(a, c);
        assertNotEquals(b, c);
    }

    @Test
    public void testTagsContainingSeparatorsStayDistinct() {
        AstNodeTable table = new AstNodeTable();

        int joined = table.intern(new AstNodeKey(List.of("string-constant", "a,b"), List.of()), payload("string-constant"));
        int split = table.intern(new AstNodeKey(List.of("string-constant", "a", "b"), List.of()), payload("string-constant"));
        int wide = table.intern(new AstNodeKey(List.of("lval"), List.of(12L)), payload("lval"));
        int pair = table.intern(new AstNodeKey(List.of("lval"), List.of(1L, 2L)), payload("lval"));

        assertNotEquals(joined, split);
        assertNotEquals(wide, pair);
        assertEquals(4, table.size());
    }

    @Test
    public void testRecordsAreOrderedCopies() {
        AstNodeTable table = new AstNodeTable();
        JsonObject stored = payload("var");
        table.intern(new AstNodeKey(List.of("var", "x"), List.of()), stored);
        table.intern(new AstNodeKey(List.of("no-offset"), List.of()), payload("no-offset"));

        stored.addProperty("name", "changed");
        List<JsonObject> records = table.records();

        assertEquals(2, records.size());
        assertEquals(1, records.get(0).get("id").getAsInt());
        assertEquals(2, records.get(1).get("id").getAsInt());
        assertFalse(records.get(0).has("name"));

        records.get(0).addProperty("tag", "mutated");
        assertEquals("var", table.records().get(0).get("tag").getAsString());
    }

    @Test
    public void testKeyRendering() {
        AstNodeKey key = new AstNodeKey(List.of("lval"), List.of(4L, 5L));

        assertEquals(List.of("lval"), key.getTags());
        assertEquals(List.of(4L, 5L), key.getArgs());
        assertEquals("[lval][4, 5]", key.toString());
        assertEquals(key, new AstNodeKey(List.of("lval"), List.of(4L, 5L)));
    }
}
