/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import arm.FunctionLifter;
import arm.LiftedFunction;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonWriter;

import domain.DecodedFunction;

import java.io.BufferedWriter;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

// The FunctionAstSerializer is a utility class of the ArmLiftFunctions script.
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class FunctionAstSerializerTest {
    List<LiftedFunction> lifted = new ArrayList<>();

    StringWriter stringWriter;
    BufferedWriter writer;

    @BeforeAll
    public void setUp() throws Exception {
        List<DecodedFunction> functions;
        try (Reader input = new InputStreamReader(
                getClass().getResourceAsStream("/lift-input.json"), StandardCharsets.UTF_8)) {
            functions = new LiftInputReader().read(input);
        }
        FunctionLifter lifter = new FunctionLifter();
        lifted.add(lifter.lift(functions.get(0)));
        lifted.add(lifter.lift(functions.get(1)));
    }

    @AfterAll
    public void cleanUp() throws Exception {
        if (writer != null) {
            writer.close();
            stringWriter.close();
        }
    }

    private JsonObject serialize() throws Exception {
        stringWriter = new StringWriter();
        writer = new BufferedWriter(stringWriter);

        FunctionAstSerializer serializer = new FunctionAstSerializer(writer, "lift-input.json");
        JsonWriter jsonWriter = serializer.serialize(lifted);
        assertNotNull(jsonWriter);

        return JsonParser.parseString(stringWriter.toString()).getAsJsonObject();
    }

    @Test
    public void testSerialize() throws Exception {
        JsonObject output = serialize();

        assertEquals("lift-input.json", output.get("input").getAsString());
        assertEquals(2, output.get("functions").getAsJsonArray().size());

        for (JsonElement element : output.get("functions").getAsJsonArray()) {
            JsonObject fn = element.getAsJsonObject();
            assertTrue(fn.has("name"));
            assertTrue(fn.has("address"));
            assertTrue(fn.has("high-level"));
            assertTrue(fn.has("low-level"));
            assertTrue(fn.has("provenance"));
            assertTrue(fn.has("spans"));
            assertTrue(fn.has("annotations"));
            assertTrue(fn.has("nodes"));
        }
    }

    @Test
    public void testNodeTable() throws Exception {
        JsonObject main = serialize().get("functions").getAsJsonArray().get(0).getAsJsonObject();
        List<JsonElement> nodes = new ArrayList<>();
        main.get("nodes").getAsJsonArray().forEach(nodes::add);

        for (int i = 0; i < nodes.size(); i++) {
            JsonObject node = nodes.get(i).getAsJsonObject();
            assertEquals(i + 1, node.get("id").getAsInt());
            assertTrue(node.has("tag"));
            assertTrue(node.has("args"));
        }

        int high = main.get("high-level").getAsInt();
        int low = main.get("low-level").getAsInt();
        assertNotEquals(high, low);
        assertEquals("block", nodes.get(high - 1).getAsJsonObject().get("tag").getAsString());
        assertEquals("block", nodes.get(low - 1).getAsJsonObject().get("tag").getAsString());
    }

    @Test
    public void testProvenanceAndSymbols() throws Exception {
        JsonObject main = serialize().get("functions").getAsJsonArray().get(0).getAsJsonObject();
        JsonObject provenance = main.get("provenance").getAsJsonObject();

        assertFalse(provenance.get("instruction-mapping").getAsJsonObject().entrySet().isEmpty());
        assertFalse(provenance.get("expression-mapping").getAsJsonObject().entrySet().isEmpty());
        assertFalse(provenance.get("condition-addresses").getAsJsonObject().entrySet().isEmpty());
        assertTrue(provenance.has("reaching-definitions"));
        assertTrue(provenance.has("lval-defuses"));
        assertTrue(provenance.has("lval-defuses-high"));

        for (Map.Entry<String, JsonElement> entry : provenance.get("instruction-addresses").getAsJsonObject().entrySet()) {
            assertTrue(entry.getValue().getAsJsonArray().size() > 0);
        }

        assertTrue(main.get("symbols").getAsJsonObject().has("count"));
        assertEquals("count := 4", main.get("annotations").getAsJsonObject().get("0x1000").getAsString());

        JsonObject span = main.get("spans").getAsJsonObject().entrySet().iterator().next().getValue().getAsJsonObject();
        assertEquals("0x1000", span.get("address").getAsString());
        assertEquals("0400a0e3", span.get("bytes").getAsString());
    }
}
