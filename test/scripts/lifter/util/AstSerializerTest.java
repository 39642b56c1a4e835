/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import ast.AstAssign;
import ast.AstExpr;
import ast.AstInstrSequence;
import ast.AstInterface;
import ast.AstLval;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;

public class AstSerializerTest {
    AstInterface astree;
    AstSerializer serializer;

    @BeforeEach
    public void setUp() {
        astree = new AstInterface();
        serializer = new AstSerializer();
    }

    private JsonObject record(int id) {
        return serializer.records().get(id - 1);
    }

    @Test
    public void testStructurallyEqualExpressionsShareIdentity() {
        AstExpr first = astree.mkBinaryOp("plus", astree.mkVariableExpr("R0"), astree.mkIntegerConstant(4));
        AstExpr second = astree.mkBinaryOp("plus", astree.mkVariableExpr("R0"), astree.mkIntegerConstant(4));
        assertNotEquals(first.getExprId(), second.getExprId());

        int a = serializer.index(first);
        int size = serializer.getTable().size();
        int b = serializer.index(second);

        assertEquals(a, b);
        assertEquals(size, serializer.getTable().size());
    }

    @Test
    public void testInstructionsKeepTheirOwnIdentity() {
        AstLval lhs = astree.mkVariableLval("R0");
        AstExpr rhs = astree.mkIntegerConstant(1);
        AstAssign first = astree.mkAssign(lhs, rhs, "0x1000", "0100a0e3", List.of());
        AstAssign second = astree.mkAssign(lhs, rhs, "0x1004", "0100a0e3", List.of());

        int a = serializer.index(first);
        int b = serializer.index(second);

        assertNotEquals(a, b);
        // the operands are shared
        assertEquals(record(a).get("args").getAsJsonArray().get(1), record(b).get("args").getAsJsonArray().get(1));
        assertEquals(first.getInstrId(), record(a).get("args").getAsJsonArray().get(0).getAsInt());
    }

    @Test
    public void testChildrenPrecedeParents() {
        AstAssign assign = astree.mkAssign(
            astree.mkVariableLval("R0"), astree.mkIntegerConstant(7), "0x1000", "0700a0e3", List.of());
        AstInstrSequence seq = astree.mkInstrSequence(List.of(assign));

        int id = serializer.index(seq);

        assertEquals(serializer.getTable().size(), id);
        for (JsonObject record : serializer.records()) {
            JsonArray args = record.get("args").getAsJsonArray();
            // instructions and statements lead with their construction id
            String tag = record.get("tag").getAsString();
            int first = tag.equals("assign") || tag.equals("instrs") ? 1 : 0;
            for (int i = first; i < args.size(); i++) {
                assertTrue(args.get(i).getAsLong() < record.get("id").getAsLong());
            }
        }
        assertEquals("instrs", record(id).get("tag").getAsString());
    }

    @Test
    public void testPayloadFields() {
        int constant = serializer.index(astree.mkIntegerConstant(42));
        int variable = serializer.index(astree.mkVariableLval("count").getLhost());
        int binop = serializer.index(astree.mkBinaryOp("minus", astree.mkVariableExpr("SP"), astree.mkIntegerConstant(8)));
        int nop = serializer.index(astree.mkNopInstruction("BX", "0x1000", "1eff2fe1", List.of()));
        int jump = serializer.index(astree.mkGoto("0x2000"));

        assertEquals("42", record(constant).get("value").getAsString());
        assertEquals("count", record(variable).get("name").getAsString());
        assertEquals("minus", record(binop).get("op").getAsString());
        assertEquals("BX", record(nop).get("descr").getAsString());
        assertEquals("0x2000", record(jump).get("destination").getAsString());
    }

    @Test
    public void testStringConstantsWithCommasKeepTheirPayload() {
        int joined = serializer.index(astree.mkStringConstant("a,b", null, null));
        int addressed = serializer.index(astree.mkStringConstant("a", null, "b"));

        assertNotEquals(joined, addressed);
        assertEquals(2, serializer.records().size());
        assertEquals("a,b", record(joined).get("cstr").getAsString());
        assertEquals("a", record(addressed).get("cstr").getAsString());
        assertEquals("b", record(addressed).get("va").getAsString());
    }

    @Test
    public void testConstructionIdsMapToIdentities() {
        AstLval lhs = astree.mkVariableLval("R0");
        AstExpr rhs = astree.mkIntegerConstant(1);
        AstAssign assign = astree.mkAssign(lhs, rhs, "0x1000", "0100a0e3", List.of());

        int id = serializer.index(assign);

        assertEquals(id, serializer.getInstructionIndices().get(assign.getInstrId()));
        assertTrue(serializer.getExpressionIndices().containsKey(rhs.getExprId()));
        assertTrue(serializer.getLvalIndices().containsKey(lhs.getLvalId()));
    }
}
