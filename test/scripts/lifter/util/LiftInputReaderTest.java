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
import com.google.gson.JsonParser;

import domain.ArmOperand;
import domain.ArmRegister;
import domain.DecodedFunction;
import domain.DecodedInstruction;
import domain.FactBundle;
import domain.IndexMode;
import domain.XExpr;
import domain.XVariable;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class LiftInputReaderTest {
    LiftInputReader reader = new LiftInputReader();
    List<DecodedFunction> functions;

    @BeforeAll
    public void setUp() throws Exception {
        try (Reader input = new InputStreamReader(
                getClass().getResourceAsStream("/lift-input.json"), StandardCharsets.UTF_8)) {
            functions = reader.read(input);
        }
    }

    private static JsonObject json(String text) {
        return JsonParser.parseString(text).getAsJsonObject();
    }

    @Test
    public void testReadFunctions() {
        assertEquals(3, functions.size());

        DecodedFunction main = functions.get(0);
        assertEquals("main", main.getName());
        assertEquals("0x1000", main.getEntryAddress());
        assertEquals(4, main.getInstructions().size());

        DecodedInstruction mov = main.getInstructions().get(0);
        assertEquals("0x1000", mov.getAddress());
        assertEquals(0x1000, mov.getAddressValue());
        assertEquals("0400a0e3", mov.getBytes());
        assertEquals(List.of("MOV", "NONE"), mov.getRecord().getTags());
        assertEquals(List.of(0, 1, 5), mov.getRecord().getArgs());
        assertEquals(List.of(new XVariable("count")), mov.getFacts().getVars());
        assertEquals(List.of("0x1004"), mov.getFacts().getDefUses().get(0).getUseAddresses());
    }

    @Test
    public void testReadOperands() {
        DecodedFunction loadNext = functions.get(1);
        ArmOperand mem = loadNext.getOperands().get(2);

        assertTrue(mem.isIndirectRegister());
        assertEquals(ArmRegister.R1, mem.getRegister());
        assertEquals(4, mem.getOffset());
        assertEquals(IndexMode.POST_INDEX, mem.getIndexMode());
        assertEquals(0x2000, functions.get(0).getOperands().get(6).getValue());

        ArmOperand list = reader.readOperand(json(
            "{\"kind\": \"register-list\", \"registers\": [\"R4\", \"R2\"]}"));
        assertEquals(List.of(ArmRegister.R2, ArmRegister.R4), list.getRegisters());
    }

    @Test
    public void testReadFacts() {
        FactBundle cbz = functions.get(0).getInstructions().get(1).getFacts();
        assertTrue(cbz.hasBranchConditions());
        assertEquals(6, cbz.getXprs().size());
        assertEquals(
            XExpr.op("eq", XExpr.variable("count"), XExpr.constant(0)),
            cbz.getXprs().get(1));

        FactBundle bl = functions.get(0).getInstructions().get(2).getFacts();
        assertTrue(bl.isCall());
        assertEquals("process", bl.getCallTarget().getName());
        assertEquals(0x2000L, bl.getCallTarget().getAddress());
        assertEquals(1, bl.getArgumentCount());

        FactBundle ldr = functions.get(1).getInstructions().get(0).getFacts();
        XVariable global = ldr.getXprs().get(0).getVariable();
        assertTrue(global.isGlobal());
        assertEquals(0x3000L, global.getGlobalAddress());
        assertEquals(2, ldr.getReachingDefinitions().size());
        assertNull(ldr.getReachingDefinitions().get(1));
    }

    @Test
    public void testMissingFactsAreInvalid() {
        FactBundle bx = functions.get(1).getInstructions().get(1).getFacts();
        assertFalse(bx.isValid());
    }

    @Test
    public void testReadExpressions() {
        XExpr expr = reader.readExpr(json(
            "{\"op\": \"lnot\", \"args\": [{\"var\": {\"name\": \"flag\"}}]}"));
        assertEquals(XExpr.op("lnot", XExpr.variable("flag")), expr);

        XExpr big = reader.readExpr(json("{\"const\": \"4294967295\"}"));
        assertEquals(XExpr.constant(4294967295L), big);
    }

    @Test
    public void testMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> reader.read(new StringReader("{\"fns\": []}")));
        assertThrows(IllegalArgumentException.class, () -> reader.readOperand(json("{\"kind\": \"register\"}")));
        assertThrows(IllegalArgumentException.class, () -> reader.readOperand(json("{\"kind\": \"shifted\"}")));
        assertThrows(IllegalArgumentException.class, () -> reader.readExpr(json("{\"value\": 1}")));
    }
}
