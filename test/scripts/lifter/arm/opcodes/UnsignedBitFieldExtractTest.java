/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import static org.mockito.Mockito.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import arm.ArmOpcode;
import arm.BaseOpcodeTest;
import arm.ExpressionResolver;
import arm.InstructionPair;
import arm.LiftContext;

import domain.FactBundle;
import domain.XExpr;
import domain.XVariable;

import java.util.List;

public class UnsignedBitFieldExtractTest extends BaseOpcodeTest {
    private UnsignedBitFieldExtract ubfx;

    @BeforeEach
    public void setUp() {
        ubfx = new UnsignedBitFieldExtract(operands, record("UBFX", OP_R0, OP_R1, OP_IMM_4, OP_IMM_8));
    }

    private static FactBundle facts() {
        XExpr field = XExpr.op("band", XExpr.op("shiftrt", XExpr.variable("flags"), XExpr.constant(4)), XExpr.constant(255));
        return FactBundle.builder()
            .vars(new XVariable("mode"))
            .xprs(field, field)
            .reachingDefinitions(rdef("R1", "0xff8"))
            .defUses(uses("R0", "0x1004"))
            .build();
    }

    @Test
    public void testLift() {
        InstructionPair pair = ubfx.liftToAst(context, IADDR, BYTES, facts());

        assertEquals(4, ubfx.getLsb());
        assertEquals(8, ubfx.getWidth());
        assertEquals(List.of("R0 = ((unsigned int)R1 >> 4) & 255"), render(pair.getLowLevel()));
        assertEquals(List.of("mode = (flags >> 4) & 255"), render(pair.getHighLevel()));
        assertEquals("mode := ((flags >> 4) & 255)", ubfx.annotation(facts()));
    }

    @Test
    public void testSimplifiedResultDrivesHighLevel() {
        XExpr raw = XExpr.op("band", XExpr.op("shiftrt", XExpr.variable("flags"), XExpr.constant(4)), XExpr.constant(255));
        XExpr simplified = XExpr.variable("mode_bits");
        FactBundle bundle = FactBundle.builder()
            .vars(new XVariable("mode"))
            .xprs(raw, simplified)
            .reachingDefinitions(rdef("R1", "0xff8"))
            .defUses(uses("R0", "0x1004"))
            .build();

        InstructionPair pair = ubfx.liftToAst(context, IADDR, BYTES, bundle);

        assertEquals(List.of("mode = mode_bits"), render(pair.getHighLevel()));
        assertEquals(List.of("R0 = ((unsigned int)R1 >> 4) & 255"), render(pair.getLowLevel()));
        assertEquals("mode := ((flags >> 4) & 255) (= mode_bits)", ubfx.annotation(bundle));
    }

    @Test
    public void testMissingSimplifiedResultIsAnError() {
        FactBundle bundle = FactBundle.builder()
            .vars(new XVariable("mode"))
            .xprs(XExpr.variable("flags"))
            .build();

        assertEquals(ArmOpcode.ERROR_VALUE, ubfx.annotation(bundle));
        assertTrue(ubfx.liftToAst(context, IADDR, BYTES, bundle).getHighLevel().isEmpty());
    }

    @Test
    public void testMultipleLvalsAreRejected() throws Exception {
        ExpressionResolver resolver = mock(ExpressionResolver.class);
        when(resolver.toLvals(any(), any())).thenReturn(
            List.of(astree.mkVariableLval("lo"), astree.mkVariableLval("hi")));
        when(resolver.toExprs(any(), any())).thenReturn(List.of(astree.mkIntegerConstant(0)));

        LiftContext mocked = new LiftContext(astree, resolver);
        IllegalStateException e = assertThrows(
            IllegalStateException.class, () -> ubfx.liftToAst(mocked, IADDR, BYTES, facts()));
        assertTrue(e.getMessage().startsWith("UnsignedBitFieldExtract at address " + IADDR));
    }
}
