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

import arm.BaseOpcodeTest;
import arm.ConditionPair;
import arm.ExpressionResolver;
import arm.LiftContext;

import ast.AstIntegerConstant;

import domain.FactBundle;
import domain.XExpr;

import java.math.BigInteger;
import java.util.List;

public class CompareBranchZeroTest extends BaseOpcodeTest {
    private static final XExpr TCOND = XExpr.op("eq", XExpr.variable("x"), XExpr.constant(0));
    private static final XExpr FCOND = XExpr.op("ne", XExpr.variable("x"), XExpr.constant(0));

    private CompareBranchZero cbz;

    @BeforeEach
    public void setUp() {
        cbz = new CompareBranchZero(operands, record(List.of("CBZ"), OP_R0, OP_ABS));
    }

    private static FactBundle conditionFacts() {
        return FactBundle.builder()
            .xprs(XExpr.variable("x"), TCOND, FCOND, TCOND, FCOND, XExpr.constant(0x2000))
            .reachingDefinitions(rdef("R0", "0xffc"))
            .branchConditions(true)
            .build();
    }

    @Test
    public void testTakenCondition() {
        ConditionPair pair = cbz.astConditionProv(context, IADDR, BYTES, conditionFacts(), false);

        assertEquals("x == 0", pair.getHighLevel().toString());
        assertEquals("R0 == 0", pair.getLowLevel().toString());
        assertEquals(
            pair.getLowLevel().getExprId(),
            astree.getProvenance().getExpressionMapping(pair.getHighLevel().getExprId()));
        assertEquals(List.of(IADDR), astree.getProvenance().getConditionAddresses(pair.getLowLevel().getExprId()));
    }

    @Test
    public void testFallThroughCondition() {
        ConditionPair pair = cbz.astConditionProv(context, IADDR, BYTES, conditionFacts(), true);

        assertEquals("x != 0", pair.getHighLevel().toString());
        assertEquals("R0 != 0", pair.getLowLevel().toString());
    }

    @Test
    public void testMissingConditionsYieldZero() {
        FactBundle facts = FactBundle.builder()
            .xprs(XExpr.variable("x"), TCOND)
            .branchConditions(true)
            .build();

        ConditionPair pair = cbz.astConditionProv(context, IADDR, BYTES, facts, false);

        assertSame(pair.getHighLevel(), pair.getLowLevel());
        assertTrue(pair.getLowLevel() instanceof AstIntegerConstant);
        assertEquals(BigInteger.ZERO, ((AstIntegerConstant) pair.getLowLevel()).getValue());
        assertTrue(cbz.ftConditions(facts).isEmpty());
    }

    @Test
    public void testUnconvertibleConditionFallsBackToLowLevel() throws Exception {
        ExpressionResolver resolver = mock(ExpressionResolver.class);
        when(resolver.toExprs(any(), any())).thenReturn(List.of());
        LiftContext mocked = new LiftContext(astree, resolver);

        ConditionPair pair = assertDoesNotThrow(
            () -> cbz.astConditionProv(mocked, IADDR, BYTES, conditionFacts(), false));

        assertSame(pair.getLowLevel(), pair.getHighLevel());
        assertEquals("R0 == 0", pair.getHighLevel().toString());
        verify(resolver).toExprs(astree, TCOND);
    }

    @Test
    public void testConditionsWithoutFlag() {
        FactBundle facts = FactBundle.builder()
            .xprs(XExpr.variable("x"), TCOND, FCOND, TCOND, FCOND, XExpr.constant(0x2000))
            .build();

        assertTrue(cbz.ftConditions(facts).isEmpty());
        assertEquals(List.of(FCOND, TCOND), cbz.ftConditions(conditionFacts()));
    }

    @Test
    public void testAnnotationAndTarget() {
        assertTrue(cbz.isConditional());
        assertEquals(0x2000, cbz.branchTarget().getValue());
        assertEquals("if (x == 0) goto 8192", cbz.annotation(conditionFacts()));
        assertTrue(cbz.liftToAst(context, IADDR, BYTES, conditionFacts()).isEmpty());
    }
}
