/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

public class XExprTest {
    @Test
    public void testRendering() {
        XExpr sum = XExpr.op("plus", XExpr.variable("R1"), XExpr.constant(4));
        assertEquals("(R1 + 4)", sum.toString());
        assertTrue(sum.isOperator());
        assertEquals("plus", sum.getOperator());
    }

    @Test
    public void testArity() {
        assertThrows(IllegalArgumentException.class, () -> XExpr.op("plus"));
        assertThrows(IllegalArgumentException.class,
            () -> XExpr.op("plus", XExpr.constant(1), XExpr.constant(2), XExpr.constant(3)));
    }

    @Test
    public void testFormAccessors() {
        XExpr constant = XExpr.constant(9);
        assertTrue(constant.isConstant());
        assertThrows(IllegalStateException.class, constant::getVariable);
        assertThrows(IllegalStateException.class, constant::getOperator);
        assertEquals(XExpr.constant(9), constant);
    }

    @Test
    public void testCallClassification() {
        assertTrue(FactBundle.builder().tags("a", "call").build().isCall());
        assertFalse(FactBundle.builder().tags("a").build().isCall());
        assertFalse(FactBundle.invalid().isValid());
    }
}
