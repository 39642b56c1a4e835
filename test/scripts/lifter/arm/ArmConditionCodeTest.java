/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import ast.AstInterface;

public class ArmConditionCodeTest {
    @Test
    public void testFromTag() {
        assertEquals(ArmConditionCode.AL, ArmConditionCode.fromTag("NONE"));
        assertEquals(ArmConditionCode.AL, ArmConditionCode.fromTag(""));
        assertEquals(ArmConditionCode.CS, ArmConditionCode.fromTag("HS"));
        assertEquals(ArmConditionCode.CC, ArmConditionCode.fromTag("lo"));
        assertEquals(ArmConditionCode.GT, ArmConditionCode.fromTag("GT"));
        assertThrows(ArmDecodeException.class, () -> ArmConditionCode.fromTag("XX"));
    }

    @Test
    public void testLowLevelTest() {
        AstInterface astree = new AstInterface();
        assertEquals("Z == 1", ArmConditionCode.EQ.lowLevelTest(astree).toString());
        assertEquals("C == 0", ArmConditionCode.CC.lowLevelTest(astree).toString());
        assertEquals("N != V", ArmConditionCode.LT.lowLevelTest(astree).toString());
        assertEquals("(Z == 0) && (N == V)", ArmConditionCode.GT.lowLevelTest(astree).toString());
        assertTrue(ArmConditionCode.AL.isUnconditional());
    }
}
