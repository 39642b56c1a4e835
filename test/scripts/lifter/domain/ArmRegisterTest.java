/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

public class ArmRegisterTest {
    @Test
    public void testAliases() {
        assertEquals(ArmRegister.SP, ArmRegister.fromName("R13"));
        assertEquals(ArmRegister.LR, ArmRegister.fromName("lr"));
        assertEquals(ArmRegister.PC, ArmRegister.fromName("r15"));
        assertEquals(ArmRegister.R7, ArmRegister.fromName(" r7 "));
    }

    @Test
    public void testNumbers() {
        assertEquals(13, ArmRegister.SP.getNumber());
        assertEquals(ArmRegister.R3, ArmRegister.fromNumber(3));
        assertThrows(IllegalArgumentException.class, () -> ArmRegister.fromNumber(16));
        assertThrows(IllegalArgumentException.class, () -> ArmRegister.fromName("X0"));
    }

    @Test
    public void testParseAddress() {
        assertEquals(0x1000L, DecodedInstruction.parseAddress("0x1000"));
        assertEquals(4096L, DecodedInstruction.parseAddress("4096"));
    }
}
