/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import domain.FactBundle;
import domain.InstructionRecord;

import java.util.List;

public class ArmOpcodeRegistryTest extends BaseOpcodeTest {
    ArmOpcodeRegistry registry = ArmOpcodeRegistry.createDefault();

    @Test
    public void testEveryMnemonicIsRegistered() {
        for (ArmMnemonic mnemonic : ArmMnemonic.values()) {
            assertTrue(registry.isRegistered(mnemonic.getTag()), mnemonic.getTag());
        }
        assertEquals(ArmMnemonic.values().length, registry.getRegisteredTags().size());
    }

    @Test
    public void testSampleRecordsMatchTheirArity() {
        for (ArmMnemonic mnemonic : ArmMnemonic.values()) {
            InstructionRecord record = sampleRecord(mnemonic);
            assertEquals(mnemonic.getTagCount(), record.getTags().size(), mnemonic.getTag());
            assertEquals(mnemonic.getArgCount(), record.getArgs().size(), mnemonic.getTag());

            ArmOpcode opcode = registry.construct(operands, record);
            assertEquals(mnemonic.getTag(), opcode.getMnemonic());
        }
    }

    @Test
    public void testArityViolationsNameTheOpcode() {
        for (ArmMnemonic mnemonic : ArmMnemonic.values()) {
            InstructionRecord record = sampleRecord(mnemonic);
            String name = registry.construct(operands, record).getClass().getSimpleName();

            ArmDecodeException extraTag = assertThrows(
                ArmDecodeException.class, () -> registry.construct(operands, withExtraTag(record)));
            assertTrue(extraTag.getMessage().startsWith(name), extraTag.getMessage());

            ArmDecodeException extraArg = assertThrows(
                ArmDecodeException.class, () -> registry.construct(operands, withExtraArg(record)));
            assertTrue(extraArg.getMessage().contains("found"), extraArg.getMessage());
        }
    }

    @Test
    public void testUnknownMnemonic() {
        ArmDecodeException e = assertThrows(
            ArmDecodeException.class, () -> registry.construct(operands, record("VMUL", 1, 2, 3)));
        assertTrue(e.getMessage().contains("VMUL"));
    }

    @Test
    public void testDuplicateRegistration() {
        ArmOpcodeRegistry custom = new ArmOpcodeRegistry();
        custom.register("NOP", ArmMnemonic.NOP.getConstructor());
        assertThrows(IllegalStateException.class,
            () -> custom.register("NOP", ArmMnemonic.NOP.getConstructor()));
    }

    // Handlers that depend on analysis facts degrade to the error annotation
    // and emit nothing when the facts are marked invalid.
    @Test
    public void testInvalidFactsDegrade() {
        FactBundle invalid = FactBundle.invalid();
        for (ArmMnemonic mnemonic : ArmMnemonic.values()) {
            if (mnemonic == ArmMnemonic.NOP) {
                continue;
            }
            ArmOpcode opcode = registry.construct(operands, sampleRecord(mnemonic));
            assertEquals(ArmOpcode.ERROR_VALUE, opcode.annotation(invalid), mnemonic.getTag());

            InstructionPair pair = assertDoesNotThrow(
                () -> opcode.liftToAst(context, IADDR, BYTES, invalid), mnemonic.getTag());
            assertTrue(pair.getHighLevel().isEmpty(), mnemonic.getTag());
            assertTrue(pair.getLowLevel().isEmpty(), mnemonic.getTag());
        }
        assertTrue(astree.getSpanMap().isEmpty());
    }

    @Test
    public void testConditionCodeFromTag() {
        ArmOpcode opcode = registry.construct(operands, record(List.of("B", "NE"), OP_ABS));
        assertEquals(ArmConditionCode.NE, opcode.getConditionCode());
        assertEquals("BNE 0x2000", opcode.toString());
    }
}
