/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import domain.InstructionRecord;
import domain.OperandTable;

@FunctionalInterface
public interface ArmOpcodeConstructor {
    ArmOpcode construct(OperandTable operandTable, InstructionRecord record);
}
