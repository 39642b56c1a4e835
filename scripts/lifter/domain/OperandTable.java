/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

// Operands of one function, addressed by the indices that decoded
// instruction records carry in their args.
public class OperandTable {
    private final Map<Integer, ArmOperand> operands = new TreeMap<>();

    public void put(int index, ArmOperand operand) {
        operands.put(index, operand);
    }

    public ArmOperand get(int index) {
        ArmOperand operand = operands.get(index);
        if (operand == null) {
            throw new IllegalArgumentException("No operand at index " + index);
        }
        return operand;
    }

    public boolean contains(int index) {
        return operands.containsKey(index);
    }

    public int size() {
        return operands.size();
    }

    public Map<Integer, ArmOperand> getOperands() {
        return Collections.unmodifiableMap(operands);
    }
}
