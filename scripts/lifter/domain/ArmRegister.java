/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.util.Locale;

public enum ArmRegister {
    R0(0), R1(1), R2(2), R3(3), R4(4), R5(5), R6(6), R7(7),
    R8(8), R9(9), R10(10), R11(11), R12(12),
    SP(13), LR(14), PC(15);

    private final int number;

    ArmRegister(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public static ArmRegister fromNumber(int number) {
        for (ArmRegister reg : values()) {
            if (reg.number == number) {
                return reg;
            }
        }
        throw new IllegalArgumentException("Not an ARM core register: " + number);
    }

    // Accepts both the architectural names (R13) and the aliases (SP), in
    // any case.
    public static ArmRegister fromName(String name) {
        String upper = name.trim().toUpperCase(Locale.ROOT);
        switch (upper) {
            case "R13": return SP;
            case "R14": return LR;
            case "R15": return PC;
            default:
                try {
                    return valueOf(upper);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Not an ARM core register: " + name, e);
                }
        }
    }
};
