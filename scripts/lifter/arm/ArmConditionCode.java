/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstExpr;
import ast.AstInterface;

import java.util.Locale;

// Condition field of a conditionally executed instruction, with the flag test
// it stands for.
public enum ArmConditionCode {
    EQ, NE, CS, CC, MI, PL, VS, VC, HI, LS, GE, LT, GT, LE, AL;

    public static ArmConditionCode fromTag(String tag) {
        String upper = tag.toUpperCase(Locale.ROOT);
        switch (upper) {
            case "":
            case "NONE":
                return AL;
            case "HS":
                return CS;
            case "LO":
                return CC;
            default:
                try {
                    return valueOf(upper);
                } catch (IllegalArgumentException e) {
                    throw new ArmDecodeException("Unknown condition code: " + tag, e);
                }
        }
    }

    public boolean isUnconditional() {
        return this == AL;
    }

    private static AstExpr flag(AstInterface astree, String name) {
        return astree.mkVariableExpr(name);
    }

    private static AstExpr isSet(AstInterface astree, String name) {
        return astree.mkBinaryOp("eq", flag(astree, name), astree.mkIntegerConstant(1));
    }

    private static AstExpr isClear(AstInterface astree, String name) {
        return astree.mkBinaryOp("eq", flag(astree, name), astree.mkIntegerConstant(0));
    }

    // The condition over the N, Z, C and V flags under which an instruction
    // with this condition code executes.
    public AstExpr lowLevelTest(AstInterface astree) {
        switch (this) {
            case EQ: return isSet(astree, "Z");
            case NE: return isClear(astree, "Z");
            case CS: return isSet(astree, "C");
            case CC: return isClear(astree, "C");
            case MI: return isSet(astree, "N");
            case PL: return isClear(astree, "N");
            case VS: return isSet(astree, "V");
            case VC: return isClear(astree, "V");
            case HI:
                return astree.mkBinaryOp("land", isSet(astree, "C"), isClear(astree, "Z"));
            case LS:
                return astree.mkBinaryOp("lor", isClear(astree, "C"), isSet(astree, "Z"));
            case GE:
                return astree.mkBinaryOp("eq", flag(astree, "N"), flag(astree, "V"));
            case LT:
                return astree.mkBinaryOp("ne", flag(astree, "N"), flag(astree, "V"));
            case GT:
                return astree.mkBinaryOp(
                    "land",
                    isClear(astree, "Z"),
                    astree.mkBinaryOp("eq", flag(astree, "N"), flag(astree, "V")));
            case LE:
                return astree.mkBinaryOp(
                    "lor",
                    isSet(astree, "Z"),
                    astree.mkBinaryOp("ne", flag(astree, "N"), flag(astree, "V")));
            default:
                return astree.mkIntegerConstant(1);
        }
    }
}
