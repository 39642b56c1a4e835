/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstExpr;
import ast.AstInterface;
import ast.AstTypInt;

// Low-level updates of the N, Z, C and V flags. Flags are not program
// variables, so these assignments have no high-level counterpart.
public final class FlagSemantics {
    private FlagSemantics() {
    }

    private static AstExpr unsigned(AstInterface astree, AstExpr expr) {
        AstTypInt uint = astree.mkUnsignedIntType();
        return astree.mkCastExpr(uint, expr);
    }

    private static AstExpr isNegative(AstInterface astree, AstExpr expr) {
        return astree.mkBinaryOp("lt", expr, astree.mkIntegerConstant(0));
    }

    // N := result <s 0; Z := result == 0
    public static void negativeZero(AstEmitter emitter, AstExpr result) {
        AstInterface astree = emitter.getAstree();
        emitter.lowLevelAssign(astree.mkVariableLval("N"), isNegative(astree, result));
        emitter.lowLevelAssign(
            astree.mkVariableLval("Z"),
            astree.mkBinaryOp("eq", result, astree.mkIntegerConstant(0)));
    }

    // Flags of op1 - op2, as set by CMP and SUBS.
    public static void subtraction(AstEmitter emitter, AstExpr op1, AstExpr op2, AstExpr difference) {
        AstInterface astree = emitter.getAstree();
        negativeZero(emitter, difference);
        emitter.lowLevelAssign(
            astree.mkVariableLval("C"),
            astree.mkBinaryOp("ge", unsigned(astree, op1), unsigned(astree, op2)));
        AstExpr overflow = astree.mkBinaryOp(
            "band",
            astree.mkBinaryOp("bxor", op1, op2),
            astree.mkBinaryOp("bxor", op1, difference));
        emitter.lowLevelAssign(astree.mkVariableLval("V"), isNegative(astree, overflow));
    }

    // Flags of op1 + op2, as set by ADDS.
    public static void addition(AstEmitter emitter, AstExpr op1, AstExpr op2, AstExpr sum) {
        AstInterface astree = emitter.getAstree();
        negativeZero(emitter, sum);
        emitter.lowLevelAssign(
            astree.mkVariableLval("C"),
            astree.mkBinaryOp("lt", unsigned(astree, sum), unsigned(astree, op1)));
        AstExpr overflow = astree.mkBinaryOp(
            "band",
            astree.mkUnaryOp("bnot", astree.mkBinaryOp("bxor", op1, op2)),
            astree.mkBinaryOp("bxor", op1, sum));
        emitter.lowLevelAssign(astree.mkVariableLval("V"), isNegative(astree, overflow));
    }
}
