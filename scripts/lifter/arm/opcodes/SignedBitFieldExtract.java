/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm.opcodes;

import ast.AstExpr;
import ast.AstInterface;

import domain.InstructionRecord;
import domain.OperandTable;

/**
 * SBFX: extracts adjacent bits from a register and sign-extends them.
 */
public class SignedBitFieldExtract extends ArmBitFieldExtract {
    public SignedBitFieldExtract(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record, "SignedBitFieldExtract");
    }

    // ((int) (Rn << (32 - lsb - width))) >> (32 - width)
    @Override
    protected AstExpr extract(AstInterface astree, AstExpr rn, int lsb, int width) {
        AstExpr shifted = astree.mkBinaryOp(
            "shiftlt", rn, astree.mkIntegerConstant(32 - lsb - width));
        return astree.mkBinaryOp(
            "shiftrt",
            astree.mkCastExpr(astree.mkSignedIntType(), shifted),
            astree.mkIntegerConstant(32 - width));
    }
}
