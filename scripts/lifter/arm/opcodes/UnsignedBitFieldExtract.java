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
 * UBFX: extracts adjacent bits from a register and zero-extends them.
 */
public class UnsignedBitFieldExtract extends ArmBitFieldExtract {
    public UnsignedBitFieldExtract(OperandTable operandTable, InstructionRecord record) {
        super(operandTable, record, "UnsignedBitFieldExtract");
    }

    // (Rn >> lsb) & ((1 << width) - 1)
    @Override
    protected AstExpr extract(AstInterface astree, AstExpr rn, int lsb, int width) {
        AstExpr shifted = astree.mkBinaryOp(
            "shiftrt", astree.mkCastExpr(astree.mkUnsignedIntType(), rn), astree.mkIntegerConstant(lsb));
        long mask = (1L << width) - 1;
        return astree.mkBinaryOp("band", shifted, astree.mkIntegerConstant(mask));
    }
}
