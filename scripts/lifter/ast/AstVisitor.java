/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public interface AstVisitor<R> {
    R visitReturn(AstReturn stmt);
    R visitBlock(AstBlock stmt);
    R visitInstrSequence(AstInstrSequence stmt);
    R visitBranch(AstBranch stmt);
    R visitGoto(AstGoto stmt);

    R visitAssign(AstAssign instr);
    R visitCall(AstCall instr);
    R visitNop(AstNopInstruction instr);

    R visitLval(AstLval lval);
    R visitVariable(AstVariable variable);
    R visitMemRef(AstMemRef memref);
    R visitNoOffset(AstNoOffset offset);
    R visitFieldOffset(AstFieldOffset offset);
    R visitIndexOffset(AstIndexOffset offset);

    R visitIntegerConstant(AstIntegerConstant expr);
    R visitGlobalAddress(AstGlobalAddressConstant expr);
    R visitStringConstant(AstStringConstant expr);
    R visitLvalExpr(AstLvalExpr expr);
    R visitSubstitutedExpr(AstSubstitutedExpr expr);
    R visitCastExpr(AstCastExpr expr);
    R visitUnaryOp(AstUnaryOp expr);
    R visitBinaryOp(AstBinaryOp expr);
    R visitQuestion(AstQuestion expr);
    R visitAddressOf(AstAddressOf expr);

    R visitVoidType(AstTypVoid typ);
    R visitIntType(AstTypInt typ);
    R visitFloatType(AstTypFloat typ);
    R visitPointerType(AstTypPtr typ);
    R visitArrayType(AstTypArray typ);
    R visitFunType(AstTypFun typ);
    R visitFunArgs(AstFunArgs funargs);
    R visitFunArg(AstFunArg funarg);
    R visitNamedType(AstTypNamed typ);
    R visitCompType(AstTypComp typ);

    R visitVarInfo(AstVarInfo vinfo);
    R visitFieldInfo(AstFieldInfo finfo);
    R visitCompInfo(AstCompInfo cinfo);
}
