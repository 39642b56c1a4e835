/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

// An expression that stands in for the value of an lval as assigned by the
// instruction with construction id assignId.
public class AstSubstitutedExpr extends AstExpr {
    private final AstLval lval;
    private final int assignId;
    private final AstExpr substitutedExpr;

    public AstSubstitutedExpr(int exprId, AstLval lval, int assignId, AstExpr substitutedExpr) {
        super("substituted-expr", exprId);
        this.lval = lval;
        this.assignId = assignId;
        this.substitutedExpr = substitutedExpr;
    }

    public AstLval getLval() {
        return lval;
    }

    public int getAssignId() {
        return assignId;
    }

    public AstExpr getSubstitutedExpr() {
        return substitutedExpr;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSubstitutedExpr(this);
    }
}
