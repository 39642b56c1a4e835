/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstCastExpr extends AstExpr {
    private final AstTyp castType;
    private final AstExpr castExpr;

    public AstCastExpr(int exprId, AstTyp castType, AstExpr castExpr) {
        super("cast-expr", exprId);
        this.castType = castType;
        this.castExpr = castExpr;
    }

    public AstTyp getCastType() {
        return castType;
    }

    public AstExpr getCastExpr() {
        return castExpr;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCastExpr(this);
    }
}
