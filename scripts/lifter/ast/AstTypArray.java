/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstTypArray extends AstTyp {
    private final AstTyp targetType;
    private final AstExpr sizeExpr;

    public AstTypArray(AstTyp targetType, AstExpr sizeExpr) {
        super("array");
        this.targetType = targetType;
        this.sizeExpr = sizeExpr;
    }

    public AstTyp getTargetType() {
        return targetType;
    }

    public boolean hasSizeExpr() {
        return sizeExpr != null;
    }

    public AstExpr getSizeExpr() {
        return sizeExpr;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArrayType(this);
    }
}
