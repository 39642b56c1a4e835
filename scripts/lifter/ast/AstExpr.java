/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public abstract class AstExpr extends AstNode {
    private final int exprId;

    protected AstExpr(String tag, int exprId) {
        super(tag);
        this.exprId = exprId;
    }

    public int getExprId() {
        return exprId;
    }

    public boolean isIntegerConstant() {
        return false;
    }
}
