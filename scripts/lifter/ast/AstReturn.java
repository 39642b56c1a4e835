/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstReturn extends AstStmt {
    private final AstExpr expr;

    public AstReturn(int stmtId, int locationId, AstExpr expr) {
        super("return", stmtId, locationId);
        this.expr = expr;
    }

    public boolean hasReturnValue() {
        return expr != null;
    }

    public AstExpr getExpr() {
        if (expr == null) {
            throw new IllegalStateException("Return statement has no return value");
        }
        return expr;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
