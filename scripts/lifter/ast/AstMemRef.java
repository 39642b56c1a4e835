/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstMemRef extends AstLHost {
    private final AstExpr memExp;

    public AstMemRef(AstExpr memExp) {
        super("memref");
        this.memExp = memExp;
    }

    public AstExpr getMemExp() {
        return memExp;
    }

    @Override
    public boolean isMemRef() {
        return true;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMemRef(this);
    }
}
