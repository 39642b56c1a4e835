/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstIndexOffset extends AstOffset {
    private final AstExpr indexExpr;
    private final AstOffset offset;

    public AstIndexOffset(AstExpr indexExpr, AstOffset offset) {
        super("index-offset");
        this.indexExpr = indexExpr;
        this.offset = offset;
    }

    public AstExpr getIndexExpr() {
        return indexExpr;
    }

    public AstOffset getOffset() {
        return offset;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIndexOffset(this);
    }
}
