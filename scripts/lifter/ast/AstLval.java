/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstLval extends AstNode {
    private final int lvalId;
    private final AstLHost lhost;
    private final AstOffset offset;

    public AstLval(int lvalId, AstLHost lhost, AstOffset offset) {
        super("lval");
        this.lvalId = lvalId;
        this.lhost = lhost;
        this.offset = offset;
    }

    public int getLvalId() {
        return lvalId;
    }

    public AstLHost getLhost() {
        return lhost;
    }

    public AstOffset getOffset() {
        return offset;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLval(this);
    }
}
