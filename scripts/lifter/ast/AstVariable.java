/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstVariable extends AstLHost {
    private final AstVarInfo varInfo;

    public AstVariable(AstVarInfo varInfo) {
        super("var");
        this.varInfo = varInfo;
    }

    public AstVarInfo getVarInfo() {
        return varInfo;
    }

    public String getName() {
        return varInfo.getName();
    }

    @Override
    public boolean isVariable() {
        return true;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
