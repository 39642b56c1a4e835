/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstFunArg extends AstNode {
    private final String argName;
    private final AstTyp argType;

    public AstFunArg(String argName, AstTyp argType) {
        super("funarg");
        this.argName = argName;
        this.argType = argType;
    }

    public String getArgName() {
        return argName;
    }

    public AstTyp getArgType() {
        return argType;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunArg(this);
    }
}
