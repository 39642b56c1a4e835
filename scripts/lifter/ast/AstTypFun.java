/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstTypFun extends AstTyp {
    private final AstTyp returnType;
    private final AstFunArgs argTypes;
    private final boolean varArgs;

    public AstTypFun(AstTyp returnType, AstFunArgs argTypes, boolean varArgs) {
        super("fun");
        this.returnType = returnType;
        this.argTypes = argTypes;
        this.varArgs = varArgs;
    }

    public AstTyp getReturnType() {
        return returnType;
    }

    // Null when the prototype is unknown.
    public AstFunArgs getArgTypes() {
        return argTypes;
    }

    public boolean isVarArgs() {
        return varArgs;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunType(this);
    }
}
