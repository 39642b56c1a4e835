/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;

public class AstFunArgs extends AstNode {
    private final List<AstFunArg> funArgs;

    public AstFunArgs(List<AstFunArg> funArgs) {
        super("funargs");
        this.funArgs = List.copyOf(funArgs);
    }

    public List<AstFunArg> getFunArgs() {
        return funArgs;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunArgs(this);
    }
}
