/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;

public class AstCall extends AstInstruction {
    private final AstLval lhs;
    private final AstExpr target;
    private final List<AstExpr> arguments;

    public AstCall(
            int instrId, int locationId, AstLval lhs, AstExpr target,
            List<AstExpr> arguments, List<String> annotations) {
        super("call", instrId, locationId, annotations);
        this.lhs = lhs;
        this.target = target;
        this.arguments = List.copyOf(arguments);
    }

    public boolean hasLhs() {
        return lhs != null;
    }

    // May be null for calls whose return value is not used.
    public AstLval getLhs() {
        return lhs;
    }

    public AstExpr getTarget() {
        return target;
    }

    public List<AstExpr> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
