/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.math.BigInteger;

public class AstIntegerConstant extends AstExpr {
    private final BigInteger value;

    public AstIntegerConstant(int exprId, BigInteger value) {
        super("integer-constant", exprId);
        this.value = value;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public boolean isIntegerConstant() {
        return true;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIntegerConstant(this);
    }
}
