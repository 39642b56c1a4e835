/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.math.BigInteger;

// An integer constant known to be the address of a global; the address
// expression is how that global is referenced (usually its variable).
public class AstGlobalAddressConstant extends AstExpr {
    private final BigInteger value;
    private final AstExpr addressExpr;

    public AstGlobalAddressConstant(int exprId, BigInteger value, AstExpr addressExpr) {
        super("global-address", exprId);
        this.value = value;
        this.addressExpr = addressExpr;
    }

    public BigInteger getValue() {
        return value;
    }

    public AstExpr getAddressExpr() {
        return addressExpr;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGlobalAddress(this);
    }
}
