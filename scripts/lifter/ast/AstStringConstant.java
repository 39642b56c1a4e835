/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstStringConstant extends AstExpr {
    private final String cstr;
    private final AstExpr addressExpr;
    private final String stringAddress;

    public AstStringConstant(int exprId, String cstr, AstExpr addressExpr, String stringAddress) {
        super("string-constant", exprId);
        this.cstr = cstr;
        this.addressExpr = addressExpr;
        this.stringAddress = stringAddress;
    }

    public String getString() {
        return cstr;
    }

    // Both of the following may be null.
    public AstExpr getAddressExpr() {
        return addressExpr;
    }

    public String getStringAddress() {
        return stringAddress;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStringConstant(this);
    }
}
