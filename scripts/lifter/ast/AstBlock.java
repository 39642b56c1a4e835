/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;

public class AstBlock extends AstStmt {
    private final List<AstStmt> stmts;

    public AstBlock(int stmtId, int locationId, List<AstStmt> stmts) {
        super("block", stmtId, locationId);
        this.stmts = List.copyOf(stmts);
    }

    public List<AstStmt> getStmts() {
        return stmts;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
