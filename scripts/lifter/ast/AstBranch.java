/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

// Two-way branch. The relative offset is the distance in bytes from the
// branch instruction to its taken target, kept so that downstream consumers
// can re-associate the statement with the original control flow.
public class AstBranch extends AstStmt {
    private final AstExpr condition;
    private final AstStmt ifStmt;
    private final AstStmt elseStmt;
    private final long relativeOffset;

    public AstBranch(
            int stmtId, int locationId, AstExpr condition,
            AstStmt ifStmt, AstStmt elseStmt, long relativeOffset) {
        super("if", stmtId, locationId);
        this.condition = condition;
        this.ifStmt = ifStmt;
        this.elseStmt = elseStmt;
        this.relativeOffset = relativeOffset;
    }

    public AstExpr getCondition() {
        return condition;
    }

    public AstStmt getIfStmt() {
        return ifStmt;
    }

    public AstStmt getElseStmt() {
        return elseStmt;
    }

    public long getRelativeOffset() {
        return relativeOffset;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }
}
