/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstGoto extends AstStmt {
    private final String destination;

    public AstGoto(int stmtId, int locationId, String destination) {
        super("goto", stmtId, locationId);
        this.destination = destination;
    }

    public String getDestination() {
        return destination;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGoto(this);
    }
}
