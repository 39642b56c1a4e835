/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public abstract class AstStmt extends AstNode {
    private final int stmtId;
    private final int locationId;

    protected AstStmt(String tag, int stmtId, int locationId) {
        super(tag);
        this.stmtId = stmtId;
        this.locationId = locationId;
    }

    public int getStmtId() {
        return stmtId;
    }

    public int getLocationId() {
        return locationId;
    }
}
