/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstNoOffset extends AstOffset {
    public AstNoOffset() {
        super("no-offset");
    }

    @Override
    public boolean isNoOffset() {
        return true;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNoOffset(this);
    }
}
