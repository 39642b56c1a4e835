/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstTypPtr extends AstTyp {
    private final AstTyp targetType;

    public AstTypPtr(AstTyp targetType) {
        super("ptr");
        this.targetType = targetType;
    }

    public AstTyp getTargetType() {
        return targetType;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPointerType(this);
    }
}
