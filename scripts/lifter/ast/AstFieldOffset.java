/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstFieldOffset extends AstOffset {
    private final String fieldName;
    private final int compKey;
    private final AstOffset offset;

    public AstFieldOffset(String fieldName, int compKey, AstOffset offset) {
        super("field-offset");
        this.fieldName = fieldName;
        this.compKey = compKey;
        this.offset = offset;
    }

    public String getFieldName() {
        return fieldName;
    }

    public int getCompKey() {
        return compKey;
    }

    public AstOffset getOffset() {
        return offset;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFieldOffset(this);
    }
}
