/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

public class AstFieldInfo extends AstNode {
    private final String fieldName;
    private final AstTyp fieldType;
    private final int compKey;
    private final int byteOffset;

    public AstFieldInfo(String fieldName, AstTyp fieldType, int compKey, int byteOffset) {
        super("fieldinfo");
        this.fieldName = fieldName;
        this.fieldType = fieldType;
        this.compKey = compKey;
        this.byteOffset = byteOffset;
    }

    public String getFieldName() {
        return fieldName;
    }

    public AstTyp getFieldType() {
        return fieldType;
    }

    public int getCompKey() {
        return compKey;
    }

    public int getByteOffset() {
        return byteOffset;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFieldInfo(this);
    }
}
