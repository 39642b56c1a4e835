/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import java.util.List;

public class AstCompInfo extends AstNode {
    private final String compName;
    private final int compKey;
    private final boolean union;
    private final List<AstFieldInfo> fieldInfos;

    public AstCompInfo(String compName, int compKey, boolean union, List<AstFieldInfo> fieldInfos) {
        super("compinfo");
        this.compName = compName;
        this.compKey = compKey;
        this.union = union;
        this.fieldInfos = List.copyOf(fieldInfos);
    }

    public String getCompName() {
        return compName;
    }

    public int getCompKey() {
        return compKey;
    }

    public boolean isUnion() {
        return union;
    }

    public List<AstFieldInfo> getFieldInfos() {
        return fieldInfos;
    }

    public AstFieldInfo getFieldInfo(String fieldName) {
        for (AstFieldInfo finfo : fieldInfos) {
            if (finfo.getFieldName().equals(fieldName)) {
                return finfo;
            }
        }
        throw new IllegalArgumentException(
            "Struct " + compName + " has no field named " + fieldName);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCompInfo(this);
    }
}
