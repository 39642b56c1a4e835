/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

// Declaration-level information for a variable. Registers get a varinfo
// without type; recovered variables may carry a type, a parameter index, or
// the address of the global they denote.
public class AstVarInfo extends AstNode {
    private final String name;
    private final AstTyp type;
    private final Integer parameter;
    private final Long globalAddress;
    private final String description;

    public AstVarInfo(
            String name, AstTyp type, Integer parameter,
            Long globalAddress, String description) {
        super("varinfo");
        this.name = name;
        this.type = type;
        this.parameter = parameter;
        this.globalAddress = globalAddress;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public AstTyp getType() {
        return type;
    }

    public Integer getParameter() {
        return parameter;
    }

    public Long getGlobalAddress() {
        return globalAddress;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVarInfo(this);
    }
}
