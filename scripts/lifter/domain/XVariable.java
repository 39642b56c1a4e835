/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.util.Objects;

// A variable recovered by the invariant analysis. Global variables carry the
// address they live at.
public class XVariable {
    private final String name;
    private final Long globalAddress;

    public XVariable(String name) {
        this(name, null);
    }

    public XVariable(String name, Long globalAddress) {
        this.name = Objects.requireNonNull(name, "name");
        this.globalAddress = globalAddress;
    }

    public String getName() {
        return name;
    }

    public boolean isGlobal() {
        return globalAddress != null;
    }

    public Long getGlobalAddress() {
        return globalAddress;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof XVariable)) {
            return false;
        }
        XVariable that = (XVariable) other;
        return name.equals(that.name) && Objects.equals(globalAddress, that.globalAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, globalAddress);
    }

    @Override
    public String toString() {
        return name;
    }
}
