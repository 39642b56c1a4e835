/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.util.List;

// The uses of the value assigned to a variable at one instruction. The same
// shape is used for the ordinary def-use chains and for the "high" ones,
// which are merged across the variable's aliases.
public class DefUses {
    private final String variable;
    private final List<String> useAddresses;

    public DefUses(String variable, List<String> useAddresses) {
        this.variable = variable;
        this.useAddresses = List.copyOf(useAddresses);
    }

    public String getVariable() {
        return variable;
    }

    public List<String> getUseAddresses() {
        return useAddresses;
    }

    public boolean isEmpty() {
        return useAddresses.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof DefUses)) {
            return false;
        }
        DefUses that = (DefUses) other;
        return variable.equals(that.variable) && useAddresses.equals(that.useAddresses);
    }

    @Override
    public int hashCode() {
        return 31 * variable.hashCode() + useAddresses.hashCode();
    }

    @Override
    public String toString() {
        return variable + ": [" + String.join(", ", useAddresses) + "]";
    }
}
