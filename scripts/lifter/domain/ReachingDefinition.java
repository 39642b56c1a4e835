/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.util.List;

// The definitions of a variable that reach a particular read: the variable
// read and the addresses of the instructions that may have last assigned it.
public class ReachingDefinition {
    private final String variable;
    private final List<String> definitionAddresses;

    public ReachingDefinition(String variable, List<String> definitionAddresses) {
        this.variable = variable;
        this.definitionAddresses = List.copyOf(definitionAddresses);
    }

    public String getVariable() {
        return variable;
    }

    public List<String> getDefinitionAddresses() {
        return definitionAddresses;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof ReachingDefinition)) {
            return false;
        }
        ReachingDefinition that = (ReachingDefinition) other;
        return variable.equals(that.variable)
            && definitionAddresses.equals(that.definitionAddresses);
    }

    @Override
    public int hashCode() {
        return 31 * variable.hashCode() + definitionAddresses.hashCode();
    }

    @Override
    public String toString() {
        return variable + ": [" + String.join(", ", definitionAddresses) + "]";
    }
}
