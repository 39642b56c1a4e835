/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import ast.AstBlock;
import ast.AstInstruction;
import ast.AstInterface;
import ast.AstProvenance;

import java.util.Collections;
import java.util.List;
import java.util.Map;

// Result of lifting one function: a body at each level, the flat list of
// instructions emitted at each level in program order, the per-address
// annotations, and the builder that owns ids, spans and provenance.
public class LiftedFunction {
    private final String name;
    private final String entryAddress;
    private final AstBlock highLevelBody;
    private final AstBlock lowLevelBody;
    private final List<AstInstruction> highLevelInstructions;
    private final List<AstInstruction> lowLevelInstructions;
    private final Map<String, String> annotations;
    private final AstInterface astree;

    public LiftedFunction(
            String name, String entryAddress,
            AstBlock highLevelBody, AstBlock lowLevelBody,
            List<AstInstruction> highLevelInstructions,
            List<AstInstruction> lowLevelInstructions,
            Map<String, String> annotations, AstInterface astree) {
        this.name = name;
        this.entryAddress = entryAddress;
        this.highLevelBody = highLevelBody;
        this.lowLevelBody = lowLevelBody;
        this.highLevelInstructions = List.copyOf(highLevelInstructions);
        this.lowLevelInstructions = List.copyOf(lowLevelInstructions);
        this.annotations = Collections.unmodifiableMap(annotations);
        this.astree = astree;
    }

    public String getName() {
        return name;
    }

    public String getEntryAddress() {
        return entryAddress;
    }

    public AstBlock getHighLevelBody() {
        return highLevelBody;
    }

    public AstBlock getLowLevelBody() {
        return lowLevelBody;
    }

    public List<AstInstruction> getHighLevelInstructions() {
        return highLevelInstructions;
    }

    public List<AstInstruction> getLowLevelInstructions() {
        return lowLevelInstructions;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public AstInterface getAstree() {
        return astree;
    }

    public AstProvenance getProvenance() {
        return astree.getProvenance();
    }
}
