/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package ast;

import domain.DefUses;
import domain.ReachingDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// Cross-references between the high-level and the low-level AST of one
// function, plus the data-flow facts attached to individual nodes. All maps
// are keyed by construction id (instruction id, expression id or lval id),
// never by node table identity.
public class AstProvenance {
    private final Map<Integer, Integer> instructionMapping = new TreeMap<>();
    private final Map<Integer, Integer> expressionMapping = new TreeMap<>();
    private final Map<Integer, Integer> lvalMapping = new TreeMap<>();

    private final Map<Integer, List<ReachingDefinition>> reachingDefinitions = new TreeMap<>();
    private final Map<Integer, DefUses> lvalDefUses = new TreeMap<>();
    private final Map<Integer, DefUses> lvalDefUsesHigh = new TreeMap<>();

    private final Map<Integer, List<String>> instructionAddresses = new TreeMap<>();
    private final Map<Integer, List<String>> conditionAddresses = new TreeMap<>();

    // A high-level instruction stands for exactly one low-level instruction.
    public void addInstructionMapping(int highInstrId, int lowInstrId) {
        Integer existing = instructionMapping.get(highInstrId);
        if (existing != null && existing != lowInstrId) {
            throw new IllegalStateException(
                "Instruction " + highInstrId + " is already mapped to " + existing
                + ", cannot map it to " + lowInstrId);
        }
        instructionMapping.put(highInstrId, lowInstrId);
    }

    public void addExpressionMapping(int highExprId, int lowExprId) {
        expressionMapping.put(highExprId, lowExprId);
    }

    public void addLvalMapping(int highLvalId, int lowLvalId) {
        lvalMapping.put(highLvalId, lowLvalId);
    }

    // Absent reaching definitions (null entries) are dropped.
    public void addReachingDefinitions(int exprId, List<ReachingDefinition> rdefs) {
        List<ReachingDefinition> present = new ArrayList<>();
        for (ReachingDefinition rdef : rdefs) {
            if (rdef != null) {
                present.add(rdef);
            }
        }
        if (present.isEmpty()) {
            return;
        }
        reachingDefinitions.computeIfAbsent(exprId, k -> new ArrayList<>()).addAll(present);
    }

    public void addLvalDefUses(int lvalId, DefUses uses) {
        if (uses != null) {
            lvalDefUses.put(lvalId, uses);
        }
    }

    public void addLvalDefUsesHigh(int lvalId, DefUses uses) {
        if (uses != null) {
            lvalDefUsesHigh.put(lvalId, uses);
        }
    }

    public void addInstructionAddress(int instrId, List<String> addresses) {
        instructionAddresses.computeIfAbsent(instrId, k -> new ArrayList<>()).addAll(addresses);
    }

    public void addConditionAddress(int exprId, List<String> addresses) {
        conditionAddresses.computeIfAbsent(exprId, k -> new ArrayList<>()).addAll(addresses);
    }

    public boolean hasInstructionMapping(int highInstrId) {
        return instructionMapping.containsKey(highInstrId);
    }

    public boolean hasExpressionMapping(int highExprId) {
        return expressionMapping.containsKey(highExprId);
    }

    public boolean hasLvalMapping(int highLvalId) {
        return lvalMapping.containsKey(highLvalId);
    }

    public boolean hasReachingDefinitions(int exprId) {
        return reachingDefinitions.containsKey(exprId);
    }

    public Integer getInstructionMapping(int highInstrId) {
        return instructionMapping.get(highInstrId);
    }

    public Integer getExpressionMapping(int highExprId) {
        return expressionMapping.get(highExprId);
    }

    public Integer getLvalMapping(int highLvalId) {
        return lvalMapping.get(highLvalId);
    }

    public List<ReachingDefinition> getReachingDefinitions(int exprId) {
        return reachingDefinitions.getOrDefault(exprId, Collections.emptyList());
    }

    public DefUses getLvalDefUses(int lvalId) {
        return lvalDefUses.get(lvalId);
    }

    public DefUses getLvalDefUsesHigh(int lvalId) {
        return lvalDefUsesHigh.get(lvalId);
    }

    public List<String> getInstructionAddresses(int instrId) {
        return instructionAddresses.getOrDefault(instrId, Collections.emptyList());
    }

    public List<String> getConditionAddresses(int exprId) {
        return conditionAddresses.getOrDefault(exprId, Collections.emptyList());
    }

    public Map<Integer, Integer> getInstructionMappings() {
        return Collections.unmodifiableMap(instructionMapping);
    }

    public Map<Integer, Integer> getExpressionMappings() {
        return Collections.unmodifiableMap(expressionMapping);
    }

    public Map<Integer, Integer> getLvalMappings() {
        return Collections.unmodifiableMap(lvalMapping);
    }

    public Map<Integer, List<ReachingDefinition>> getAllReachingDefinitions() {
        return Collections.unmodifiableMap(reachingDefinitions);
    }

    public Map<Integer, DefUses> getAllLvalDefUses() {
        return Collections.unmodifiableMap(lvalDefUses);
    }

    public Map<Integer, DefUses> getAllLvalDefUsesHigh() {
        return Collections.unmodifiableMap(lvalDefUsesHigh);
    }

    public Map<Integer, List<String>> getAllInstructionAddresses() {
        return Collections.unmodifiableMap(instructionAddresses);
    }

    public Map<Integer, List<String>> getAllConditionAddresses() {
        return Collections.unmodifiableMap(conditionAddresses);
    }
}
