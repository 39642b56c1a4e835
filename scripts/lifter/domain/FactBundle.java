/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

// Per-instruction output of the data-flow and invariant analysis. The layout
// of vars, xprs, rdefs and uses is fixed per opcode family; bundles are
// read through the opcode's accessor struct rather than indexed directly.
public class FactBundle {
    private final boolean valid;
    private final List<String> tags;
    private final List<XVariable> vars;
    private final List<XExpr> xprs;
    private final List<ReachingDefinition> reachingDefinitions;
    private final List<DefUses> defUses;
    private final List<DefUses> defUsesHigh;
    private final boolean branchConditions;
    private final CallTarget callTarget;
    private final Integer argumentCount;
    private final XExpr returnXpr;
    private final XExpr returnXprSimplified;
    private final XExpr instructionCondition;

    private FactBundle(Builder builder) {
        this.valid = builder.valid;
        this.tags = List.copyOf(builder.tags);
        this.vars = List.copyOf(builder.vars);
        this.xprs = List.copyOf(builder.xprs);
        // Entries may be absent, so no List.copyOf here.
        this.reachingDefinitions = Collections.unmodifiableList(new ArrayList<>(builder.reachingDefinitions));
        this.defUses = Collections.unmodifiableList(new ArrayList<>(builder.defUses));
        this.defUsesHigh = Collections.unmodifiableList(new ArrayList<>(builder.defUsesHigh));
        this.branchConditions = builder.branchConditions;
        this.callTarget = builder.callTarget;
        this.argumentCount = builder.argumentCount;
        this.returnXpr = builder.returnXpr;
        this.returnXprSimplified = builder.returnXprSimplified;
        this.instructionCondition = builder.instructionCondition;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FactBundle invalid() {
        return builder().valid(false).build();
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isCall() {
        return tags.size() >= 2 && "call".equals(tags.get(1));
    }

    public List<XVariable> getVars() {
        return vars;
    }

    public List<XExpr> getXprs() {
        return xprs;
    }

    public List<ReachingDefinition> getReachingDefinitions() {
        return reachingDefinitions;
    }

    public List<DefUses> getDefUses() {
        return defUses;
    }

    public List<DefUses> getDefUsesHigh() {
        return defUsesHigh;
    }

    public boolean hasBranchConditions() {
        return branchConditions;
    }

    public boolean hasCallTarget() {
        return callTarget != null;
    }

    public CallTarget getCallTarget() {
        return callTarget;
    }

    public Integer getArgumentCount() {
        return argumentCount;
    }

    public boolean hasReturnXpr() {
        return returnXpr != null;
    }

    public XExpr getReturnXpr() {
        return returnXpr;
    }

    public XExpr getReturnXprSimplified() {
        return returnXprSimplified != null ? returnXprSimplified : returnXpr;
    }

    public boolean hasInstructionCondition() {
        return instructionCondition != null;
    }

    public XExpr getInstructionCondition() {
        return instructionCondition;
    }

    public static class Builder {
        private boolean valid = true;
        private List<String> tags = new ArrayList<>();
        private List<XVariable> vars = new ArrayList<>();
        private List<XExpr> xprs = new ArrayList<>();
        private List<ReachingDefinition> reachingDefinitions = new ArrayList<>();
        private List<DefUses> defUses = new ArrayList<>();
        private List<DefUses> defUsesHigh = new ArrayList<>();
        private boolean branchConditions = false;
        private CallTarget callTarget;
        private Integer argumentCount;
        private XExpr returnXpr;
        private XExpr returnXprSimplified;
        private XExpr instructionCondition;

        public Builder valid(boolean valid) {
            this.valid = valid;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = new ArrayList<>(Arrays.asList(tags));
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public Builder vars(List<XVariable> vars) {
            this.vars = new ArrayList<>(vars);
            return this;
        }

        public Builder vars(XVariable... vars) {
            return vars(Arrays.asList(vars));
        }

        public Builder xprs(List<XExpr> xprs) {
            this.xprs = new ArrayList<>(xprs);
            return this;
        }

        public Builder xprs(XExpr... xprs) {
            return xprs(Arrays.asList(xprs));
        }

        public Builder reachingDefinitions(List<ReachingDefinition> rdefs) {
            this.reachingDefinitions = new ArrayList<>(rdefs);
            return this;
        }

        public Builder reachingDefinitions(ReachingDefinition... rdefs) {
            return reachingDefinitions(Arrays.asList(rdefs));
        }

        public Builder defUses(List<DefUses> uses) {
            this.defUses = new ArrayList<>(uses);
            return this;
        }

        public Builder defUses(DefUses... uses) {
            return defUses(Arrays.asList(uses));
        }

        public Builder defUsesHigh(List<DefUses> uses) {
            this.defUsesHigh = new ArrayList<>(uses);
            return this;
        }

        public Builder defUsesHigh(DefUses... uses) {
            return defUsesHigh(Arrays.asList(uses));
        }

        public Builder branchConditions(boolean branchConditions) {
            this.branchConditions = branchConditions;
            return this;
        }

        public Builder callTarget(CallTarget callTarget, Integer argumentCount) {
            this.callTarget = callTarget;
            this.argumentCount = argumentCount;
            return this;
        }

        public Builder returnXpr(XExpr returnXpr, XExpr returnXprSimplified) {
            this.returnXpr = returnXpr;
            this.returnXprSimplified = returnXprSimplified;
            return this;
        }

        public Builder instructionCondition(XExpr condition) {
            this.instructionCondition = condition;
            return this;
        }

        public FactBundle build() {
            return new FactBundle(this);
        }
    }
}
