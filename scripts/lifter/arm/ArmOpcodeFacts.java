/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package arm;

import domain.DefUses;
import domain.FactBundle;
import domain.ReachingDefinition;
import domain.XExpr;
import domain.XVariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Base of the per-opcode views over a fact bundle. Subclasses read their
// named fields once, in the constructor, through the bounds-checked helpers
// below; a missing position yields null and the view reports !isOk().
public abstract class ArmOpcodeFacts {
    private final FactBundle bundle;
    private final boolean ok;

    protected ArmOpcodeFacts(FactBundle bundle, int varCount, int xprCount) {
        this.bundle = bundle;
        this.ok = bundle.isValid()
            && bundle.getVars().size() >= varCount
            && bundle.getXprs().size() >= xprCount;
    }

    public boolean isOk() {
        return ok;
    }

    public FactBundle getBundle() {
        return bundle;
    }

    protected XVariable var(int i) {
        List<XVariable> vars = bundle.getVars();
        return i < vars.size() ? vars.get(i) : null;
    }

    protected XExpr xpr(int i) {
        List<XExpr> xprs = bundle.getXprs();
        return i < xprs.size() ? xprs.get(i) : null;
    }

    protected ReachingDefinition rdef(int i) {
        List<ReachingDefinition> rdefs = bundle.getReachingDefinitions();
        return i < rdefs.size() ? rdefs.get(i) : null;
    }

    // rdefs[from..], empty when the bundle has fewer.
    protected List<ReachingDefinition> rdefsFrom(int from) {
        List<ReachingDefinition> rdefs = bundle.getReachingDefinitions();
        if (from >= rdefs.size()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(rdefs.subList(from, rdefs.size()));
    }

    protected DefUses uses(int i) {
        List<DefUses> uses = bundle.getDefUses();
        return i < uses.size() ? uses.get(i) : null;
    }

    protected DefUses usesHigh(int i) {
        List<DefUses> uses = bundle.getDefUsesHigh();
        return i < uses.size() ? uses.get(i) : null;
    }

    public List<ReachingDefinition> allReachingDefinitions() {
        return rdefsFrom(0);
    }
}
