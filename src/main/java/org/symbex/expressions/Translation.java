package org.symbex.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 一次翻译的结果：值项、按求值顺序排列的错误隐患，以及下一个可用的不透明编号。
 */
@Getter
public final class Translation {

    private final Term term;
    private final List<Hazard> hazards;
    private final int nextFresh;

    public Translation(Term term, List<Hazard> hazards, int nextFresh) {
        this.term = Objects.requireNonNull(term, "Term cannot be null.");
        this.hazards = List.copyOf(hazards);
        this.nextFresh = nextFresh;
    }

    public boolean hasHazards() {
        return !hazards.isEmpty();
    }

    @Override
    public String toString() {
        return hazards.isEmpty() ? term.toString() : term + " with hazards " + hazards;
    }
}
