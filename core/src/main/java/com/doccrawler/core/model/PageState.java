package com.doccrawler.core.model;

/** URL별 상태. Unvisited 는 VisitedSet 에 없는 상태로 표현된다 */
public enum PageState {
    VISITING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() { return this != VISITING; }
}
