package org.carball.autoindex.model.decision;

public enum DecisionAction {
    CREATE,
    SKIP,
    DEFER
}
