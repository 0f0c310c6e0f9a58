package org.carball.autoindex.parser;

import org.carball.autoindex.model.telemetry.PredicateKind;

public record ExtractedPredicate(String table, String field, PredicateKind kind) {
}
