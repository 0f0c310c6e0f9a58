package org.carball.autoindex.model.tenant;

import java.util.Locale;

public record ActiveField(String table, String field) {

    public ActiveField {
        table = table.toLowerCase(Locale.ROOT);
        field = field.toLowerCase(Locale.ROOT);
    }
}
