package org.carball.autoindex.model.schema;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class Column {
    private String name;
    private String dataType;
    private boolean nullable;
    // 0 when the planner has no estimate
    private long distinctEstimate;
}
