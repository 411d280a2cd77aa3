package com.talentscope.search.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text with its positional parameters. Parameters may contain {@code null}.
 */
public record SqlStatement(String sql, List<Object> params) {
    public SqlStatement {
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    public Object[] args() {
        return params.toArray();
    }
}
