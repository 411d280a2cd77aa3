package com.talentscope.search.store;

import com.talentscope.search.execution.SearchDeadline;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ParameterDisposer;
import org.springframework.jdbc.core.PreparedStatementSetter;

/**
 * Binds statement arguments and sets the query timeout to what is left of the request deadline,
 * rounded up to whole seconds. Runs after the template's own statement settings, so it replaces
 * the configured default timeout.
 */
final class DeadlineStatementSetter implements PreparedStatementSetter, ParameterDisposer {
    private final ArgumentPreparedStatementSetter arguments;
    private final SearchDeadline deadline;

    DeadlineStatementSetter(SqlStatement statement, SearchDeadline deadline) {
        this.arguments = new ArgumentPreparedStatementSetter(statement.args());
        this.deadline = deadline;
    }

    @Override
    public void setValues(PreparedStatement ps) throws SQLException {
        ps.setQueryTimeout(timeoutSeconds(deadline.remainingMs()));
        arguments.setValues(ps);
    }

    @Override
    public void cleanupParameters() {
        arguments.cleanupParameters();
    }

    static int timeoutSeconds(long remainingMs) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, (remainingMs + 999L) / 1000L));
    }
}
