package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.ledger.DateWindow;
import com.caradonti.finance_ledger.money.MoneyPair;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Summary aggregation for a register, computed in SQL rather than by loading
 * every entry.
 */
@Repository
public class RegisterSummaryQuery {

    private static final String SUMMARY_SQL =
        "SELECT COUNT(*) AS total_entries, " +
        "  COUNT(*) FILTER (WHERE approval_status = 'PENDING') AS pending_entries, " +
        "  COUNT(*) FILTER (WHERE approval_status = 'APPROVED') AS approved_entries, " +
        "  COUNT(*) FILTER (WHERE approval_status = 'REJECTED') AS rejected_entries, " +
        "  COALESCE(SUM(income_ars) FILTER (WHERE approval_status <> 'REJECTED'), 0) AS income_ars, " +
        "  COALESCE(SUM(income_usd) FILTER (WHERE approval_status <> 'REJECTED'), 0) AS income_usd, " +
        "  COALESCE(SUM(expense_ars) FILTER (WHERE approval_status <> 'REJECTED'), 0) AS expense_ars, " +
        "  COALESCE(SUM(expense_usd) FILTER (WHERE approval_status <> 'REJECTED'), 0) AS expense_usd " +
        "FROM cash_register_entries WHERE register_id = ?";

    private final JdbcTemplate jdbcTemplate;

    public RegisterSummaryQuery(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(readOnly = true)
    public RegisterSummary summarize(UUID registerId, DateWindow window) {
        StringBuilder sql = new StringBuilder(SUMMARY_SQL);
        List<Object> args = new ArrayList<>();
        args.add(registerId);
        if (window.getFrom() != null) {
            sql.append(" AND entry_date >= ?");
            args.add(Date.valueOf(window.getFrom()));
        }
        if (window.getTo() != null) {
            sql.append(" AND entry_date <= ?");
            args.add(Date.valueOf(window.getTo()));
        }

        return jdbcTemplate.queryForObject(sql.toString(), (rs, rowNum) -> new RegisterSummary(
            registerId,
            window.getFrom(),
            window.getTo(),
            rs.getLong("total_entries"),
            rs.getLong("pending_entries"),
            rs.getLong("approved_entries"),
            rs.getLong("rejected_entries"),
            MoneyPair.of(rs.getBigDecimal("income_ars"), rs.getBigDecimal("income_usd")),
            MoneyPair.of(rs.getBigDecimal("expense_ars"), rs.getBigDecimal("expense_usd"))
        ), args.toArray());
    }
}
