package com.lending.dialog.adapters.out.postgres;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.lending.dialog.application.port.out.LoanRecordStore;
import com.lending.dialog.domain.entity.LoanRecord;

/**
 * PostgreSQL implementation of the LoanRecordStore outbound port.
 * <p>
 * One row per identity in {@code loan_records}; a newer decision overwrites
 * the previous one via ON CONFLICT DO UPDATE, keeping the original
 * {@code created_at}.
 * </p>
 */
@Component
public class PostgresLoanRecordStore implements LoanRecordStore {

    private static final Logger log = LoggerFactory.getLogger(PostgresLoanRecordStore.class);

    private static final String UPSERT_SQL = "INSERT INTO loan_records (identity, reference_id, status, full_name, "
            + "approved_amount, apr, term_months, purpose, employment, monthly_income, reason, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT (identity) DO UPDATE SET "
            + "reference_id = EXCLUDED.reference_id, status = EXCLUDED.status, full_name = EXCLUDED.full_name, "
            + "approved_amount = EXCLUDED.approved_amount, apr = EXCLUDED.apr, term_months = EXCLUDED.term_months, "
            + "purpose = EXCLUDED.purpose, employment = EXCLUDED.employment, "
            + "monthly_income = EXCLUDED.monthly_income, reason = EXCLUDED.reason, updated_at = EXCLUDED.updated_at";

    private static final String SELECT_BY_IDENTITY_SQL = "SELECT identity, reference_id, status, full_name, "
            + "approved_amount, apr, term_months, purpose, employment, monthly_income, reason, created_at, updated_at "
            + "FROM loan_records WHERE identity = ?";

    private final JdbcTemplate jdbcTemplate;

    public PostgresLoanRecordStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(LoanRecord record) {
        jdbcTemplate.update(UPSERT_SQL,
                record.getIdentity(),
                record.getReferenceId(),
                record.getStatus(),
                record.getFullName(),
                record.getApprovedAmount(),
                record.getApr(),
                record.getTermMonths(),
                record.getPurpose(),
                record.getEmployment(),
                record.getMonthlyIncome(),
                record.getReason(),
                Timestamp.from(record.getCreatedAt()),
                Timestamp.from(record.getUpdatedAt()));
        log.info("action=loan_record_saved identity={} ref={} status={}",
                record.getIdentity(), record.getReferenceId(), record.getStatus());
    }

    @Override
    public Optional<LoanRecord> find(String identity) {
        List<LoanRecord> rows = jdbcTemplate.query(SELECT_BY_IDENTITY_SQL,
                (rs, rowNum) -> mapRow(rs), identity);
        return rows.stream().findFirst();
    }

    // ─────────────────── Private Helpers ───────────────────

    private LoanRecord mapRow(ResultSet rs) throws SQLException {
        BigDecimal approvedAmount = rs.getBigDecimal("approved_amount");
        return new LoanRecord(
                rs.getString("identity"),
                rs.getString("reference_id"),
                rs.getString("status"),
                rs.getString("full_name"),
                approvedAmount,
                rs.getBigDecimal("apr"),
                rs.getInt("term_months"),
                rs.getString("purpose"),
                rs.getString("employment"),
                rs.getBigDecimal("monthly_income"),
                rs.getString("reason"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }
}
