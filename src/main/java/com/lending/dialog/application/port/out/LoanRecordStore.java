package com.lending.dialog.application.port.out;

import java.util.Optional;

import com.lending.dialog.domain.entity.LoanRecord;

/**
 * Secondary (outbound) port: persisted loan outcomes, one per identity.
 */
public interface LoanRecordStore {

    /**
     * Inserts or replaces the record for {@code record.getIdentity()}.
     */
    void save(LoanRecord record);

    Optional<LoanRecord> find(String identity);
}
