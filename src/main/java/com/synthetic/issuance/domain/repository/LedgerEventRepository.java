package com.synthetic.issuance.domain.repository;

import com.synthetic.issuance.domain.model.LedgerEventRecord;
import com.synthetic.issuance.domain.model.LedgerEventType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LedgerEventRepository extends JpaRepository<LedgerEventRecord, Long> {

    Page<LedgerEventRecord> findByUserIdOrderByTimestampEpochMsDesc(String userId, Pageable pageable);

    long countByType(LedgerEventType type);
}
