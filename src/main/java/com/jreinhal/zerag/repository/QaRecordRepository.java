package com.jreinhal.zerag.repository;

import com.jreinhal.zerag.model.QaRecord;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface QaRecordRepository extends MongoRepository<QaRecord, String> {

    // Newest first; the page size caps how far back a caller can read.
    List<QaRecord> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    List<QaRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
