package com.jreinhal.zerag.service;

import com.jreinhal.zerag.model.QaRecord;
import com.jreinhal.zerag.repository.QaRecordRepository;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Read and delete access to the QA audit trail. Records are never modified.
 */
@Service
public class QaHistoryService {

    private static final Logger log = LoggerFactory.getLogger(QaHistoryService.class);
    static final int MAX_LIMIT = 100;

    private final QaRecordRepository repository;

    public QaHistoryService(QaRecordRepository repository) {
        this.repository = repository;
    }

    /**
     * Newest first. A null user lists every record.
     */
    public List<QaRecord> listHistory(String userId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(MAX_LIMIT, limit)));
        return userId != null
                ? this.repository.findByUserIdOrderByCreatedAtDesc(userId, page)
                : this.repository.findAllByOrderByCreatedAtDesc(page);
    }

    public Optional<QaRecord> getHistory(String id) {
        return this.repository.findById(id);
    }

    /**
     * Deletes the record only when it belongs to {@code userId}.
     */
    public boolean deleteHistory(String id, String userId) {
        Optional<QaRecord> existing = this.repository.findById(id);
        if (existing.isEmpty() || userId == null || !userId.equals(existing.get().getUserId())) {
            return false;
        }
        this.repository.deleteById(id);
        log.info("QA record {} deleted by its owner", id);
        return true;
    }
}
