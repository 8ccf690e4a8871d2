package com.jreinhal.zerag.repository;

import com.jreinhal.zerag.model.DocumentChunk;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DocumentChunkRepository extends MongoRepository<DocumentChunk, String> {

    List<DocumentChunk> findByDataSourceId(String dataSourceId);

    long countByDataSourceId(String dataSourceId);

    long deleteByDataSourceId(String dataSourceId);
}
