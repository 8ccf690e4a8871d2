package com.jreinhal.zerag.repository;

import com.jreinhal.zerag.model.DataSource;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DataSourceRepository extends MongoRepository<DataSource, String> {

    List<DataSource> findAllByOrderByCreatedAtDesc();

    List<DataSource> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
}
