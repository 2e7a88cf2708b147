package com.dpw.fixrunner.repository;

import com.dpw.fixrunner.model.RunRequest;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RunRequestRepository extends MongoRepository<RunRequest, String> {
}
