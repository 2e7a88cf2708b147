package com.dpw.fixrunner.repository;

import com.dpw.fixrunner.model.TestRun;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TestRunRepository extends MongoRepository<TestRun, String> {
}
