package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface HighWaterMarkRepository extends MongoRepository<HighWaterMark, String> {
}
