package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface SymbolMetadataRepository extends MongoRepository<SymbolMetadata, String> {
}
