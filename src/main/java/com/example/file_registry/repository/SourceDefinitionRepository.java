package com.example.file_registry.repository;

import com.example.file_registry.model.SourceDefinition;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SourceDefinitionRepository extends MongoRepository<SourceDefinition, String> {}
