package com.example.file_registry.config;

import com.example.file_registry.model.FileRecord;
import com.example.file_registry.model.SourceDefinition;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.data.mapping.context.MappingContext;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.data.mongodb.core.mapping.MongoPersistentEntity;
import org.springframework.data.mongodb.core.mapping.MongoPersistentProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the indexes declared on the registry documents before any request is served. The unique
 * {@code source_path_idx} is what makes a duplicate (source, path) insert fail atomically.
 */
@Component
public class MongoIndexEnsurer implements SmartInitializingSingleton {
  private static final Logger log = LoggerFactory.getLogger(MongoIndexEnsurer.class);
  private static final List<Class<?>> DOCUMENTS = List.of(FileRecord.class, SourceDefinition.class);

  private final MongoTemplate mongoTemplate;

  public MongoIndexEnsurer(MongoTemplate mongoTemplate) {
    this.mongoTemplate = mongoTemplate;
  }

  @Override
  public void afterSingletonsInstantiated() {
    ensureIndexes();
  }

  public void ensureIndexes() {
    MappingContext<? extends MongoPersistentEntity<?>, MongoPersistentProperty> mappingContext =
        mongoTemplate.getConverter().getMappingContext();
    MongoPersistentEntityIndexResolver resolver =
        new MongoPersistentEntityIndexResolver(mappingContext);
    for (Class<?> type : DOCUMENTS) {
      IndexOperations indexOps = mongoTemplate.indexOps(type);
      resolver.resolveIndexFor(type).forEach(indexOps::ensureIndex);
      log.info("Ensured indexes for {}", mongoTemplate.getCollectionName(type));
    }
  }
}
