package com.shardmesh.core;

import com.shardmesh.core.schema.ConversionSchema;

import java.util.List;
import java.util.Optional;

public interface SchemaRepository {
    ConversionSchema create(ConversionSchema schema);
    Optional<ConversionSchema> findById(String id, SchemaScope scope);
    Optional<ConversionSchema> update(String id, SchemaScope scope, ConversionSchema schema);
    boolean delete(String id, SchemaScope scope);
    List<ConversionSchema> list(SchemaScope scope);
}
