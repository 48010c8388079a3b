package com.shardmesh.repositories.memory;

import com.shardmesh.repos.certification.RelationshipRepositoryCertification;

public class InMemoryRelationshipRepositoryCertificationTest extends RelationshipRepositoryCertification {

    @Override
    public void init() {
        this.repository = new InMemoryRelationshipRepository();
    }
}
