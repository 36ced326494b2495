package com.vcc.copilot.repository;

import com.vcc.copilot.entity.OrganizationEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface OrganizationRepository extends ReactiveCrudRepository<OrganizationEntity, UUID> {
}
