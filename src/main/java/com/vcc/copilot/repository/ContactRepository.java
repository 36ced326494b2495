package com.vcc.copilot.repository;

import com.vcc.copilot.entity.ContactEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface ContactRepository extends ReactiveCrudRepository<ContactEntity, UUID> {

    Mono<ContactEntity> findByIdAndOrganizationId(UUID id, UUID organizationId);
}
