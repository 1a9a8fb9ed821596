package com.mergeline.backend.registry;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StatusRequirementRepository extends JpaRepository<StatusRequirementEntity, Long> {

    List<StatusRequirementEntity> findByRepositoryIdOrderById(Long repositoryId);
}
