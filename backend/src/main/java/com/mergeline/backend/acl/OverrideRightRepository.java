package com.mergeline.backend.acl;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OverrideRightRepository extends JpaRepository<OverrideRightEntity, Long> {

    List<OverrideRightEntity> findByPartnerId(Long partnerId);
}
