package com.mergeline.backend.commit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface CommitRepository extends JpaRepository<CommitEntity, Long> {

    Optional<CommitEntity> findBySha(String sha);

    @Query("select c.id from CommitEntity c where c.toCheck = true order by c.id")
    List<Long> findIdsToCheck();
}
