package com.datafetch.infrastructure.persistence.repository;

import com.datafetch.domain.model.JobState;
import com.datafetch.infrastructure.persistence.entity.FetchJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

@Repository
public interface FetchJobRepository extends JpaRepository<FetchJobEntity, UUID> {

    @Transactional
    long deleteByStateInAndCompletedAtBefore(Collection<JobState> states, Instant cutoff);
}
