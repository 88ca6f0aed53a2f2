package com.ai.hospital.repository;

import com.ai.hospital.entity.StoreState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

@Repository
public interface StoreStateRepository extends JpaRepository<StoreState, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StoreState s WHERE s.id = :id")
    Optional<StoreState> findByIdForUpdate(@Param("id") Long id);
}
