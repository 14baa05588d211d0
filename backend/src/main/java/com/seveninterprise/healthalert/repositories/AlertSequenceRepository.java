package com.seveninterprise.healthalert.repositories;

import com.seveninterprise.healthalert.model.AlertSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AlertSequenceRepository extends JpaRepository<AlertSequence, String> {

    /**
     * Lê o contador com lock pessimista de linha
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AlertSequence s WHERE s.key = :key")
    Optional<AlertSequence> findForUpdate(@Param("key") String key);
}
