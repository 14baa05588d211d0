package com.seveninterprise.healthalert.repositories;

import com.seveninterprise.healthalert.model.AlertStatusChange;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertStatusChangeRepository extends JpaRepository<AlertStatusChange, Long> {

    List<AlertStatusChange> findByAlertAlertIdOrderByChangedAtAsc(String alertId);
}
