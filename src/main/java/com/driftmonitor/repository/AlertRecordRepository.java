package com.driftmonitor.repository;

import com.driftmonitor.entity.AlertRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface AlertRecordRepository extends JpaRepository<AlertRecord, UUID> {
}
