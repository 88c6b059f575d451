package com.example.rentalrepairs.repository.jpa;

import com.example.rentalrepairs.model.entity.Worker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.UUID;

public interface WorkerJpaRepository extends JpaRepository<Worker, UUID>, JpaSpecificationExecutor<Worker> {
}
