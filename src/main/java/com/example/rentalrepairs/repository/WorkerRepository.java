package com.example.rentalrepairs.repository;

import com.example.rentalrepairs.model.entity.Worker;

public interface WorkerRepository extends AggregateRepository<Worker> {
}
