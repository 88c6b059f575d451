package com.example.rentalrepairs.repository.jpa;

import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.repository.WorkerRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Repository;

@Repository
public class JpaWorkerRepository extends JpaAggregateRepository<Worker, WorkerJpaRepository>
        implements WorkerRepository {

    public JpaWorkerRepository(WorkerJpaRepository jpaRepository, EntityManager entityManager) {
        super(Worker.class, Worker::getId, jpaRepository, entityManager);
    }
}
