package com.project.lingodeck.backend.repository;

import com.project.lingodeck.backend.entity.ReviewSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReviewSessionRepository extends JpaRepository<ReviewSessionEntity, String> {
}
