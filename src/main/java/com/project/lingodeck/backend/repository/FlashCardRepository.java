package com.project.lingodeck.backend.repository;

import com.project.lingodeck.backend.entity.FlashCardEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;


@Repository
public interface FlashCardRepository extends JpaRepository<FlashCardEntity, String> {
    public List<FlashCardEntity> findByOwnerIdAndDueAtLessThanEqual(String ownerId, Instant now);
    public List<FlashCardEntity> findByOwnerId(String ownerId);
    public Optional<FlashCardEntity> findByIdAndOwnerId(String id, String ownerId);
}
