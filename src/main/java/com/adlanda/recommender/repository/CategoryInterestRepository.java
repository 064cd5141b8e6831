package com.adlanda.recommender.repository;

import com.adlanda.recommender.entity.CategoryInterest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for per-user category interest tallies.
 */
@Repository
public interface CategoryInterestRepository extends JpaRepository<CategoryInterest, UUID> {

    Optional<CategoryInterest> findByUserIdAndCategory(String userId, String category);

    List<CategoryInterest> findByUserIdOrderByWeightDesc(String userId);
}
