package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.ReviewItem;
import com.openforge.docrouter.domain.ReviewStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReviewItemRepository extends JpaRepository<ReviewItem, Long> {

    List<ReviewItem> findByStatusOrderByCreateTimeAsc(ReviewStatus status);

    long countByStatus(ReviewStatus status);
}
