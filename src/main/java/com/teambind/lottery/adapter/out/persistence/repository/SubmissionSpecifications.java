package com.teambind.lottery.adapter.out.persistence.repository;

import com.teambind.lottery.adapter.out.persistence.entity.SubmissionEntity;
import com.teambind.lottery.domain.model.SubmissionSearchCondition;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * 응모 검색 조건 → JPA Specification 변환
 */
public final class SubmissionSpecifications {

    private SubmissionSpecifications() {
    }

    public static Specification<SubmissionEntity> matching(SubmissionSearchCondition condition) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (condition.getEmail() != null && !condition.getEmail().isBlank()) {
                predicates.add(cb.like(cb.lower(root.get("email")),
                        "%" + condition.getEmail().toLowerCase() + "%"));
            }
            if (condition.getCouponId() != null) {
                predicates.add(cb.equal(root.get("couponId"), condition.getCouponId()));
            }
            if (condition.getAssignedRewardId() != null) {
                predicates.add(cb.equal(root.get("assignedRewardId"), condition.getAssignedRewardId()));
            }
            if (condition.getAssigned() != null) {
                predicates.add(condition.getAssigned()
                        ? cb.isNotNull(root.get("assignedRewardId"))
                        : cb.isNull(root.get("assignedRewardId")));
            }
            if (condition.getSubmittedFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("submittedAt"), condition.getSubmittedFrom()));
            }
            if (condition.getSubmittedTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("submittedAt"), condition.getSubmittedTo()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
