package com.koni.homeenergy.infrastructure.persistence.repository;

import com.koni.homeenergy.domain.model.SampleCriteria;
import com.koni.homeenergy.infrastructure.persistence.entity.SampleEntity;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Criteria-API predicates for sample lookups.
 */
final class SampleSpecifications {

    private SampleSpecifications() {
    }

    /**
     * A sample matches the window if either its timestamp or its receivedAt falls inside it.
     */
    static Specification<SampleEntity> matching(SampleCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (criteria.hasDeviceFilter()) {
                predicates.add(root.get("deviceId").in(criteria.getDeviceIds()));
            }
            if (criteria.getFrom() != null || criteria.getTo() != null) {
                predicates.add(cb.or(
                        within(cb, root.<Instant>get("timestamp"), criteria.getFrom(), criteria.getTo()),
                        within(cb, root.<Instant>get("receivedAt"), criteria.getFrom(), criteria.getTo())
                ));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static Predicate within(CriteriaBuilder cb, Path<Instant> path, Instant from, Instant to) {
        if (from != null && to != null) {
            return cb.between(path, from, to);
        }
        if (from != null) {
            return cb.greaterThanOrEqualTo(path, from);
        }
        return cb.lessThanOrEqualTo(path, to);
    }
}
