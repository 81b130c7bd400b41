package com.example.carstock.infrastructure.car;

import com.example.carstock.car.domain.CarEntity;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Query fragments for the dealer-scoped car search. Every search starts from
 * {@link #ownedBy(int)} and is narrowed by the optional equality filters.
 */
public final class CarSpecifications {

    private CarSpecifications() {
    }

    public static Specification<CarEntity> ownedBy(int dealerId) {
        return (root, query, cb) -> cb.equal(root.get("dealerId"), dealerId);
    }

    public static Specification<CarEntity> makeEqualsIgnoreCase(String make) {
        return (root, query, cb) -> cb.equal(cb.lower(root.<String>get("make")), make.toLowerCase(Locale.ROOT));
    }

    public static Specification<CarEntity> modelEqualsIgnoreCase(String model) {
        return (root, query, cb) -> cb.equal(cb.lower(root.<String>get("model")), model.toLowerCase(Locale.ROOT));
    }
}
