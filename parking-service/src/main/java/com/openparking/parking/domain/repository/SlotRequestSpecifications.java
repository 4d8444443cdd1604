package com.openparking.parking.domain.repository;

import com.openparking.common.util.Pagination;
import com.openparking.parking.domain.model.SlotRequest;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.model.Vehicle;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

/**
 * Composable filters for the slot request listing.
 * Each factory returns {@code null} when its argument is absent; {@link Specification#where}
 * and {@code and} treat null as "no restriction".
 */
public final class SlotRequestSpecifications {
    private SlotRequestSpecifications() {
    }

    public static Specification<SlotRequest> ownedBy(Long userId) {
        if (userId == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("userId"), userId);
    }

    public static Specification<SlotRequest> hasStatus(RequestStatus status) {
        if (status == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("requestStatus"), status);
    }

    /**
     * Vehicle plate contains {@code search}, a term already normalized by {@link Pagination#searchTerm}.
     */
    public static Specification<SlotRequest> plateContains(String search) {
        if (search == null || search.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> {
            Subquery<Long> vehicles = query.subquery(Long.class);
            var v = vehicles.from(Vehicle.class);
            vehicles.select(v.<Long>get("id"))
                    .where(cb.like(cb.lower(v.<String>get("plateNumber")), "%" + search + "%", Pagination.LIKE_ESCAPE));
            return root.get("vehicleId").in(vehicles);
        };
    }

    /**
     * Vehicle plate, requester email or requester name contains {@code search}, a term already
     * normalized by {@link Pagination#searchTerm}.
     */
    public static Specification<SlotRequest> plateOrRequesterContains(String search) {
        if (search == null || search.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> {
            String pattern = "%" + search + "%";
            Subquery<Long> users = query.subquery(Long.class);
            var u = users.from(User.class);
            users.select(u.<Long>get("id"))
                    .where(cb.or(
                            cb.like(cb.lower(u.<String>get("email")), pattern, Pagination.LIKE_ESCAPE),
                            cb.like(cb.lower(u.<String>get("name")), pattern, Pagination.LIKE_ESCAPE)));
            return cb.or(
                    plateContains(search).toPredicate(root, query, cb),
                    root.get("userId").in(users));
        };
    }
}
