package com.openparking.parking.domain.repository;

import com.openparking.parking.domain.model.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByEmailAndIdNot(String email, Long id);

    /**
     * Case-insensitive match on name or email. {@code search} must already be lower-cased.
     */
    @Query("""
           SELECT u FROM User u
           WHERE LOWER(u.name) LIKE CONCAT('%', :search, '%') ESCAPE '!'
              OR LOWER(u.email) LIKE CONCAT('%', :search, '%') ESCAPE '!'
           """)
    Page<User> search(@Param("search") String search, Pageable pageable);
}
