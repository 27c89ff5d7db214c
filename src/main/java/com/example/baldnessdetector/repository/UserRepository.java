package com.example.baldnessdetector.repository;

import com.example.baldnessdetector.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    Optional<User> findByGoogleId(String googleId);

    Optional<User> findByWalletAddress(String walletAddress);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.walletAddress = :address WHERE u.id = :id AND u.walletAddress IS NULL")
    int assignWalletAddressIfAbsent(@Param("id") Long id, @Param("address") String address);
}
