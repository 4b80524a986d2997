package com.threadsmith.repository;

import com.threadsmith.model.Personality;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PersonalityRepository extends JpaRepository<Personality, Long> {

    List<Personality> findByUserTelegramIdOrderByIdAsc(Long telegramId);

    Optional<Personality> findByUserTelegramIdAndName(Long telegramId, String name);

    boolean existsByUserTelegramIdAndName(Long telegramId, String name);

    long countByUserTelegramId(Long telegramId);

    @Query("SELECT p FROM Personality p WHERE p.user.telegramId = :telegramId AND p.isDefault = true")
    Optional<Personality> findDefaultByUserTelegramId(@Param("telegramId") Long telegramId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Personality p SET p.isDefault = false WHERE p.user.telegramId = :telegramId AND p.isDefault = true")
    int clearDefaultForUser(@Param("telegramId") Long telegramId);
}
