package com.threadsmith.repository;

import com.threadsmith.model.AppUser;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    /**
     * Inserts the user row unless one already exists.
     *
     * @return 1 when this call created the row, 0 when another writer got there first
     */
    @Modifying
    @Query(value = """
            INSERT INTO users (telegram_id, username, first_name, is_active, created_at)
            VALUES (:telegramId, :username, :firstName, TRUE, now())
            ON CONFLICT (telegram_id) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("telegramId") Long telegramId,
            @Param("username") String username,
            @Param("firstName") String firstName);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM AppUser u WHERE u.telegramId = :telegramId")
    Optional<AppUser> findByTelegramIdForUpdate(@Param("telegramId") Long telegramId);
}
