package com.example.engage.persistence;

import com.example.engage.domain.CommitmentStatus;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommitmentJpaRepository extends JpaRepository<CommitmentEntity, String> {

    @Query(
            "select c from CommitmentEntity c "
                    + "where c.userId = :userId "
                    + "and (:chatId is null or c.chatId = :chatId) "
                    + "and c.status in (:statuses) "
                    + "order by c.assignedAt desc")
    List<CommitmentEntity> findForUser(
            @Param("userId") String userId,
            @Param("chatId") String chatId,
            @Param("statuses") Collection<CommitmentStatus> statuses);

    @Query(
            "select c from CommitmentEntity c "
                    + "where c.userId = :userId "
                    + "and (:chatId is null or c.chatId = :chatId) "
                    + "order by c.assignedAt desc")
    List<CommitmentEntity> findHistory(
            @Param("userId") String userId, @Param("chatId") String chatId, Pageable pageable);
}
