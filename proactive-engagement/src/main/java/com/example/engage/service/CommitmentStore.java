package com.example.engage.service;

import com.example.engage.domain.Commitment;
import com.example.engage.domain.CommitmentStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CommitmentStore {

    Commitment save(Commitment commitment);

    Optional<Commitment> findById(String id);

    List<Commitment> findByUser(String userId, String chatId, Collection<CommitmentStatus> statuses);

    List<Commitment> findHistory(String userId, String chatId, int limit);
}
