package com.flamingo.ai.librarychat.domain.repository;

import com.flamingo.ai.librarychat.domain.entity.Answer;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Answer entities. */
@Repository
public interface AnswerRepository extends JpaRepository<Answer, UUID> {}
