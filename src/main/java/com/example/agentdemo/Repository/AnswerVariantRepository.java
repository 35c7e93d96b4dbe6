package com.example.agentdemo.Repository;

import com.example.agentdemo.Domain.AnswerVariant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface AnswerVariantRepository extends JpaRepository<AnswerVariant, UUID> {

    @Query("SELECT v FROM AnswerVariant v WHERE v.answer.id IN :answerIds AND v.approved = true " +
            "ORDER BY v.variantOrder ASC")
    List<AnswerVariant> findApprovedByAnswerIds(@Param("answerIds") Collection<UUID> answerIds);
}
