package com.example.agentdemo.Repository;

import com.example.agentdemo.Domain.QuestionVariant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface QuestionVariantRepository extends JpaRepository<QuestionVariant, UUID> {

    @Query("SELECT v FROM QuestionVariant v WHERE v.question.id IN :questionIds AND v.approved = true " +
            "ORDER BY v.variantOrder ASC")
    List<QuestionVariant> findApprovedByQuestionIds(@Param("questionIds") Collection<UUID> questionIds);

    List<QuestionVariant> findByQuestion_IdOrderByVariantOrderAsc(UUID questionId);
}
