package com.example.agentdemo.DTO;

import com.example.agentdemo.Enum.ContentStatus;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * 질문 + 답변 생성/수정 요청
 * - 수정 시 status 를 주지 않으면 Draft 로 되돌린다
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class QuestionRequest {
    @NotBlank(message = "Question text is required")
    private String questionText;

    @NotBlank(message = "Answer text is required")
    private String answerText;

    @NotBlank(message = "Answer HTML is required")
    private String answerHtml;

    private ContentStatus status;
}
