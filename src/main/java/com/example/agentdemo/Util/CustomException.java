package com.example.agentdemo.Util;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 요청 처리 중 발생하는 애플리케이션 예외
 * - GlobalExceptionHandler 에서 status 그대로 응답 코드로 변환
 */
@Getter
public class CustomException extends RuntimeException {

    private final HttpStatus status;

    public CustomException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public static CustomException notFound(String resource) {
        return new CustomException(resource + "을(를) 찾을 수 없습니다.", HttpStatus.NOT_FOUND);
    }
}
