package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.ChatMessageDto;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 세션별 최근 대화 캐시 (Redis list, 최신 메시지가 앞)
 * DB 가 원본이고 Redis 는 조회용 사본. Redis 장애 시 DB 조회로 대체한다.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatHistoryCacheService {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper om;

    static final Duration TTL_RECENT = Duration.ofHours(12);
    static final int MAX_RECENT = 10;

    static String keyRecent(UUID sessionId) {
        return "chat:" + sessionId + ":recent";
    }

    /**
     * 최근 메시지를 시간순으로 반환
     * 캐시에 없으면 loader(DB, 시간순) 결과로 캐시를 채운다.
     */
    public List<ChatMessageDto> recent(UUID sessionId, Supplier<List<ChatMessageDto>> loader) {
        String key = keyRecent(sessionId);
        try {
            List<String> cached = redisTemplate.opsForList().range(key, 0, MAX_RECENT - 1);
            if (cached != null && !cached.isEmpty()) {
                List<ChatMessageDto> messages = new ArrayList<>(cached.size());
                for (String json : cached) {
                    messages.add(om.readValue(json, ChatMessageDto.class));
                }
                Collections.reverse(messages);
                return messages;
            }
        } catch (Exception e) {
            log.warn("대화 캐시 조회 실패 → DB 조회: sessionId={}", sessionId, e);
            return loader.get();
        }

        List<ChatMessageDto> loaded = loader.get();
        warm(key, loaded);
        return loaded;
    }

    /**
     * 새 메시지(시간순)를 캐시 앞쪽에 추가
     * 캐시가 아직 없으면 건너뜀 (다음 조회 때 DB 에서 채움)
     */
    public void append(UUID sessionId, List<ChatMessageDto> messages) {
        String key = keyRecent(sessionId);
        try {
            if (!Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
                return;
            }
            push(key, messages);
        } catch (Exception e) {
            log.warn("대화 캐시 추가 실패: sessionId={}", sessionId, e);
        }
    }

    public void evict(UUID sessionId) {
        try {
            redisTemplate.delete(keyRecent(sessionId));
        } catch (Exception e) {
            log.warn("대화 캐시 삭제 실패: sessionId={}", sessionId, e);
        }
    }

    private void warm(String key, List<ChatMessageDto> messages) {
        if (messages.isEmpty()) {
            return;
        }
        try {
            redisTemplate.delete(key);
            push(key, messages);
        } catch (Exception e) {
            log.warn("대화 캐시 적재 실패: key={}", key, e);
        }
    }

    private void push(String key, List<ChatMessageDto> messages) throws JsonProcessingException {
        for (ChatMessageDto m : messages) {
            redisTemplate.opsForList().leftPush(key, om.writeValueAsString(m));
        }
        // 최근 MAX_RECENT 건만 유지
        redisTemplate.opsForList().trim(key, 0, MAX_RECENT - 1);
        redisTemplate.expire(key, TTL_RECENT);
    }
}
