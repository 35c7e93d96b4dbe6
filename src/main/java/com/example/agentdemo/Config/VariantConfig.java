package com.example.agentdemo.Config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class VariantConfig {

    // 변형 생성/답변 변형 선택에 쓰는 난수원 (테스트에서는 고정 시드로 교체)
    @Bean(name = "variantRandom")
    public Random variantRandom() {
        return new Random();
    }
}
