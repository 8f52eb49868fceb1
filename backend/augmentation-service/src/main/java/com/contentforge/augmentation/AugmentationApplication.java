package com.contentforge.augmentation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ContentForge Augmentation Service Application
 *
 * 생성된 원고에 근거 기반 인용과 팩트체크 리포트를 붙이는 서비스
 * - 검증 가능한 주장(claim) 추출
 * - 리서치 데이터 기반 증거 매칭 및 신뢰도 산출
 * - 인라인 인용 + 참고문헌, 또는 검증 리포트 생성
 */
@SpringBootApplication
public class AugmentationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AugmentationApplication.class, args);
    }
}
