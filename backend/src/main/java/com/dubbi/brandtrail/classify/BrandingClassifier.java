package com.dubbi.brandtrail.classify;

/**
 * 버튼 역할, 색상 역할, 로고 선택을 판단하는 외부 분류기.
 * 실패(시간 초과, 전송 오류, 잘못된 응답)는 ClassificationException 으로 알린다.
 */
public interface BrandingClassifier {

    SemanticEnhancement classify(ClassificationRequest request);
}
