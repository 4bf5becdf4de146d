package com.dubbi.brandtrail.classify;

/**
 * 분류기가 설정되지 않았을 때의 기본 구현. 항상 실패하므로 결과는 규칙 기반 프로필 그대로다.
 */
public class DisabledBrandingClassifier implements BrandingClassifier {
    @Override
    public SemanticEnhancement classify(ClassificationRequest request) {
        throw new ClassificationException("no branding classifier configured");
    }
}
