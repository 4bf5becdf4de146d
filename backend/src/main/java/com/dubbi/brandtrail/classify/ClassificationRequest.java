package com.dubbi.brandtrail.classify;

import com.dubbi.brandtrail.collect.domain.LogoCandidate;
import com.dubbi.brandtrail.inference.domain.ButtonCandidate;
import com.dubbi.brandtrail.inference.domain.HeuristicBrandingProfile;
import java.util.List;

/**
 * 분류기 입력. 응답의 인덱스는 buttons / logoCandidates 의 위치를 가리킨다.
 *
 * @param logoCandidates 후보가 없으면 빈 목록
 * @param brandName 브랜드 이름 힌트 (없으면 null)
 * @param screenshot 페이지 스크린샷 (base64 또는 URL, 없으면 null)
 */
public record ClassificationRequest(
        HeuristicBrandingProfile heuristic,
        List<ButtonCandidate> buttons,
        List<LogoCandidate> logoCandidates,
        String brandName,
        String screenshot,
        String url
) {
    public ClassificationRequest {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
        logoCandidates = logoCandidates == null ? List.of() : List.copyOf(logoCandidates);
    }
}
