package com.dubbi.brandtrail.branding.service;

import com.dubbi.brandtrail.collect.domain.RawBrandingRecord;
import com.dubbi.brandtrail.collect.service.BrandingSignalCollector;
import com.dubbi.brandtrail.collect.web.PageAccessor;
import com.dubbi.brandtrail.collect.web.PlaywrightPageAccessor;
import com.dubbi.brandtrail.merge.domain.FinalBrandingProfile;
import com.microsoft.playwright.Page;
import org.springframework.stereotype.Service;

/**
 * 이미 로드된 페이지에서 최종 브랜딩 프로필까지 한 번에 만든다.
 * 이동, 로딩 대기, 스크린샷은 호출자 책임이다.
 */
@Service
public class BrandingExtractionService {
    private final BrandingSignalCollector collector;
    private final BrandingTransformer transformer;

    public BrandingExtractionService(BrandingSignalCollector collector, BrandingTransformer transformer) {
        this.collector = collector;
        this.transformer = transformer;
    }

    public FinalBrandingProfile extract(Page page, String url, String screenshot) {
        String pageUrl = url != null ? url : page.url();
        return extract(new PlaywrightPageAccessor(page), pageUrl, screenshot);
    }

    public FinalBrandingProfile extract(PageAccessor page, String url, String screenshot) {
        RawBrandingRecord raw = collector.collect(page);
        return transformer.transform(raw, url, screenshot);
    }
}
