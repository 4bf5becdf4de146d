package com.dubbi.brandtrail.branding.service;

import com.dubbi.brandtrail.classify.BrandingClassifier;
import com.dubbi.brandtrail.classify.ClassificationOutcome;
import com.dubbi.brandtrail.classify.ClassificationRequest;
import com.dubbi.brandtrail.classify.SemanticEnhancement;
import com.dubbi.brandtrail.collect.domain.LogoCandidate;
import com.dubbi.brandtrail.collect.domain.RawBrandingRecord;
import com.dubbi.brandtrail.inference.domain.HeuristicBrandingProfile;
import com.dubbi.brandtrail.inference.service.BrandingInferenceEngine;
import com.dubbi.brandtrail.merge.domain.FinalBrandingProfile;
import com.dubbi.brandtrail.merge.service.BrandingMerger;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * 추론 → 분류기 호출 → 병합
 * 분류기 실패는 파이프라인 실패가 아니며, 이 경우 규칙 기반 프로필이 그대로 반환된다.
 */
@Service
public class BrandingTransformer {
    private static final Logger log = LoggerFactory.getLogger(BrandingTransformer.class);

    private final BrandingInferenceEngine inferenceEngine;
    private final BrandingClassifier classifier;
    private final BrandingMerger merger;
    private final TaskExecutor taskExecutor;
    private final boolean debug;
    private final long classifierTimeoutMs;

    public BrandingTransformer(
            BrandingInferenceEngine inferenceEngine,
            BrandingClassifier classifier,
            BrandingMerger merger,
            TaskExecutor taskExecutor,
            @Value("${branding.debug:false}") boolean debug,
            @Value("${branding.classifier.timeout-ms:30000}") long classifierTimeoutMs
    ) {
        this.inferenceEngine = inferenceEngine;
        this.classifier = classifier;
        this.merger = merger;
        this.taskExecutor = taskExecutor;
        this.debug = debug;
        this.classifierTimeoutMs = classifierTimeoutMs;
    }

    public FinalBrandingProfile transform(RawBrandingRecord raw, String url, String screenshot) {
        HeuristicBrandingProfile heuristic = inferenceEngine.infer(raw);
        List<LogoCandidate> logos = raw.logoCandidates();

        log.info("Sending {} buttons and {} logo candidates for classification ({})",
                heuristic.buttonCandidates().size(), logos.size(), url);

        ClassificationOutcome outcome = classify(new ClassificationRequest(
                heuristic, heuristic.buttonCandidates(), logos, raw.brandName(), screenshot, url));
        if (!outcome.isSuccess()) {
            log.warn("Branding classification failed, using heuristic profile only ({}): {}", url, outcome.failureReason());
        }
        return merger.merge(heuristic, outcome, logos, debug);
    }

    /**
     * 분류기를 taskExecutor 에서 실행하고 최대 classifierTimeoutMs 동안 기다린다.
     * 시간 초과 시 FutureTask 를 취소해 작업 스레드를 interrupt 한다.
     */
    ClassificationOutcome classify(ClassificationRequest request) {
        FutureTask<SemanticEnhancement> task = new FutureTask<>(() -> classifier.classify(request));
        try {
            taskExecutor.execute(task);
        } catch (RuntimeException e) {
            return ClassificationOutcome.failure("classifier could not be scheduled: " + e.getMessage());
        }

        try {
            SemanticEnhancement enhancement = task.get(classifierTimeoutMs, TimeUnit.MILLISECONDS);
            if (enhancement == null) return ClassificationOutcome.failure("empty classifier response");
            return ClassificationOutcome.success(enhancement);
        } catch (TimeoutException e) {
            task.cancel(true);
            return ClassificationOutcome.failure("classifier timed out after " + classifierTimeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return ClassificationOutcome.failure(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            return ClassificationOutcome.failure("interrupted while waiting for classifier");
        }
    }

    public boolean isDebug() {
        return debug;
    }
}
