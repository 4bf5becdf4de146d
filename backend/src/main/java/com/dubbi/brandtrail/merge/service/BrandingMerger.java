package com.dubbi.brandtrail.merge.service;

import com.dubbi.brandtrail.classify.ClassificationOutcome;
import com.dubbi.brandtrail.classify.SemanticEnhancement;
import com.dubbi.brandtrail.classify.SemanticEnhancement.ButtonClassification;
import com.dubbi.brandtrail.classify.SemanticEnhancement.ColorRoles;
import com.dubbi.brandtrail.classify.SemanticEnhancement.LogoSelection;
import com.dubbi.brandtrail.collect.domain.LogoCandidate;
import com.dubbi.brandtrail.common.util.CssColors;
import com.dubbi.brandtrail.inference.domain.BrandingDebug;
import com.dubbi.brandtrail.inference.domain.BrandingDebug.EnhancementConfidence;
import com.dubbi.brandtrail.inference.domain.BrandingParts.BrandImages;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ButtonStyle;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ComponentStyles;
import com.dubbi.brandtrail.inference.domain.ButtonCandidate;
import com.dubbi.brandtrail.inference.domain.HeuristicBrandingProfile;
import com.dubbi.brandtrail.inference.domain.Palette;
import com.dubbi.brandtrail.merge.domain.FieldSource;
import com.dubbi.brandtrail.merge.domain.FinalBrandingProfile;
import com.dubbi.brandtrail.merge.domain.MergeField;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 규칙 기반 프로필과 분류기 결과를 병합한다.
 * 필드마다 독립적으로: 값이 있고 유효하며 인덱스가 범위 안일 때만 덮어쓴다.
 * 한 필드의 실패는 다른 필드의 결과에 영향을 주지 않는다.
 */
@Component
public class BrandingMerger {
    private static final Logger log = LoggerFactory.getLogger(BrandingMerger.class);

    public FinalBrandingProfile merge(
            HeuristicBrandingProfile heuristic,
            ClassificationOutcome outcome,
            List<LogoCandidate> logoCandidates,
            boolean includeDebug
    ) {
        if (outcome == null || !outcome.isSuccess()) {
            return FinalBrandingProfile.fromHeuristic(heuristic, includeDebug);
        }

        SemanticEnhancement enhancement = outcome.enhancement();
        List<ButtonCandidate> buttons = heuristic.buttonCandidates();
        List<LogoCandidate> logos = logoCandidates == null ? List.of() : logoCandidates;
        Map<MergeField, FieldSource> sources = new EnumMap<>(FinalBrandingProfile.allKept());

        ButtonClassification bc = enhancement.buttonClassification();
        ComponentStyles components = heuristic.components();
        if (bc != null) {
            ButtonCandidate primary = field(MergeField.BUTTON_PRIMARY, () -> at(buttons, bc.primaryButtonIndex()));
            if (primary != null) {
                components = components.withButtonPrimary(toStyle(primary));
                sources.put(MergeField.BUTTON_PRIMARY, FieldSource.OVERRIDDEN);
            }
            ButtonCandidate secondary = field(MergeField.BUTTON_SECONDARY, () -> at(buttons, bc.secondaryButtonIndex()));
            if (secondary != null) {
                components = components.withButtonSecondary(toStyle(secondary));
                sources.put(MergeField.BUTTON_SECONDARY, FieldSource.OVERRIDDEN);
            }
        }

        ColorRoles roles = enhancement.colorRoles();
        Palette colors = heuristic.colors();
        if (roles != null) {
            colors = color(colors, roles, MergeField.COLOR_PRIMARY, ColorRoles::primary, sources);
            colors = color(colors, roles, MergeField.COLOR_ACCENT, ColorRoles::accent, sources);
            colors = color(colors, roles, MergeField.COLOR_BACKGROUND, ColorRoles::background, sources);
            colors = color(colors, roles, MergeField.COLOR_TEXT_PRIMARY, ColorRoles::textPrimary, sources);
            colors = color(colors, roles, MergeField.COLOR_LINK, ColorRoles::link, sources);
        }

        LogoSelection logoSelection = enhancement.logoSelection();
        BrandImages images = heuristic.images();
        if (logoSelection != null) {
            LogoCandidate logo = field(MergeField.LOGO, () -> at(logos, logoSelection.selectedLogoIndex()));
            if (logo != null && logo.src() != null && !logo.src().isBlank()) {
                images = images.withLogo(logo.src());
                sources.put(MergeField.LOGO, FieldSource.OVERRIDDEN);
            }
        }

        long overridden = sources.values().stream().filter(s -> s == FieldSource.OVERRIDDEN).count();
        log.info("Merged branding classification: {} of {} fields overridden", overridden, sources.size());

        BrandingDebug debug = null;
        if (includeDebug && heuristic.debug() != null) {
            debug = heuristic.debug().withEnhancement(confidence(enhancement));
        }

        return new FinalBrandingProfile(
                heuristic.colorScheme(),
                heuristic.fonts(),
                colors,
                heuristic.typography(),
                heuristic.spacing(),
                components,
                images,
                heuristic.frameworkHints(),
                sources,
                includeDebug ? buttons : null,
                debug);
    }

    private static Palette color(
            Palette current,
            ColorRoles roles,
            MergeField field,
            Function<ColorRoles, String> role,
            Map<MergeField, FieldSource> sources
    ) {
        String hex = field(field, () -> {
            String normalized = CssColors.hexify(role.apply(roles));
            return normalized == null || CssColors.isTransparent(normalized) ? null : normalized;
        });
        if (hex == null) return current;
        sources.put(field, FieldSource.OVERRIDDEN);
        return switch (field) {
            case COLOR_PRIMARY -> current.withPrimary(hex);
            case COLOR_ACCENT -> current.withAccent(hex);
            case COLOR_BACKGROUND -> current.withBackground(hex);
            case COLOR_TEXT_PRIMARY -> current.withTextPrimary(hex);
            case COLOR_LINK -> current.withLink(hex);
            default -> current;
        };
    }

    private static <T> T field(MergeField field, Supplier<T> resolve) {
        try {
            return resolve.get();
        } catch (RuntimeException e) {
            log.warn("Ignoring classifier value for {}: {}", field, e.getMessage());
            return null;
        }
    }

    private static <T> T at(List<T> list, Integer index) {
        if (index == null || index < 0 || index >= list.size()) return null;
        return list.get(index);
    }

    private static ButtonStyle toStyle(ButtonCandidate c) {
        String bg = CssColors.isTransparent(c.background()) ? null : c.background();
        return new ButtonStyle(bg, c.textColor(), c.borderColor(), c.borderRadius());
    }

    private static EnhancementConfidence confidence(SemanticEnhancement e) {
        ButtonClassification bc = e.buttonClassification();
        ColorRoles roles = e.colorRoles();
        LogoSelection logo = e.logoSelection();
        return new EnhancementConfidence(
                bc == null ? null : bc.primaryButtonIndex(),
                bc == null ? null : bc.secondaryButtonIndex(),
                bc == null ? null : bc.confidence(),
                roles == null ? null : roles.confidence(),
                logo == null ? null : logo.selectedLogoIndex(),
                logo == null ? null : logo.confidence());
    }
}
