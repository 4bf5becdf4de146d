package com.dubbi.brandtrail.inference.service;

import com.dubbi.brandtrail.collect.domain.ImageRef;
import com.dubbi.brandtrail.collect.domain.ImageType;
import com.dubbi.brandtrail.collect.domain.RawBrandingRecord;
import com.dubbi.brandtrail.collect.domain.StyleSnapshot;
import com.dubbi.brandtrail.common.util.CssColors;
import com.dubbi.brandtrail.inference.domain.BrandingDebug;
import com.dubbi.brandtrail.inference.domain.BrandingDebug.SnapshotColor;
import com.dubbi.brandtrail.inference.domain.BrandingDebug.SnapshotColors;
import com.dubbi.brandtrail.inference.domain.BrandingParts.BrandImages;
import com.dubbi.brandtrail.inference.domain.BrandingParts.ComponentStyles;
import com.dubbi.brandtrail.inference.domain.BrandingParts.SpacingProfile;
import com.dubbi.brandtrail.inference.domain.ButtonCandidate;
import com.dubbi.brandtrail.inference.domain.HeuristicBrandingProfile;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * RawBrandingRecord → HeuristicBrandingProfile
 * 상태가 없고 입력을 변경하지 않으므로 여러 페이지에 동시에 사용해도 된다.
 */
@Component
public class BrandingInferenceEngine {
    private static final int DEBUG_CLASS_LENGTH = 50;

    public HeuristicBrandingProfile infer(RawBrandingRecord raw) {
        Objects.requireNonNull(raw, "raw branding record");

        List<StyleSnapshot> snapshots = raw.snapshots();
        PaletteInference.PaletteResult palette = PaletteInference.infer(
                snapshots, raw.cssData().colors(), raw.colorScheme(), raw.pageBackground());

        List<Double> radii = new ArrayList<>();
        for (StyleSnapshot s : snapshots) {
            if (s.radius() != null) radii.add(s.radius());
        }
        radii.addAll(raw.cssData().radii());
        String borderRadius = SpacingInference.borderRadius(radii);
        SpacingProfile spacing = new SpacingProfile(SpacingInference.baseUnit(raw.cssData().spacings()), borderRadius);

        ComponentStyles components = ComponentInference.infer(snapshots, palette.palette(), borderRadius);
        List<ButtonCandidate> buttons = ButtonCandidateRanker.rank(snapshots);

        BrandingDebug debug = new BrandingDebug(
                palette.frequencies(),
                raw.backgroundCandidates(),
                List.copyOf(raw.cssData().colors()),
                raw.cssData().fonts().stream().distinct().toList(),
                snapshotColors(snapshots),
                palette.palette(),
                raw.cssData().skipped(),
                null);

        return new HeuristicBrandingProfile(
                raw.colorScheme(),
                TypographyInference.fonts(raw.typography(), snapshots),
                palette.palette(),
                TypographyInference.profile(raw.typography()),
                spacing,
                components,
                images(raw.images()),
                buttons,
                raw.frameworkHints(),
                debug);
    }

    /**
     * logo: logo → logo-svg → og → twitter → favicon, ogImage: og → twitter
     */
    static BrandImages images(List<ImageRef> images) {
        String logo = firstOf(images, ImageType.LOGO, ImageType.LOGO_SVG, ImageType.OG, ImageType.TWITTER, ImageType.FAVICON);
        return new BrandImages(
                logo,
                firstOf(images, ImageType.FAVICON),
                firstOf(images, ImageType.OG, ImageType.TWITTER));
    }

    private static String firstOf(List<ImageRef> images, ImageType... types) {
        for (ImageType type : types) {
            for (ImageRef ref : images) {
                if (ref.type() == type && ref.src() != null && !ref.src().isBlank()) return ref.src();
            }
        }
        return null;
    }

    private static SnapshotColors snapshotColors(List<StyleSnapshot> snapshots) {
        return new SnapshotColors(
                listColors(snapshots, s -> s.colors().background(), true),
                listColors(snapshots, s -> s.colors().text(), false),
                listColors(snapshots, s -> s.colors().border(), false));
    }

    private static List<SnapshotColor> listColors(List<StyleSnapshot> snapshots, Function<StyleSnapshot, String> color, boolean withArea) {
        List<SnapshotColor> out = new ArrayList<>();
        for (StyleSnapshot s : snapshots) {
            String hex = CssColors.hexify(color.apply(s));
            if (hex == null) continue;
            String classes = s.classes().length() > DEBUG_CLASS_LENGTH ? s.classes().substring(0, DEBUG_CLASS_LENGTH) : s.classes();
            out.add(new SnapshotColor(hex, withArea ? s.rect().area() : 0, s.tag(), classes));
        }
        return out;
    }
}
