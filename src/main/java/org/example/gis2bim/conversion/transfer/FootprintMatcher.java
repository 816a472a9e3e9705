package org.example.gis2bim.conversion.transfer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 按平面位置把 2D 足迹与 3D 构件配对：目标质心的 XY 严格落在足迹包围盒内即为命中，
 * 命中按质心到包围盒中心的平面距离升序排列。一个目标可以同时命中多个足迹。
 */
public final class FootprintMatcher {

    private FootprintMatcher() {
    }

    public record Candidate(ProductShape target, double distance) {
    }

    public record FootprintMatch(ProductShape footprint, List<Candidate> candidates) {

        public FootprintMatch {
            candidates = List.copyOf(candidates);
        }
    }

    /**
     * @return 与 footprints 一一对应（同顺序），没有命中的足迹 candidates 为空
     */
    public static List<FootprintMatch> match(List<ProductShape> footprints, List<ProductShape> targets) {
        List<FootprintMatch> out = new ArrayList<>(footprints.size());
        for (ProductShape footprint : footprints) {
            double cx = footprint.bounds().center().x();
            double cy = footprint.bounds().center().y();
            List<Candidate> candidates = new ArrayList<>();
            for (ProductShape target : targets) {
                if (footprint.bounds().containsXyStrictly(target.centroid())) {
                    double distance = Math.hypot(target.centroid().x() - cx, target.centroid().y() - cy);
                    candidates.add(new Candidate(target, distance));
                }
            }
            candidates.sort(Comparator.comparingDouble(Candidate::distance));
            out.add(new FootprintMatch(footprint, candidates));
        }
        return out;
    }
}
