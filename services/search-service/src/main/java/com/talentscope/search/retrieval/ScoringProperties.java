package com.talentscope.search.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.scoring")
public class ScoringProperties {
    private Decay keyword = new Decay(0.98, 0.02, 0.7);
    private Decay fallback = new Decay(0.95, 0.03, 0.6);

    public Decay getKeyword() {
        return keyword;
    }

    public void setKeyword(Decay keyword) {
        this.keyword = keyword;
    }

    public Decay getFallback() {
        return fallback;
    }

    public void setFallback(Decay fallback) {
        this.fallback = fallback;
    }

    /**
     * Rank-based heuristic score: {@code max(floor, start - rank * step)}.
     */
    public static class Decay {
        private double start;
        private double step;
        private double floor;

        public Decay() {
        }

        public Decay(double start, double step, double floor) {
            this.start = start;
            this.step = step;
            this.floor = floor;
        }

        public double scoreAt(int rank) {
            return Math.max(floor, start - rank * step);
        }

        public double getStart() {
            return start;
        }

        public void setStart(double start) {
            this.start = start;
        }

        public double getStep() {
            return step;
        }

        public void setStep(double step) {
            this.step = step;
        }

        public double getFloor() {
            return floor;
        }

        public void setFloor(double floor) {
            this.floor = floor;
        }
    }
}
