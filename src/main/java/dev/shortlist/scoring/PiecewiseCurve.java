package dev.shortlist.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Piecewise-linear map from a match ratio in [0, 1] to points. Bands are
 * declared from the top down; a ratio at or above a band's lower bound is
 * interpolated within that band, a ratio below every band falls on the
 * linear segment from 0 to the lowest band's start.
 */
public final class PiecewiseCurve {

    private record Band(double fromRatio, double toRatio, double fromPoints, double toPoints) {
    }

    private final double maxPoints;
    private final List<Band> bands;

    private PiecewiseCurve(double maxPoints, List<Band> bands) {
        this.maxPoints = maxPoints;
        this.bands = List.copyOf(bands);
    }

    public static Builder topAt(double ratio, double points) {
        return new Builder(ratio, points);
    }

    public double apply(double ratio) {
        if (ratio >= 1.0) {
            return maxPoints;
        }
        for (Band band : bands) {
            if (ratio >= band.fromRatio()) {
                double slope = (band.toPoints() - band.fromPoints()) / (band.toRatio() - band.fromRatio());
                return band.fromPoints() + (ratio - band.fromRatio()) * slope;
            }
        }
        Band lowest = bands.get(bands.size() - 1);
        return Math.max(0.0, ratio) * lowest.fromPoints() / lowest.fromRatio();
    }

    /**
     * Bands are added from the top ratio downward. Each band runs from its own
     * start to the start of the band above it.
     */
    public static final class Builder {

        private final double topRatio;
        private final double topPoints;
        private final List<Band> bands = new ArrayList<>();
        private double upperRatio;
        private double upperPoints;

        private Builder(double topRatio, double topPoints) {
            this.topRatio = topRatio;
            this.topPoints = topPoints;
            this.upperRatio = topRatio;
            this.upperPoints = topPoints;
        }

        public Builder band(double fromRatio, double fromPoints) {
            bands.add(new Band(fromRatio, upperRatio, fromPoints, upperPoints));
            upperRatio = fromRatio;
            upperPoints = fromPoints;
            return this;
        }

        /**
         * @param maxPoints points for a full match (ratio 1.0)
         */
        public PiecewiseCurve build(double maxPoints) {
            if (topRatio < 1.0) {
                bands.add(0, new Band(topRatio, 1.0, topPoints, topPoints));
            }
            return new PiecewiseCurve(maxPoints, bands);
        }
    }
}
