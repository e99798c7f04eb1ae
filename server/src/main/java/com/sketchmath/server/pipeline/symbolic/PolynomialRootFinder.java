package com.sketchmath.server.pipeline.symbolic;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every complex root of a univariate polynomial. Degrees one and two use
 * closed forms; higher degrees use Durand-Kerner simultaneous iteration.
 * Roots are returned as {re, im} pairs, repeated roots included.
 */
final class PolynomialRootFinder {

    private final int maxIterations;
    private final double tolerance;

    PolynomialRootFinder(int maxIterations, double tolerance) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /**
     * @param coefficients lowest power first; the highest entry must be non-zero
     */
    List<double[]> findRoots(double[] coefficients) {
        List<double[]> roots = new ArrayList<>();
        int low = 0;
        while (low < coefficients.length - 1 && coefficients[low] == 0.0) {
            roots.add(new double[] { 0.0, 0.0 });
            low++;
        }
        double[] reduced = new double[coefficients.length - low];
        System.arraycopy(coefficients, low, reduced, 0, reduced.length);

        int degree = reduced.length - 1;
        if (degree == 1) {
            roots.add(new double[] { -reduced[0] / reduced[1], 0.0 });
        } else if (degree == 2) {
            addQuadraticRoots(reduced[2], reduced[1], reduced[0], roots);
        } else if (degree > 2) {
            roots.addAll(durandKerner(reduced));
        }
        return roots;
    }

    private static void addQuadraticRoots(double a, double b, double c, List<double[]> roots) {
        double discriminant = b * b - 4 * a * c;
        if (discriminant >= 0) {
            double sqrt = Math.sqrt(discriminant);
            // Avoids cancellation between -b and the root of the discriminant.
            double q = -0.5 * (b + Math.copySign(sqrt, b));
            if (q == 0.0) {
                roots.add(new double[] { 0.0, 0.0 });
                roots.add(new double[] { 0.0, 0.0 });
                return;
            }
            roots.add(new double[] { q / a, 0.0 });
            roots.add(new double[] { c / q, 0.0 });
        } else {
            double re = -b / (2 * a);
            double im = Math.sqrt(-discriminant) / (2 * a);
            roots.add(new double[] { re, -Math.abs(im) });
            roots.add(new double[] { re, Math.abs(im) });
        }
    }

    private List<double[]> durandKerner(double[] coefficients) {
        int n = coefficients.length - 1;
        double lead = coefficients[n];
        double[] monic = new double[n + 1];
        for (int k = 0; k <= n; k++) {
            monic[k] = coefficients[k] / lead;
        }

        double[] re = new double[n];
        double[] im = new double[n];
        // Powers of 0.4+0.9i: distinct starting points off the real axis.
        double seedRe = 0.4;
        double seedIm = 0.9;
        double curRe = 1.0;
        double curIm = 0.0;
        for (int k = 0; k < n; k++) {
            re[k] = curRe;
            im[k] = curIm;
            double nextRe = curRe * seedRe - curIm * seedIm;
            double nextIm = curRe * seedIm + curIm * seedRe;
            curRe = nextRe;
            curIm = nextIm;
        }

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double maxStep = 0.0;
            for (int k = 0; k < n; k++) {
                double[] value = evaluate(monic, re[k], im[k]);
                double denRe = 1.0;
                double denIm = 0.0;
                for (int j = 0; j < n; j++) {
                    if (j == k) {
                        continue;
                    }
                    double dRe = re[k] - re[j];
                    double dIm = im[k] - im[j];
                    double t = denRe * dRe - denIm * dIm;
                    denIm = denRe * dIm + denIm * dRe;
                    denRe = t;
                }
                double norm = denRe * denRe + denIm * denIm;
                if (norm == 0.0) {
                    continue;
                }
                double stepRe = (value[0] * denRe + value[1] * denIm) / norm;
                double stepIm = (value[1] * denRe - value[0] * denIm) / norm;
                re[k] -= stepRe;
                im[k] -= stepIm;
                maxStep = Math.max(maxStep, Math.hypot(stepRe, stepIm));
            }
            if (maxStep < tolerance) {
                break;
            }
        }

        List<double[]> roots = new ArrayList<>();
        for (int k = 0; k < n; k++) {
            roots.add(new double[] { re[k], im[k] });
        }
        return roots;
    }

    /** Horner evaluation at a complex point; coefficients lowest power first. */
    static double[] evaluate(double[] coefficients, double re, double im) {
        double accRe = 0.0;
        double accIm = 0.0;
        for (int k = coefficients.length - 1; k >= 0; k--) {
            double t = accRe * re - accIm * im + coefficients[k];
            accIm = accRe * im + accIm * re;
            accRe = t;
        }
        return new double[] { accRe, accIm };
    }
}
