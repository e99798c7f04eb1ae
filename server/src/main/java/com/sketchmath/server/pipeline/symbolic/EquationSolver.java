package com.sketchmath.server.pipeline.symbolic;

import com.sketchmath.util.NumberText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Solves an equation by moving everything to one side, folding it into a
 * rational function and finding the zeros of the numerator that do not also
 * zero the denominator.
 */
final class EquationSolver {

    private static final Logger logger = LoggerFactory.getLogger(EquationSolver.class);

    private static final double DUPLICATE_ROOT_DISTANCE = 1e-7;
    private static final double POLE_TOLERANCE = 1e-9;

    private final RationalFunctionConverter converter;
    private final PolynomialRootFinder rootFinder;
    private final int significantDigits;

    EquationSolver(NumericEvaluator evaluator, int maxIterations, double tolerance, int significantDigits) {
        this.converter = new RationalFunctionConverter(evaluator);
        this.rootFinder = new PolynomialRootFinder(maxIterations, tolerance);
        this.significantDigits = significantDigits;
    }

    List<Solution> solve(Equation equation) {
        if (equation.freeSymbols().isEmpty()) {
            return Collections.emptyList();
        }
        RationalFunction difference = converter.convert(equation.getLeft())
                .subtract(converter.convert(equation.getRight()));
        Polynomial numerator = difference.numerator();
        Set<String> unknowns = numerator.symbols();
        logger.debug("Numerator of {}: {}", equation, numerator);

        if (unknowns.isEmpty()) {
            // Identity or contradiction: nothing to report.
            return Collections.emptyList();
        }
        if (unknowns.size() == 1) {
            String unknown = unknowns.iterator().next();
            return solveUnivariate(unknown, numerator, difference.denominator());
        }
        return solveLinearForFirst(unknowns, numerator);
    }

    private List<Solution> solveUnivariate(String unknown, Polynomial numerator, Polynomial denominator) {
        double[] coefficients = numerator.univariateCoefficients(unknown);
        List<double[]> roots = rootFinder.findRoots(coefficients);

        double[] poleCoefficients = denominator.symbols().isEmpty() || denominator.symbols().equals(Set.of(unknown))
                ? denominator.univariateCoefficients(unknown)
                : null;

        List<double[]> kept = new ArrayList<>();
        for (double[] root : roots) {
            if (poleCoefficients != null && isPole(poleCoefficients, root)) {
                logger.debug("Dropping root {}{}i: zero of the denominator", root[0], root[1]);
                continue;
            }
            if (!containsClose(kept, root)) {
                kept.add(root);
            }
        }
        kept.sort(rootOrder());

        List<Solution> solutions = new ArrayList<>();
        for (double[] root : kept) {
            solutions.add(Solution.value(NumberText.formatComplex(root[0], root[1], significantDigits)));
        }
        return solutions;
    }

    private List<Solution> solveLinearForFirst(Set<String> unknowns, Polynomial numerator) {
        for (String unknown : unknowns) {
            if (numerator.degreeIn(unknown) != 1) {
                continue;
            }
            List<Polynomial> parts = numerator.coefficientsIn(unknown);
            Polynomial slope = parts.get(1);
            Polynomial offset = parts.get(0);
            String value;
            if (slope.isConstant()) {
                value = offset.scale(-1.0 / slope.constantValue()).render(significantDigits);
            } else {
                value = "-(" + offset.render(significantDigits) + ")/(" + slope.render(significantDigits) + ")";
            }
            return Collections.singletonList(Solution.assignment(unknown, value));
        }
        throw new UnsolvableEquationException("cannot solve a non-linear equation in several unknowns "
                + unknowns);
    }

    private static boolean isPole(double[] denominator, double[] root) {
        double[] value = PolynomialRootFinder.evaluate(denominator, root[0], root[1]);
        double scale = 0.0;
        double magnitude = Math.hypot(root[0], root[1]);
        double power = 1.0;
        for (double c : denominator) {
            scale += Math.abs(c) * power;
            power *= Math.max(1.0, magnitude);
        }
        return Math.hypot(value[0], value[1]) <= POLE_TOLERANCE * Math.max(1.0, scale);
    }

    private static boolean containsClose(List<double[]> roots, double[] candidate) {
        for (double[] root : roots) {
            double distance = Math.hypot(root[0] - candidate[0], root[1] - candidate[1]);
            if (distance <= DUPLICATE_ROOT_DISTANCE * Math.max(1.0, Math.hypot(root[0], root[1]))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isReal(double[] root) {
        return Math.abs(root[1]) <= 1e-9 * Math.max(1.0, Math.abs(root[0]));
    }

    /** Real roots ascending, then complex roots by real then imaginary part. */
    private static Comparator<double[]> rootOrder() {
        return (a, b) -> {
            boolean realA = isReal(a);
            boolean realB = isReal(b);
            if (realA != realB) {
                return realA ? -1 : 1;
            }
            int byRe = Double.compare(a[0], b[0]);
            return byRe != 0 ? byRe : Double.compare(a[1], b[1]);
        };
    }
}
