package com.formative.fit;

import com.formative.api.FittingException;
import com.formative.data.Dataset;

import java.util.*;

import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link FittingBackend} on top of Apache Commons Math.
 *
 * <p>
 * Small dense designs only: normal equations solved by LU decomposition,
 * Student-t inference with {@code n - k} degrees of freedom, logit by
 * iteratively reweighted least squares. Stateless and safe to share across
 * threads.
 */
public final class CommonsMathBackend implements FittingBackend {
    private static final Logger log = LogManager.getLogger(CommonsMathBackend.class);

    public static final CommonsMathBackend INSTANCE = new CommonsMathBackend();

    private static final double CONFIDENCE = 0.95;
    private static final int LOGIT_MAX_ITERATIONS = 100;
    private static final double LOGIT_TOLERANCE = 1e-8;

    @Override
    public RegressionResult ols(Dataset data, String outcome, List<String> regressors) {
        RealMatrix x = design(data, regressors);
        RealVector y = new ArrayRealVector(data.column(outcome), false);
        int dof = residualDof(x);

        RealMatrix xtxInv = inverse(x.transpose().multiply(x), "OLS design for " + outcome);
        RealVector beta = xtxInv.operate(x.transpose().operate(y));
        RealVector resid = y.subtract(x.operate(beta));
        double rss = resid.dotProduct(resid);
        return tabulate(names(regressors), beta, xtxInv.scalarMultiply(rss / dof), dof, rss);
    }

    @Override
    public double[] logit(Dataset data, String treatment, List<String> covariates) {
        RealMatrix x = design(data, covariates);
        double[] y = data.column(treatment);
        int n = x.getRowDimension(), k = x.getColumnDimension();
        RealVector beta = new ArrayRealVector(k);

        for (int iter = 0; iter < LOGIT_MAX_ITERATIONS; iter++) {
            double[] p = probabilities(x, beta);
            RealMatrix hessian = new Array2DRowRealMatrix(k, k);
            RealVector gradient = new ArrayRealVector(k);
            for (int i = 0; i < n; i++) {
                double w = p[i] * (1.0 - p[i]);
                double r = y[i] - p[i];
                for (int a = 0; a < k; a++) {
                    double xa = x.getEntry(i, a);
                    gradient.addToEntry(a, xa * r);
                    for (int b = 0; b < k; b++)
                        hessian.addToEntry(a, b, w * xa * x.getEntry(i, b));
                }
            }
            RealVector delta = solver(hessian, "logit information matrix for " + treatment).solve(gradient);
            beta = beta.add(delta);
            if (!isFinite(beta))
                throw new FittingException("Logit for '" + treatment + "' diverged (perfect separation?)");
            if (delta.getLInfNorm() < LOGIT_TOLERANCE) {
                log.debug("Logit for {} converged after {} iterations", treatment, iter + 1);
                return probabilities(x, beta);
            }
        }
        throw new FittingException("Logit for '" + treatment + "' did not converge in "
                + LOGIT_MAX_ITERATIONS + " iterations");
    }

    @Override
    public RegressionResult twoStageLeastSquares(Dataset data, String outcome, String endogenous,
            String instrument, List<String> controls) {
        List<String> exog = new ArrayList<>();
        exog.add(endogenous);
        exog.addAll(controls);
        List<String> inst = new ArrayList<>();
        inst.add(instrument);
        inst.addAll(controls);

        RealMatrix x = design(data, exog);
        RealMatrix z = design(data, inst);
        RealVector y = new ArrayRealVector(data.column(outcome), false);
        int dof = residualDof(x);

        // Stage 1: project the exogenous design onto the instrument space.
        RealMatrix ztzInv = inverse(z.transpose().multiply(z), "2SLS instrument matrix");
        RealMatrix xHat = z.multiply(ztzInv).multiply(z.transpose().multiply(x));

        // Stage 2: regress the outcome on the projection; residuals use the original design.
        RealMatrix xhxhInv = inverse(xHat.transpose().multiply(xHat), "2SLS second stage");
        RealVector beta = xhxhInv.operate(xHat.transpose().operate(y));
        RealVector resid = y.subtract(x.operate(beta));
        double rss = resid.dotProduct(resid);
        return tabulate(names(exog), beta, xhxhInv.scalarMultiply(rss / dof), dof, rss);
    }

    @Override
    public double firstStageF(Dataset data, String treatment, String instrument, List<String> controls) {
        List<String> regressors = new ArrayList<>();
        regressors.add(instrument);
        regressors.addAll(controls);
        Coefficient c = ols(data, treatment, regressors).coefficient(instrument);
        // Single linear restriction: the Wald F equals the squared t statistic.
        double t = c.estimate() / c.stdErr();
        return t * t;
    }

    @Override
    public double nearestNeighbourAtt(double[] treatment, double[] outcome, double[] propensity) {
        List<Integer> treated = new ArrayList<>();
        List<Integer> control = new ArrayList<>();
        for (int i = 0; i < treatment.length; i++) {
            if (treatment[i] == 1.0)
                treated.add(i);
            else if (treatment[i] == 0.0)
                control.add(i);
        }
        if (treated.isEmpty() || control.isEmpty())
            throw new FittingException("Sample must contain both treated and control units.");

        // Controls sorted by score; ties keep original row order.
        Integer[] sorted = control.toArray(new Integer[0]);
        Arrays.sort(sorted, Comparator.comparingDouble(i -> propensity[i]));
        double[] scores = new double[sorted.length];
        for (int j = 0; j < sorted.length; j++)
            scores[j] = propensity[sorted[j]];

        double sum = 0;
        for (int t : treated) {
            int match = sorted[nearest(scores, propensity[t])];
            sum += outcome[t] - outcome[match];
        }
        return sum / treated.size();
    }

    // ── Internals ───────────────────────────────────────────────

    private static int nearest(double[] sortedScores, double target) {
        int pos = Arrays.binarySearch(sortedScores, target);
        if (pos >= 0) {
            while (pos > 0 && sortedScores[pos - 1] == target)
                pos--;
            return pos;
        }
        int ins = -pos - 1;
        if (ins == 0)
            return 0;
        if (ins == sortedScores.length)
            return sortedScores.length - 1;
        return (target - sortedScores[ins - 1]) <= (sortedScores[ins] - target) ? ins - 1 : ins;
    }

    private static RealMatrix design(Dataset data, List<String> regressors) {
        int n = data.rowCount(), k = regressors.size() + 1;
        double[][] m = new double[n][k];
        for (int i = 0; i < n; i++)
            m[i][0] = 1.0;
        for (int j = 0; j < regressors.size(); j++) {
            double[] col = data.column(regressors.get(j));
            for (int i = 0; i < n; i++)
                m[i][j + 1] = col[i];
        }
        return new Array2DRowRealMatrix(m, false);
    }

    private static List<String> names(List<String> regressors) {
        List<String> names = new ArrayList<>(regressors.size() + 1);
        names.add(INTERCEPT);
        names.addAll(regressors);
        return names;
    }

    private static int residualDof(RealMatrix x) {
        int dof = x.getRowDimension() - x.getColumnDimension();
        if (dof <= 0)
            throw new FittingException("No residual degrees of freedom: " + x.getRowDimension()
                    + " rows for " + x.getColumnDimension() + " parameters");
        return dof;
    }

    private static DecompositionSolver solver(RealMatrix m, String what) {
        DecompositionSolver solver = new LUDecomposition(m).getSolver();
        if (!solver.isNonSingular())
            throw new FittingException("Singular " + what + " (collinear or constant regressors?)");
        return solver;
    }

    private static RealMatrix inverse(RealMatrix m, String what) {
        return solver(m, what).getInverse();
    }

    private static double[] probabilities(RealMatrix x, RealVector beta) {
        RealVector eta = x.operate(beta);
        double[] p = new double[eta.getDimension()];
        for (int i = 0; i < p.length; i++)
            p[i] = 1.0 / (1.0 + Math.exp(-eta.getEntry(i)));
        return p;
    }

    private static boolean isFinite(RealVector v) {
        for (int i = 0; i < v.getDimension(); i++)
            if (!Double.isFinite(v.getEntry(i)))
                return false;
        return true;
    }

    private static RegressionResult tabulate(List<String> names, RealVector beta, RealMatrix cov, int dof,
            double rss) {
        TDistribution t = new TDistribution(dof);
        double critical = t.inverseCumulativeProbability(0.5 + CONFIDENCE / 2);
        Map<String, Coefficient> out = new LinkedHashMap<>(names.size() * 2);
        for (int j = 0; j < names.size(); j++) {
            double est = beta.getEntry(j);
            double se = Math.sqrt(Math.max(cov.getEntry(j, j), 0.0));
            double p = 2.0 * t.cumulativeProbability(-Math.abs(est / se));
            var ci = new ConfidenceInterval(est - critical * se, est + critical * se);
            out.put(names.get(j), new Coefficient(est, se, ci, Double.isNaN(p) ? 1.0 : p));
        }
        return new RegressionResult(out, dof, rss);
    }
}
