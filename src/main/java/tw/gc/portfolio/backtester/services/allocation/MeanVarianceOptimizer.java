package tw.gc.portfolio.backtester.services.allocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.joptimizer.functions.ConvexMultivariateRealFunction;
import com.joptimizer.functions.LinearMultivariateRealFunction;
import com.joptimizer.functions.PDQuadraticMultivariateRealFunction;
import com.joptimizer.optimizers.JOptimizer;
import com.joptimizer.optimizers.OptimizationRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.springframework.stereotype.Component;

import tw.gc.portfolio.backtester.config.BacktestConfig;
import tw.gc.portfolio.backtester.enums.AllocationMethod;
import tw.gc.portfolio.backtester.enums.StrategyType;
import tw.gc.portfolio.backtester.enums.WarningCode;
import tw.gc.portfolio.backtester.exceptions.OptimizationDidNotConvergeException;
import tw.gc.portfolio.backtester.exceptions.SingularCovarianceException;
import tw.gc.portfolio.backtester.model.AllocationWarning;
import tw.gc.portfolio.backtester.model.EstimatedParameters;
import tw.gc.portfolio.backtester.model.PortfolioWeights;
import tw.gc.portfolio.backtester.model.WeightBounds;

/**
 * Markowitz maximum-Sharpe portfolio under budget and box constraints.
 *
 * <p>Maximizing (w·μ − r_f) / sqrt(wᵀΣw) over {Σw = 1, min ≤ w_i ≤ max} is solved as the
 * equivalent convex quadratic program in y = w / κ:
 * <pre>
 *   minimize   yᵀΣy
 *   subject to (μ − r_f)ᵀy = 1
 *              min·Σy − y_i ≤ 0,   y_i − max·Σy ≤ 0
 * </pre>
 * and w = y / Σy. The QP is handed to JOptimizer's primal-dual interior-point method; its answer
 * is verified against the negative-Sharpe objective before being accepted.
 *
 * <p>Fallback chain, each step reported as a degraded result:
 * <ol>
 *   <li>optimizer failure → analytical tangency w ∝ Σ⁻¹(μ − r_f), clipped and renormalized</li>
 *   <li>singular Σ or non-positive tangency denominator → equal weight</li>
 * </ol>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MeanVarianceOptimizer implements PortfolioAllocator {

    /** Relative ridge added to the QP diagonal so the quadratic form is strictly positive definite */
    private static final double RIDGE = 1e-12;

    /** Feasibility slack accepted on the normalized optimizer solution before projection */
    private static final double SOLUTION_BOUND_SLACK = 1e-4;

    private static final double SINGULARITY_THRESHOLD = 1e-11;

    private final EqualWeightAllocator equalWeightAllocator;

    @Override
    public StrategyType strategyType() {
        return StrategyType.MEAN_VARIANCE;
    }

    @Override
    public AllocationResult allocate(AllocationRequest request) {
        EstimatedParameters params = request.requireParameters();
        BacktestConfig config = request.config();
        config.weightBounds().requireFeasibleFor(request.assetCount());

        List<AllocationWarning> warnings = new ArrayList<>(params.warnings());
        try {
            double[] weights = solveMaxSharpe(params, config);
            return result(params, weights, AllocationMethod.MAX_SHARPE_OPTIMIZER, warnings);
        } catch (OptimizationDidNotConvergeException e) {
            log.warn("⚠️ Max-Sharpe optimizer failed for window ending {}: {}", params.windowEnd(), e.getMessage());
            warnings.add(AllocationWarning.of(WarningCode.OPTIMIZATION_DID_NOT_CONVERGE, e.getMessage()));
            return tangencyOrEqualWeight(params, config.weightBounds(), warnings);
        }
    }

    @Override
    public AllocationResult fallback(AllocationRequest request, AllocationWarning reason) {
        List<AllocationWarning> warnings = new ArrayList<>();
        warnings.add(reason);
        if (request.parameters() == null) {
            return equalWeightResult(request.assets(), Double.NaN, warnings);
        }
        warnings.addAll(request.parameters().warnings());
        return tangencyOrEqualWeight(request.parameters(), request.config().weightBounds(), warnings);
    }

    /**
     * Solves the max-Sharpe QP.
     *
     * @return weights satisfying the budget and the bounds
     * @throws OptimizationDidNotConvergeException if the problem is infeasible, the solver fails or
     *                                             the solution does not beat the equal-weight start
     */
    double[] solveMaxSharpe(EstimatedParameters params, BacktestConfig config) {
        WeightBounds bounds = config.weightBounds();
        int n = params.assetCount();
        double[] excess = params.excessReturns();
        double[][] covariance = params.covariance();

        double bestExcess = maxAttainableExcess(excess, bounds);
        if (!(bestExcess > 0.0)) {
            throw new OptimizationDidNotConvergeException(
                "No portfolio within bounds %s earns more than the risk-free rate %.4f"
                    .formatted(bounds.describe(), params.riskFreeRate()));
        }

        double trace = 0.0;
        for (int i = 0; i < n; i++) {
            trace += covariance[i][i];
        }
        double ridge = RIDGE * Math.max(trace / n, 1e-12);
        double[][] p = new double[n][n];
        for (int i = 0; i < n; i++) {
            p[i] = covariance[i].clone();
            p[i][i] += ridge;
        }
        PDQuadraticMultivariateRealFunction objective = new PDQuadraticMultivariateRealFunction(p, null, 0);

        // (μ − r_f)ᵀy = 1 fixes the scale of y
        double[][] a = new double[][] {excess};
        double[] b = new double[] {1.0};

        boolean upperBinding = bounds.isUpperBinding();
        ConvexMultivariateRealFunction[] inequalities = new ConvexMultivariateRealFunction[upperBinding ? 2 * n : n];
        for (int i = 0; i < n; i++) {
            double[] lower = new double[n];
            Arrays.fill(lower, bounds.min());
            lower[i] -= 1.0;
            inequalities[i] = new LinearMultivariateRealFunction(lower, 0);
            if (upperBinding) {
                double[] upper = new double[n];
                Arrays.fill(upper, -bounds.max());
                upper[i] += 1.0;
                inequalities[i + n] = new LinearMultivariateRealFunction(upper, 0);
            }
        }

        OptimizationRequest or = new OptimizationRequest();
        or.setF0(objective);
        or.setA(a);
        or.setB(b);
        or.setFi(inequalities);
        or.setToleranceFeas(config.meanVarianceTolerance());
        or.setTolerance(config.meanVarianceTolerance());
        or.setMaxIteration(config.meanVarianceMaxIterations());

        double[] equalWeights = new double[n];
        Arrays.fill(equalWeights, 1.0 / n);
        double equalExcess = dot(excess, equalWeights);
        double equalWeight = 1.0 / n;
        if (equalExcess > 0.0 && bounds.min() < equalWeight && (equalWeight < bounds.max() || !upperBinding)) {
            double[] guess = new double[n];
            for (int i = 0; i < n; i++) {
                guess[i] = equalWeights[i] / equalExcess;
            }
            or.setInitialPoint(guess);
        }

        double[] y;
        try {
            JOptimizer opt = new JOptimizer();
            opt.setOptimizationRequest(or);
            opt.optimize();
            y = opt.getOptimizationResponse().getSolution();
        } catch (Exception e) {
            throw new OptimizationDidNotConvergeException("Interior-point solver failed: " + e.getMessage(), e);
        }
        return verify(y, params, bounds, equalWeights);
    }

    private double[] verify(double[] y, EstimatedParameters params, WeightBounds bounds, double[] equalWeights) {
        if (y == null || y.length != params.assetCount()) {
            throw new OptimizationDidNotConvergeException("Solver returned no solution");
        }
        double sum = 0.0;
        for (double v : y) {
            if (!Double.isFinite(v)) {
                throw new OptimizationDidNotConvergeException("Solver returned a non-finite solution");
            }
            sum += v;
        }
        if (!(sum > 0.0)) {
            throw new OptimizationDidNotConvergeException("Solver returned a non-positive scale " + sum);
        }
        double[] raw = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            raw[i] = y[i] / sum;
            if (raw[i] < bounds.min() - SOLUTION_BOUND_SLACK || raw[i] > bounds.max() + SOLUTION_BOUND_SLACK) {
                throw new OptimizationDidNotConvergeException("Solver solution violates bounds: w[%d]=%.6f"
                    .formatted(i, raw[i]));
            }
        }
        double[] weights = BoxConstraints.enforce(raw, bounds);

        NegativeSharpeObjective objective = new NegativeSharpeObjective(
            params.expectedReturns(), params.covariance(), params.riskFreeRate());
        double solved = objective.value(weights);
        double start = objective.value(equalWeights);
        if (solved > start + 1e-6 * Math.max(1.0, Math.abs(start))) {
            throw new OptimizationDidNotConvergeException(
                "Solution Sharpe %.6f is worse than the equal-weight start %.6f".formatted(-solved, -start));
        }
        return weights;
    }

    /**
     * Largest (μ − r_f)·w over the bounded simplex: fill the best assets first.
     */
    static double maxAttainableExcess(double[] excess, WeightBounds bounds) {
        int n = excess.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (x, y) -> Double.compare(excess[y], excess[x]));
        double remaining = 1.0 - n * bounds.min();
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            total += bounds.min() * excess[i];
        }
        for (Integer index : order) {
            double add = Math.min(bounds.max() - bounds.min(), Math.max(remaining, 0.0));
            total += add * excess[index];
            remaining -= add;
        }
        return total;
    }

    /**
     * Σ⁻¹(μ − r_f), unnormalized.
     *
     * @throws SingularCovarianceException if Σ cannot be inverted
     */
    double[] tangencyDirection(EstimatedParameters params) {
        DecompositionSolver solver = new LUDecomposition(
            new Array2DRowRealMatrix(params.covariance(), false), SINGULARITY_THRESHOLD).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularCovarianceException("Covariance matrix of window ending %s is singular"
                .formatted(params.windowEnd()));
        }
        return solver.solve(new ArrayRealVector(params.excessReturns(), false)).toArray();
    }

    private AllocationResult tangencyOrEqualWeight(EstimatedParameters params, WeightBounds bounds,
                                                   List<AllocationWarning> warnings) {
        double[] direction;
        try {
            direction = tangencyDirection(params);
        } catch (SingularCovarianceException e) {
            log.warn("⚠️ {}; falling back to equal weight", e.getMessage());
            warnings.add(AllocationWarning.of(WarningCode.SINGULAR_COVARIANCE, e.getMessage()));
            return equalWeightResult(params, warnings);
        }

        double denominator = 0.0;
        for (double z : direction) {
            denominator += z;
        }
        if (!(denominator > 0.0) || !Double.isFinite(denominator)) {
            String message = "Tangency denominator 1ᵀΣ⁻¹(μ − r_f) = %.6g is not positive".formatted(denominator);
            log.warn("⚠️ {}; falling back to equal weight", message);
            warnings.add(AllocationWarning.of(WarningCode.NON_POSITIVE_TANGENCY_DENOMINATOR, message));
            return equalWeightResult(params, warnings);
        }

        double[] tangency = new double[direction.length];
        for (int i = 0; i < direction.length; i++) {
            tangency[i] = direction[i] / denominator;
        }
        double[] weights = BoxConstraints.enforce(tangency, bounds);
        log.info("Mean-variance window ending {} uses the analytical tangency portfolio", params.windowEnd());
        return result(params, weights, AllocationMethod.ANALYTICAL_TANGENCY, warnings);
    }

    private MeanVarianceResult equalWeightResult(EstimatedParameters params, List<AllocationWarning> warnings) {
        PortfolioWeights weights = equalWeightAllocator.weights(params.assets());
        return result(params, weights.toArray(), AllocationMethod.EQUAL_WEIGHT_FALLBACK, warnings);
    }

    private MeanVarianceResult equalWeightResult(List<String> assets, double riskFreeRate,
                                                 List<AllocationWarning> warnings) {
        return new MeanVarianceResult(equalWeightAllocator.weights(assets),
            AllocationDiagnostics.of(AllocationMethod.EQUAL_WEIGHT_FALLBACK, warnings),
            Double.NaN, Double.NaN, Double.NaN, riskFreeRate);
    }

    private MeanVarianceResult result(EstimatedParameters params, double[] weights, AllocationMethod method,
                                      List<AllocationWarning> warnings) {
        NegativeSharpeObjective objective = new NegativeSharpeObjective(
            params.expectedReturns(), params.covariance(), params.riskFreeRate());
        return new MeanVarianceResult(
            PortfolioWeights.of(params.assets(), weights),
            AllocationDiagnostics.of(method, warnings),
            objective.expectedReturn(weights),
            objective.volatility(weights),
            objective.sharpe(weights),
            params.riskFreeRate()
        );
    }

    private static double dot(double[] x, double[] y) {
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            sum += x[i] * y[i];
        }
        return sum;
    }
}
