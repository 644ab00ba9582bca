package com.ridershipforecast.forecasting;

import com.ridershipforecast.exception.ConvergenceException;
import com.ridershipforecast.exception.InsufficientDataException;
import com.ridershipforecast.model.FittedModel;
import com.ridershipforecast.model.SeasonalOrder;
import com.ridershipforecast.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

import java.util.Arrays;

/**
 * Conditional maximum-likelihood estimation of seasonal ARIMA models.
 * <p>
 * The series is differenced by the order, centred on its sample mean when no differencing
 * applies, and the Gaussian likelihood conditional on the first {@code p + mP} values is
 * maximised. That is the same as minimising the conditional sum of squared innovations,
 * which a Nelder-Mead simplex does over {@code atanh} of the coefficients so every AR and MA
 * coefficient stays inside {@code (-1, 1)}.
 */
@Slf4j
public class SarimaFitter {

    private static final double RELATIVE_TOLERANCE = 1e-8;
    private static final double ABSOLUTE_TOLERANCE = 1e-10;
    private static final double INITIAL_STEP = 0.5;
    private static final double PENALTY = Double.MAX_VALUE;
    private static final double VARIANCE_FLOOR = 1e-12;

    private final FittingSettings settings;

    public SarimaFitter(FittingSettings settings) {
        this.settings = settings;
    }

    public FittedModel fit(TimeSeries series, SeasonalOrder order) {
        int n = series.size();
        if (n < settings.minObservations()) {
            throw new InsufficientDataException(series.service(), n, settings.minObservations());
        }
        double[] w = Differencing.apply(series.values(), order);
        int conditioning = order.p() + order.seasonalP() * order.period();
        int parameters = order.armaParameterCount();
        int effective = w.length - conditioning;
        if (effective <= parameters + 1) {
            throw new InsufficientDataException(series.service(), n,
                n - effective + parameters + 2);
        }

        boolean includeMean = order.differencingLoss() == 0;
        double mean = includeMean ? Differencing.mean(w) : 0.0;
        double[] x = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            x[i] = w[i] - mean;
        }

        double[] coefficients;
        int iterations;
        if (parameters == 0) {
            coefficients = new double[0];
            iterations = 0;
        } else {
            SimplexOptimizer optimizer = new SimplexOptimizer(
                new SimpleValueChecker(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE));
            try {
                PointValuePair optimum = optimizer.optimize(
                    new MaxEval(settings.maxEvaluations()),
                    new MaxIter(settings.maxIterations()),
                    new ObjectiveFunction(u -> objective(order, x, constrain(u))),
                    GoalType.MINIMIZE,
                    new InitialGuess(new double[parameters]),
                    new NelderMeadSimplex(parameters, INITIAL_STEP));
                coefficients = constrain(optimum.getPoint());
                iterations = optimizer.getIterations();
            } catch (TooManyEvaluationsException | TooManyIterationsException e) {
                throw new ConvergenceException(order, "optimizer budget of " + settings.maxIterations()
                    + " iterations / " + settings.maxEvaluations() + " evaluations exhausted", e);
            }
        }

        double sumOfSquares = SarimaProcess.of(order, coefficients).sumOfSquares(x);
        if (!Double.isFinite(sumOfSquares)) {
            throw new ConvergenceException(order, "sum of squared innovations is not finite");
        }
        double variance = sumOfSquares / effective;
        double logLikelihood = -0.5 * effective * (Math.log(2.0 * Math.PI * Math.max(variance, VARIANCE_FLOOR)) + 1.0);
        int estimated = parameters + (includeMean ? 1 : 0) + 1;
        double aic = -2.0 * logLikelihood + 2.0 * estimated;

        int p = order.p();
        int q = order.q();
        int sp = order.seasonalP();
        FittedModel model = FittedModel.builder()
            .order(order)
            .trainingSeries(series)
            .arCoefficients(Arrays.copyOfRange(coefficients, 0, p))
            .maCoefficients(Arrays.copyOfRange(coefficients, p, p + q))
            .seasonalArCoefficients(Arrays.copyOfRange(coefficients, p + q, p + q + sp))
            .seasonalMaCoefficients(Arrays.copyOfRange(coefficients, p + q + sp, parameters))
            .mean(mean)
            .innovationVariance(variance)
            .logLikelihood(logLikelihood)
            .aic(aic)
            .iterations(iterations)
            .build();
        log.debug("Model fitted | service={} | order={} | sigma2={} | aic={} | iterations={}",
            series.service(), order, variance, aic, iterations);
        return model;
    }

    private static double objective(SeasonalOrder order, double[] x, double[] coefficients) {
        double value = SarimaProcess.of(order, coefficients).sumOfSquares(x);
        return Double.isFinite(value) ? value : PENALTY;
    }

    static double[] constrain(double[] unconstrained) {
        double[] out = new double[unconstrained.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.tanh(unconstrained[i]);
        }
        return out;
    }
}
