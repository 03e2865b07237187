package com.driftmonitor.core;

import com.driftmonitor.config.MonitoringSettings;

import java.time.Clock;
import java.util.Arrays;

/**
 * Two-sample Kolmogorov-Smirnov test with the asymptotic Kolmogorov distribution for the
 * p-value (Stephens' small-sample correction applied to the effective sample size).
 */
public class KolmogorovSmirnovDetector extends AbstractDriftDetector {

    public static final String NAME = "ks_test";

    private static final int MAX_TERMS = 100;
    private static final double RELATIVE_TERM_EPS = 0.001;
    private static final double ABSOLUTE_SUM_EPS = 1.0e-8;

    public KolmogorovSmirnovDetector(MonitoringSettings settings, Clock clock) {
        super(settings, clock);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Score score(double[] reference, double[] current) {
        double d = statistic(reference, current);
        return new Score(d, pValue(d, reference.length, current.length));
    }

    /** Largest vertical distance between the two empirical CDFs. */
    static double statistic(double[] first, double[] second) {
        double[] a = first.clone();
        double[] b = second.clone();
        Arrays.sort(a);
        Arrays.sort(b);
        int n1 = a.length;
        int n2 = b.length;
        int i = 0;
        int j = 0;
        double d = 0.0;
        while (i < n1 && j < n2) {
            double x = Math.min(a[i], b[j]);
            while (i < n1 && a[i] <= x) {
                i++;
            }
            while (j < n2 && b[j] <= x) {
                j++;
            }
            d = Math.max(d, Math.abs((double) i / n1 - (double) j / n2));
        }
        return d;
    }

    static double pValue(double d, int n1, int n2) {
        double en = Math.sqrt((double) n1 * n2 / (n1 + n2));
        return kolmogorovTail((en + 0.12 + 0.11 / en) * d);
    }

    /** Q_KS(lambda) = 2 * sum_{j>=1} (-1)^(j-1) exp(-2 j^2 lambda^2); 1 when the series does not settle. */
    static double kolmogorovTail(double lambda) {
        double a2 = -2.0 * lambda * lambda;
        double fac = 2.0;
        double sum = 0.0;
        double previous = 0.0;
        for (int j = 1; j <= MAX_TERMS; j++) {
            double term = fac * Math.exp(a2 * j * j);
            sum += term;
            if (Math.abs(term) <= RELATIVE_TERM_EPS * previous || Math.abs(term) <= ABSOLUTE_SUM_EPS * sum) {
                return Math.max(0.0, Math.min(1.0, sum));
            }
            fac = -fac;
            previous = Math.abs(term);
        }
        return 1.0;
    }
}
