/* Copyright (C) 2013-2023 TU Dortmund
 * This file is part of LearnLib, http://www.learnlib.de/.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.dpnlearn.api.util;

import java.util.Arrays;
import java.util.Collection;

/**
 * Order statistics over finite samples. Quantiles interpolate linearly between the two closest order statistics.
 */
public final class Quantiles {

    private Quantiles() {
        // prevent instantiation
    }

    public static double[] sorted(Collection<Double> values) {
        double[] result = new double[values.size()];
        int i = 0;
        for (Double v : values) {
            result[i++] = v;
        }
        Arrays.sort(result);
        return result;
    }

    /**
     * Computes the {@code q}-quantile of an already sorted, non-empty sample.
     *
     * @param sorted
     *         the ascending sample
     * @param q
     *         the quantile in {@code [0, 1]}
     *
     * @return the interpolated quantile
     */
    public static double quantile(double[] sorted, double q) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Quantile of an empty sample");
        }
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("Quantile out of range: " + q);
        }
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        double frac = pos - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    public static double[] quantiles(double[] sorted, double... qs) {
        double[] result = new double[qs.length];
        for (int i = 0; i < qs.length; i++) {
            result[i] = quantile(sorted, qs[i]);
        }
        return result;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Mean of an empty sample");
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
