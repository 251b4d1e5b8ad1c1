/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.hierarchicalforecast.forecast;

import static com.amazon.hierarchicalforecast.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;

public class AutoRegressiveModelTest {

    @Test
    public void testConstantSeries() {
        double[] series = new double[12];
        Arrays.fill(series, 5.0);
        BaseForecast forecast = new AutoRegressiveModel(4).forecast(series, 3);
        assertEquals(BaseForecastMethod.ARIMA, forecast.getMethod());
        assertArrayEquals(new double[] { 5, 5, 5 }, forecast.getPointForecast(), EPSILON);
        assertEquals(0.0, forecast.getResidualVariance(), EPSILON);
        assertEquals(5.0, forecast.getForecast().upper[2], EPSILON);
    }

    @Test
    public void testLinearTrendIsDifferenced() {
        double[] series = new double[12];
        for (int t = 0; t < series.length; t++) {
            series[t] = 3 * t + 2;
        }
        assertEquals(1, AutoRegressiveModel.differencingOrder(series));

        BaseForecast forecast = new AutoRegressiveModel(4).forecast(series, 3);
        assertArrayEquals(new double[] { 38, 41, 44 }, forecast.getPointForecast(), EPSILON);
        double[] residuals = forecast.getResiduals();
        assertTrue(Double.isNaN(residuals[0]));
        for (int t = 1; t < residuals.length; t++) {
            assertEquals(0.0, residuals[t], EPSILON);
        }
    }

    @Test
    public void testAutoregressiveProcess() {
        Random random = new Random(42);
        double[] series = new double[300];
        for (int t = 1; t < series.length; t++) {
            series[t] = -0.5 * series[t - 1] + random.nextGaussian();
        }
        assertEquals(0, AutoRegressiveModel.differencingOrder(series));

        BaseForecast forecast = new AutoRegressiveModel(4).forecast(series, 2);
        double last = series[series.length - 1];
        assertEquals(-0.5 * last, forecast.getPointForecast(0), 0.5);
        assertTrue(forecast.getResidualVariance() < AbstractUnivariateModel.variance(series));
        assertEquals(1.0, forecast.getResidualVariance(), 0.25);
    }

    @Test
    public void testMeanModel() {
        double[] series = { 1, 5, 2, 6, 3, 7 };
        assertEquals(0, AutoRegressiveModel.differencingOrder(series));
        BaseForecast forecast = new AutoRegressiveModel(0).forecast(series, 2);
        assertArrayEquals(new double[] { 4, 4 }, forecast.getPointForecast(), EPSILON);
        assertEquals(-3.0, forecast.getResiduals()[0], EPSILON);
    }

    @Test
    public void testShortSeries() {
        BaseForecast forecast = new AutoRegressiveModel(4).forecast(new double[] { 3, 4 }, 2);
        assertArrayEquals(new double[] { 3.5, 3.5 }, forecast.getPointForecast(), EPSILON);
        assertThrows(IllegalArgumentException.class, () -> new AutoRegressiveModel(-1));
    }
}
