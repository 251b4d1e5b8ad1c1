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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;

public class ExponentialSmoothingModelTest {

    private final ExponentialSmoothingModel model = new ExponentialSmoothingModel(4);

    @Test
    public void testConstantSeries() {
        double[] series = new double[12];
        Arrays.fill(series, 10.0);
        BaseForecast forecast = model.forecast(series, 4);
        assertEquals(BaseForecastMethod.ETS, forecast.getMethod());
        assertArrayEquals(new double[] { 10, 10, 10, 10 }, forecast.getPointForecast(), EPSILON);

        double[] residuals = forecast.getResiduals();
        for (int t = 0; t < 4; t++) {
            assertTrue(Double.isNaN(residuals[t]));
        }
        for (int t = 4; t < 12; t++) {
            assertEquals(0.0, residuals[t], EPSILON);
        }
    }

    @Test
    public void testSeasonalSeries() {
        double[] pattern = { 5, -5, 10, -10 };
        double[] series = new double[16];
        for (int t = 0; t < series.length; t++) {
            series[t] = 50 + pattern[t % 4];
        }
        BaseForecast forecast = model.forecast(series, 6);
        assertArrayEquals(new double[] { 55, 45, 60, 40, 55, 45 }, forecast.getPointForecast(), EPSILON);
    }

    @Test
    public void testTrendWithoutFullSeasons() {
        // six observations are fewer than two seasons, so the trend model is used
        double[] series = { 1, 3, 5, 7, 9, 11 };
        BaseForecast forecast = model.forecast(series, 3);
        assertArrayEquals(new double[] { 13, 15, 17 }, forecast.getPointForecast(), EPSILON);
        assertTrue(Double.isNaN(forecast.getResiduals()[0]));
        assertEquals(0.0, forecast.getResidualVariance(), EPSILON);
    }

    @Test
    public void testShortSeries() {
        BaseForecast single = model.forecast(new double[] { 7 }, 2);
        assertArrayEquals(new double[] { 7, 7 }, single.getPointForecast(), EPSILON);

        BaseForecast pair = model.forecast(new double[] { 4, 6 }, 1);
        // simple smoothing, the level lies between the two observations
        assertTrue(pair.getPointForecast(0) > 4 && pair.getPointForecast(0) < 6);
    }

    @Test
    public void testNonSeasonalFrequency() {
        ExponentialSmoothingModel annual = new ExponentialSmoothingModel(1);
        double[] series = { 2, 4, 6, 8, 10, 12, 14, 16, 18 };
        assertArrayEquals(new double[] { 20, 22 }, annual.forecast(series, 2).getPointForecast(), EPSILON);
    }
}
