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

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import com.amazon.hierarchicalforecast.config.BaseForecastMethod;
import com.amazon.hierarchicalforecast.config.ForecastConfig;
import com.amazon.hierarchicalforecast.errors.UnsupportedMethodException;
import com.amazon.hierarchicalforecast.returntypes.BaseForecast;

/**
 * The default {@link IBaseForecaster}: dispatches every call to the model
 * registered for the requested method. Models are fitted afresh on every call,
 * so a single adapter can be shared by all worker threads.
 */
public class BaseForecastAdapter implements IBaseForecaster {

    public static final int DEFAULT_MAX_AUTOREGRESSIVE_ORDER = 4;

    private final Map<BaseForecastMethod, IUnivariateModel> models;

    public BaseForecastAdapter(int frequency) {
        this(frequency, AbstractUnivariateModel.DEFAULT_INTERVAL_LEVEL);
    }

    public BaseForecastAdapter(int frequency, double intervalLevel) {
        checkArgument(frequency > 0, "frequency must be positive");
        models = new EnumMap<>(BaseForecastMethod.class);
        models.put(BaseForecastMethod.RANDOM_WALK, new RandomWalkModel(intervalLevel));
        models.put(BaseForecastMethod.ETS, new ExponentialSmoothingModel(frequency, intervalLevel));
        models.put(BaseForecastMethod.ARIMA, new AutoRegressiveModel(DEFAULT_MAX_AUTOREGRESSIVE_ORDER, intervalLevel));
    }

    /**
     * @param models the models to dispatch to; methods without a model are
     *               unsupported
     */
    public BaseForecastAdapter(Map<BaseForecastMethod, ? extends IUnivariateModel> models) {
        checkNotNull(models, "models must not be null");
        this.models = new EnumMap<>(BaseForecastMethod.class);
        models.forEach((method, model) -> {
            checkNotNull(model, "model for " + method + " must not be null");
            checkArgument(model.getMethod() == method, "model registered under " + method + " implements "
                    + model.getMethod());
            this.models.put(method, model);
        });
    }

    public static BaseForecastAdapter fromConfig(ForecastConfig config) {
        checkNotNull(config, "config must not be null");
        return new BaseForecastAdapter(config.getFrequency(), config.getIntervalLevel());
    }

    public boolean supports(BaseForecastMethod method) {
        return method != null && models.containsKey(method);
    }

    public Set<BaseForecastMethod> getSupportedMethods() {
        return Collections.unmodifiableSet(models.keySet());
    }

    @Override
    public BaseForecast forecastNode(double[] series, int horizon, BaseForecastMethod method) {
        if (!supports(method)) {
            throw new UnsupportedMethodException("no model is available for base method " + method);
        }
        return models.get(method).forecast(series, horizon);
    }
}
