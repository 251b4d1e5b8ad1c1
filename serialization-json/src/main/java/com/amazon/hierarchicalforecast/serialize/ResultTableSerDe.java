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

package com.amazon.hierarchicalforecast.serialize;

import lombok.Getter;

import com.amazon.hierarchicalforecast.crossvalidation.ResultTable;
import com.amazon.hierarchicalforecast.state.ResultTableMapper;
import com.amazon.hierarchicalforecast.state.ResultTableState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * {@link ResultTable} serialization. Internally we use the
 * {@link ResultTableMapper} class to convert a table into a corresponding state
 * object, and we use <a href="https://github.com/google/gson">Gson</a> to write
 * the state object as a JSON string. Unset values are written as {@code NaN},
 * so the default Gson instance allows special floating point values.
 */
@Getter
public class ResultTableSerDe {

    private final ResultTableMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public ResultTableSerDe() {
        this(new ResultTableMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper A ResultTableMapper instance, used to convert a ResultTable to
     *               a corresponding state object.
     * @param gson   A Gson instance that will be used to generate JSON for a given
     *               {@link ResultTableState} object.
     */
    public ResultTableSerDe(ResultTableMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * Serializes a result table to a json string.
     *
     * @param table A result table
     * @return a json string serialized from the table.
     */
    public String toJson(ResultTable table) {
        return gson.toJson(mapper.toState(table));
    }

    /**
     * Deserializes a JSON string to a frozen result table.
     *
     * @param json a json string serialized from a result table
     * @return the result table
     */
    public ResultTable fromJson(String json) {
        ResultTableState state = gson.fromJson(json, ResultTableState.class);
        return mapper.toModel(state);
    }
}
